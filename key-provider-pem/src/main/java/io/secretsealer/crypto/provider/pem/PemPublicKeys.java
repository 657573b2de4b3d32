/*
 * Copyright Secretsealer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.secretsealer.crypto.provider.pem;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PublicKey;
import java.security.cert.CertificateFactory;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;

import io.secretsealer.crypto.CryptoException;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Reads the controller's RSA public key from the PEM text the controller publishes.
 * Both an X.509 certificate and a bare SubjectPublicKeyInfo are accepted.
 */
public final class PemPublicKeys {

    static final String CERTIFICATE = "CERTIFICATE";
    static final String PUBLIC_KEY = "PUBLIC KEY";

    private static final String BEGIN = "-----BEGIN ";
    private static final String END = "-----END ";
    private static final String DASHES = "-----";

    private PemPublicKeys() {
    }

    /**
     * Parses the first PEM block in the given text.
     * @param pem The PEM text.
     * @return The RSA public key.
     * @throws CryptoException If the text holds no certificate or public key block, or the key in it is not RSA.
     */
    @NonNull
    public static PublicKey parse(String pem) {
        if (pem == null || pem.isBlank()) {
            throw new CryptoException("No PEM data");
        }
        int begin = pem.indexOf(BEGIN);
        if (begin < 0) {
            throw new CryptoException("No PEM block found");
        }
        int typeEnd = pem.indexOf(DASHES, begin + BEGIN.length());
        if (typeEnd < 0) {
            throw new CryptoException("Malformed PEM header");
        }
        String type = pem.substring(begin + BEGIN.length(), typeEnd);
        String footer = END + type + DASHES;
        int end = pem.indexOf(footer, typeEnd);
        if (end < 0) {
            throw new CryptoException("Missing '" + footer + "'");
        }
        PublicKey key;
        switch (type) {
            case CERTIFICATE:
                key = fromCertificate(pem.substring(begin, end + footer.length()));
                break;
            case PUBLIC_KEY:
                key = fromSubjectPublicKeyInfo(pem.substring(typeEnd + DASHES.length(), end));
                break;
            default:
                throw new CryptoException("Unsupported PEM block '" + type + "', expected " + CERTIFICATE + " or " + PUBLIC_KEY);
        }
        if (!(key instanceof RSAPublicKey)) {
            throw new CryptoException("Expected an RSA public key but got " + key.getAlgorithm());
        }
        return key;
    }

    private static PublicKey fromCertificate(String block) {
        try {
            var certificate = CertificateFactory.getInstance("X.509")
                    .generateCertificate(new ByteArrayInputStream(block.getBytes(StandardCharsets.US_ASCII)));
            return certificate.getPublicKey();
        }
        catch (GeneralSecurityException e) {
            throw new CryptoException("Invalid certificate", e);
        }
    }

    private static PublicKey fromSubjectPublicKeyInfo(String body) {
        byte[] der;
        try {
            der = Base64.getMimeDecoder().decode(body.strip());
        }
        catch (IllegalArgumentException e) {
            throw new CryptoException("Public key is not valid base64", e);
        }
        try {
            return KeyFactory.getInstance("RSA").generatePublic(new X509EncodedKeySpec(der));
        }
        catch (GeneralSecurityException e) {
            throw new CryptoException("Invalid RSA public key", e);
        }
    }
}
