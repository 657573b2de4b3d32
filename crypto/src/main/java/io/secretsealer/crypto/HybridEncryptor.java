/*
 * Copyright Secretsealer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.secretsealer.crypto;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.MGF1ParameterSpec;
import java.util.Arrays;
import java.util.Objects;

import javax.annotation.concurrent.ThreadSafe;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.OAEPParameterSpec;
import javax.crypto.spec.PSource;
import javax.crypto.spec.SecretKeySpec;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Seals values so that only the holder of the private key matching a given RSA public key can open them,
 * and only under the same label.
 * <ol>
 *     <li>A fresh 256 bit AES session key is generated for every value.</li>
 *     <li>The session key is wrapped with RSA-OAEP (SHA-256, MGF1 with SHA-256) using the label as the OAEP label.</li>
 *     <li>The plaintext is encrypted with AES-GCM under the session key, with a 128 bit tag,
 *     an all-zero 96 bit nonce and the label as additional authenticated data.</li>
 * </ol>
 * The all-zero nonce is safe only because a session key never encrypts more than one plaintext.
 * <p>
 * Sealing is deliberately non-deterministic: two seals of the same plaintext are different.
 */
@ThreadSafe
public class HybridEncryptor {

    static final String WRAP_ALGO = "RSA/ECB/OAEPPadding";
    static final String AEAD_ALGO = "AES/GCM/NoPadding";
    static final String KEY_ALGO = "AES";
    static final int SESSION_KEY_BYTES = 32;
    static final int NONCE_BYTES = 12;
    static final int TAG_BITS = 128;

    private final SecureRandom random;

    public HybridEncryptor() {
        this(new SecureRandom());
    }

    public HybridEncryptor(@NonNull SecureRandom random) {
        this.random = Objects.requireNonNull(random);
    }

    /**
     * Seals the UTF-8 encoding of the given plaintext.
     * @see #seal(PublicKey, byte[], byte[])
     */
    @NonNull
    public SealedValue seal(PublicKey publicKey, @NonNull byte[] label, @NonNull String plaintext) {
        return seal(publicKey, label, plaintext.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Seals the given plaintext.
     * @param publicKey The controller's RSA public key.
     * @param label The label binding the value to its scope. May be empty, but not null.
     * @param plaintext The plaintext.
     * @return The sealed value.
     * @throws CryptoException If the key is null or not an RSA public key, if random generation fails,
     * or if any cipher step fails.
     */
    @NonNull
    public SealedValue seal(PublicKey publicKey, @NonNull byte[] label, @NonNull byte[] plaintext) {
        var rsaKey = requireRsa(publicKey);
        Objects.requireNonNull(label);
        Objects.requireNonNull(plaintext);
        byte[] sessionKey = new byte[SESSION_KEY_BYTES];
        try {
            try {
                random.nextBytes(sessionKey);
            }
            catch (RuntimeException e) {
                throw new CryptoException("Failed to generate session key", e);
            }
            byte[] wrappedKey = wrap(rsaKey, label, sessionKey);
            byte[] payload = aeadSeal(sessionKey, label, plaintext);
            return new SealedValue(wrappedKey, payload);
        }
        finally {
            Arrays.fill(sessionKey, (byte) 0);
        }
    }

    private byte[] wrap(RSAPublicKey rsaKey, byte[] label, byte[] sessionKey) {
        try {
            Cipher rsa = Cipher.getInstance(WRAP_ALGO);
            rsa.init(Cipher.ENCRYPT_MODE, rsaKey, oaepSpec(label), random);
            return rsa.doFinal(sessionKey);
        }
        catch (GeneralSecurityException e) {
            throw new CryptoException(e);
        }
    }

    private static byte[] aeadSeal(byte[] sessionKey, byte[] label, byte[] plaintext) {
        try {
            Cipher aes = Cipher.getInstance(AEAD_ALGO);
            aes.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(sessionKey, KEY_ALGO), gcmSpec());
            aes.updateAAD(label);
            return aes.doFinal(plaintext);
        }
        catch (GeneralSecurityException e) {
            throw new CryptoException(e);
        }
    }

    private static RSAPublicKey requireRsa(PublicKey publicKey) {
        if (publicKey == null) {
            throw new CryptoException("No public key");
        }
        if (!(publicKey instanceof RSAPublicKey rsaKey)) {
            throw new CryptoException("Expected an RSA public key but got " + publicKey.getAlgorithm());
        }
        return rsaKey;
    }

    static OAEPParameterSpec oaepSpec(byte[] label) {
        return new OAEPParameterSpec("SHA-256", "MGF1", MGF1ParameterSpec.SHA256, new PSource.PSpecified(label));
    }

    static GCMParameterSpec gcmSpec() {
        return new GCMParameterSpec(TAG_BITS, new byte[NONCE_BYTES]);
    }
}
