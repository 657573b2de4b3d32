/*
 * Copyright Secretsealer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.secretsealer.crypto;

import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.interfaces.RSAPrivateKey;
import java.util.Arrays;
import java.util.Objects;

import javax.annotation.concurrent.ThreadSafe;
import javax.crypto.Cipher;
import javax.crypto.spec.SecretKeySpec;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Opens values sealed by {@link HybridEncryptor}, as the controller does.
 */
@ThreadSafe
public class HybridDecryptor {

    /**
     * Opens a raw blob.
     * @see #open(PrivateKey, byte[], SealedValue)
     */
    @NonNull
    public byte[] open(PrivateKey privateKey, @NonNull byte[] label, @NonNull byte[] blob) {
        return open(privateKey, label, SealedValue.fromBytes(blob));
    }

    /**
     * Opens a sealed value.
     * @param privateKey The controller's RSA private key.
     * @param label The label the value was sealed under.
     * @param sealedValue The sealed value.
     * @return The plaintext.
     * @throws CryptoException If the key, the label or the value do not match, or the value was tampered with.
     */
    @NonNull
    public byte[] open(PrivateKey privateKey, @NonNull byte[] label, @NonNull SealedValue sealedValue) {
        if (!(privateKey instanceof RSAPrivateKey)) {
            throw new CryptoException("Expected an RSA private key");
        }
        Objects.requireNonNull(label);
        byte[] sessionKey = unwrap(privateKey, label, sealedValue.wrappedKey());
        try {
            if (sessionKey.length != HybridEncryptor.SESSION_KEY_BYTES) {
                throw new CryptoException("Unexpected session key length " + sessionKey.length);
            }
            Cipher aes = Cipher.getInstance(HybridEncryptor.AEAD_ALGO);
            aes.init(Cipher.DECRYPT_MODE, new SecretKeySpec(sessionKey, HybridEncryptor.KEY_ALGO), HybridEncryptor.gcmSpec());
            aes.updateAAD(label);
            return aes.doFinal(sealedValue.payload());
        }
        catch (GeneralSecurityException e) {
            throw new CryptoException(e);
        }
        finally {
            Arrays.fill(sessionKey, (byte) 0);
        }
    }

    private static byte[] unwrap(PrivateKey privateKey, byte[] label, byte[] wrappedKey) {
        try {
            Cipher rsa = Cipher.getInstance(HybridEncryptor.WRAP_ALGO);
            rsa.init(Cipher.DECRYPT_MODE, privateKey, HybridEncryptor.oaepSpec(label));
            return rsa.doFinal(wrappedKey);
        }
        catch (GeneralSecurityException e) {
            throw new CryptoException(e);
        }
    }
}
