/*
 * Copyright Secretsealer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.secretsealer.crypto;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Base64;
import java.util.Objects;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * A single sealed value: the session key wrapped by the controller's public key, and
 * the AES-GCM ciphertext (with its tag) of the plaintext under that session key.
 * <p>
 * The wire form, produced by {@link SealedValueSerde}, is
 * {@code [u16 BE length of wrappedKey][wrappedKey][payload]}, which is what the
 * controller expects (base64 encoded) in a SealedSecret's {@code encryptedData}.
 * @param wrappedKey The RSA-OAEP wrapped session key.
 * @param payload The AES-GCM ciphertext followed by the authentication tag.
 */
public record SealedValue(byte[] wrappedKey,
                          byte[] payload) {

    private static final SealedValueSerde SERDE = new SealedValueSerde();

    public SealedValue {
        Objects.requireNonNull(wrappedKey);
        Objects.requireNonNull(payload);
        if (wrappedKey.length > 0xFFFF) {
            throw new CryptoException("Wrapped key of " + wrappedKey.length + " bytes does not fit a 2 byte length prefix");
        }
        wrappedKey = wrappedKey.clone();
        payload = payload.clone();
    }

    @Override
    public byte[] wrappedKey() {
        return wrappedKey.clone();
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }

    /**
     * @return The raw blob.
     */
    @NonNull
    public byte[] toBytes() {
        var buffer = ByteBuffer.allocate(SERDE.sizeOf(this));
        SERDE.serialize(this, buffer);
        return buffer.array();
    }

    /**
     * @return The blob, in standard base64, as embedded in a manifest.
     */
    @NonNull
    public String toBase64() {
        return Base64.getEncoder().encodeToString(toBytes());
    }

    /**
     * Parses a raw blob.
     * @param blob The blob.
     * @return The sealed value.
     * @throws CryptoException If the blob is truncated.
     */
    @NonNull
    public static SealedValue fromBytes(@NonNull byte[] blob) {
        return SERDE.deserialize(ByteBuffer.wrap(blob));
    }

    /**
     * Parses a base64 blob.
     * @param base64 The base64 text.
     * @return The sealed value.
     * @throws CryptoException If the text is not base64 or the blob is truncated.
     */
    @NonNull
    public static SealedValue fromBase64(@NonNull String base64) {
        byte[] blob;
        try {
            blob = Base64.getDecoder().decode(base64);
        }
        catch (IllegalArgumentException e) {
            throw new CryptoException("Sealed value is not valid base64", e);
        }
        return fromBytes(blob);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SealedValue that = (SealedValue) o;
        return Arrays.equals(wrappedKey, that.wrappedKey) && Arrays.equals(payload, that.payload);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(wrappedKey);
        result = 31 * result + Arrays.hashCode(payload);
        return result;
    }

    @Override
    public String toString() {
        return "SealedValue{" +
                "wrappedKey=" + wrappedKey.length + " bytes" +
                ", payload=" + payload.length + " bytes" +
                '}';
    }
}
