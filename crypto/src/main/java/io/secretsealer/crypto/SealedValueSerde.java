/*
 * Copyright Secretsealer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.secretsealer.crypto;

import java.nio.ByteBuffer;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Serde for {@link SealedValue}.
 * The length prefix lets a reader split the wrapped key from the payload without any other framing;
 * the payload runs to the end of the buffer.
 */
public class SealedValueSerde implements Ser<SealedValue>, De<SealedValue> {

    @Override
    public int sizeOf(SealedValue sealedValue) {
        return Short.BYTES // wrapped key length
                + sealedValue.wrappedKey().length
                + sealedValue.payload().length;
    }

    @Override
    public void serialize(SealedValue sealedValue, @NonNull ByteBuffer buffer) {
        byte[] wrappedKey = sealedValue.wrappedKey();
        Ser.putUnsignedShort(buffer, wrappedKey.length);
        buffer.put(wrappedKey);
        buffer.put(sealedValue.payload());
    }

    @Override
    public SealedValue deserialize(@NonNull ByteBuffer buffer) {
        if (buffer.remaining() < Short.BYTES) {
            throw new CryptoException("Truncated sealed value: " + buffer.remaining() + " bytes is too short for the length prefix");
        }
        int wrappedKeyLength = De.getUnsignedShort(buffer);
        if (buffer.remaining() < wrappedKeyLength) {
            throw new CryptoException("Truncated sealed value: wrapped key needs " + wrappedKeyLength
                    + " bytes but only " + buffer.remaining() + " remain");
        }
        var wrappedKey = new byte[wrappedKeyLength];
        buffer.get(wrappedKey);
        var payload = new byte[buffer.remaining()];
        buffer.get(payload);
        return new SealedValue(wrappedKey, payload);
    }
}
