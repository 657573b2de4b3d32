/*
 * Copyright Secretsealer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.secretsealer.crypto;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * A ByteBuffer-sympathetic deserializer for some type, {@code T}.
 * @param <T> The type of the deserialized object.
 * @see Ser
 */
public interface De<T> {

    /**
     * Read two big-endian bytes from the buffer's {@link ByteBuffer#position() position} and return them as a value in the range 0-65535.
     * The buffer's position will be incremented by 2.
     * @param buffer The buffer to read from.
     * @return The value, which will be in the range [0, 65535].
     * @throws BufferUnderflowException If there are fewer than two bytes remaining in the buffer.
     * @see Ser#putUnsignedShort(ByteBuffer, int)
     */
    static int getUnsignedShort(@NonNull ByteBuffer buffer) {
        return buffer.getShort() & 0xFFFF;
    }

    /**
     * Deserialize an instance of {@code T} from the given buffer.
     * @param buffer The buffer.
     * @return The instance.
     * @throws BufferUnderflowException If the buffer's current position is not smaller than its limit.
     */
    T deserialize(@NonNull ByteBuffer buffer);

}
