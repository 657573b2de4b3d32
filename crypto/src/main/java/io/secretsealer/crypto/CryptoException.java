/*
 * Copyright Secretsealer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.secretsealer.crypto;

/**
 * Thrown when a value cannot be sealed or opened: a missing or malformed key,
 * a failure of the random source, or a failed authentication tag.
 * Retrying with the same inputs will not help.
 */
public class CryptoException extends RuntimeException {

    public CryptoException(String message) {
        super(message);
    }

    public CryptoException(Throwable cause) {
        super(cause);
    }

    public CryptoException(String message, Throwable cause) {
        super(message, cause);
    }
}
