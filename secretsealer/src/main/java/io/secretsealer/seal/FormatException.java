/*
 * Copyright Secretsealer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.secretsealer.seal;

/**
 * Thrown when user-supplied text cannot be understood.
 * The message is meant to be shown to the user as-is.
 */
public class FormatException extends RuntimeException {

    private final int lineIndex;

    public FormatException(String message) {
        this(message, -1);
    }

    public FormatException(String message, int lineIndex) {
        super(message);
        this.lineIndex = lineIndex;
    }

    /**
     * @return The 0-based index of the offending line, or -1 if the problem is not with a particular line.
     */
    public int lineIndex() {
        return lineIndex;
    }
}
