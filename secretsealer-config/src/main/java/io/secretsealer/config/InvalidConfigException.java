/*
 * Copyright Secretsealer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.secretsealer.config;

import java.util.List;

/**
 * Thrown when a configuration document cannot be read, or does not conform to its schema.
 */
public class InvalidConfigException extends RuntimeException {

    private final List<String> messages;

    public InvalidConfigException(String message, List<String> messages) {
        super(message + ": " + messages);
        this.messages = List.copyOf(messages);
    }

    public InvalidConfigException(String message, Throwable cause) {
        super(message, cause);
        this.messages = List.of(String.valueOf(cause.getMessage()));
    }

    /**
     * @return The individual problems found.
     */
    public List<String> messages() {
        return messages;
    }
}
