/*
 * Copyright Secretsealer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.secretsealer.api;

/**
 * Thrown when a collaborator (secret store, annotation store or key source) fails.
 * Unless it is a {@link NotFoundException} the failure is assumed to be transient.
 */
public class CollaboratorException extends RuntimeException {

    public CollaboratorException(String message) {
        super(message);
    }

    public CollaboratorException(String message, Throwable cause) {
        super(message, cause);
    }
}
