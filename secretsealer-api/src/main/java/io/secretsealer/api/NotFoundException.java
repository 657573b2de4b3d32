/*
 * Copyright Secretsealer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.secretsealer.api;

/**
 * Thrown when something a collaborator was asked about does not exist.
 */
public class NotFoundException extends CollaboratorException {

    public NotFoundException(String message) {
        super(message);
    }
}
