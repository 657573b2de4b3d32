/*
 * Copyright Secretsealer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.secretsealer.api;

import java.util.Map;
import java.util.concurrent.CompletionStage;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Read access to the plaintext of secrets that already exist, so that a seal can carry them forward.
 */
public interface SecretStore {

    /**
     * Asynchronously reads the plaintext data of the given secret.
     * @param namespace The namespace.
     * @param name The secret name.
     * @return A completion stage for the secret's data, which is empty if the secret does not exist.
     * The stage may fail with {@link NotFoundException} if the namespace does not exist,
     * or with {@link CollaboratorException} for other failures.
     */
    @NonNull
    CompletionStage<Map<String, String>> getPlaintext(@NonNull String namespace, @NonNull String name);
}
