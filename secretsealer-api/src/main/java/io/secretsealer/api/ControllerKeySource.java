/*
 * Copyright Secretsealer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.secretsealer.api;

import java.security.PublicKey;
import java.util.concurrent.CompletionStage;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * The source of the controller's current public key.
 * The controller rotates its key on its own schedule, so callers should ask for the key each time they need it.
 */
@FunctionalInterface
public interface ControllerKeySource {

    /**
     * Asynchronously fetches the controller's current public key.
     * @return A completion stage for the key.
     * The stage fails with {@link NotFoundException} if there is no controller or certificate,
     * or with {@link CollaboratorException} if the controller could not be reached.
     */
    @NonNull
    CompletionStage<PublicKey> currentPublicKey();
}
