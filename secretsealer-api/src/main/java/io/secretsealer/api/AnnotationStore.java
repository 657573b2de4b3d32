/*
 * Copyright Secretsealer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.secretsealer.api;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletionStage;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Read access to the annotations of an existing sealed record.
 */
public interface AnnotationStore {

    /**
     * Asynchronously reads those annotations of the given sealed record whose keys are in {@code allowlist}.
     * @param namespace The namespace.
     * @param name The sealed record name.
     * @param allowlist The annotation keys of interest.
     * @return A completion stage for the matching annotations, which is empty if the record does not exist.
     * The stage may fail with {@link NotFoundException} if the namespace does not exist,
     * or with {@link CollaboratorException} for other failures.
     */
    @NonNull
    CompletionStage<Map<String, String>> getPreserved(@NonNull String namespace, @NonNull String name, @NonNull Set<String> allowlist);
}
