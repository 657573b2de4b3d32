/*
 * Copyright Secretsealer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.secretsealer.seal;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Maps a {@link Scope} to the label a value is sealed under, and to the annotations that tell the controller which scope was used.
 * <p>
 * The label is what stops a sealed value being moved: it is mixed into both the key wrapping and the payload,
 * so a value only opens under the namespace (and, for {@link Scope#STRICT}, the name) it was sealed for.
 * Strict scope has no annotation; the absence of both markers means strict.
 */
public final class ScopeLabelResolver {

    public static final String CLUSTER_WIDE_ANNOTATION = "sealedsecrets.bitnami.com/cluster-wide";
    public static final String NAMESPACE_WIDE_ANNOTATION = "sealedsecrets.bitnami.com/namespace-wide";

    private ScopeLabelResolver() {
    }

    @NonNull
    public static byte[] resolveLabel(@NonNull Scope scope, @NonNull String namespace, @NonNull String secretName) {
        Objects.requireNonNull(namespace);
        Objects.requireNonNull(secretName);
        String label = switch (Objects.requireNonNull(scope)) {
            case CLUSTER -> "";
            case NAMESPACE -> namespace;
            case STRICT -> namespace + "/" + secretName;
        };
        return label.getBytes(StandardCharsets.UTF_8);
    }

    @NonNull
    public static Map<String, String> resolveAnnotations(@NonNull Scope scope) {
        return switch (Objects.requireNonNull(scope)) {
            case CLUSTER -> Map.of(CLUSTER_WIDE_ANNOTATION, "true");
            case NAMESPACE -> Map.of(NAMESPACE_WIDE_ANNOTATION, "true");
            case STRICT -> Map.of();
        };
    }

    /**
     * @param annotationKey An annotation key.
     * @return true if the key is one of the two scope markers, which must always be recomputed and never carried over.
     */
    public static boolean isScopeControl(String annotationKey) {
        return CLUSTER_WIDE_ANNOTATION.equals(annotationKey) || NAMESPACE_WIDE_ANNOTATION.equals(annotationKey);
    }
}
