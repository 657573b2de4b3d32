/*
 * Copyright Secretsealer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.secretsealer.seal;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * The metadata of a sealed record, or of the secret the controller will create from it.
 * Annotations are kept sorted by key.
 */
public record ObjectMeta(@NonNull String name,
                         @NonNull String namespace,
                         @NonNull Map<String, String> annotations) {

    public ObjectMeta {
        Objects.requireNonNull(name);
        Objects.requireNonNull(namespace);
        annotations = Collections.unmodifiableMap(new TreeMap<>(annotations));
    }
}
