/*
 * Copyright Secretsealer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.secretsealer.api.inmemory;

import java.util.Objects;

record NamespacedName(String namespace, String name) {
    NamespacedName {
        Objects.requireNonNull(namespace);
        Objects.requireNonNull(name);
    }
}
