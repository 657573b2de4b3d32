/*
 * Copyright Secretsealer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.secretsealer.seal;

import java.util.Locale;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * How widely a sealed value may be used once the controller decrypts it.
 */
public enum Scope {
    /** The value may be used under any name in any namespace. */
    CLUSTER("cluster"),
    /** The value may be used under any name, but only in its namespace. */
    NAMESPACE("namespace"),
    /** The value may be used only under its own name in its own namespace. */
    STRICT("strict");

    private final String wireName;

    Scope(String wireName) {
        this.wireName = wireName;
    }

    /**
     * @return The name used for this scope in forms and configuration.
     */
    public String wireName() {
        return wireName;
    }

    /**
     * Parses a scope name, ignoring case and surrounding whitespace.
     * @param name The name.
     * @return The scope.
     * @throws FormatException If the name is not one of {@code cluster}, {@code namespace} or {@code strict}.
     */
    @NonNull
    public static Scope fromName(String name) {
        if (name != null) {
            var normalized = name.trim().toLowerCase(Locale.ROOT);
            for (Scope scope : values()) {
                if (scope.wireName.equals(normalized)) {
                    return scope;
                }
            }
        }
        throw new FormatException("Unknown scope '" + name + "', expected one of cluster, namespace or strict");
    }
}
