/*
 * Copyright Secretsealer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.secretsealer.seal;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * A request to seal some plaintext values into the secret {@code namespace/secretName}.
 * @param scope The scope the values are bound to.
 * @param namespace The target namespace.
 * @param secretName The target secret name.
 * @param values The plaintext values, by key.
 */
public record SealRequest(@NonNull Scope scope,
                          @NonNull String namespace,
                          @NonNull String secretName,
                          @NonNull Map<String, String> values) {

    public SealRequest {
        Objects.requireNonNull(scope, "scope");
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("namespace must not be blank");
        }
        if (secretName == null || secretName.isBlank()) {
            throw new IllegalArgumentException("secretName must not be blank");
        }
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("values must not be empty");
        }
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * Builds a request from the raw fields of a form.
     * @param scope The scope name, see {@link Scope#fromName(String)}.
     * @param namespace The namespace.
     * @param secretName The secret name.
     * @param valuesText The values, see {@link ValueParser}.
     * @return The request.
     * @throws FormatException If any field is blank, the scope is unknown, or the values cannot be parsed.
     */
    @NonNull
    public static SealRequest fromForm(String scope, String namespace, String secretName, String valuesText) {
        if (isBlank(scope) || isBlank(namespace) || isBlank(secretName) || valuesText == null || valuesText.isEmpty()) {
            throw new FormatException("All fields are required");
        }
        return new SealRequest(Scope.fromName(scope), namespace.trim(), secretName.trim(), ValueParser.parse(valuesText));
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    @Override
    public String toString() {
        // never the values
        return "SealRequest{" +
                "scope=" + scope +
                ", namespace='" + namespace + '\'' +
                ", secretName='" + secretName + '\'' +
                ", keys=" + values.keySet() +
                '}';
    }
}
