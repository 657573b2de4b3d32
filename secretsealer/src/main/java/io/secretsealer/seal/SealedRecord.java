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
import java.util.TreeMap;

import io.secretsealer.crypto.SealedValue;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * A SealedSecret, ready to be rendered as a manifest.
 * @param metadata The record's own metadata: scope markers plus preserved annotations.
 * @param encryptedData The sealed values, by key, sorted.
 * @param template The metadata of the secret the controller will create, which carries only the scope markers.
 */
public record SealedRecord(@NonNull ObjectMeta metadata,
                           @NonNull Map<String, SealedValue> encryptedData,
                           @NonNull ObjectMeta template) {

    public static final String API_VERSION = "bitnami.com/v1alpha1";
    public static final String KIND = "SealedSecret";

    public SealedRecord {
        Objects.requireNonNull(metadata);
        Objects.requireNonNull(template);
        encryptedData = Collections.unmodifiableMap(new TreeMap<>(encryptedData));
    }

    public String apiVersion() {
        return API_VERSION;
    }

    public String kind() {
        return KIND;
    }

    /**
     * @return The sealed values as the base64 text that goes in the manifest's {@code encryptedData}.
     */
    @NonNull
    public Map<String, String> encodedData() {
        var encoded = new LinkedHashMap<String, String>();
        encryptedData.forEach((key, value) -> encoded.put(key, value.toBase64()));
        return Collections.unmodifiableMap(encoded);
    }
}
