/*
 * Copyright Secretsealer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.secretsealer.config;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

import io.secretsealer.seal.AnnotationAllowlist;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * The configuration of a secret sealer. Absent properties take their defaults.
 * @param controllerNamespace The namespace the controller runs in.
 * @param controllerName The name of the controller's service.
 * @param clusterDomain The cluster's DNS domain.
 * @param annotationsToPreserve Annotation keys kept when an existing sealed secret is re-sealed.
 * @param encryptionThreads The size of the pool sealing values.
 * @param sealTimeoutSeconds How long a seal may take.
 */
public record SealerConfig(@JsonProperty String controllerNamespace,
                           @JsonProperty String controllerName,
                           @JsonProperty String clusterDomain,
                           @JsonProperty List<String> annotationsToPreserve,
                           @JsonProperty Integer encryptionThreads,
                           @JsonProperty Integer sealTimeoutSeconds) {

    public static final String DEFAULT_CONTROLLER_NAMESPACE = "kube-system";
    public static final String DEFAULT_CONTROLLER_NAME = "sealed-secrets-controller";
    public static final String DEFAULT_CLUSTER_DOMAIN = "cluster.local";
    public static final int DEFAULT_ENCRYPTION_THREADS = 4;
    public static final int MAX_ENCRYPTION_THREADS = 64;
    public static final int DEFAULT_SEAL_TIMEOUT_SECONDS = 10;

    static final String ENV_CONTROLLER_NAMESPACE = "SEALED_SECRETS_CONTROLLER_NAMESPACE";
    static final String ENV_CONTROLLER_NAME = "SEALED_SECRETS_CONTROLLER_NAME";
    static final String ENV_CLUSTER_DOMAIN = "CLUSTER_DOMAIN";
    static final String ENV_ANNOTATIONS_TO_PRESERVE = "ANNOTATIONS_TO_PRESERVE";

    private static final int CONTROLLER_PORT = 8080;

    public SealerConfig {
        controllerNamespace = orDefault(controllerNamespace, DEFAULT_CONTROLLER_NAMESPACE);
        controllerName = orDefault(controllerName, DEFAULT_CONTROLLER_NAME);
        clusterDomain = orDefault(clusterDomain, DEFAULT_CLUSTER_DOMAIN);
        annotationsToPreserve = annotationsToPreserve == null ? List.of() : List.copyOf(annotationsToPreserve);
        encryptionThreads = encryptionThreads == null ? DEFAULT_ENCRYPTION_THREADS : encryptionThreads;
        sealTimeoutSeconds = sealTimeoutSeconds == null ? DEFAULT_SEAL_TIMEOUT_SECONDS : sealTimeoutSeconds;
        if (encryptionThreads < 1 || encryptionThreads > MAX_ENCRYPTION_THREADS) {
            throw new IllegalArgumentException("encryptionThreads must be between 1 and " + MAX_ENCRYPTION_THREADS + ", was " + encryptionThreads);
        }
        if (sealTimeoutSeconds < 1) {
            throw new IllegalArgumentException("sealTimeoutSeconds must be at least 1, was " + sealTimeoutSeconds);
        }
    }

    @NonNull
    public static SealerConfig defaults() {
        return new SealerConfig(null, null, null, null, null, null);
    }

    private static String orDefault(String value, String defaultValue) {
        return value == null || value.isBlank() ? defaultValue : value.trim();
    }

    /**
     * Applies overrides from the environment. Only non-empty variables override.
     * {@code ANNOTATIONS_TO_PRESERVE} is a comma-separated list.
     * @param env The environment, usually {@link System#getenv()}.
     * @return A config with the overrides applied.
     */
    @NonNull
    public SealerConfig withEnvironment(@NonNull Map<String, String> env) {
        var annotations = env.get(ENV_ANNOTATIONS_TO_PRESERVE);
        return new SealerConfig(
                override(env, ENV_CONTROLLER_NAMESPACE, controllerNamespace),
                override(env, ENV_CONTROLLER_NAME, controllerName),
                override(env, ENV_CLUSTER_DOMAIN, clusterDomain),
                annotations == null || annotations.isEmpty() ? annotationsToPreserve : Arrays.asList(annotations.split(",")),
                encryptionThreads,
                sealTimeoutSeconds);
    }

    private static String override(Map<String, String> env, String name, String current) {
        var value = env.get(name);
        return value == null || value.isEmpty() ? current : value;
    }

    /**
     * @return The URL the controller serves its current certificate from.
     */
    @NonNull
    public String controllerCertUrl() {
        return "http://" + controllerName + "." + controllerNamespace + ".svc." + clusterDomain + ":" + CONTROLLER_PORT + "/v1/cert.pem";
    }

    /**
     * @return {@link #annotationsToPreserve()}, trimmed and without blank entries.
     */
    @NonNull
    public AnnotationAllowlist allowlist() {
        return AnnotationAllowlist.of(annotationsToPreserve);
    }

    @NonNull
    public Duration sealTimeout() {
        return Duration.ofSeconds(sealTimeoutSeconds);
    }
}
