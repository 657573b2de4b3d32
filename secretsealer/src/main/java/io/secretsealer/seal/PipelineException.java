/*
 * Copyright Secretsealer Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.secretsealer.seal;

import java.util.Objects;

/**
 * Thrown (or used to fail a stage) when a seal could not be completed.
 * No part of a failed seal is ever returned.
 */
public class PipelineException extends RuntimeException {

    /**
     * Why a seal failed.
     */
    public enum Reason {
        /** Something the seal needed does not exist. */
        NOT_FOUND(false),
        /** A collaborator failed, probably transiently. */
        UNAVAILABLE(true),
        /** Sealing a value failed. */
        CRYPTO(false),
        /** The seal did not finish in time. */
        TIMED_OUT(true),
        /** The seal was abandoned. */
        CANCELLED(false);

        private final boolean retryable;

        Reason(boolean retryable) {
            this.retryable = retryable;
        }
    }

    private final Reason reason;

    public PipelineException(Reason reason, String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason);
    }

    public PipelineException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = Objects.requireNonNull(reason);
    }

    public Reason reason() {
        return reason;
    }

    /**
     * @return true if the same seal might succeed if tried again later.
     */
    public boolean isRetryable() {
        return reason.retryable;
    }
}
