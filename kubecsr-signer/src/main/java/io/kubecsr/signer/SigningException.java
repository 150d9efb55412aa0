/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.signer;

/**
 * Thrown when a signing request is refused or cannot be signed. Signing failures are final: the request
 * is denied rather than retried.
 */
public class SigningException extends RuntimeException {

    public enum Reason {
        /** The subject organization does not name a signing profile. */
        INVALID_ORGANIZATION("InvalidOrganization"),
        /** The subject common name does not carry the profile's prefix. */
        INVALID_COMMON_NAME("InvalidCommonName"),
        /** No certificate authority is configured for the profile. */
        PROFILE_UNSUPPORTED("ProfileUnsupported"),
        /** The embedded certificate request is missing, malformed or badly signed. */
        INVALID_REQUEST("InvalidRequest"),
        SIGNING_FAILED("SigningFailed");

        private final String conditionReason;

        Reason(String conditionReason) {
            this.conditionReason = conditionReason;
        }

        /**
         * @return the value written to the {@code reason} of the Denied condition
         */
        public String conditionReason() {
            return conditionReason;
        }
    }

    private final Reason reason;

    public SigningException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public SigningException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
