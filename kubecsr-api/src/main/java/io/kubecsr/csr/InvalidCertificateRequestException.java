/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.csr;

/**
 * Thrown when the PKCS#10 request carried by a signing request cannot be used.
 */
public class InvalidCertificateRequestException extends RuntimeException {

    public enum Reason {
        /** The request could not be decoded as a PKCS#10 certificate request. */
        MALFORMED,
        /** The request decoded but its self-signature did not verify. */
        BAD_SIGNATURE
    }

    private final Reason reason;

    public InvalidCertificateRequestException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public InvalidCertificateRequestException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
