/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.cloud;

/**
 * Thrown when a node cannot be resolved to a cloud identity.
 */
public class ResolutionException extends RuntimeException {

    public enum Kind {
        INSTANCE_NOT_FOUND,
        GROUP_NOT_FOUND,
        /** More than one instance or group matched. */
        AMBIGUOUS,
        /** A network or provider API failure; the lookup may succeed if retried. */
        TRANSIENT
    }

    private final Kind kind;

    public ResolutionException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ResolutionException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }

    public boolean isTransient() {
        return kind == Kind.TRANSIENT;
    }

    public static ResolutionException instanceNotFound(String nodeName) {
        return new ResolutionException(Kind.INSTANCE_NOT_FOUND, "no instance found for node " + nodeName);
    }

    public static ResolutionException groupNotFound(String nodeName) {
        return new ResolutionException(Kind.GROUP_NOT_FOUND, "no instance group found for node " + nodeName);
    }

    public static ResolutionException ambiguous(String what, String nodeName, int matches) {
        return new ResolutionException(Kind.AMBIGUOUS, "expected one " + what + " for node " + nodeName + " but found " + matches);
    }

    public static ResolutionException transientFailure(String message, Throwable cause) {
        return new ResolutionException(Kind.TRANSIENT, message, cause);
    }
}
