/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.approver.recognizer;

/**
 * The result of one recognizer: accepted, or rejected with a reason suitable for logging.
 * @param accepted whether the request passed
 * @param reason why the request was rejected, empty when accepted
 */
public record Verdict(boolean accepted, String reason) {

    private static final Verdict ACCEPTED = new Verdict(true, "");

    public static Verdict accept() {
        return ACCEPTED;
    }

    public static Verdict reject(String reason) {
        return new Verdict(false, reason);
    }
}
