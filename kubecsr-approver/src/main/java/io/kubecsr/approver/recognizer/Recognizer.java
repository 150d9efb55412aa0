/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.approver.recognizer;

import java.util.Objects;
import java.util.function.Function;

/**
 * A single check applied to a signing request.
 * <p>
 * Recognizers must not modify the request or any external state. Those that consult a
 * {@link io.kubecsr.cloud.CloudIdentityResolver} turn not-found and ambiguous resolutions into a
 * rejection, but let transient failures propagate so that the whole evaluation is retried.
 * </p>
 */
public interface Recognizer {

    /**
     * @return a short name, used when logging why a chain did not match
     */
    String name();

    Verdict recognize(ParsedSigningRequest request);

    static Recognizer named(String name, Function<ParsedSigningRequest, Verdict> check) {
        Objects.requireNonNull(name);
        Objects.requireNonNull(check);
        return new Recognizer() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public Verdict recognize(ParsedSigningRequest request) {
                return check.apply(request);
            }

            @Override
            public String toString() {
                return name;
            }
        };
    }
}
