/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.approver.recognizer;

import java.util.List;
import java.util.Objects;

/**
 * A named policy under which requests are approved: every recognizer must accept the request.
 * Recognizers are applied in order and the first rejection ends the evaluation.
 *
 * @param name label of the chain
 * @param approvalMessage message recorded on the Approved condition when this chain matches
 * @param recognizers the checks, in evaluation order
 */
public record RecognizerChain(String name,
                              String approvalMessage,
                              List<Recognizer> recognizers) {

    public RecognizerChain {
        Objects.requireNonNull(name);
        Objects.requireNonNull(approvalMessage);
        recognizers = List.copyOf(recognizers);
        if (recognizers.isEmpty()) {
            throw new IllegalArgumentException("chain " + name + " has no recognizers");
        }
    }

    public Verdict evaluate(ParsedSigningRequest request) {
        for (Recognizer recognizer : recognizers) {
            Verdict verdict = recognizer.recognize(request);
            if (!verdict.accepted()) {
                return Verdict.reject(recognizer.name() + ": " + verdict.reason());
            }
        }
        return Verdict.accept();
    }
}
