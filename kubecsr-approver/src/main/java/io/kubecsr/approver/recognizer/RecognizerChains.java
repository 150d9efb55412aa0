/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.approver.recognizer;

import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ordered set of {@link RecognizerChain}s. The first chain that fully matches a request wins and the
 * remaining chains are not evaluated. A request that matches no chain is left alone: nothing here ever
 * denies a request.
 */
public class RecognizerChains {

    private static final Logger LOGGER = LoggerFactory.getLogger(RecognizerChains.class);

    private final List<RecognizerChain> chains;

    public RecognizerChains(List<RecognizerChain> chains) {
        this.chains = List.copyOf(chains);
    }

    /**
     * @return the first chain that matched, or empty if none did
     * @throws io.kubecsr.cloud.ResolutionException if a recognizer hit a transient cloud failure
     */
    public Optional<RecognizerChain> evaluate(ParsedSigningRequest request) {
        for (RecognizerChain chain : chains) {
            Verdict verdict = chain.evaluate(request);
            if (verdict.accepted()) {
                LOGGER.debug("Signing request {} matched chain {}", request.name(), chain.name());
                return Optional.of(chain);
            }
            LOGGER.debug("Signing request {} did not match chain {}: {}", request.name(), chain.name(), verdict.reason());
        }
        return Optional.empty();
    }

    public List<RecognizerChain> chains() {
        return chains;
    }
}
