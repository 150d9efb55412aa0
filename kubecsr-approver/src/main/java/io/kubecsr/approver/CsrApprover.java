/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.approver;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.certificates.v1.CertificateSigningRequest;
import io.fabric8.kubernetes.api.model.certificates.v1.CertificateSigningRequestBuilder;
import io.fabric8.kubernetes.api.model.certificates.v1.CertificateSigningRequestCondition;
import io.fabric8.kubernetes.api.model.certificates.v1.CertificateSigningRequestStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import io.kubecsr.approver.recognizer.ParsedSigningRequest;
import io.kubecsr.approver.recognizer.RecognizerChain;
import io.kubecsr.approver.recognizer.RecognizerChains;
import io.kubecsr.csr.InvalidCertificateRequestException;
import io.kubecsr.csr.SigningRequests;

/**
 * Decides a single signing request and, if a chain matches, records the approval.
 * <p>
 * Requests that already carry a certificate, an approval or a denial are skipped without any further
 * calls, which makes redelivery of the same request harmless. Otherwise the request is copied before
 * it is touched, evaluated against the chains, and the Approved condition is written with a
 * resource-version-checked update. A request is therefore approved at most once however many workers
 * see it.
 * </p>
 * <p>
 * Requests that match no chain are left pending and requests whose embedded certificate request is
 * invalid are logged and left alone; neither is ever denied. Transient cloud failures, cluster lookup
 * failures and failed updates are thrown so that the caller can retry.
 * </p>
 */
public class CsrApprover {

    private static final Logger LOGGER = LoggerFactory.getLogger(CsrApprover.class);

    static final String APPROVAL_REASON = "AutoApproved";

    /**
     * Name of the decision counter. Prometheus exposes it as {@code kubecsr_approver_decisions_total}.
     */
    static final String DECISIONS_METRIC_NAME = "kubecsr_approver_decisions";

    public enum Outcome {
        /** The request was already approved, denied or issued. */
        SKIPPED,
        /** The embedded certificate request could not be parsed or verified. */
        INVALID,
        /** No chain matched. */
        PENDING,
        APPROVED
    }

    private final RecognizerChains chains;
    private final ApprovalClient approvalClient;
    private final Clock clock;
    private final MeterRegistry registry;

    public CsrApprover(RecognizerChains chains, ApprovalClient approvalClient, Clock clock, MeterRegistry registry) {
        this.chains = chains;
        this.approvalClient = approvalClient;
        this.clock = clock;
        this.registry = registry;
    }

    public Outcome handle(CertificateSigningRequest csr) {
        Outcome outcome = decide(csr);
        decisionCounter(outcome).increment();
        return outcome;
    }

    private Outcome decide(CertificateSigningRequest csr) {
        String name = SigningRequests.name(csr);
        if (SigningRequests.isTerminal(csr)) {
            LOGGER.debug("Signing request {} is already decided, skipping", name);
            return Outcome.SKIPPED;
        }

        CertificateSigningRequest copy = new CertificateSigningRequestBuilder(csr).build();
        ParsedSigningRequest request;
        try {
            request = ParsedSigningRequest.from(copy);
        }
        catch (InvalidCertificateRequestException e) {
            LOGGER.warn("Ignoring signing request {} with invalid certificate request ({}): {}", name, e.reason(), e.getMessage());
            return Outcome.INVALID;
        }

        Optional<RecognizerChain> match = chains.evaluate(request);
        if (match.isEmpty()) {
            LOGGER.debug("Signing request {} from {} matched no chain, leaving it pending", name, request.requester().username());
            return Outcome.PENDING;
        }

        RecognizerChain chain = match.get();
        approve(copy, chain);
        approvalClient.updateApproval(copy);
        LOGGER.info("Approved signing request {} from {} ({})", name, request.requester().username(), chain.name());
        return Outcome.APPROVED;
    }

    private void approve(CertificateSigningRequest copy, RecognizerChain chain) {
        CertificateSigningRequestStatus status = copy.getStatus() == null ? new CertificateSigningRequestStatus() : copy.getStatus();
        List<CertificateSigningRequestCondition> conditions = new ArrayList<>(SigningRequests.conditions(copy));
        conditions.add(SigningRequests.approvedCondition(APPROVAL_REASON, chain.approvalMessage(), clock));
        status.setConditions(conditions);
        copy.setStatus(status);
    }

    private Counter decisionCounter(Outcome outcome) {
        return Counter.builder(DECISIONS_METRIC_NAME)
                .description("Signing requests handled by the approver, by outcome")
                .tag("outcome", outcome.name().toLowerCase(Locale.ROOT))
                .register(registry);
    }
}
