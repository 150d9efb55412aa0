/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.approver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.certificates.v1.CertificateSigningRequest;
import io.javaoperatorsdk.operator.api.reconciler.Context;
import io.javaoperatorsdk.operator.api.reconciler.ControllerConfiguration;
import io.javaoperatorsdk.operator.api.reconciler.Reconciler;
import io.javaoperatorsdk.operator.api.reconciler.UpdateControl;

import io.kubecsr.csr.SigningRequests;

/**
 * Reconciles {@link CertificateSigningRequest}s by handing each one to a {@link CsrApprover}.
 * <p>
 * The approval is written by the approver itself through the {@code approval} subresource, so the
 * reconciler never asks the framework to update the resource. Exceptions propagate to the framework,
 * which retries the request with backoff. Deleted requests need no action.
 * </p>
 */
@ControllerConfiguration(name = CsrApprovalReconciler.NAME, generationAwareEventProcessing = false)
public class CsrApprovalReconciler implements Reconciler<CertificateSigningRequest> {

    private static final Logger LOGGER = LoggerFactory.getLogger(CsrApprovalReconciler.class);

    public static final String NAME = "csrapprovalreconciler";

    private final CsrApprover approver;

    public CsrApprovalReconciler(CsrApprover approver) {
        this.approver = approver;
    }

    @Override
    public UpdateControl<CertificateSigningRequest> reconcile(CertificateSigningRequest csr, Context<CertificateSigningRequest> context) {
        CsrApprover.Outcome outcome = approver.handle(csr);
        LOGGER.debug("Completed reconciliation of signing request {}: {}", SigningRequests.name(csr), outcome);
        return UpdateControl.noUpdate();
    }
}
