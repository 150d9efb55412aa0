/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.approver;

import io.fabric8.kubernetes.api.model.certificates.v1.CertificateSigningRequest;
import io.fabric8.kubernetes.client.KubernetesClient;

/**
 * Updates the {@code approval} subresource of a request. The update carries the resource version
 * the request was read at, so the API server rejects it if another writer got there first.
 */
public class KubernetesApprovalClient implements ApprovalClient {

    static final String APPROVAL_SUBRESOURCE = "approval";

    private final KubernetesClient client;

    public KubernetesApprovalClient(KubernetesClient client) {
        this.client = client;
    }

    @Override
    public CertificateSigningRequest updateApproval(CertificateSigningRequest csr) {
        return client.certificates().v1().certificateSigningRequests()
                .resource(csr)
                .subresource(APPROVAL_SUBRESOURCE)
                .update();
    }
}
