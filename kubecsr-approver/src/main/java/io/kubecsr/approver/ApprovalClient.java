/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.approver;

import io.fabric8.kubernetes.api.model.certificates.v1.CertificateSigningRequest;

/**
 * Writes approval decisions back to the API server.
 */
public interface ApprovalClient {

    /**
     * Replaces the conditions of the stored request with those of {@code csr}.
     * The write is conditional on the stored request still having {@code csr}'s resource version.
     *
     * @return the stored request after the update
     * @throws io.fabric8.kubernetes.client.KubernetesClientException with code 409 if the stored request has changed
     */
    CertificateSigningRequest updateApproval(CertificateSigningRequest csr);
}
