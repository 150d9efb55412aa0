/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.signer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.certificates.v1.CertificateSigningRequest;
import io.fabric8.kubernetes.client.KubernetesClient;

import io.kubecsr.csr.SigningRequests;

/**
 * Signs a request held by the cluster API. The decision is written through the {@code approval}
 * subresource and the certificate through the {@code status} subresource, each with the resource
 * version of the object it was derived from.
 */
public class KubernetesCsrSigner {

    private static final Logger LOGGER = LoggerFactory.getLogger(KubernetesCsrSigner.class);

    static final String APPROVAL_SUBRESOURCE = "approval";

    private final KubernetesClient client;
    private final CertSigner signer;

    public KubernetesCsrSigner(KubernetesClient client, CertSigner signer) {
        this.client = client;
        this.signer = signer;
    }

    /**
     * Signs the named request.
     *
     * @param name the request name
     * @return the request as last written, or as read when it was already decided
     * @throws IllegalArgumentException if there is no such request
     * @throws SigningException if the request was refused; it has been denied
     */
    public CertificateSigningRequest sign(String name) {
        CertificateSigningRequest csr = client.certificates().v1().certificateSigningRequests().withName(name).get();
        if (csr == null) {
            throw new IllegalArgumentException("certificate signing request " + name + " not found");
        }
        if (SigningRequests.isTerminal(csr)) {
            LOGGER.info("Certificate signing request {} is already decided, leaving it unchanged", name);
            return csr;
        }

        try {
            signer.sign(csr);
        }
        catch (SigningException e) {
            client.certificates().v1().certificateSigningRequests().resource(csr).subresource(APPROVAL_SUBRESOURCE).update();
            LOGGER.warn("Denied certificate signing request {}: {}", name, e.getMessage());
            throw e;
        }

        String certificate = csr.getStatus().getCertificate();
        CertificateSigningRequest approved = client.certificates().v1().certificateSigningRequests().resource(csr).subresource(APPROVAL_SUBRESOURCE).update();
        approved.getStatus().setCertificate(certificate);
        CertificateSigningRequest issued = client.certificates().v1().certificateSigningRequests().resource(approved).updateStatus();
        LOGGER.info("Signed certificate signing request {}", name);
        return issued;
    }
}
