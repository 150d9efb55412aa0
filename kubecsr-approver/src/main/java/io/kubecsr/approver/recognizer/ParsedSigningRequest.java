/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.approver.recognizer;

import java.util.List;
import java.util.Objects;

import io.fabric8.kubernetes.api.model.certificates.v1.CertificateSigningRequest;

import io.kubecsr.csr.CertificateRequest;
import io.kubecsr.csr.Requester;
import io.kubecsr.csr.SigningRequests;

/**
 * What recognizers see of a signing request: who asked, for which usages, and the verified PKCS#10 request.
 * @param name the name of the signing request
 * @param requester the authenticated requester
 * @param usages the requested key usages, as the API carries them
 * @param certificateRequest the parsed and verified embedded request
 */
public record ParsedSigningRequest(String name,
                                   Requester requester,
                                   List<String> usages,
                                   CertificateRequest certificateRequest) {

    public ParsedSigningRequest {
        Objects.requireNonNull(name);
        Objects.requireNonNull(requester);
        Objects.requireNonNull(certificateRequest);
        usages = List.copyOf(usages);
    }

    /**
     * @throws io.kubecsr.csr.InvalidCertificateRequestException if the embedded request is malformed or badly signed
     */
    public static ParsedSigningRequest from(CertificateSigningRequest csr) {
        return new ParsedSigningRequest(SigningRequests.name(csr),
                SigningRequests.requester(csr),
                SigningRequests.usages(csr),
                SigningRequests.request(csr));
    }
}
