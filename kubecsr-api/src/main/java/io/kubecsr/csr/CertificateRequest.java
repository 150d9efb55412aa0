/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.csr;

import java.util.List;
import java.util.Objects;

import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x509.SubjectPublicKeyInfo;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A parsed PKCS#10 certificate request whose self-signature has been verified.
 *
 * @param subject the requested subject
 * @param commonName the single common name in the subject, if any
 * @param organizations the organizations in the subject, in the order they appear
 * @param dnsNames DNS subject alternative names
 * @param emailAddresses email subject alternative names
 * @param ipAddresses IP address subject alternative names, as textual addresses
 * @param uris URI subject alternative names
 * @param publicKeyInfo the key to be certified
 */
public record CertificateRequest(X500Name subject,
                                 @Nullable String commonName,
                                 List<String> organizations,
                                 List<String> dnsNames,
                                 List<String> emailAddresses,
                                 List<String> ipAddresses,
                                 List<String> uris,
                                 SubjectPublicKeyInfo publicKeyInfo) {

    public CertificateRequest {
        Objects.requireNonNull(subject);
        Objects.requireNonNull(publicKeyInfo);
        organizations = List.copyOf(organizations);
        dnsNames = List.copyOf(dnsNames);
        emailAddresses = List.copyOf(emailAddresses);
        ipAddresses = List.copyOf(ipAddresses);
        uris = List.copyOf(uris);
    }

    public boolean hasSubjectAlternativeNames() {
        return !dnsNames.isEmpty() || !emailAddresses.isEmpty() || !ipAddresses.isEmpty() || !uris.isEmpty();
    }
}
