/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.signer;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import io.kubecsr.csr.CertificateRequest;
import io.kubecsr.csr.KeyUsage;

import static io.kubecsr.csr.KeyUsage.CLIENT_AUTH;
import static io.kubecsr.csr.KeyUsage.DIGITAL_SIGNATURE;
import static io.kubecsr.csr.KeyUsage.KEY_ENCIPHERMENT;
import static io.kubecsr.csr.KeyUsage.SERVER_AUTH;

/**
 * The classes of etcd certificate the signer issues. The subject organization of a request selects
 * the profile, which fixes the usages of the issued certificate and the authority that signs it.
 */
public enum Profile {
    ETCD_PEER("system:etcd-peers", EnumSet.of(KEY_ENCIPHERMENT, DIGITAL_SIGNATURE, CLIENT_AUTH, SERVER_AUTH)),
    ETCD_SERVER("system:etcd-servers", EnumSet.of(KEY_ENCIPHERMENT, DIGITAL_SIGNATURE, SERVER_AUTH)),
    ETCD_METRIC("system:etcd-metrics", EnumSet.of(KEY_ENCIPHERMENT, DIGITAL_SIGNATURE, CLIENT_AUTH, SERVER_AUTH));

    private final String organization;
    private final String commonNamePrefix;
    private final Set<KeyUsage> usages;

    Profile(String organization, Set<KeyUsage> usages) {
        this.organization = organization;
        // system:etcd-peers -> system:etcd-peer:
        this.commonNamePrefix = organization.substring(0, organization.length() - 1) + ":";
        this.usages = Collections.unmodifiableSet(usages);
    }

    public String organization() {
        return organization;
    }

    public String commonNamePrefix() {
        return commonNamePrefix;
    }

    public Set<KeyUsage> usages() {
        return usages;
    }

    /**
     * Whether certificates of this profile are issued by the metric authority rather than the main one.
     */
    public boolean usesMetricAuthority() {
        return this == ETCD_METRIC;
    }

    /**
     * Selects the profile for a request.
     *
     * @param request the parsed request
     * @return the profile named by the request's single subject organization
     * @throws SigningException with {@link SigningException.Reason#INVALID_ORGANIZATION} if the request does not
     * carry exactly one organization, or it names no profile, and {@link SigningException.Reason#INVALID_COMMON_NAME}
     * if the common name lacks the profile's prefix
     */
    public static Profile select(CertificateRequest request) {
        List<String> organizations = request.organizations();
        if (organizations.size() != 1) {
            throw new SigningException(SigningException.Reason.INVALID_ORGANIZATION,
                    "expected exactly one subject organization, found " + organizations);
        }
        String organization = organizations.get(0);
        Profile profile = Arrays.stream(values())
                .filter(p -> p.organization.equals(organization))
                .findFirst()
                .orElseThrow(() -> new SigningException(SigningException.Reason.INVALID_ORGANIZATION,
                        "organization " + organization + " is not one of " + organizations()));
        String commonName = request.commonName();
        if (commonName == null || !commonName.startsWith(profile.commonNamePrefix)) {
            throw new SigningException(SigningException.Reason.INVALID_COMMON_NAME,
                    "common name " + commonName + " does not start with " + profile.commonNamePrefix);
        }
        return profile;
    }

    private static String organizations() {
        return Arrays.stream(values()).map(Profile::organization).collect(Collectors.joining(", ", "[", "]"));
    }
}
