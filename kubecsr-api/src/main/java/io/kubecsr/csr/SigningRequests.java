/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.csr;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.Base64;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import io.fabric8.kubernetes.api.model.certificates.v1.CertificateSigningRequest;
import io.fabric8.kubernetes.api.model.certificates.v1.CertificateSigningRequestCondition;
import io.fabric8.kubernetes.api.model.certificates.v1.CertificateSigningRequestConditionBuilder;
import io.fabric8.kubernetes.api.model.certificates.v1.CertificateSigningRequestSpec;
import io.fabric8.kubernetes.api.model.certificates.v1.CertificateSigningRequestStatus;

import static io.kubecsr.csr.InvalidCertificateRequestException.Reason.MALFORMED;

/**
 * Read and write helpers over {@link CertificateSigningRequest}.
 */
public final class SigningRequests {

    public static final String APPROVED = "Approved";
    public static final String DENIED = "Denied";

    private SigningRequests() {
    }

    public static boolean hasCertificate(CertificateSigningRequest csr) {
        return Optional.ofNullable(csr.getStatus())
                .map(CertificateSigningRequestStatus::getCertificate)
                .filter(certificate -> !certificate.isEmpty())
                .isPresent();
    }

    public static boolean isApproved(CertificateSigningRequest csr) {
        return hasCondition(csr, APPROVED);
    }

    public static boolean isDenied(CertificateSigningRequest csr) {
        return hasCondition(csr, DENIED);
    }

    /**
     * A request is terminal once it carries a certificate or an approval or denial condition.
     * Nothing in this project mutates a terminal request.
     */
    public static boolean isTerminal(CertificateSigningRequest csr) {
        return hasCertificate(csr) || isApproved(csr) || isDenied(csr);
    }

    public static List<CertificateSigningRequestCondition> conditions(CertificateSigningRequest csr) {
        CertificateSigningRequestStatus status = csr.getStatus();
        if (status == null || status.getConditions() == null) {
            return List.of();
        }
        return status.getConditions();
    }

    private static boolean hasCondition(CertificateSigningRequest csr, String type) {
        return conditions(csr).stream().anyMatch(condition -> type.equals(condition.getType()));
    }

    public static Requester requester(CertificateSigningRequest csr) {
        CertificateSigningRequestSpec spec = spec(csr);
        return new Requester(spec.getUsername() == null ? "" : spec.getUsername(),
                spec.getGroups() == null ? Set.of() : Set.copyOf(spec.getGroups()));
    }

    public static List<String> usages(CertificateSigningRequest csr) {
        List<String> usages = spec(csr).getUsages();
        return usages == null ? List.of() : List.copyOf(usages);
    }

    /**
     * Decodes and verifies the PKCS#10 request embedded in {@code spec.request}.
     * @throws InvalidCertificateRequestException if the request is missing, malformed or badly signed
     */
    public static CertificateRequest request(CertificateSigningRequest csr) {
        String encoded = spec(csr).getRequest();
        if (encoded == null || encoded.isEmpty()) {
            throw new InvalidCertificateRequestException(MALFORMED, "signing request has no embedded certificate request");
        }
        byte[] pem;
        try {
            pem = Base64.getMimeDecoder().decode(encoded);
        }
        catch (IllegalArgumentException e) {
            throw new InvalidCertificateRequestException(MALFORMED, "embedded certificate request is not base64 encoded", e);
        }
        return CertificateRequests.parse(pem);
    }

    /**
     * Encodes PEM bytes the way {@code spec.request} and {@code status.certificate} carry them.
     */
    public static String encode(byte[] pem) {
        return Base64.getEncoder().encodeToString(pem);
    }

    public static String encode(String pem) {
        return encode(pem.getBytes(StandardCharsets.US_ASCII));
    }

    public static byte[] certificate(CertificateSigningRequest csr) {
        if (!hasCertificate(csr)) {
            return new byte[0];
        }
        return Base64.getMimeDecoder().decode(csr.getStatus().getCertificate());
    }

    public static CertificateSigningRequestCondition approvedCondition(String reason, String message, Clock clock) {
        return condition(APPROVED, reason, message, clock);
    }

    public static CertificateSigningRequestCondition deniedCondition(String reason, String message, Clock clock) {
        return condition(DENIED, reason, message, clock);
    }

    private static CertificateSigningRequestCondition condition(String type, String reason, String message, Clock clock) {
        String now = ZonedDateTime.now(clock).truncatedTo(ChronoUnit.SECONDS).format(DateTimeFormatter.ISO_INSTANT);
        // @formatter:off
        return new CertificateSigningRequestConditionBuilder()
                .withType(type)
                .withStatus("True")
                .withReason(reason)
                .withMessage(message)
                .withLastUpdateTime(now)
                .withLastTransitionTime(now)
                .build();
        // @formatter:on
    }

    public static String name(CertificateSigningRequest csr) {
        return csr.getMetadata() == null ? "" : Objects.requireNonNullElse(csr.getMetadata().getName(), "");
    }

    private static CertificateSigningRequestSpec spec(CertificateSigningRequest csr) {
        CertificateSigningRequestSpec spec = csr.getSpec();
        return spec == null ? new CertificateSigningRequestSpec() : spec;
    }
}
