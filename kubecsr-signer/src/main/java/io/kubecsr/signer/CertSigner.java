/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.signer;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.Provider;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x509.BasicConstraints;
import org.bouncycastle.asn1.x509.ExtendedKeyUsage;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.GeneralName;
import org.bouncycastle.asn1.x509.GeneralNames;
import org.bouncycastle.asn1.x509.KeyPurposeId;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.X509v3CertificateBuilder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.cert.jcajce.JcaX509ExtensionUtils;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.openssl.jcajce.JcaPEMWriter;
import org.bouncycastle.operator.ContentSigner;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.api.model.certificates.v1.CertificateSigningRequest;
import io.fabric8.kubernetes.api.model.certificates.v1.CertificateSigningRequestCondition;
import io.fabric8.kubernetes.api.model.certificates.v1.CertificateSigningRequestStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import io.kubecsr.csr.CertificateRequest;
import io.kubecsr.csr.InvalidCertificateRequestException;
import io.kubecsr.csr.KeyUsage;
import io.kubecsr.csr.SigningRequests;
import io.kubecsr.signer.config.SignerConfig;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Issues certificates for etcd signing requests.
 * <p>
 * The profile is chosen from the subject of the embedded request and decides the usages, the validity
 * and the authority of the certificate. The subject and subject alternative names are copied from the
 * request; whatever usages the request itself asks for are ignored.
 * </p>
 * <p>
 * {@link #sign(CertificateSigningRequest)} updates the status of the request it is given. A signed
 * request carries the certificate and a single Approved condition; a refused one carries a single
 * Denied condition naming the failure.
 * </p>
 */
public class CertSigner {

    private static final Logger LOGGER = LoggerFactory.getLogger(CertSigner.class);
    private static final Provider BOUNCY_CASTLE = new BouncyCastleProvider();

    static final String APPROVAL_REASON = "SignerApproved";

    /**
     * Name of the request counter. Prometheus exposes it as {@code kubecsr_signer_requests_total}.
     */
    static final String REQUESTS_METRIC_NAME = "kubecsr_signer_requests";

    private static final int SERIAL_NUMBER_BITS = 128;

    private final Map<Profile, CertificateAuthority> authorities;
    private final Map<Profile, Duration> validities;
    private final Clock clock;
    private final MeterRegistry registry;
    private final SecureRandom random = new SecureRandom();

    public CertSigner(Map<Profile, CertificateAuthority> authorities, Map<Profile, Duration> validities, Clock clock, MeterRegistry registry) {
        this.authorities = authorities.isEmpty() ? Map.of() : new EnumMap<>(authorities);
        this.validities = new EnumMap<>(Profile.class);
        for (Profile profile : Profile.values()) {
            this.validities.put(profile, validities.getOrDefault(profile, SignerConfig.DEFAULT_CERT_DURATION));
        }
        this.clock = clock;
        this.registry = registry;
    }

    /**
     * Loads the configured authorities.
     * @throws io.kubecsr.config.ConfigurationException if an authority cannot be loaded
     */
    public static CertSigner create(SignerConfig config, Clock clock, MeterRegistry registry) {
        Map<Profile, CertificateAuthority> authorities = new EnumMap<>(Profile.class);
        if (config.caCert() != null && config.caKey() != null) {
            CertificateAuthority main = CertificateAuthority.load(Path.of(config.caCert()), Path.of(config.caKey()));
            authorities.put(Profile.ETCD_PEER, main);
            authorities.put(Profile.ETCD_SERVER, main);
        }
        if (config.metricCaCert() != null && config.metricCaKey() != null) {
            authorities.put(Profile.ETCD_METRIC, CertificateAuthority.load(Path.of(config.metricCaCert()), Path.of(config.metricCaKey())));
        }
        LOGGER.info("Signing profiles {}", authorities.keySet());
        return new CertSigner(authorities,
                Map.of(Profile.ETCD_PEER, config.peerCertDuration(),
                        Profile.ETCD_SERVER, config.serverCertDuration(),
                        Profile.ETCD_METRIC, config.metricCertDuration()),
                clock,
                registry);
    }

    /**
     * Signs a request and records the outcome in its status.
     *
     * @param csr the request, updated in place
     * @return the PEM encoded certificate
     * @throws SigningException if the request is refused; its status then carries a Denied condition
     */
    public byte[] sign(CertificateSigningRequest csr) {
        Profile profile = null;
        try {
            CertificateRequest request = parse(csr);
            profile = Profile.select(request);
            CertificateAuthority authority = authorities.get(profile);
            if (authority == null) {
                throw new SigningException(SigningException.Reason.PROFILE_UNSUPPORTED,
                        "no certificate authority is configured for profile " + profile);
            }
            byte[] pem = toPem(issue(request, profile, authority));
            setStatus(csr, SigningRequests.encode(pem),
                    SigningRequests.approvedCondition(APPROVAL_REASON, "kubecsr signed " + profile.organization() + " certificate", clock));
            requestCounter(profile, "issued").increment();
            LOGGER.info("Issued {} certificate for {}", profile, request.commonName());
            return pem;
        }
        catch (SigningException e) {
            setStatus(csr, null, SigningRequests.deniedCondition(e.reason().conditionReason(), e.getMessage(), clock));
            requestCounter(profile, "denied").increment();
            throw e;
        }
    }

    private static CertificateRequest parse(CertificateSigningRequest csr) {
        try {
            return SigningRequests.request(csr);
        }
        catch (InvalidCertificateRequestException e) {
            throw new SigningException(SigningException.Reason.INVALID_REQUEST, "error parsing certificate request: " + e.getMessage(), e);
        }
    }

    private X509Certificate issue(CertificateRequest request, Profile profile, CertificateAuthority authority) {
        Instant notBefore = clock.instant();
        Instant notAfter = notBefore.plus(validities.get(profile));
        try {
            JcaX509ExtensionUtils extensionUtils = new JcaX509ExtensionUtils();
            X509v3CertificateBuilder builder = new X509v3CertificateBuilder(
                    X500Name.getInstance(authority.certificate().getSubjectX500Principal().getEncoded()),
                    new BigInteger(SERIAL_NUMBER_BITS, random),
                    Date.from(notBefore),
                    Date.from(notAfter),
                    request.subject(),
                    request.publicKeyInfo());
            builder.addExtension(Extension.basicConstraints, true, new BasicConstraints(false));
            builder.addExtension(Extension.keyUsage, true, new org.bouncycastle.asn1.x509.KeyUsage(keyUsageBits(profile)));
            builder.addExtension(Extension.extendedKeyUsage, false, new ExtendedKeyUsage(extendedKeyUsages(profile)));
            builder.addExtension(Extension.subjectKeyIdentifier, false, extensionUtils.createSubjectKeyIdentifier(request.publicKeyInfo()));
            builder.addExtension(Extension.authorityKeyIdentifier, false, extensionUtils.createAuthorityKeyIdentifier(authority.certificate()));
            GeneralNames sans = subjectAlternativeNames(request);
            if (sans != null) {
                builder.addExtension(Extension.subjectAlternativeName, false, sans);
            }
            ContentSigner contentSigner = new JcaContentSignerBuilder(authority.signatureAlgorithm())
                    .setProvider(BOUNCY_CASTLE)
                    .build(authority.privateKey());
            X509CertificateHolder holder = builder.build(contentSigner);
            return new JcaX509CertificateConverter().getCertificate(holder);
        }
        catch (IOException | GeneralSecurityException | OperatorCreationException | IllegalArgumentException e) {
            throw new SigningException(SigningException.Reason.SIGNING_FAILED, "certificate signing error: " + e.getMessage(), e);
        }
    }

    private static int keyUsageBits(Profile profile) {
        int bits = 0;
        for (KeyUsage usage : profile.usages()) {
            bits |= switch (usage) {
                case DIGITAL_SIGNATURE -> org.bouncycastle.asn1.x509.KeyUsage.digitalSignature;
                case KEY_ENCIPHERMENT -> org.bouncycastle.asn1.x509.KeyUsage.keyEncipherment;
                default -> 0;
            };
        }
        return bits;
    }

    private static KeyPurposeId[] extendedKeyUsages(Profile profile) {
        List<KeyPurposeId> purposes = new ArrayList<>();
        if (profile.usages().contains(KeyUsage.SERVER_AUTH)) {
            purposes.add(KeyPurposeId.id_kp_serverAuth);
        }
        if (profile.usages().contains(KeyUsage.CLIENT_AUTH)) {
            purposes.add(KeyPurposeId.id_kp_clientAuth);
        }
        return purposes.toArray(new KeyPurposeId[0]);
    }

    @Nullable
    private static GeneralNames subjectAlternativeNames(CertificateRequest request) {
        if (!request.hasSubjectAlternativeNames()) {
            return null;
        }
        List<GeneralName> names = new ArrayList<>();
        request.dnsNames().forEach(name -> names.add(new GeneralName(GeneralName.dNSName, name)));
        request.ipAddresses().forEach(address -> names.add(new GeneralName(GeneralName.iPAddress, address)));
        request.emailAddresses().forEach(address -> names.add(new GeneralName(GeneralName.rfc822Name, address)));
        request.uris().forEach(uri -> names.add(new GeneralName(GeneralName.uniformResourceIdentifier, uri)));
        return new GeneralNames(names.toArray(new GeneralName[0]));
    }

    private static void setStatus(CertificateSigningRequest csr, @Nullable String certificate, CertificateSigningRequestCondition condition) {
        CertificateSigningRequestStatus status = csr.getStatus() == null ? new CertificateSigningRequestStatus() : csr.getStatus();
        status.setCertificate(certificate);
        status.setConditions(new ArrayList<>(List.of(condition)));
        csr.setStatus(status);
    }

    private static byte[] toPem(X509Certificate certificate) {
        StringWriter out = new StringWriter();
        try (JcaPEMWriter writer = new JcaPEMWriter(out)) {
            writer.writeObject(certificate);
        }
        catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toString().getBytes(StandardCharsets.US_ASCII);
    }

    private Counter requestCounter(@Nullable Profile profile, String outcome) {
        return Counter.builder(REQUESTS_METRIC_NAME)
                .description("Signing requests handled by the signer, by profile and outcome")
                .tag("profile", profile == null ? "none" : profile.name().toLowerCase(Locale.ROOT))
                .tag("outcome", outcome)
                .register(registry);
    }
}
