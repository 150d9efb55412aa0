/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.csr;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.charset.StandardCharsets;
import java.security.Provider;
import java.util.ArrayList;
import java.util.List;

import org.bouncycastle.asn1.ASN1Encodable;
import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.ASN1OctetString;
import org.bouncycastle.asn1.ASN1String;
import org.bouncycastle.asn1.pkcs.Attribute;
import org.bouncycastle.asn1.pkcs.PKCSObjectIdentifiers;
import org.bouncycastle.asn1.x500.AttributeTypeAndValue;
import org.bouncycastle.asn1.x500.RDN;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x500.style.BCStyle;
import org.bouncycastle.asn1.x500.style.IETFUtils;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.Extensions;
import org.bouncycastle.asn1.x509.GeneralName;
import org.bouncycastle.asn1.x509.GeneralNames;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.operator.ContentVerifierProvider;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.operator.jcajce.JcaContentVerifierProviderBuilder;
import org.bouncycastle.pkcs.PKCS10CertificationRequest;
import org.bouncycastle.pkcs.PKCSException;

import edu.umd.cs.findbugs.annotations.Nullable;

import static io.kubecsr.csr.InvalidCertificateRequestException.Reason.BAD_SIGNATURE;
import static io.kubecsr.csr.InvalidCertificateRequestException.Reason.MALFORMED;

/**
 * Decodes PEM encoded PKCS#10 certificate requests.
 */
public final class CertificateRequests {

    private static final Provider BOUNCY_CASTLE = new BouncyCastleProvider();

    private CertificateRequests() {
    }

    /**
     * Parses a PEM {@code CERTIFICATE REQUEST} block and verifies its self-signature.
     *
     * @param pem the PEM encoded request
     * @return the parsed request
     * @throws InvalidCertificateRequestException if the input is not a PKCS#10 request, its subject names more than one common name, or its signature does not verify
     */
    public static CertificateRequest parse(byte[] pem) {
        PKCS10CertificationRequest pkcs10 = decode(pem);
        verify(pkcs10);
        X500Name subject = pkcs10.getSubject();
        List<String> commonNames = attributeValues(subject, BCStyle.CN);
        if (commonNames.size() > 1) {
            throw new InvalidCertificateRequestException(MALFORMED, "certificate request subject carries " + commonNames.size() + " common names");
        }
        List<String> dnsNames = new ArrayList<>();
        List<String> emailAddresses = new ArrayList<>();
        List<String> ipAddresses = new ArrayList<>();
        List<String> uris = new ArrayList<>();
        GeneralNames sans = subjectAlternativeNames(pkcs10);
        if (sans != null) {
            for (GeneralName name : sans.getNames()) {
                switch (name.getTagNo()) {
                    case GeneralName.dNSName -> dnsNames.add(stringValue(name));
                    case GeneralName.rfc822Name -> emailAddresses.add(stringValue(name));
                    case GeneralName.uniformResourceIdentifier -> uris.add(stringValue(name));
                    case GeneralName.iPAddress -> ipAddresses.add(ipAddress(name));
                    default -> {
                        // other name forms are not used by kubelets or etcd members
                    }
                }
            }
        }
        return new CertificateRequest(subject,
                commonNames.isEmpty() ? null : commonNames.get(0),
                attributeValues(subject, BCStyle.O),
                dnsNames,
                emailAddresses,
                ipAddresses,
                uris,
                pkcs10.getSubjectPublicKeyInfo());
    }

    private static PKCS10CertificationRequest decode(byte[] pem) {
        try (PEMParser parser = new PEMParser(new InputStreamReader(new ByteArrayInputStream(pem), StandardCharsets.US_ASCII))) {
            Object object = parser.readObject();
            if (object instanceof PKCS10CertificationRequest request) {
                return request;
            }
            throw new InvalidCertificateRequestException(MALFORMED,
                    object == null ? "no PEM encoded certificate request found" : "PEM block is not a certificate request");
        }
        catch (IOException | IllegalArgumentException | IllegalStateException e) {
            throw new InvalidCertificateRequestException(MALFORMED, "failed to decode certificate request: " + e.getMessage(), e);
        }
    }

    private static void verify(PKCS10CertificationRequest pkcs10) {
        boolean valid;
        try {
            ContentVerifierProvider verifierProvider = new JcaContentVerifierProviderBuilder()
                    .setProvider(BOUNCY_CASTLE)
                    .build(pkcs10.getSubjectPublicKeyInfo());
            valid = pkcs10.isSignatureValid(verifierProvider);
        }
        catch (OperatorCreationException | PKCSException e) {
            throw new InvalidCertificateRequestException(BAD_SIGNATURE, "unable to verify certificate request signature: " + e.getMessage(), e);
        }
        if (!valid) {
            throw new InvalidCertificateRequestException(BAD_SIGNATURE, "certificate request signature does not match its public key");
        }
    }

    @Nullable
    private static GeneralNames subjectAlternativeNames(PKCS10CertificationRequest pkcs10) {
        try {
            for (Attribute attribute : pkcs10.getAttributes(PKCSObjectIdentifiers.pkcs_9_at_extensionRequest)) {
                for (ASN1Encodable value : attribute.getAttributeValues()) {
                    GeneralNames names = GeneralNames.fromExtensions(Extensions.getInstance(value), Extension.subjectAlternativeName);
                    if (names != null) {
                        return names;
                    }
                }
            }
            return null;
        }
        catch (IllegalArgumentException | IllegalStateException e) {
            throw new InvalidCertificateRequestException(MALFORMED, "invalid extension request: " + e.getMessage(), e);
        }
    }

    private static String stringValue(GeneralName name) {
        return ((ASN1String) name.getName()).getString();
    }

    private static String ipAddress(GeneralName name) {
        byte[] octets = ASN1OctetString.getInstance(name.getName()).getOctets();
        try {
            return InetAddress.getByAddress(octets).getHostAddress();
        }
        catch (UnknownHostException e) {
            throw new InvalidCertificateRequestException(MALFORMED, "invalid IP address subject alternative name", e);
        }
    }

    /**
     * Every value of the given attribute type in subject order, including those held in multi-valued RDNs
     * such as {@code O=a+O=b}.
     */
    private static List<String> attributeValues(X500Name subject, ASN1ObjectIdentifier type) {
        List<String> values = new ArrayList<>();
        for (RDN rdn : subject.getRDNs()) {
            for (AttributeTypeAndValue typeAndValue : rdn.getTypesAndValues()) {
                if (type.equals(typeAndValue.getType())) {
                    values.add(attributeValue(typeAndValue.getValue()));
                }
            }
        }
        return values;
    }

    private static String attributeValue(ASN1Encodable value) {
        return value instanceof ASN1String string ? string.getString() : IETFUtils.valueToString(value);
    }
}
