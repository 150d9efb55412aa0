/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.signer;

import java.nio.file.Path;
import java.security.PrivateKey;
import java.security.cert.X509Certificate;
import java.util.Objects;

import io.kubecsr.config.ConfigurationException;

/**
 * A certificate authority the signer issues certificates with.
 *
 * @param certificate the authority's certificate, used as issuer of every certificate it signs
 * @param privateKey the authority's key
 */
public record CertificateAuthority(X509Certificate certificate, PrivateKey privateKey) {

    public CertificateAuthority {
        Objects.requireNonNull(certificate);
        Objects.requireNonNull(privateKey);
    }

    /**
     * Loads an authority from a PEM certificate file and a PEM private key file.
     * @throws ConfigurationException if either file cannot be read or parsed
     */
    public static CertificateAuthority load(Path certificateFile, Path privateKeyFile) {
        CertificateAuthority authority = new CertificateAuthority(PemFiles.readCertificate(certificateFile), PemFiles.readPrivateKey(privateKeyFile));
        // fail at startup rather than on the first request
        authority.signatureAlgorithm();
        return authority;
    }

    /**
     * @return the JCA name of the algorithm certificates are signed with
     */
    public String signatureAlgorithm() {
        String keyAlgorithm = privateKey.getAlgorithm();
        return switch (keyAlgorithm) {
            case "RSA" -> "SHA256withRSA";
            case "EC", "ECDSA" -> "SHA256withECDSA";
            case "Ed25519", "EdDSA" -> "Ed25519";
            default -> throw new ConfigurationException("Unsupported certificate authority key algorithm " + keyAlgorithm);
        };
    }
}
