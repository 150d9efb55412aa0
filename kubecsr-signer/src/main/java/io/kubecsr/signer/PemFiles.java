/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.signer;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.PrivateKey;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;

import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;

import io.kubecsr.config.ConfigurationException;

/**
 * Reads certificates and unencrypted private keys from PEM files.
 */
final class PemFiles {

    private PemFiles() {
    }

    static X509Certificate readCertificate(Path file) {
        Object object = readFirstObject(file);
        if (!(object instanceof X509CertificateHolder holder)) {
            throw new ConfigurationException("File " + file + " does not start with a PEM encoded certificate");
        }
        try {
            return new JcaX509CertificateConverter().getCertificate(holder);
        }
        catch (CertificateException e) {
            throw new ConfigurationException("Error parsing certificate file " + file + ": " + e.getMessage(), e);
        }
    }

    static PrivateKey readPrivateKey(Path file) {
        Object object = readFirstObject(file);
        JcaPEMKeyConverter converter = new JcaPEMKeyConverter().setProvider(new BouncyCastleProvider());
        try {
            if (object instanceof PEMKeyPair pair) {
                return converter.getKeyPair(pair).getPrivate();
            }
            if (object instanceof PrivateKeyInfo info) {
                return converter.getPrivateKey(info);
            }
        }
        catch (IOException e) {
            throw new ConfigurationException("Malformed private key in " + file + ": " + e.getMessage(), e);
        }
        throw new ConfigurationException("File " + file + " does not start with an unencrypted PEM encoded private key");
    }

    private static Object readFirstObject(Path file) {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.US_ASCII);
                PEMParser parser = new PEMParser(reader)) {
            Object object = parser.readObject();
            if (object == null) {
                throw new ConfigurationException("File " + file + " contains no PEM data");
            }
            return object;
        }
        catch (IOException e) {
            throw new ConfigurationException("Error reading PEM file " + file + ": " + e.getMessage(), e);
        }
    }
}
