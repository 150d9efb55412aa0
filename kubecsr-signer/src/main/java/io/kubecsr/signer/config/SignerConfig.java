/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.signer.config;

import java.time.Duration;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import io.kubecsr.config.ConfigurationException;
import io.kubecsr.config.DurationSerde;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Top level configuration of the signer.
 *
 * @param caCert PEM certificate of the authority issuing etcd peer and server certificates
 * @param caKey PEM private key matching {@code caCert}
 * @param metricCaCert PEM certificate of the authority issuing etcd metric certificates
 * @param metricCaKey PEM private key matching {@code metricCaCert}
 * @param serverCert PEM certificate the signing endpoint presents; plain HTTP is served when absent
 * @param serverKey PEM private key matching {@code serverCert}
 * @param listenAddress {@code host:port} the signing endpoint binds to
 * @param healthCheckAddress {@code host:port} of a plain HTTP listener serving only readiness and metrics
 * @param peerCertDuration validity of issued peer certificates
 * @param serverCertDuration validity of issued server certificates
 * @param metricCertDuration validity of issued metric certificates
 * @param csrDir directory signed requests are kept in
 */
public record SignerConfig(@Nullable String caCert,
                           @Nullable String caKey,
                           @Nullable String metricCaCert,
                           @Nullable String metricCaKey,
                           @Nullable String serverCert,
                           @Nullable String serverKey,
                           @Nullable String listenAddress,
                           @Nullable String healthCheckAddress,
                           @JsonSerialize(using = DurationSerde.Serializer.class) @JsonDeserialize(using = DurationSerde.Deserializer.class) @Nullable Duration peerCertDuration,
                           @JsonSerialize(using = DurationSerde.Serializer.class) @JsonDeserialize(using = DurationSerde.Deserializer.class) @Nullable Duration serverCertDuration,
                           @JsonSerialize(using = DurationSerde.Serializer.class) @JsonDeserialize(using = DurationSerde.Deserializer.class) @Nullable Duration metricCertDuration,
                           @Nullable String csrDir) {

    public static final String DEFAULT_LISTEN_ADDRESS = "0.0.0.0:6443";
    public static final Duration DEFAULT_CERT_DURATION = Duration.ofHours(8760);

    public SignerConfig {
        requirePair("caCert", caCert, "caKey", caKey);
        requirePair("metricCaCert", metricCaCert, "metricCaKey", metricCaKey);
        requirePair("serverCert", serverCert, "serverKey", serverKey);
        if (caCert == null && metricCaCert == null) {
            throw new ConfigurationException("At least one of caCert/caKey and metricCaCert/metricCaKey must be configured");
        }
        if (listenAddress == null) {
            listenAddress = DEFAULT_LISTEN_ADDRESS;
        }
        peerCertDuration = positive("peerCertDuration", peerCertDuration);
        serverCertDuration = positive("serverCertDuration", serverCertDuration);
        metricCertDuration = positive("metricCertDuration", metricCertDuration);
    }

    public boolean tlsEnabled() {
        return serverCert != null;
    }

    public SignerConfig withCsrDir(String csrDir) {
        return new SignerConfig(caCert, caKey, metricCaCert, metricCaKey, serverCert, serverKey, listenAddress, healthCheckAddress,
                peerCertDuration, serverCertDuration, metricCertDuration, csrDir);
    }

    public SignerConfig withListenAddress(String listenAddress) {
        return new SignerConfig(caCert, caKey, metricCaCert, metricCaKey, serverCert, serverKey, listenAddress, healthCheckAddress,
                peerCertDuration, serverCertDuration, metricCertDuration, csrDir);
    }

    private static void requirePair(String firstName, @Nullable String first, String secondName, @Nullable String second) {
        if ((first == null) != (second == null)) {
            throw new ConfigurationException(firstName + " and " + secondName + " must be configured together");
        }
    }

    private static Duration positive(String name, @Nullable Duration duration) {
        if (duration == null) {
            return DEFAULT_CERT_DURATION;
        }
        if (duration.isNegative() || duration.isZero()) {
            throw new ConfigurationException(name + " must be positive, was " + DurationSerde.format(duration));
        }
        return duration;
    }
}
