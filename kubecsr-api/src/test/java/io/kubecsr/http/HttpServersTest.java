/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.http;

import java.io.IOException;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.junitpioneer.jupiter.RestoreSystemProperties;
import org.junitpioneer.jupiter.SetSystemProperty;

import com.sun.net.httpserver.HttpServer;

import io.kubecsr.config.ConfigurationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpServersTest {

    @Test
    void parsesHostAndPort() {
        // When
        var address = HttpServers.socketAddress("127.0.0.1:6443");

        // Then
        assertThat(address.getAddress().getHostAddress()).isEqualTo("127.0.0.1");
        assertThat(address.getPort()).isEqualTo(6443);
    }

    @Test
    void emptyHostBindsEveryInterface() {
        assertThat(HttpServers.socketAddress(":6443").getAddress().isAnyLocalAddress()).isTrue();
    }

    @Test
    void acceptsBracketedIpv6Host() {
        assertThat(HttpServers.socketAddress("[::1]:6443").getAddress().isLoopbackAddress()).isTrue();
    }

    @Test
    void hostWithoutPortIsRejected() {
        assertThatThrownBy(() -> HttpServers.socketAddress("127.0.0.1"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("must be of the form host:port");
    }

    @ParameterizedTest
    @ValueSource(strings = { "localhost:https", "localhost:70000", "localhost:-1", "localhost:" })
    void invalidPortIsRejected(String address) {
        assertThatThrownBy(() -> HttpServers.socketAddress(address))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("invalid port");
    }

    @Test
    @RestoreSystemProperties
    void limitsRequestAndResponseTime() {
        // Given
        System.clearProperty(HttpServers.MAX_REQUEST_TIME_PROPERTY);
        System.clearProperty(HttpServers.MAX_RESPONSE_TIME_PROPERTY);

        // When
        HttpServers.limitExchangeTimes();

        // Then
        assertThat(System.getProperty(HttpServers.MAX_REQUEST_TIME_PROPERTY)).isEqualTo("60");
        assertThat(System.getProperty(HttpServers.MAX_RESPONSE_TIME_PROPERTY)).isEqualTo("120");
    }

    @Test
    @RestoreSystemProperties
    @SetSystemProperty(key = "sun.net.httpserver.maxReqTime", value = "12")
    void keepsConfiguredRequestTimeout() {
        // When
        HttpServers.limitExchangeTimes();

        // Then
        assertThat(System.getProperty(HttpServers.MAX_REQUEST_TIME_PROPERTY)).isEqualTo("12");
    }

    @Test
    @RestoreSystemProperties
    void createdServerIsBoundToRequestedAddress() throws IOException {
        // Given
        HttpServer server = HttpServers.create(HttpServers.socketAddress("127.0.0.1:0"));
        try {
            // Then
            assertThat(server.getAddress().getAddress().isLoopbackAddress()).isTrue();
            assertThat(server.getAddress().getPort()).isPositive();
        }
        finally {
            server.stop(0);
        }
    }
}
