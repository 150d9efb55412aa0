/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.http;

import java.io.IOException;
import java.net.InetSocketAddress;

import javax.net.ssl.SSLContext;

import com.sun.net.httpserver.HttpServer;
import com.sun.net.httpserver.HttpsConfigurator;
import com.sun.net.httpserver.HttpsServer;

import io.kubecsr.config.ConfigurationException;

/**
 * Creates JDK HTTP servers bound to configured listen addresses.
 */
public final class HttpServers {

    static final String MAX_REQUEST_TIME_PROPERTY = "sun.net.httpserver.maxReqTime";
    static final String MAX_RESPONSE_TIME_PROPERTY = "sun.net.httpserver.maxRspTime";
    private static final String DEFAULT_MAX_REQUEST_SECONDS = "60";
    private static final String DEFAULT_MAX_RESPONSE_SECONDS = "120";

    private HttpServers() {
    }

    public static HttpServer create(InetSocketAddress address) throws IOException {
        limitExchangeTimes();
        return HttpServer.create(address, 0);
    }

    public static HttpsServer createHttps(InetSocketAddress address, SSLContext sslContext) throws IOException {
        limitExchangeTimes();
        HttpsServer server = HttpsServer.create(address, 0);
        server.setHttpsConfigurator(new HttpsConfigurator(sslContext));
        return server;
    }

    /**
     * Bounds how long the JDK server waits on a slow client. Values already set on the command line win.
     */
    static void limitExchangeTimes() {
        if (System.getProperty(MAX_REQUEST_TIME_PROPERTY) == null) {
            System.setProperty(MAX_REQUEST_TIME_PROPERTY, DEFAULT_MAX_REQUEST_SECONDS);
        }
        if (System.getProperty(MAX_RESPONSE_TIME_PROPERTY) == null) {
            System.setProperty(MAX_RESPONSE_TIME_PROPERTY, DEFAULT_MAX_RESPONSE_SECONDS);
        }
    }

    /**
     * Parses a {@code host:port} listen address. IPv6 hosts may be bracketed and an empty host means every interface.
     *
     * @param address the address
     * @return the socket address
     * @throws ConfigurationException if the address has no valid port
     */
    public static InetSocketAddress socketAddress(String address) {
        int colon = address.lastIndexOf(':');
        if (colon < 0) {
            throw new ConfigurationException("Address " + address + " must be of the form host:port");
        }
        String host = address.substring(0, colon);
        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }
        int port;
        try {
            port = Integer.parseInt(address.substring(colon + 1));
        }
        catch (NumberFormatException e) {
            throw new ConfigurationException("Address " + address + " has an invalid port", e);
        }
        if (port < 0 || port > 65535) {
            throw new ConfigurationException("Address " + address + " has an invalid port");
        }
        return host.isEmpty() ? new InetSocketAddress(port) : new InetSocketAddress(host, port);
    }
}
