/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.signer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.PrivateKey;
import java.security.SecureRandom;
import java.security.cert.Certificate;
import java.security.cert.X509Certificate;
import java.util.Optional;
import java.util.UUID;

import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.Filter;
import com.sun.net.httpserver.HttpContext;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import io.fabric8.kubernetes.api.model.certificates.v1.CertificateSigningRequest;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import io.prometheus.metrics.exporter.httpserver.MetricsHandler;

import io.kubecsr.config.ConfigurationException;
import io.kubecsr.csr.SigningRequests;
import io.kubecsr.http.HttpServers;
import io.kubecsr.http.MethodFilter;
import io.kubecsr.signer.config.SignerConfig;
import io.kubecsr.tag.VisibleForTesting;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The HTTP surface of the signer.
 * <ul>
 *     <li>{@code POST /apis/certificates.k8s.io/v1/certificatesigningrequests} signs the posted request, keeps it
 *     and returns it.</li>
 *     <li>{@code GET /apis/certificates.k8s.io/v1/certificatesigningrequests/{name}} returns a request signed earlier.</li>
 *     <li>{@code GET /readyz} and {@code GET /metrics}, also served by the optional health check listener.</li>
 * </ul>
 */
public class CertServer {

    private static final Logger LOGGER = LoggerFactory.getLogger(CertServer.class);

    static final String CSR_PATH = "/apis/certificates.k8s.io/v1/certificatesigningrequests";
    static final String HTTP_PATH_READYZ = "/readyz";
    static final String HTTP_PATH_METRICS = "/metrics";
    private static final String KIND = "CertificateSigningRequest";
    private static final String JSON = "application/json";

    private final CertSigner signer;
    private final CsrStore store;
    private final HttpServer server;
    @Nullable
    private final HttpServer healthServer;
    private final PrometheusMeterRegistry prometheus;
    private final ObjectMapper mapper = new ObjectMapper().disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    public CertServer(CertSigner signer, CsrStore store, HttpServer server, @Nullable HttpServer healthServer, PrometheusMeterRegistry prometheus) {
        this.signer = signer;
        this.store = store;
        this.server = server;
        this.healthServer = healthServer;
        this.prometheus = prometheus;
    }

    public void start() {
        configure(server);
        server.createContext(CSR_PATH, this::handleSigningRequests).getFilters().add(RequestLoggingFilter.INSTANCE);
        server.start();
        LOGGER.info("Serving signing requests on {}", server.getAddress());
        if (healthServer != null) {
            configure(healthServer);
            healthServer.start();
            LOGGER.info("Serving health checks on {}", healthServer.getAddress());
        }
    }

    public void stop() {
        server.stop(0);
        if (healthServer != null) {
            healthServer.stop(0);
        }
        LOGGER.info("Signer stopped.");
    }

    private void configure(HttpServer httpServer) {
        httpServer.createContext("/", exchange -> {
            try (exchange) {
                exchange.sendResponseHeaders(404, -1);
            }
        });
        HttpContext readiness = httpServer.createContext(HTTP_PATH_READYZ, exchange -> {
            try (exchange) {
                exchange.sendResponseHeaders(200, -1);
            }
        });
        readiness.getFilters().add(RequestLoggingFilter.INSTANCE);
        readiness.getFilters().add(MethodFilter.allowing("GET", "HEAD"));
        httpServer.createContext(HTTP_PATH_METRICS, new MetricsHandler(prometheus.getPrometheusRegistry()));
    }

    private void handleSigningRequests(HttpExchange exchange) throws IOException {
        try (exchange) {
            String path = exchange.getRequestURI().getPath();
            String method = exchange.getRequestMethod();
            if (path.equals(CSR_PATH)) {
                if ("POST".equals(method)) {
                    handlePost(exchange);
                }
                else {
                    methodNotAllowed(exchange, "POST");
                }
            }
            else if (path.startsWith(CSR_PATH + "/")) {
                if ("GET".equals(method)) {
                    handleGet(exchange, path.substring(CSR_PATH.length() + 1));
                }
                else {
                    methodNotAllowed(exchange, "GET");
                }
            }
            else {
                exchange.sendResponseHeaders(404, -1);
            }
        }
    }

    private void handlePost(HttpExchange exchange) throws IOException {
        CertificateSigningRequest csr;
        try {
            csr = mapper.readValue(exchange.getRequestBody(), CertificateSigningRequest.class);
        }
        catch (IOException e) {
            LOGGER.warn("Error decoding request body: {}", e.getMessage());
            sendText(exchange, 400, "Failed to decode request body");
            return;
        }
        if (csr == null || !KIND.equals(csr.getKind())) {
            LOGGER.warn("Request body is not a certificate signing request");
            sendText(exchange, 400, "Invalid Certificate Signing Request");
            return;
        }

        String name = SigningRequests.name(csr);
        try {
            signer.sign(csr);
        }
        catch (SigningException e) {
            LOGGER.warn("Error signing CSR {} provided in request from agent ({}): {}", name, e.reason(), e.getMessage());
            sendText(exchange, 400, "Error signing csr");
            return;
        }

        byte[] json = mapper.writeValueAsBytes(csr);
        try {
            store.write(name, json);
        }
        catch (IOException | IllegalArgumentException e) {
            LOGGER.error("Unable to persist signed CSR {} in {}", name, store.directory(), e);
            sendText(exchange, 500, "error persisting signed CSR");
            return;
        }
        send(exchange, 200, JSON, json);
    }

    private void handleGet(HttpExchange exchange, String name) throws IOException {
        Optional<byte[]> stored;
        try {
            stored = store.read(name);
        }
        catch (IllegalArgumentException e) {
            stored = Optional.empty();
        }
        catch (IOException e) {
            LOGGER.error("Error reading CSR {} from {}", name, store.directory(), e);
            sendText(exchange, 500, "error reading CSR from file");
            return;
        }
        if (stored.isEmpty()) {
            sendText(exchange, 404, "CSR not found with given CSR name " + name);
            return;
        }
        send(exchange, 200, JSON, stored.get());
    }

    private static void methodNotAllowed(HttpExchange exchange, String allowed) throws IOException {
        exchange.getResponseHeaders().add("Allow", allowed);
        exchange.sendResponseHeaders(405, -1);
    }

    private static void sendText(HttpExchange exchange, int status, String message) throws IOException {
        send(exchange, status, "text/plain; charset=utf-8", (message + "\n").getBytes(StandardCharsets.UTF_8));
    }

    private static void send(HttpExchange exchange, int status, String contentType, byte[] body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(body);
        }
    }

    /**
     * Creates the signing listener, using TLS when a server certificate is configured.
     */
    public static HttpServer createServer(SignerConfig config) throws IOException {
        InetSocketAddress address = HttpServers.socketAddress(config.listenAddress());
        if (!config.tlsEnabled()) {
            LOGGER.warn("No serverCert configured, signing requests are served over plain HTTP");
            return HttpServers.create(address);
        }
        return HttpServers.createHttps(address, sslContext(Path.of(config.serverCert()), Path.of(config.serverKey())));
    }

    @Nullable
    public static HttpServer createHealthServer(SignerConfig config) throws IOException {
        if (config.healthCheckAddress() == null) {
            return null;
        }
        return HttpServers.create(HttpServers.socketAddress(config.healthCheckAddress()));
    }

    @VisibleForTesting
    static SSLContext sslContext(Path certificateFile, Path keyFile) {
        X509Certificate certificate = PemFiles.readCertificate(certificateFile);
        PrivateKey key = PemFiles.readPrivateKey(keyFile);
        // the key store only lives in memory
        char[] password = UUID.randomUUID().toString().toCharArray();
        try {
            KeyStore keyStore = KeyStore.getInstance("PKCS12");
            keyStore.load(null, null);
            keyStore.setKeyEntry("server", key, password, new Certificate[]{ certificate });
            KeyManagerFactory keyManagerFactory = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
            keyManagerFactory.init(keyStore, password);
            SSLContext context = SSLContext.getInstance("TLS");
            context.init(keyManagerFactory.getKeyManagers(), null, new SecureRandom());
            return context;
        }
        catch (GeneralSecurityException | IOException e) {
            throw new ConfigurationException("Failed to load key pair from (" + certificateFile + ", " + keyFile + "): " + e.getMessage(), e);
        }
    }

    /**
     * Logs each request the signer receives.
     */
    static class RequestLoggingFilter extends Filter {

        static final Filter INSTANCE = new RequestLoggingFilter();

        @Override
        public void doFilter(HttpExchange exchange, Chain chain) throws IOException {
            LOGGER.debug("{} {}", exchange.getRequestMethod(), exchange.getRequestURI().getPath());
            chain.doFilter(exchange);
        }

        @Override
        public String description() {
            return "Logs request method and path";
        }
    }
}
