/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.approver;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.time.Clock;
import java.time.Duration;
import java.util.function.IntSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sun.net.httpserver.HttpContext;
import com.sun.net.httpserver.HttpServer;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.javaoperatorsdk.operator.Operator;
import io.javaoperatorsdk.operator.monitoring.micrometer.MicrometerMetrics;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import io.prometheus.metrics.exporter.httpserver.MetricsHandler;

import io.kubecsr.approver.config.ApproverConfig;
import io.kubecsr.approver.recognizer.AllowedGroups;
import io.kubecsr.approver.recognizer.ClusterMembership;
import io.kubecsr.approver.recognizer.NodeRecognizers;
import io.kubecsr.cloud.CloudIdentityResolver;
import io.kubecsr.cloud.ResolutionException;
import io.kubecsr.cloud.retry.Sleeper;
import io.kubecsr.http.HttpServers;
import io.kubecsr.http.MethodFilter;
import io.kubecsr.tag.VisibleForTesting;

/**
 * Wires the approval reconciler into an operator and runs the management server next to it.
 */
public class ApproverOperator {

    private static final Logger LOGGER = LoggerFactory.getLogger(ApproverOperator.class);
    private static final String BIND_ADDRESS_VAR_NAME = "BIND_ADDRESS";
    private static final String DEFAULT_BIND_ADDRESS = "0.0.0.0:8080";
    private static final Duration DISCOVERY_RETRY_INTERVAL = Duration.ofSeconds(10);
    static final String HTTP_PATH_LIVEZ = "/livez";
    static final String HTTP_PATH_METRICS = "/metrics";

    private final ApproverConfig config;
    private final KubernetesClient kubeClient;
    private final CloudIdentityResolver resolver;
    private final HttpServer managementServer;
    private final Sleeper sleeper;
    private final Clock clock;
    private final Operator operator;

    public ApproverOperator(ApproverConfig config, KubernetesClient kubeClient, CloudIdentityResolver resolver) throws IOException {
        this(config, kubeClient, resolver, createHttpServer(), Sleeper.SYSTEM, Clock.systemUTC());
    }

    @VisibleForTesting
    ApproverOperator(ApproverConfig config,
                     KubernetesClient kubeClient,
                     CloudIdentityResolver resolver,
                     HttpServer managementServer,
                     Sleeper sleeper,
                     Clock clock) {
        this.config = config;
        this.kubeClient = kubeClient;
        this.resolver = resolver;
        this.managementServer = managementServer;
        this.sleeper = sleeper;
        this.clock = clock;
        configurePrometheusMetrics(managementServer);
        // the overrider is applied more than once, so metrics must be built outside of it
        MicrometerMetrics metrics = enablePrometheusMetrics();
        operator = new Operator(o -> {
            o.withMetrics(metrics);
            o.withKubernetesClient(kubeClient);
            o.withConcurrentReconciliationThreads(config.workers());
            if (config.leaderElection() != null) {
                o.withLeaderElectionConfiguration(config.leaderElection().toLeaderElectionConfiguration());
            }
        });
    }

    /**
     * Starts the operator and returns once it is running. Blocks until the allowed instance groups
     * have been discovered.
     */
    void start() {
        ClusterMembership membership = new KubernetesClusterMembership(kubeClient);
        AllowedGroups allowedGroups = discoverAllowedGroups(membership);
        LOGGER.info("Approving nodes in instance groups {}", allowedGroups);
        if (Boolean.TRUE.equals(config.removeAutoApproveBinding())) {
            AutoApproveBinding.remove(kubeClient);
        }

        CsrApprover approver = new CsrApprover(NodeRecognizers.defaultChains(resolver, membership, allowedGroups),
                new KubernetesApprovalClient(kubeClient),
                clock,
                Metrics.globalRegistry);
        operator.installShutdownHook(Duration.ofSeconds(10));
        operator.register(new CsrApprovalReconciler(approver), o -> o
                .withRetry(config.retry().toRetry())
                .withRateLimiter(config.rateLimit().toRateLimiter()));
        addHttpGetHandler("/", () -> 404);
        managementServer.start();
        addHttpGetHandler(HTTP_PATH_LIVEZ, this::livezStatusCode);
        operator.start();
        LOGGER.info("Approver started with {} worker(s)", config.workers());
    }

    private AllowedGroups discoverAllowedGroups(ClusterMembership membership) {
        while (true) {
            try {
                return AllowedGroups.discover(config.allowedGroups(), config.roleLabels(), membership, resolver);
            }
            catch (ResolutionException | KubernetesClientException e) {
                LOGGER.warn("Failed to discover allowed instance groups, retrying in {}: {}", DISCOVERY_RETRY_INTERVAL, e.getMessage());
                try {
                    sleeper.sleep(DISCOVERY_RETRY_INTERVAL);
                }
                catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("interrupted while discovering allowed instance groups", ie);
                }
            }
        }
    }

    private void addHttpGetHandler(String path, IntSupplier statusCodeSupplier) {
        managementServer.createContext(path, exchange -> {
            try (exchange) {
                exchange.sendResponseHeaders(statusCodeSupplier.getAsInt(), -1);
            }
        }).getFilters().add(MethodFilter.GET_ONLY);
    }

    private int livezStatusCode() {
        boolean healthy;
        try {
            healthy = operator.getRuntimeInfo().allEventSourcesAreHealthy();
        }
        catch (RuntimeException e) {
            LOGGER.warn("Operator health is unavailable, reporting unhealthy on {}", HTTP_PATH_LIVEZ, e);
            return 400;
        }
        if (!healthy) {
            LOGGER.warn("Reporting unhealthy on {}, not every CSR event source is healthy", HTTP_PATH_LIVEZ);
            return 400;
        }
        return 200;
    }

    void stop() {
        operator.stop();
        managementServer.stop(0);
        resolver.close();
        LOGGER.info("Approver stopped.");
    }

    private MicrometerMetrics enablePrometheusMetrics() {
        return MicrometerMetrics.newPerResourceCollectingMicrometerMetricsBuilder(Metrics.globalRegistry)
                .withCleanUpDelayInSeconds(35)
                .withCleaningThreadNumber(1)
                .build();
    }

    private void configurePrometheusMetrics(HttpServer server) {
        final PrometheusMeterRegistry prometheusMeterRegistry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        final HttpContext metricsContext = server.createContext(HTTP_PATH_METRICS,
                new MetricsHandler(prometheusMeterRegistry.getPrometheusRegistry()));
        metricsContext.getFilters().add(MethodFilter.GET_ONLY);
        Metrics.globalRegistry.add(prometheusMeterRegistry);
    }

    private static HttpServer createHttpServer() throws IOException {
        InetSocketAddress address = getBindAddress();
        LOGGER.info("Starting management server on: {}", address);
        return HttpServers.create(address);
    }

    /**
     * Reads the management server address from {@code BIND_ADDRESS}, falling back to every interface on port 8080.
     *
     * @throws io.kubecsr.config.ConfigurationException if the variable is not a valid {@code host:port}
     */
    @VisibleForTesting
    static InetSocketAddress getBindAddress() {
        String bindAddress = System.getenv(BIND_ADDRESS_VAR_NAME);
        return HttpServers.socketAddress(bindAddress == null || bindAddress.isBlank() ? DEFAULT_BIND_ADDRESS : bindAddress);
    }
}
