/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.signer;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.sun.net.httpserver.HttpServer;

import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.prometheusmetrics.PrometheusConfig;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;

import io.kubecsr.config.ConfigParser;
import io.kubecsr.signer.config.SignerConfig;

import edu.umd.cs.findbugs.annotations.Nullable;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

/**
 * Signer entrypoint.
 */
@Command(name = "kubecsr-signer", mixinStandardHelpOptions = true, description = "Issues etcd peer, server and metric certificates", subcommands = {
        SignerMain.ServeCommand.class, SignerMain.SignCommand.class })
public class SignerMain implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(SignerMain.class);

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        throw new ParameterException(spec.commandLine(), "Missing required subcommand");
    }

    /**
     * Options shared by the subcommands.
     */
    abstract static class ConfiguredCommand {

        @Spec
        CommandSpec spec;

        @Option(names = { "-c", "--config" }, description = "name of the configuration file", required = true)
        File configFile;

        SignerConfig loadConfig() {
            if (!configFile.exists()) {
                throw new ParameterException(spec.commandLine(), String.format("Given configuration file does not exist: %s", configFile.toPath().toAbsolutePath()));
            }
            return new ConfigParser<>(SignerConfig.class).parseConfiguration(configFile.toPath());
        }
    }

    @Command(name = "serve", mixinStandardHelpOptions = true, description = "Signs certificate signing requests posted over HTTPS")
    static class ServeCommand extends ConfiguredCommand implements Callable<Integer> {

        @Option(names = { "--csr-dir" }, description = "directory signed requests are kept in, overrides the configuration file")
        @Nullable
        String csrDir;

        @Override
        public Integer call() throws Exception {
            SignerConfig config = loadConfig();
            if (csrDir != null) {
                config = config.withCsrDir(csrDir);
            }
            if (config.csrDir() == null) {
                throw new ParameterException(spec.commandLine(), "csrDir must be configured to serve signing requests");
            }
            try {
                PrometheusMeterRegistry prometheus = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
                Metrics.globalRegistry.add(prometheus);
                CertSigner signer = CertSigner.create(config, Clock.systemUTC(), Metrics.globalRegistry);
                HttpServer healthServer = CertServer.createHealthServer(config);
                CertServer server = new CertServer(signer, new CsrStore(Path.of(config.csrDir())), CertServer.createServer(config), healthServer, prometheus);
                Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "signer-shutdown"));
                server.start();
            }
            catch (Exception e) {
                LOGGER.error("Signer has thrown exception during startup. Will now exit.", e);
                throw e;
            }
            return 0;
        }
    }

    @Command(name = "sign", mixinStandardHelpOptions = true, description = "Signs a certificate signing request held by the cluster API")
    static class SignCommand extends ConfiguredCommand implements Callable<Integer> {

        @Parameters(index = "0", paramLabel = "CSR_NAME", description = "name of the certificate signing request")
        String name;

        @Option(names = { "--kubeconfig" }, description = "kubeconfig used to reach the cluster API, the usual client discovery applies when absent")
        @Nullable
        File kubeconfig;

        @Override
        public Integer call() throws IOException {
            SignerConfig config = loadConfig();
            try (KubernetesClient client = createClient()) {
                return sign(config, client);
            }
        }

        int sign(SignerConfig config, KubernetesClient client) {
            CertSigner signer = CertSigner.create(config, Clock.systemUTC(), Metrics.globalRegistry);
            try {
                new KubernetesCsrSigner(client, signer).sign(name);
                return 0;
            }
            catch (SigningException e) {
                spec.commandLine().getErr().println("Denied " + name + ": " + e.getMessage());
                return 1;
            }
        }

        private KubernetesClient createClient() throws IOException {
            KubernetesClientBuilder builder = new KubernetesClientBuilder();
            if (kubeconfig != null) {
                builder.withConfig(Config.fromKubeconfig(Files.readString(kubeconfig.toPath(), StandardCharsets.UTF_8)));
            }
            return builder.build();
        }
    }

    /**
     * Signer entry point
     * @param args args
     */
    public static void main(String... args) {
        int exitCode = new CommandLine(new SignerMain()).execute(args);
        // serve keeps the process alive through the server threads
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }
}
