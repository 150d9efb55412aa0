/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.approver;

import java.io.File;
import java.time.Clock;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;

import io.kubecsr.approver.config.ApproverConfig;
import io.kubecsr.cloud.CloudIdentityResolver;
import io.kubecsr.config.ConfigParser;

import edu.umd.cs.findbugs.annotations.Nullable;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

/**
 * Approver entrypoint.
 */
@Command(name = "kubecsr-approver", mixinStandardHelpOptions = true, description = "Approves node client certificate signing requests backed by cloud instance identity")
public class ApproverMain implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(ApproverMain.class);

    @Spec
    private CommandSpec spec;

    @Option(names = { "-c", "--config" }, description = "name of the configuration file", required = true)
    private File configFile;

    @Option(names = { "--workers" }, description = "number of requests reconciled concurrently, overrides the configuration file")
    @Nullable
    private Integer workers;

    @Override
    public Integer call() throws Exception {
        ApproverConfig config = loadConfig();
        try {
            KubernetesClient client = new KubernetesClientBuilder().build();
            CloudIdentityResolver resolver = config.cloud().buildResolver(Clock.systemUTC());
            new ApproverOperator(config, client, resolver).start();
        }
        catch (Exception e) {
            LOGGER.error("Approver has thrown exception during startup. Will now exit.", e);
            throw e;
        }
        return 0;
    }

    ApproverConfig loadConfig() {
        if (!configFile.exists()) {
            throw new ParameterException(spec.commandLine(), String.format("Given configuration file does not exist: %s", configFile.toPath().toAbsolutePath()));
        }
        ApproverConfig config = new ConfigParser<>(ApproverConfig.class).parseConfiguration(configFile.toPath());
        return workers == null ? config : config.withWorkers(workers);
    }

    /**
     * Approver entry point
     * @param args args
     */
    public static void main(String... args) {
        int exitCode = new CommandLine(new ApproverMain()).execute(args);
        // after a successful start the operator's threads keep the process alive
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }
}
