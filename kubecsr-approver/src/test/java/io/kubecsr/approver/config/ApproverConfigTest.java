/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.approver.config;

import java.time.Duration;
import java.util.List;

import org.junit.jupiter.api.Test;

import io.kubecsr.cloud.aws.AwsConfig;
import io.kubecsr.cloud.azure.AzureConfig;
import io.kubecsr.config.ConfigParser;
import io.kubecsr.config.ConfigurationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ApproverConfigTest {

    private final ConfigParser<ApproverConfig> parser = new ConfigParser<>(ApproverConfig.class);

    @Test
    void parsesFullConfiguration() {
        // Given
        String yaml = """
                cloud:
                  type: aws
                  region: us-west-1
                allowedGroups: [nodes-asg, masters-asg]
                roleLabels: [node-role.kubernetes.io/master]
                workers: 4
                leaderElection:
                  leaseName: kubecsr-approver
                  leaseNamespace: kube-system
                retry:
                  initialInterval: 500ms
                  multiplier: 1.5
                  maxInterval: 2m
                  maxAttempts: 7
                rateLimit:
                  period: 10s
                  limit: 3
                removeAutoApproveBinding: true
                """;

        // When
        ApproverConfig config = parser.parseConfiguration(yaml);

        // Then
        assertThat(config.cloud()).isInstanceOfSatisfying(AwsConfig.class, aws -> assertThat(aws.region()).isEqualTo("us-west-1"));
        assertThat(config.allowedGroups()).containsExactly("nodes-asg", "masters-asg");
        assertThat(config.roleLabels()).containsExactly("node-role.kubernetes.io/master");
        assertThat(config.workers()).isEqualTo(4);
        assertThat(config.leaderElection()).isEqualTo(new LeaderElectionConfig("kubecsr-approver", "kube-system"));
        assertThat(config.retry()).isEqualTo(new RetryConfig(Duration.ofMillis(500), 1.5, Duration.ofMinutes(2), 7));
        assertThat(config.rateLimit()).isEqualTo(new RateLimitConfig(Duration.ofSeconds(10), 3));
        assertThat(config.removeAutoApproveBinding()).isTrue();
    }

    @Test
    void appliesDefaults() {
        // Given
        String yaml = """
                cloud:
                  type: azure
                  tenantId: tenant
                  subscriptionId: subscription
                  resourceGroup: cluster-rg
                  vmType: vmss
                """;

        // When
        ApproverConfig config = parser.parseConfiguration(yaml);

        // Then
        assertThat(config.cloud()).isInstanceOf(AzureConfig.class);
        assertThat(config.allowedGroups()).isEmpty();
        assertThat(config.roleLabels()).isEmpty();
        assertThat(config.workers()).isEqualTo(2);
        assertThat(config.leaderElection()).isNull();
        assertThat(config.retry()).isEqualTo(RetryConfig.DEFAULT);
        assertThat(config.retry().initialInterval()).isEqualTo(Duration.ofMillis(200));
        assertThat(config.rateLimit()).isEqualTo(RateLimitConfig.DEFAULT);
        assertThat(config.removeAutoApproveBinding()).isFalse();
    }

    @Test
    void requiresCloud() {
        assertThatThrownBy(() -> parser.parseConfiguration("allowedGroups: [a]"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("cloud");
    }

    @Test
    void rejectsZeroWorkers() {
        assertThatThrownBy(() -> parser.parseConfiguration("cloud: {type: aws}\nworkers: 0"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("workers must be at least 1");
    }

    @Test
    void rejectsUnknownProperties() {
        assertThatThrownBy(() -> parser.parseConfiguration("cloud: {type: aws}\nworker: 3"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("worker");
    }

    @Test
    void workersOverride() {
        // Given
        ApproverConfig config = new ApproverConfig(new AwsConfig(null, null), List.of("a"), null, null, null, null, null, null);

        // When
        ApproverConfig overridden = config.withWorkers(8);

        // Then
        assertThat(overridden.workers()).isEqualTo(8);
        assertThat(overridden.allowedGroups()).containsExactly("a");
    }

    @Test
    void buildsOperatorRetry() {
        // Given
        RetryConfig retry = new RetryConfig(Duration.ofSeconds(1), 3.0, Duration.ofSeconds(30), 5);

        // When
        var genericRetry = retry.toRetry();

        // Then
        assertThat(genericRetry.getInitialInterval()).isEqualTo(1000L);
        assertThat(genericRetry.getIntervalMultiplier()).isEqualTo(3.0);
        assertThat(genericRetry.getMaxInterval()).isEqualTo(30_000L);
        assertThat(genericRetry.getMaxAttempts()).isEqualTo(5);
    }
}
