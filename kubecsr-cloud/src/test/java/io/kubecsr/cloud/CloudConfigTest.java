/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.cloud;

import java.time.Duration;

import org.junit.jupiter.api.Test;

import io.kubecsr.cloud.aws.AwsConfig;
import io.kubecsr.cloud.azure.AzureConfig;
import io.kubecsr.cloud.retry.Backoff;
import io.kubecsr.config.ConfigParser;
import io.kubecsr.config.ConfigurationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CloudConfigTest {

    private final ConfigParser<CloudConfig> parser = new ConfigParser<>(CloudConfig.class);

    @Test
    void parsesAws() {
        // When
        CloudConfig config = parser.parseConfiguration("""
                type: aws
                region: us-west-1
                backoff:
                  steps: 4
                  factor: 2.0
                  duration: 200ms
                  jitter: 0.1
                """);

        // Then
        assertThat(config).isInstanceOf(AwsConfig.class);
        AwsConfig aws = (AwsConfig) config;
        assertThat(aws.region()).isEqualTo("us-west-1");
        assertThat(aws.backoff()).isEqualTo(new Backoff(4, 2.0, Duration.ofMillis(200), 0.1));
    }

    @Test
    void awsDefaultsToSingleAttempt() {
        // When
        AwsConfig aws = (AwsConfig) parser.parseConfiguration("type: aws");

        // Then
        assertThat(aws.region()).isNull();
        assertThat(aws.backoff()).isEqualTo(Backoff.NONE);
    }

    @Test
    void parsesAzureWithDefaults() {
        // When
        CloudConfig config = parser.parseConfiguration("""
                type: azure
                tenantId: t
                subscriptionId: s
                resourceGroup: rg
                vmType: vmss
                """);

        // Then
        assertThat(config).isInstanceOf(AzureConfig.class);
        AzureConfig azure = (AzureConfig) config;
        assertThat(azure.usesScaleSets()).isTrue();
        assertThat(azure.cacheTtl()).isEqualTo(Duration.ofSeconds(15));
        assertThat(azure.refreshInterval()).isEqualTo(Duration.ofMinutes(5));
        assertThat(azure.negativeCacheTtl()).isNull();
    }

    @Test
    void parsesAzureOverrides() {
        // When
        AzureConfig azure = (AzureConfig) parser.parseConfiguration("""
                type: azure
                tenantId: t
                subscriptionId: s
                resourceGroup: rg
                cacheTtl: 30s
                refreshInterval: 1m
                negativeCacheTtl: 1h
                backoff: { steps: 6, factor: 1.5, duration: 5s, jitter: 1.0 }
                """);

        // Then
        assertThat(azure.usesScaleSets()).isFalse();
        assertThat(azure.cacheTtl()).isEqualTo(Duration.ofSeconds(30));
        assertThat(azure.refreshInterval()).isEqualTo(Duration.ofMinutes(1));
        assertThat(azure.negativeCacheTtl()).isEqualTo(Duration.ofHours(1));
        assertThat(azure.backoff().steps()).isEqualTo(6);
    }

    @Test
    void azureRequiresResourceGroup() {
        assertThatThrownBy(() -> parser.parseConfiguration("""
                type: azure
                tenantId: t
                subscriptionId: s
                """))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("resourceGroup");
    }

    @Test
    void rejectsUnknownProvider() {
        assertThatThrownBy(() -> parser.parseConfiguration("type: gcp"))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("gcp");
    }
}
