/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.cloud.azure;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.azure.core.credential.TokenCredential;
import com.azure.core.management.AzureEnvironment;
import com.azure.core.management.profile.AzureProfile;
import com.azure.identity.ClientSecretCredentialBuilder;
import com.azure.identity.DefaultAzureCredentialBuilder;
import com.azure.resourcemanager.compute.ComputeManager;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import io.kubecsr.cloud.CloudConfig;
import io.kubecsr.cloud.CloudIdentityResolver;
import io.kubecsr.cloud.cache.TimedCache;
import io.kubecsr.cloud.retry.Backoff;
import io.kubecsr.cloud.retry.Retrier;
import io.kubecsr.config.DurationSerde;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Azure configuration.
 *
 * @param tenantId the Azure AD tenant
 * @param subscriptionId the subscription holding the cluster's virtual machines
 * @param clientId service principal client id; when absent the default Azure credential chain is used
 * @param clientSecret service principal secret
 * @param resourceGroup the resource group holding the cluster's virtual machines
 * @param vmType {@code vmss} when nodes run in scale sets, anything else for standalone virtual machines in availability sets
 * @param backoff retry policy for compute API calls, a single attempt when absent
 * @param cacheTtl how long virtual machine lookups are cached, default 15 seconds
 * @param refreshInterval how often the scale set snapshot is rebuilt, default 5 minutes
 * @param negativeCacheTtl how long a node found in no scale set is remembered as such, for ever when absent
 */
public record AzureConfig(String tenantId,
                          String subscriptionId,
                          @Nullable String clientId,
                          @Nullable String clientSecret,
                          String resourceGroup,
                          @Nullable String vmType,
                          @Nullable Backoff backoff,
                          @JsonSerialize(using = DurationSerde.Serializer.class) @JsonDeserialize(using = DurationSerde.Deserializer.class) @Nullable Duration cacheTtl,
                          @JsonSerialize(using = DurationSerde.Serializer.class) @JsonDeserialize(using = DurationSerde.Deserializer.class) @Nullable Duration refreshInterval,
                          @JsonSerialize(using = DurationSerde.Serializer.class) @JsonDeserialize(using = DurationSerde.Deserializer.class) @Nullable Duration negativeCacheTtl)
        implements CloudConfig {

    private static final Logger LOGGER = LoggerFactory.getLogger(AzureConfig.class);

    public static final String VM_TYPE_SCALE_SET = "vmss";
    static final Duration DEFAULT_CACHE_TTL = Duration.ofSeconds(15);
    static final Duration DEFAULT_REFRESH_INTERVAL = Duration.ofMinutes(5);

    public AzureConfig {
        Objects.requireNonNull(tenantId, "tenantId");
        Objects.requireNonNull(subscriptionId, "subscriptionId");
        Objects.requireNonNull(resourceGroup, "resourceGroup");
    }

    @Override
    public Backoff backoff() {
        return backoff == null ? Backoff.NONE : backoff;
    }

    @Override
    public Duration cacheTtl() {
        return cacheTtl == null ? DEFAULT_CACHE_TTL : cacheTtl;
    }

    @Override
    public Duration refreshInterval() {
        return refreshInterval == null ? DEFAULT_REFRESH_INTERVAL : refreshInterval;
    }

    public boolean usesScaleSets() {
        return VM_TYPE_SCALE_SET.equalsIgnoreCase(vmType);
    }

    @Override
    public CloudIdentityResolver buildResolver(Clock clock) {
        ComputeManager manager = ComputeManager.authenticate(credential(), new AzureProfile(tenantId, subscriptionId, AzureEnvironment.AZURE));
        return buildResolver(new SdkComputeApi(manager.serviceClient(), resourceGroup), backoff().retrier(), clock);
    }

    CloudIdentityResolver buildResolver(ComputeApi api, Retrier retrier, Clock clock) {
        var availabilitySets = new AvailabilitySetResolver(api, retrier, new TimedCache<>(cacheTtl(), clock));
        if (!usesScaleSets()) {
            LOGGER.info("Resolving nodes against availability sets in resource group {}", resourceGroup);
            return availabilitySets;
        }
        LOGGER.info("Resolving nodes against scale sets in resource group {}, refreshing every {}", resourceGroup, refreshInterval());
        return new ScaleSetResolver(api, retrier, availabilitySets, clock, negativeCacheTtl).startRefreshing(refreshInterval());
    }

    private TokenCredential credential() {
        if (clientId != null && clientSecret != null) {
            return new ClientSecretCredentialBuilder()
                    .tenantId(tenantId)
                    .clientId(clientId)
                    .clientSecret(clientSecret)
                    .build();
        }
        return new DefaultAzureCredentialBuilder()
                .tenantId(tenantId)
                .build();
    }
}
