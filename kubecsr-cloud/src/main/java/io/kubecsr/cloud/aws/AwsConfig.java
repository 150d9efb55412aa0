/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.cloud.aws;

import java.time.Clock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.imds.Ec2MetadataClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.autoscaling.AutoScalingClient;
import software.amazon.awssdk.services.ec2.Ec2Client;

import io.kubecsr.cloud.CloudConfig;
import io.kubecsr.cloud.CloudIdentityResolver;
import io.kubecsr.cloud.Zones;
import io.kubecsr.cloud.retry.Backoff;
import io.kubecsr.config.ConfigurationException;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * AWS configuration. Credentials come from the SDK's default provider chain.
 * @param region the region, derived from the instance metadata availability zone when absent
 * @param backoff retry policy for EC2 and auto scaling calls, a single attempt when absent
 */
public record AwsConfig(@Nullable String region,
                        @Nullable Backoff backoff) implements CloudConfig {

    private static final Logger LOGGER = LoggerFactory.getLogger(AwsConfig.class);
    private static final String AVAILABILITY_ZONE_PATH = "/latest/meta-data/placement/availability-zone";

    @Override
    public Backoff backoff() {
        return backoff == null ? Backoff.NONE : backoff;
    }

    @Override
    public CloudIdentityResolver buildResolver(Clock clock) {
        Region resolvedRegion = Region.of(region == null ? regionFromInstanceMetadata() : region);
        LOGGER.info("Resolving nodes against EC2 in {}", resolvedRegion);
        var credentials = DefaultCredentialsProvider.create();
        var api = new SdkEc2Api(
                Ec2Client.builder().region(resolvedRegion).credentialsProvider(credentials).build(),
                AutoScalingClient.builder().region(resolvedRegion).credentialsProvider(credentials).build());
        return new AwsIdentityResolver(api, backoff().retrier(), api);
    }

    private static String regionFromInstanceMetadata() {
        try (Ec2MetadataClient metadata = Ec2MetadataClient.create()) {
            String zone = metadata.get(AVAILABILITY_ZONE_PATH).asString();
            return Zones.regionFromZone(zone);
        }
        catch (SdkException | IllegalArgumentException e) {
            throw new ConfigurationException("region is not configured and could not be derived from instance metadata", e);
        }
    }
}
