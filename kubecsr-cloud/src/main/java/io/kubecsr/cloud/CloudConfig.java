/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.cloud;

import java.time.Clock;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import io.kubecsr.cloud.aws.AwsConfig;
import io.kubecsr.cloud.azure.AzureConfig;

/**
 * Configuration of the cloud provider nodes run on, selected by the {@code type} property.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = AwsConfig.class, name = "aws"),
        @JsonSubTypes.Type(value = AzureConfig.class, name = "azure")
})
public interface CloudConfig {

    /**
     * Connects to the provider and builds a resolver for it.
     * @param clock clock used for cache expiry
     * @return resolver, which the caller must close
     */
    CloudIdentityResolver buildResolver(Clock clock);
}
