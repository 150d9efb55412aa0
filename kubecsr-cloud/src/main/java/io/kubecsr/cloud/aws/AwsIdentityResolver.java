/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.cloud.aws;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.kubecsr.cloud.CloudIdentityResolver;
import io.kubecsr.cloud.Page;
import io.kubecsr.cloud.ResolutionException;
import io.kubecsr.cloud.retry.Retrier;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Resolves a node, named by its private DNS name, to the running EC2 instance with that name
 * and the auto scaling group it belongs to. Nothing is cached.
 */
public class AwsIdentityResolver implements CloudIdentityResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(AwsIdentityResolver.class);

    private final Ec2Api api;
    private final Retrier retrier;
    @Nullable
    private final AutoCloseable resources;

    public AwsIdentityResolver(Ec2Api api, Retrier retrier) {
        this(api, retrier, null);
    }

    AwsIdentityResolver(Ec2Api api, Retrier retrier, @Nullable AutoCloseable resources) {
        this.api = api;
        this.retrier = retrier;
        this.resources = resources;
    }

    @Override
    public String instanceId(String nodeName) {
        List<String> ids = listAll("DescribeInstances for " + nodeName, nodeName, api::describeRunningInstances);
        if (ids.isEmpty()) {
            throw ResolutionException.instanceNotFound(nodeName);
        }
        if (ids.size() > 1) {
            throw ResolutionException.ambiguous("running instance", nodeName, ids.size());
        }
        LOGGER.debug("Node {} is instance {}", nodeName, ids.get(0));
        return ids.get(0);
    }

    @Override
    public String instanceGroupId(String nodeName) {
        String instanceId = instanceId(nodeName);
        List<String> groups = listAll("DescribeAutoScalingInstances for " + instanceId, instanceId, api::describeAutoScalingGroups);
        if (groups.isEmpty()) {
            throw ResolutionException.groupNotFound(nodeName);
        }
        if (groups.size() > 1) {
            throw ResolutionException.ambiguous("auto scaling group", nodeName, groups.size());
        }
        return groups.get(0);
    }

    private List<String> listAll(String operation, String argument, BiFunction<String, String, Page<String>> query) {
        List<String> all = new ArrayList<>();
        String nextToken = null;
        do {
            String token = nextToken;
            Page<String> page = retrier.call(operation, () -> query.apply(argument, token));
            all.addAll(page.items());
            nextToken = page.nextToken();
        } while (nextToken != null);
        return all;
    }

    @Override
    public void close() {
        if (resources != null) {
            try {
                resources.close();
            }
            catch (Exception e) {
                LOGGER.warn("Failed to close AWS clients", e);
            }
        }
    }
}
