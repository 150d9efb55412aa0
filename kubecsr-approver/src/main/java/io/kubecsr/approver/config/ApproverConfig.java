/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.approver.config;

import java.util.List;
import java.util.Objects;

import io.kubecsr.cloud.CloudConfig;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Top level configuration of the approver.
 *
 * @param cloud the cloud provider nodes run on
 * @param allowedGroups instance groups whose nodes may be approved
 * @param roleLabels node labels; the instance groups of nodes carrying any of them are added to {@code allowedGroups} at startup
 * @param workers number of requests reconciled concurrently
 * @param leaderElection lease used to elect the single active replica, no election when absent
 * @param retry how failed reconciliations are retried
 * @param rateLimit how often reconciliations may run
 * @param removeAutoApproveBinding whether to delete the binding that lets the built-in controller approve bootstrap requests
 */
public record ApproverConfig(CloudConfig cloud,
                             @Nullable List<String> allowedGroups,
                             @Nullable List<String> roleLabels,
                             @Nullable Integer workers,
                             @Nullable LeaderElectionConfig leaderElection,
                             @Nullable RetryConfig retry,
                             @Nullable RateLimitConfig rateLimit,
                             @Nullable Boolean removeAutoApproveBinding) {

    static final int DEFAULT_WORKERS = 2;

    public ApproverConfig {
        Objects.requireNonNull(cloud, "cloud");
        allowedGroups = allowedGroups == null ? List.of() : List.copyOf(allowedGroups);
        roleLabels = roleLabels == null ? List.of() : List.copyOf(roleLabels);
        if (workers == null) {
            workers = DEFAULT_WORKERS;
        }
        else if (workers < 1) {
            throw new IllegalArgumentException("workers must be at least 1, was " + workers);
        }
        if (retry == null) {
            retry = RetryConfig.DEFAULT;
        }
        if (rateLimit == null) {
            rateLimit = RateLimitConfig.DEFAULT;
        }
        if (removeAutoApproveBinding == null) {
            removeAutoApproveBinding = false;
        }
    }

    public ApproverConfig withWorkers(int workers) {
        return new ApproverConfig(cloud, allowedGroups, roleLabels, workers, leaderElection, retry, rateLimit, removeAutoApproveBinding);
    }
}
