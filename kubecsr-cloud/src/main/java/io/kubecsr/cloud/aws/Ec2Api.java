/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.cloud.aws;

import io.kubecsr.cloud.Page;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The two EC2 queries node resolution needs. Implementations report provider failures as
 * transient {@link io.kubecsr.cloud.ResolutionException}s.
 */
public interface Ec2Api {

    /**
     * One page of the ids of running instances with the given private DNS name.
     */
    Page<String> describeRunningInstances(String privateDnsName, @Nullable String nextToken);

    /**
     * One page of the names of the auto scaling groups the instance belongs to.
     */
    Page<String> describeAutoScalingGroups(String instanceId, @Nullable String nextToken);
}
