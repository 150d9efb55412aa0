/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.cloud.aws;

import java.util.List;
import java.util.function.Supplier;

import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.autoscaling.AutoScalingClient;
import software.amazon.awssdk.services.autoscaling.model.AutoScalingInstanceDetails;
import software.amazon.awssdk.services.autoscaling.model.DescribeAutoScalingInstancesRequest;
import software.amazon.awssdk.services.autoscaling.model.DescribeAutoScalingInstancesResponse;
import software.amazon.awssdk.services.ec2.Ec2Client;
import software.amazon.awssdk.services.ec2.model.DescribeInstancesRequest;
import software.amazon.awssdk.services.ec2.model.DescribeInstancesResponse;
import software.amazon.awssdk.services.ec2.model.Filter;
import software.amazon.awssdk.services.ec2.model.Instance;
import software.amazon.awssdk.services.ec2.model.Reservation;

import io.kubecsr.cloud.Page;
import io.kubecsr.cloud.ResolutionException;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * {@link Ec2Api} over the AWS SDK.
 */
public class SdkEc2Api implements Ec2Api, AutoCloseable {

    private final Ec2Client ec2;
    private final AutoScalingClient autoScaling;

    public SdkEc2Api(Ec2Client ec2, AutoScalingClient autoScaling) {
        this.ec2 = ec2;
        this.autoScaling = autoScaling;
    }

    @Override
    public Page<String> describeRunningInstances(String privateDnsName, @Nullable String nextToken) {
        DescribeInstancesRequest request = DescribeInstancesRequest.builder()
                .filters(Filter.builder().name("private-dns-name").values(privateDnsName).build(),
                        Filter.builder().name("instance-state-name").values("running").build())
                .nextToken(nextToken)
                .build();
        DescribeInstancesResponse response = invoke("DescribeInstances", () -> ec2.describeInstances(request));
        List<String> ids = response.reservations().stream()
                .map(Reservation::instances)
                .flatMap(List::stream)
                .map(Instance::instanceId)
                .toList();
        return new Page<>(ids, response.nextToken());
    }

    @Override
    public Page<String> describeAutoScalingGroups(String instanceId, @Nullable String nextToken) {
        DescribeAutoScalingInstancesRequest request = DescribeAutoScalingInstancesRequest.builder()
                .instanceIds(instanceId)
                .nextToken(nextToken)
                .build();
        DescribeAutoScalingInstancesResponse response = invoke("DescribeAutoScalingInstances", () -> autoScaling.describeAutoScalingInstances(request));
        List<String> groups = response.autoScalingInstances().stream()
                .map(AutoScalingInstanceDetails::autoScalingGroupName)
                .toList();
        return new Page<>(groups, response.nextToken());
    }

    private static <T> T invoke(String operation, Supplier<T> call) {
        try {
            return call.get();
        }
        catch (SdkException e) {
            throw ResolutionException.transientFailure(operation + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        ec2.close();
        autoScaling.close();
    }
}
