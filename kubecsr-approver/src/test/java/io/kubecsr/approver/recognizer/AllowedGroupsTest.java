/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.approver.recognizer;

import java.util.List;

import org.junit.jupiter.api.Test;

import io.kubecsr.approver.InMemoryClusterMembership;
import io.kubecsr.approver.InMemoryIdentityResolver;
import io.kubecsr.cloud.ResolutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AllowedGroupsTest {

    private static final String MASTER_LABEL = "node-role.kubernetes.io/master";
    private static final String WORKER_LABEL = "node-role.kubernetes.io/worker";

    private final InMemoryIdentityResolver resolver = new InMemoryIdentityResolver();
    private final InMemoryClusterMembership membership = new InMemoryClusterMembership();

    @Test
    void staticGroupsOnly() {
        // When
        AllowedGroups groups = AllowedGroups.discover(List.of("workers"), List.of(), membership, resolver);

        // Then
        assertThat(groups.groups()).containsExactly("workers");
        assertThat(resolver.lookups).hasValue(0);
    }

    @Test
    void addsGroupsOfLabelledNodes() {
        // Given
        resolver.withNode("master-0", "i-0", "masters")
                .withNode("worker-0", "i-1", "workers-a")
                .withNode("worker-1", "i-2", "workers-b")
                .withNode("bastion", "i-3", "bastions");
        membership.withNode("master-0", true, MASTER_LABEL)
                .withNode("worker-0", true, WORKER_LABEL)
                .withNode("worker-1", false, WORKER_LABEL)
                .withNode("bastion", true);

        // When
        AllowedGroups groups = AllowedGroups.discover(List.of("static"), List.of(MASTER_LABEL, WORKER_LABEL), membership, resolver);

        // Then
        assertThat(groups.groups()).containsExactlyInAnyOrder("static", "masters", "workers-a", "workers-b");
        assertThat(groups.contains("bastions")).isFalse();
    }

    @Test
    void skipsNodesWithoutGroup() {
        // Given
        membership.withNode("worker-0", true, WORKER_LABEL);

        // When
        AllowedGroups groups = AllowedGroups.discover(List.of(), List.of(WORKER_LABEL), membership, resolver);

        // Then
        assertThat(groups.groups()).isEmpty();
    }

    @Test
    void transientFailurePropagates() {
        // Given
        membership.withNode("worker-0", true, WORKER_LABEL);
        resolver.failing("worker-0", ResolutionException.transientFailure("throttled", new RuntimeException()));

        // When/Then
        assertThatThrownBy(() -> AllowedGroups.discover(List.of(), List.of(WORKER_LABEL), membership, resolver))
                .isInstanceOf(ResolutionException.class)
                .hasMessage("throttled");
    }
}
