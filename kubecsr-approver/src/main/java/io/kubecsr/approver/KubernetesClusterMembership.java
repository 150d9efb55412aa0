/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.approver;

import java.util.List;
import java.util.Optional;

import io.fabric8.kubernetes.api.model.Node;
import io.fabric8.kubernetes.api.model.NodeCondition;
import io.fabric8.kubernetes.api.model.NodeStatus;
import io.fabric8.kubernetes.client.KubernetesClient;

import io.kubecsr.approver.recognizer.ClusterMembership;

/**
 * {@link ClusterMembership} backed by the Kubernetes nodes API.
 */
public class KubernetesClusterMembership implements ClusterMembership {

    private final KubernetesClient client;

    public KubernetesClusterMembership(KubernetesClient client) {
        this.client = client;
    }

    @Override
    public Optional<RegisteredNode> node(String nodeName) {
        Node node = client.nodes().withName(nodeName).get();
        if (node == null) {
            return Optional.empty();
        }
        return Optional.of(new RegisteredNode(nodeName, isReady(node)));
    }

    @Override
    public List<String> nodesLabelled(String labelKey) {
        return client.nodes().withLabel(labelKey).list().getItems().stream()
                .map(node -> node.getMetadata().getName())
                .toList();
    }

    static boolean isReady(Node node) {
        return Optional.ofNullable(node.getStatus())
                .map(NodeStatus::getConditions)
                .orElse(List.of())
                .stream()
                .filter(condition -> "Ready".equals(condition.getType()))
                .map(NodeCondition::getStatus)
                .anyMatch("True"::equals);
    }
}
