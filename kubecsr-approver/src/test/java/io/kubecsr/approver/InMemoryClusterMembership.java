/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.approver;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import io.kubecsr.approver.recognizer.ClusterMembership;

public class InMemoryClusterMembership implements ClusterMembership {

    private final Map<String, RegisteredNode> nodes = new HashMap<>();
    private final Map<String, Set<String>> labels = new HashMap<>();
    public final AtomicInteger lookups = new AtomicInteger();

    public InMemoryClusterMembership withNode(String name, boolean ready, String... labelKeys) {
        nodes.put(name, new RegisteredNode(name, ready));
        labels.put(name, Set.of(labelKeys));
        return this;
    }

    @Override
    public Optional<RegisteredNode> node(String nodeName) {
        lookups.incrementAndGet();
        return Optional.ofNullable(nodes.get(nodeName));
    }

    @Override
    public List<String> nodesLabelled(String labelKey) {
        List<String> result = new ArrayList<>();
        labels.forEach((node, keys) -> {
            if (keys.contains(labelKey)) {
                result.add(node);
            }
        });
        result.sort(null);
        return result;
    }
}
