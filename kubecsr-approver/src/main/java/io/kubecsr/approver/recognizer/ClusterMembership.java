/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.approver.recognizer;

import java.util.List;
import java.util.Optional;

/**
 * Looks up the nodes registered with the cluster.
 * Failures other than "not registered" are thrown and are treated as transient.
 */
public interface ClusterMembership {

    /**
     * @return the registered node, or empty if no node of that name is registered
     */
    Optional<RegisteredNode> node(String nodeName);

    /**
     * @return names of the registered nodes carrying the given label, whatever its value
     */
    List<String> nodesLabelled(String labelKey);

    /**
     * @param name node name
     * @param ready whether the node's Ready condition is True
     */
    record RegisteredNode(String name, boolean ready) {}
}
