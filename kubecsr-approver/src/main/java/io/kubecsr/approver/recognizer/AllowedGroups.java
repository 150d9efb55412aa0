/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.approver.recognizer;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.kubecsr.cloud.CloudIdentityResolver;
import io.kubecsr.cloud.ResolutionException;

/**
 * The instance groups whose nodes may be approved automatically.
 */
public final class AllowedGroups {

    private static final Logger LOGGER = LoggerFactory.getLogger(AllowedGroups.class);

    private final Set<String> groups;

    private AllowedGroups(Set<String> groups) {
        this.groups = Set.copyOf(groups);
    }

    public static AllowedGroups of(Collection<String> groups) {
        return new AllowedGroups(new LinkedHashSet<>(groups));
    }

    /**
     * Extends {@code staticGroups} with the instance groups of every registered node carrying one of
     * {@code roleLabels}. Nodes whose group cannot be resolved are skipped.
     *
     * @throws ResolutionException if a lookup failed transiently
     * @throws io.fabric8.kubernetes.client.KubernetesClientException if the nodes could not be listed
     */
    public static AllowedGroups discover(Collection<String> staticGroups,
                                         Collection<String> roleLabels,
                                         ClusterMembership membership,
                                         CloudIdentityResolver resolver) {
        Set<String> groups = new LinkedHashSet<>(staticGroups);
        for (String label : roleLabels) {
            for (String node : membership.nodesLabelled(label)) {
                try {
                    String group = resolver.instanceGroupId(node);
                    if (groups.add(group)) {
                        LOGGER.info("Allowing instance group {} of node {} labelled {}", group, node, label);
                    }
                }
                catch (ResolutionException e) {
                    if (e.isTransient()) {
                        throw e;
                    }
                    LOGGER.warn("Ignoring node {} labelled {}: {}", node, label, e.getMessage());
                }
            }
        }
        return new AllowedGroups(groups);
    }

    public boolean contains(String group) {
        return groups.contains(group);
    }

    public Set<String> groups() {
        return groups;
    }

    @Override
    public String toString() {
        return groups.toString();
    }
}
