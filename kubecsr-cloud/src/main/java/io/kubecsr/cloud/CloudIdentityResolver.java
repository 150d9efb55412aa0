/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.cloud;

/**
 * Maps a Kubernetes node name to the cloud instance backing it and to the instance group
 * (auto scaling group, scale set or availability set) that instance belongs to.
 * <p>
 * A node resolves to at most one instance and at most one group. Lookups that would match
 * more than one fail with {@link ResolutionException.Kind#AMBIGUOUS} rather than picking one.
 * </p>
 */
public interface CloudIdentityResolver extends AutoCloseable {

    /**
     * @param nodeName the Kubernetes node name
     * @return the provider's identifier for the instance
     * @throws ResolutionException if the instance cannot be resolved
     */
    String instanceId(String nodeName);

    /**
     * @param nodeName the Kubernetes node name
     * @return the provider's identifier for the group the instance belongs to
     * @throws ResolutionException if the instance or its group cannot be resolved
     */
    String instanceGroupId(String nodeName);

    /**
     * Releases background resources. The default implementation holds none.
     */
    @Override
    default void close() {
    }
}
