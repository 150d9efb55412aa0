/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.cloud;

public final class Zones {

    private Zones() {
    }

    /**
     * Derives a region from an availability zone by dropping the zone letter, {@code us-west-1a} becomes {@code us-west-1}.
     * @param zone the availability zone
     * @return the region
     * @throws IllegalArgumentException if the zone is empty
     */
    public static String regionFromZone(String zone) {
        String trimmed = zone.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("cannot derive a region from an empty availability zone");
        }
        return trimmed.substring(0, trimmed.length() - 1);
    }
}
