/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.approver.config;

import java.util.Objects;

import io.javaoperatorsdk.operator.api.config.LeaderElectionConfiguration;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * @param leaseName name of the lease
 * @param leaseNamespace namespace of the lease, the client's namespace when absent
 */
public record LeaderElectionConfig(String leaseName, @Nullable String leaseNamespace) {

    public LeaderElectionConfig {
        Objects.requireNonNull(leaseName, "leaseName");
    }

    public LeaderElectionConfiguration toLeaderElectionConfiguration() {
        return new LeaderElectionConfiguration(leaseName, leaseNamespace);
    }
}
