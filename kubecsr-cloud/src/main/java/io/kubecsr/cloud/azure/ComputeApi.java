/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.cloud.azure;

import java.util.Optional;

import io.kubecsr.cloud.Page;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The Azure compute queries node resolution needs, scoped to one resource group. Implementations
 * report provider failures as transient {@link io.kubecsr.cloud.ResolutionException}s.
 */
public interface ComputeApi {

    record VirtualMachine(String id, @Nullable String availabilitySetId) {}

    record ScaleSet(String id, String name) {}

    record ScaleSetVm(String id, String computerName) {}

    /**
     * @return the named virtual machine, empty if there is none
     */
    Optional<VirtualMachine> getVirtualMachine(String name);

    Page<ScaleSet> listScaleSets(@Nullable String nextLink);

    Page<ScaleSetVm> listScaleSetVms(String scaleSetName, @Nullable String nextLink);
}
