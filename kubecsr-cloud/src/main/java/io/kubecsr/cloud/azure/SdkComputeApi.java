/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.cloud.azure;

import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

import com.azure.core.exception.HttpResponseException;
import com.azure.core.http.rest.PagedIterable;
import com.azure.core.http.rest.PagedResponse;
import com.azure.resourcemanager.compute.fluent.ComputeManagementClient;
import com.azure.resourcemanager.compute.fluent.models.VirtualMachineInner;
import com.azure.resourcemanager.compute.fluent.models.VirtualMachineScaleSetVMInner;

import io.kubecsr.cloud.Page;
import io.kubecsr.cloud.ResolutionException;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * {@link ComputeApi} over the Azure resource manager compute client.
 */
public class SdkComputeApi implements ComputeApi {

    private static final int NOT_FOUND = 404;

    private final ComputeManagementClient client;
    private final String resourceGroup;

    public SdkComputeApi(ComputeManagementClient client, String resourceGroup) {
        this.client = client;
        this.resourceGroup = resourceGroup;
    }

    @Override
    public Optional<VirtualMachine> getVirtualMachine(String name) {
        VirtualMachineInner vm;
        try {
            vm = client.getVirtualMachines().getByResourceGroup(resourceGroup, name);
        }
        catch (HttpResponseException e) {
            if (isNotFound(e)) {
                return Optional.empty();
            }
            throw failure("get virtual machine " + name, e);
        }
        catch (UncheckedIOException e) {
            throw failure("get virtual machine " + name, e);
        }
        if (vm == null) {
            return Optional.empty();
        }
        String availabilitySetId = vm.availabilitySet() == null ? null : vm.availabilitySet().id();
        return Optional.of(new VirtualMachine(vm.id(), availabilitySetId));
    }

    @Override
    public Page<ScaleSet> listScaleSets(@Nullable String nextLink) {
        return invoke("list scale sets in " + resourceGroup,
                () -> page(client.getVirtualMachineScaleSets().listByResourceGroup(resourceGroup), nextLink,
                        ss -> new ScaleSet(ss.id(), ss.name())));
    }

    @Override
    public Page<ScaleSetVm> listScaleSetVms(String scaleSetName, @Nullable String nextLink) {
        return invoke("list virtual machines of scale set " + scaleSetName,
                () -> page(client.getVirtualMachineScaleSetVMs().list(resourceGroup, scaleSetName), nextLink, SdkComputeApi::scaleSetVm));
    }

    private static ScaleSetVm scaleSetVm(VirtualMachineScaleSetVMInner vm) {
        String computerName = vm.osProfile() == null || vm.osProfile().computerName() == null ? "" : vm.osProfile().computerName();
        return new ScaleSetVm(vm.id(), computerName);
    }

    private static <I, T> Page<T> page(PagedIterable<I> iterable, @Nullable String nextLink, Function<I, T> mapper) {
        Iterator<PagedResponse<I>> pages = iterable.iterableByPage(nextLink).iterator();
        if (!pages.hasNext()) {
            return Page.last(List.of());
        }
        PagedResponse<I> page = pages.next();
        List<T> items = page.getValue().stream().map(mapper).toList();
        return new Page<>(items, page.getContinuationToken());
    }

    private static <T> T invoke(String operation, Supplier<T> call) {
        try {
            return call.get();
        }
        catch (HttpResponseException | UncheckedIOException e) {
            throw failure(operation, e);
        }
    }

    private static boolean isNotFound(HttpResponseException e) {
        return e.getResponse() != null && e.getResponse().getStatusCode() == NOT_FOUND;
    }

    private static ResolutionException failure(String operation, RuntimeException e) {
        return ResolutionException.transientFailure(operation + " failed: " + e.getMessage(), e);
    }
}
