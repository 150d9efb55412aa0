/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.cloud.azure;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.kubecsr.cloud.CloudIdentityResolver;
import io.kubecsr.cloud.ResolutionException;
import io.kubecsr.cloud.azure.ComputeApi.VirtualMachine;
import io.kubecsr.cloud.cache.TimedCache;
import io.kubecsr.cloud.retry.Retrier;

/**
 * Resolves a node to the standalone virtual machine of the same name and its availability set.
 * Virtual machine lookups are cached for a short time.
 */
public class AvailabilitySetResolver implements CloudIdentityResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(AvailabilitySetResolver.class);

    private final ComputeApi api;
    private final Retrier retrier;
    private final TimedCache<String, VirtualMachine> vmCache;

    public AvailabilitySetResolver(ComputeApi api, Retrier retrier, TimedCache<String, VirtualMachine> vmCache) {
        this.api = api;
        this.retrier = retrier;
        this.vmCache = vmCache;
    }

    @Override
    public String instanceId(String nodeName) {
        return virtualMachine(nodeName).id();
    }

    @Override
    public String instanceGroupId(String nodeName) {
        VirtualMachine vm = virtualMachine(nodeName);
        if (vm.availabilitySetId() == null) {
            // the VM may be added to an availability set later, do not keep serving the old answer
            vmCache.delete(nodeName);
            throw ResolutionException.groupNotFound(nodeName);
        }
        return vm.availabilitySetId();
    }

    private VirtualMachine virtualMachine(String nodeName) {
        return vmCache.getOrCreate(nodeName, name -> {
            LOGGER.debug("Looking up virtual machine {}", name);
            return retrier.call("get virtual machine " + name,
                    () -> api.getVirtualMachine(name).orElseThrow(() -> ResolutionException.instanceNotFound(name)));
        });
    }
}
