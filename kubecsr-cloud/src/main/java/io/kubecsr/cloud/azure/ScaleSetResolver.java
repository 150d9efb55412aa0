/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.cloud.azure;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.kubecsr.cloud.CloudIdentityResolver;
import io.kubecsr.cloud.Page;
import io.kubecsr.cloud.azure.ComputeApi.ScaleSet;
import io.kubecsr.cloud.azure.ComputeApi.ScaleSetVm;
import io.kubecsr.cloud.cache.GroupCache;
import io.kubecsr.cloud.cache.GroupCache.Membership;
import io.kubecsr.cloud.retry.Retrier;
import io.kubecsr.tag.VisibleForTesting;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Resolves a node to a scale set virtual machine whose computer name matches, and to that scale set.
 * <p>
 * Every scale set member of the resource group is held in a {@link GroupCache} keyed by lower-cased computer name.
 * Nodes the snapshot does not contain are passed to the availability set resolver, and remembered as absent
 * so that they do not trigger a full refresh on every lookup.
 * </p>
 */
public class ScaleSetResolver implements CloudIdentityResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(ScaleSetResolver.class);

    /**
     * A scale set virtual machine, keyed by node name.
     */
    record Member(String id, String nodeName, ScaleSet scaleSet) {}

    private final ComputeApi api;
    private final Retrier retrier;
    private final GroupCache<Member> members;
    private final CloudIdentityResolver fallback;

    public ScaleSetResolver(ComputeApi api, Retrier retrier, CloudIdentityResolver fallback, Clock clock, @Nullable Duration negativeCacheTtl) {
        this.api = api;
        this.retrier = retrier;
        this.fallback = fallback;
        this.members = new GroupCache<>("scale-set-members", this::listMembers, Member::nodeName, clock, negativeCacheTtl);
    }

    /**
     * Starts refreshing the scale set snapshot every {@code interval}.
     */
    public ScaleSetResolver startRefreshing(Duration interval) {
        members.start(interval);
        return this;
    }

    @Override
    public String instanceId(String nodeName) {
        Optional<Membership<Member>> membership = lookup(nodeName);
        if (membership.isPresent()) {
            return membership.get().member().id();
        }
        return fallback.instanceId(nodeName);
    }

    @Override
    public String instanceGroupId(String nodeName) {
        Optional<Membership<Member>> membership = lookup(nodeName);
        if (membership.isPresent()) {
            return membership.get().member().scaleSet().id();
        }
        return fallback.instanceGroupId(nodeName);
    }

    private Optional<Membership<Member>> lookup(String nodeName) {
        String key = nodeName.toLowerCase(Locale.ROOT);
        Optional<Membership<Member>> membership = members.find(key);
        if (membership.isEmpty() && !members.isAbsent(key)) {
            LOGGER.debug("Node {} is not in any scale set, will use the availability set resolver", nodeName);
            members.markAbsent(key);
        }
        return membership;
    }

    @VisibleForTesting
    Map<String, List<Member>> listMembers() {
        Map<String, List<Member>> byScaleSet = new LinkedHashMap<>();
        for (ScaleSet scaleSet : listAll("list scale sets", api::listScaleSets)) {
            List<Member> vms = new ArrayList<>();
            for (ScaleSetVm vm : listAll("list virtual machines of " + scaleSet.name(), next -> api.listScaleSetVms(scaleSet.name(), next))) {
                vms.add(new Member(vm.id(), vm.computerName().toLowerCase(Locale.ROOT), scaleSet));
            }
            byScaleSet.put(scaleSet.id(), vms);
        }
        return byScaleSet;
    }

    private <T> List<T> listAll(String operation, PageFetcher<T> fetcher) {
        List<T> all = new ArrayList<>();
        String nextLink = null;
        do {
            String link = nextLink;
            Page<T> page = retrier.call(operation, () -> fetcher.fetch(link));
            all.addAll(page.items());
            nextLink = page.nextToken();
        } while (nextLink != null);
        return all;
    }

    @FunctionalInterface
    private interface PageFetcher<T> {
        Page<T> fetch(@Nullable String nextLink);
    }

    @Override
    public void close() {
        members.close();
        fallback.close();
    }
}
