/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.cloud.azure;

import java.time.Duration;

import org.junit.jupiter.api.Test;

import io.kubecsr.cloud.ResolutionException;
import io.kubecsr.cloud.cache.TimedCache;
import io.kubecsr.cloud.retry.Retrier;
import io.kubecsr.test.MutableClock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AvailabilitySetResolverTest {

    private final FakeComputeApi api = new FakeComputeApi();
    private final MutableClock clock = new MutableClock();
    private final AvailabilitySetResolver resolver = new AvailabilitySetResolver(api, Retrier.once(), new TimedCache<>(Duration.ofSeconds(15), clock));

    @Test
    void resolvesVirtualMachineAndAvailabilitySet() {
        // Given
        var vm = api.addVirtualMachine("master-0", "masters");

        // When/Then
        assertThat(resolver.instanceId("master-0")).isEqualTo(vm.id());
        assertThat(resolver.instanceGroupId("master-0")).isEqualTo(vm.availabilitySetId());
    }

    @Test
    void cachesLookupsWithinTtl() {
        // Given
        api.addVirtualMachine("master-0", "masters");

        // When
        resolver.instanceId("master-0");
        resolver.instanceGroupId("master-0");
        clock.advance(Duration.ofSeconds(16));
        resolver.instanceId("master-0");

        // Then
        assertThat(api.vmGets).hasValue(2);
    }

    @Test
    void unknownVirtualMachineIsNotFound() {
        assertThatThrownBy(() -> resolver.instanceId("ghost"))
                .isInstanceOf(ResolutionException.class)
                .extracting(e -> ((ResolutionException) e).kind())
                .isEqualTo(ResolutionException.Kind.INSTANCE_NOT_FOUND);
    }

    @Test
    void virtualMachineWithoutAvailabilitySetIsEvicted() {
        // Given
        api.addVirtualMachine("loner", null);
        assertThatThrownBy(() -> resolver.instanceGroupId("loner"))
                .isInstanceOf(ResolutionException.class)
                .extracting(e -> ((ResolutionException) e).kind())
                .isEqualTo(ResolutionException.Kind.GROUP_NOT_FOUND);

        // When
        var vm = api.addVirtualMachine("loner", "workers");

        // Then
        assertThat(resolver.instanceGroupId("loner")).isEqualTo(vm.availabilitySetId());
    }
}
