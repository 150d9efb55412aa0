/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.cloud;

import java.util.List;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * One page of a paginated provider listing.
 * @param items the items on this page
 * @param nextToken the continuation token for the next page, null on the last page
 * @param <T> item type
 */
public record Page<T>(List<T> items, @Nullable String nextToken) {

    public Page {
        items = List.copyOf(items);
        if (nextToken != null && nextToken.isEmpty()) {
            nextToken = null;
        }
    }

    public static <T> Page<T> last(List<T> items) {
        return new Page<>(items, null);
    }

    public boolean hasNext() {
        return nextToken != null;
    }
}
