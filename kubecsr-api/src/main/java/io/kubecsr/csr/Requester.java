/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.csr;

import java.util.Objects;
import java.util.Set;

/**
 * The identity that submitted a signing request, as recorded by the API server's authenticator.
 * @param username the authenticated user name
 * @param groups the groups the user belongs to
 */
public record Requester(String username, Set<String> groups) {

    public Requester {
        Objects.requireNonNull(username);
        groups = Set.copyOf(groups);
    }

    public boolean isMemberOf(String group) {
        return groups.contains(group);
    }
}
