/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.approver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.fabric8.kubernetes.client.KubernetesClient;

/**
 * The cluster role binding through which the built-in controller manager approves every
 * bootstrap client certificate request. It has to go for the approver to be the only one deciding.
 */
public final class AutoApproveBinding {

    private static final Logger LOGGER = LoggerFactory.getLogger(AutoApproveBinding.class);

    public static final String NAME = "system-bootstrap-approve-node-client-csr";

    private AutoApproveBinding() {
    }

    /**
     * Deletes the binding. A binding that does not exist is not an error.
     * @return whether a binding was deleted
     */
    public static boolean remove(KubernetesClient client) {
        boolean deleted = !client.rbac().clusterRoleBindings().withName(NAME).delete().isEmpty();
        if (deleted) {
            LOGGER.info("Removed cluster role binding {}", NAME);
        }
        else {
            LOGGER.info("Cluster role binding {} is already absent", NAME);
        }
        return deleted;
    }
}
