/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.approver.recognizer;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

import io.kubecsr.cloud.CloudIdentityResolver;
import io.kubecsr.cloud.ResolutionException;
import io.kubecsr.csr.CertificateRequest;
import io.kubecsr.csr.KeyUsage;
import io.kubecsr.csr.Requester;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The recognizers that make up the kubelet client certificate approval policy, and the default chains built from them.
 */
public final class NodeRecognizers {

    public static final String NODE_ORGANIZATION = "system:nodes";
    public static final String NODE_USER_PREFIX = "system:node:";
    public static final String NODES_GROUP = "system:nodes";
    public static final String BOOTSTRAPPERS_GROUP = "system:bootstrappers";
    public static final String BOOTSTRAPPER_USER_PREFIX = "system:bootstrappers:";

    public static final Set<KeyUsage> KUBELET_CLIENT_USAGES = EnumSet.of(KeyUsage.KEY_ENCIPHERMENT, KeyUsage.DIGITAL_SIGNATURE, KeyUsage.CLIENT_AUTH);

    public static final String SELF_CHAIN = "self";
    public static final String NEW_NODE_CHAIN = "new-node";

    private NodeRecognizers() {
    }

    /**
     * The approval policy: a node renewing its own certificate, then a new node bootstrapping.
     */
    public static RecognizerChains defaultChains(CloudIdentityResolver resolver, ClusterMembership membership, AllowedGroups allowedGroups) {
        RecognizerChain self = new RecognizerChain(SELF_CHAIN, "kubecsr approved self node client cert", List.of(
                hasExactUsages(KUBELET_CLIENT_USAGES),
                isNodeClientCert(),
                isSelfRequest(),
                isExistingNodeRequest(membership),
                isInAllowedGroup(resolver, allowedGroups)));
        RecognizerChain newNode = new RecognizerChain(NEW_NODE_CHAIN, "kubecsr approved new node client cert", List.of(
                hasExactUsages(KUBELET_CLIENT_USAGES),
                isNodeClientCert(),
                isNewNodeRequest(resolver, membership),
                isInAllowedGroup(resolver, allowedGroups)));
        return new RecognizerChains(List.of(self, newNode));
    }

    /**
     * Accepts requests whose usages are exactly {@code expected}, ignoring order and duplicates.
     * Extra usages are rejected.
     */
    public static Recognizer hasExactUsages(Set<KeyUsage> expected) {
        Set<String> expectedValues = KeyUsage.wireValues(expected);
        return Recognizer.named("hasExactUsages", request -> {
            Set<String> requested = Set.copyOf(request.usages());
            if (requested.equals(expectedValues)) {
                return Verdict.accept();
            }
            return Verdict.reject("requested usages " + request.usages() + " differ from " + expectedValues);
        });
    }

    /**
     * Accepts requests shaped like a kubelet client certificate: organization exactly {@value #NODE_ORGANIZATION},
     * no subject alternative names and a common name starting {@value #NODE_USER_PREFIX}.
     */
    public static Recognizer isNodeClientCert() {
        return Recognizer.named("isNodeClientCert", request -> {
            CertificateRequest certificateRequest = request.certificateRequest();
            if (!List.of(NODE_ORGANIZATION).equals(certificateRequest.organizations())) {
                return Verdict.reject("organization " + certificateRequest.organizations() + " is not [" + NODE_ORGANIZATION + "]");
            }
            if (certificateRequest.hasSubjectAlternativeNames()) {
                return Verdict.reject("request has subject alternative names");
            }
            if (nodeName(request).isEmpty()) {
                return Verdict.reject("common name " + certificateRequest.commonName() + " does not start with " + NODE_USER_PREFIX);
            }
            return Verdict.accept();
        });
    }

    /**
     * Accepts requests made by the node the certificate is for, using its current credential.
     */
    public static Recognizer isSelfRequest() {
        return Recognizer.named("isSelfRequest", request -> {
            String commonName = request.certificateRequest().commonName();
            if (request.requester().username().equals(commonName)) {
                return Verdict.accept();
            }
            return Verdict.reject("requester " + request.requester().username() + " is not " + commonName);
        });
    }

    /**
     * Accepts requests from a bootstrap token whose user name embeds the cloud instance id of the
     * node named in the certificate, for a node not yet registered with the cluster.
     */
    public static Recognizer isNewNodeRequest(CloudIdentityResolver resolver, ClusterMembership membership) {
        return Recognizer.named("isNewNodeRequest", request -> {
            Requester requester = request.requester();
            if (!requester.isMemberOf(BOOTSTRAPPERS_GROUP)) {
                return Verdict.reject("requester is not in group " + BOOTSTRAPPERS_GROUP);
            }
            String username = requester.username();
            if (!username.startsWith(BOOTSTRAPPER_USER_PREFIX) || username.length() == BOOTSTRAPPER_USER_PREFIX.length()) {
                return Verdict.reject("requester " + username + " carries no instance id");
            }
            Optional<String> nodeName = nodeName(request);
            if (nodeName.isEmpty()) {
                return Verdict.reject("common name does not name a node");
            }
            String node = nodeName.get();
            String claimed = username.substring(BOOTSTRAPPER_USER_PREFIX.length());
            Resolution resolved = resolve(() -> resolver.instanceId(node));
            if (resolved.failure() != null) {
                return resolved.failure();
            }
            if (!claimed.equals(resolved.value())) {
                return Verdict.reject("node " + node + " is instance " + resolved.value() + ", not " + claimed);
            }
            if (membership.node(node).isPresent()) {
                return Verdict.reject("node " + node + " is already registered");
            }
            return Verdict.accept();
        });
    }

    /**
     * Accepts requests from a member of {@value #NODES_GROUP} for a node that is registered and Ready.
     */
    public static Recognizer isExistingNodeRequest(ClusterMembership membership) {
        return Recognizer.named("isExistingNodeRequest", request -> {
            if (!request.requester().isMemberOf(NODES_GROUP)) {
                return Verdict.reject("requester is not in group " + NODES_GROUP);
            }
            Optional<String> nodeName = nodeName(request);
            if (nodeName.isEmpty()) {
                return Verdict.reject("common name does not name a node");
            }
            Optional<ClusterMembership.RegisteredNode> node = membership.node(nodeName.get());
            if (node.isEmpty()) {
                return Verdict.reject("node " + nodeName.get() + " is not registered");
            }
            if (!node.get().ready()) {
                return Verdict.reject("node " + nodeName.get() + " is not Ready");
            }
            return Verdict.accept();
        });
    }

    /**
     * Accepts requests for nodes whose cloud instance group is allowed.
     */
    public static Recognizer isInAllowedGroup(CloudIdentityResolver resolver, AllowedGroups allowedGroups) {
        return Recognizer.named("isInAllowedGroup", request -> {
            Optional<String> nodeName = nodeName(request);
            if (nodeName.isEmpty()) {
                return Verdict.reject("common name does not name a node");
            }
            Resolution resolved = resolve(() -> resolver.instanceGroupId(nodeName.get()));
            if (resolved.failure() != null) {
                return resolved.failure();
            }
            if (allowedGroups.contains(resolved.value())) {
                return Verdict.accept();
            }
            return Verdict.reject("instance group " + resolved.value() + " is not allowed");
        });
    }

    static Optional<String> nodeName(ParsedSigningRequest request) {
        String commonName = request.certificateRequest().commonName();
        if (commonName == null || !commonName.startsWith(NODE_USER_PREFIX) || commonName.length() == NODE_USER_PREFIX.length()) {
            return Optional.empty();
        }
        return Optional.of(commonName.substring(NODE_USER_PREFIX.length()));
    }

    private static Resolution resolve(Supplier<String> lookup) {
        try {
            return new Resolution(lookup.get(), null);
        }
        catch (ResolutionException e) {
            if (e.isTransient()) {
                throw e;
            }
            return new Resolution(null, Verdict.reject(e.getMessage()));
        }
    }

    private record Resolution(@Nullable String value, @Nullable Verdict failure) {}
}
