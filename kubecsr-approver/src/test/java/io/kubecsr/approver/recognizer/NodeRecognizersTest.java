/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.approver.recognizer;

import java.util.List;
import java.util.stream.Stream;

import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.x500.X500NameBuilder;
import org.bouncycastle.asn1.x500.style.BCStyle;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import io.kubecsr.approver.InMemoryClusterMembership;
import io.kubecsr.approver.InMemoryIdentityResolver;
import io.kubecsr.cloud.ResolutionException;
import io.kubecsr.test.CertificateGenerator;
import io.kubecsr.test.CertificateGenerator.Subject;
import io.kubecsr.test.SigningRequestFixtures;

import static io.kubecsr.test.SigningRequestFixtures.BOOTSTRAPPERS_GROUP;
import static io.kubecsr.test.SigningRequestFixtures.KUBELET_CLIENT_USAGES;
import static io.kubecsr.test.SigningRequestFixtures.NODES_GROUP;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NodeRecognizersTest {

    private final InMemoryIdentityResolver resolver = new InMemoryIdentityResolver();
    private final InMemoryClusterMembership membership = new InMemoryClusterMembership();

    static Stream<Arguments> usageSets() {
        return Stream.of(
                Arguments.argumentSet("exact", List.of("key encipherment", "digital signature", "client auth"), true),
                Arguments.argumentSet("reordered", List.of("client auth", "key encipherment", "digital signature"), true),
                Arguments.argumentSet("duplicated", List.of("client auth", "key encipherment", "digital signature", "client auth"), true),
                Arguments.argumentSet("superset with server auth", List.of("key encipherment", "digital signature", "client auth", "server auth"), false),
                Arguments.argumentSet("subset missing client auth", List.of("key encipherment", "digital signature"), false),
                Arguments.argumentSet("none", List.of(), false));
    }

    @ParameterizedTest
    @MethodSource("usageSets")
    void hasExactUsagesComparesAsSets(List<String> usages, boolean expected) {
        // Given
        var request = request("system:node:worker-1", "system:node:worker-1", List.of(NODES_GROUP), usages, Subject.of("system:node:worker-1", "system:nodes"));

        // When
        Verdict verdict = NodeRecognizers.hasExactUsages(NodeRecognizers.KUBELET_CLIENT_USAGES).recognize(request);

        // Then
        assertThat(verdict.accepted()).isEqualTo(expected);
    }

    static Stream<Arguments> subjects() {
        return Stream.of(
                Arguments.argumentSet("node client cert", Subject.of("system:node:worker-1", "system:nodes"), true),
                Arguments.argumentSet("no organization", Subject.of("system:node:worker-1"), false),
                Arguments.argumentSet("extra organization", Subject.of("system:node:worker-1", "system:nodes", "system:masters"), false),
                Arguments.argumentSet("other organization", Subject.of("system:node:worker-1", "system:masters"), false),
                Arguments.argumentSet("dns name", Subject.of("system:node:worker-1", "system:nodes").withDnsNames("worker-1.example.com"), false),
                Arguments.argumentSet("ip address", Subject.of("system:node:worker-1", "system:nodes").withIpAddresses("10.0.0.1"), false),
                Arguments.argumentSet("not a node name", Subject.of("worker-1", "system:nodes"), false),
                Arguments.argumentSet("bare prefix", Subject.of("system:node:", "system:nodes"), false),
                Arguments.argumentSet("no common name", Subject.of(null, "system:nodes"), false),
                Arguments.argumentSet("extra organization with dns name",
                        Subject.of("system:node:worker-1", "system:nodes", "system:masters").withDnsNames("worker-1.example.com"), false));
    }

    @ParameterizedTest
    @MethodSource("subjects")
    void isNodeClientCert(Subject subject, boolean expected) {
        // Given
        var request = request(subject.commonName(), "system:node:worker-1", List.of(NODES_GROUP), KUBELET_CLIENT_USAGES, subject);

        // When
        Verdict verdict = NodeRecognizers.isNodeClientCert().recognize(request);

        // Then
        assertThat(verdict.accepted()).isEqualTo(expected);
    }

    @Test
    void nodeClientCertRejectsOrganizationsSharingOneRdn() {
        // Given
        var subject = new X500NameBuilder(BCStyle.INSTANCE)
                .addMultiValuedRDN(new ASN1ObjectIdentifier[]{ BCStyle.O, BCStyle.O }, new String[]{ "system:nodes", "system:masters" })
                .addRDN(BCStyle.CN, "system:node:worker-1")
                .build();
        var request = ParsedSigningRequest.from(SigningRequestFixtures.pendingRequest("csr-1", "system:node:worker-1", List.of(NODES_GROUP),
                KUBELET_CLIENT_USAGES, CertificateGenerator.generateCertificateRequestPem(subject)));

        // When
        Verdict verdict = NodeRecognizers.isNodeClientCert().recognize(request);

        // Then
        assertThat(verdict.accepted()).isFalse();
        assertThat(verdict.reason()).contains("system:masters");
    }

    @Test
    void selfRequestRequiresRequesterToBeTheNode() {
        // Given
        var self = request("system:node:worker-1", "system:node:worker-1", List.of(NODES_GROUP), KUBELET_CLIENT_USAGES, Subject.of("system:node:worker-1", "system:nodes"));
        var other = request("system:node:worker-1", "system:node:worker-2", List.of(NODES_GROUP), KUBELET_CLIENT_USAGES, Subject.of("system:node:worker-1", "system:nodes"));

        // When/Then
        assertThat(NodeRecognizers.isSelfRequest().recognize(self).accepted()).isTrue();
        assertThat(NodeRecognizers.isSelfRequest().recognize(other))
                .satisfies(verdict -> {
                    assertThat(verdict.accepted()).isFalse();
                    assertThat(verdict.reason()).contains("system:node:worker-2");
                });
    }

    @Test
    void newNodeRequestAcceptsMatchingInstance() {
        // Given
        resolver.withNode("valid-node", "id-1", "workers");
        var request = ParsedSigningRequest.from(SigningRequestFixtures.newNodeRequest("csr-1", "valid-node", "id-1"));

        // When
        Verdict verdict = NodeRecognizers.isNewNodeRequest(resolver, membership).recognize(request);

        // Then
        assertThat(verdict.accepted()).isTrue();
    }

    @Test
    void newNodeRequestRejectsInstanceMismatch() {
        // Given
        resolver.withNode("valid-node", "id-2", "workers");
        var request = ParsedSigningRequest.from(SigningRequestFixtures.newNodeRequest("csr-1", "valid-node", "id-1"));

        // When
        Verdict verdict = NodeRecognizers.isNewNodeRequest(resolver, membership).recognize(request);

        // Then
        assertThat(verdict.accepted()).isFalse();
        assertThat(verdict.reason()).contains("id-2").contains("id-1");
    }

    @Test
    void newNodeRequestRejectsRegisteredNode() {
        // Given
        resolver.withNode("valid-node", "id-1", "workers");
        membership.withNode("valid-node", true);
        var request = ParsedSigningRequest.from(SigningRequestFixtures.newNodeRequest("csr-1", "valid-node", "id-1"));

        // When
        Verdict verdict = NodeRecognizers.isNewNodeRequest(resolver, membership).recognize(request);

        // Then
        assertThat(verdict.accepted()).isFalse();
        assertThat(verdict.reason()).contains("already registered");
    }

    @Test
    void newNodeRequestRequiresBootstrapperGroup() {
        // Given
        resolver.withNode("valid-node", "id-1", "workers");
        var request = request("system:node:valid-node", "system:bootstrappers:id-1", List.of("system:authenticated"), KUBELET_CLIENT_USAGES,
                Subject.of("system:node:valid-node", "system:nodes"));

        // When
        Verdict verdict = NodeRecognizers.isNewNodeRequest(resolver, membership).recognize(request);

        // Then
        assertThat(verdict.accepted()).isFalse();
        assertThat(resolver.lookups).hasValue(0);
    }

    @Test
    void newNodeRequestRequiresInstanceIdInUserName() {
        // Given
        var request = request("system:node:valid-node", "system:bootstrappers:", List.of(BOOTSTRAPPERS_GROUP), KUBELET_CLIENT_USAGES,
                Subject.of("system:node:valid-node", "system:nodes"));

        // When
        Verdict verdict = NodeRecognizers.isNewNodeRequest(resolver, membership).recognize(request);

        // Then
        assertThat(verdict.accepted()).isFalse();
        assertThat(verdict.reason()).contains("no instance id");
    }

    @Test
    void unresolvableNodeIsRejected() {
        // Given
        var request = ParsedSigningRequest.from(SigningRequestFixtures.newNodeRequest("csr-1", "unknown-node", "id-1"));

        // When
        Verdict verdict = NodeRecognizers.isNewNodeRequest(resolver, membership).recognize(request);

        // Then
        assertThat(verdict.accepted()).isFalse();
        assertThat(verdict.reason()).contains("no instance found for node unknown-node");
    }

    @Test
    void ambiguousNodeIsRejected() {
        // Given
        resolver.failing("valid-node", ResolutionException.ambiguous("instance", "valid-node", 2));
        var request = ParsedSigningRequest.from(SigningRequestFixtures.newNodeRequest("csr-1", "valid-node", "id-1"));

        // When
        Verdict verdict = NodeRecognizers.isNewNodeRequest(resolver, membership).recognize(request);

        // Then
        assertThat(verdict.accepted()).isFalse();
    }

    @Test
    void transientResolutionFailurePropagates() {
        // Given
        var failure = ResolutionException.transientFailure("throttled", new RuntimeException("503"));
        resolver.failing("valid-node", failure);
        var request = ParsedSigningRequest.from(SigningRequestFixtures.newNodeRequest("csr-1", "valid-node", "id-1"));
        Recognizer recognizer = NodeRecognizers.isNewNodeRequest(resolver, membership);

        // When/Then
        assertThatThrownBy(() -> recognizer.recognize(request)).isSameAs(failure);
    }

    @Test
    void existingNodeRequestRequiresReadyNode() {
        // Given
        membership.withNode("ready", true).withNode("not-ready", false);
        Recognizer recognizer = NodeRecognizers.isExistingNodeRequest(membership);

        // When/Then
        assertThat(recognizer.recognize(ParsedSigningRequest.from(SigningRequestFixtures.selfNodeRequest("a", "ready"))).accepted()).isTrue();
        assertThat(recognizer.recognize(ParsedSigningRequest.from(SigningRequestFixtures.selfNodeRequest("b", "not-ready"))).reason()).contains("not Ready");
        assertThat(recognizer.recognize(ParsedSigningRequest.from(SigningRequestFixtures.selfNodeRequest("c", "missing"))).reason()).contains("not registered");
    }

    @Test
    void existingNodeRequestRequiresNodesGroup() {
        // Given
        membership.withNode("worker-1", true);
        var request = request("system:node:worker-1", "system:node:worker-1", List.of("system:authenticated"), KUBELET_CLIENT_USAGES,
                Subject.of("system:node:worker-1", "system:nodes"));

        // When
        Verdict verdict = NodeRecognizers.isExistingNodeRequest(membership).recognize(request);

        // Then
        assertThat(verdict.accepted()).isFalse();
        assertThat(membership.lookups).hasValue(0);
    }

    @Test
    void allowedGroupMembership() {
        // Given
        resolver.withNode("worker-1", "i-1", "workers").withNode("bastion", "i-2", "bastions");
        Recognizer recognizer = NodeRecognizers.isInAllowedGroup(resolver, AllowedGroups.of(List.of("workers")));

        // When/Then
        assertThat(recognizer.recognize(ParsedSigningRequest.from(SigningRequestFixtures.selfNodeRequest("a", "worker-1"))).accepted()).isTrue();
        assertThat(recognizer.recognize(ParsedSigningRequest.from(SigningRequestFixtures.selfNodeRequest("b", "bastion"))).reason())
                .contains("bastions is not allowed");
        assertThat(recognizer.recognize(ParsedSigningRequest.from(SigningRequestFixtures.selfNodeRequest("c", "unknown"))).accepted()).isFalse();
    }

    private static ParsedSigningRequest request(String name, String username, List<String> groups, List<String> usages, Subject subject) {
        return ParsedSigningRequest.from(SigningRequestFixtures.pendingRequest(name, username, groups, usages,
                CertificateGenerator.generateCertificateRequestPem(subject)));
    }
}
