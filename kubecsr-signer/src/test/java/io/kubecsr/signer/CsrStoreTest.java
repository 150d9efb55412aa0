/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.signer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assumptions.assumeThat;

class CsrStoreTest {

    @TempDir
    Path dir;

    @Test
    void readsWhatWasWritten() throws IOException {
        // Given
        CsrStore store = new CsrStore(dir);

        // When
        store.write("etcd-1", bytes("{\"kind\":\"CertificateSigningRequest\"}"));

        // Then
        assertThat(store.read("etcd-1")).hasValueSatisfying(content -> assertThat(new String(content, StandardCharsets.UTF_8))
                .isEqualTo("{\"kind\":\"CertificateSigningRequest\"}"));
        assertThat(dir.resolve("etcd-1")).exists();
    }

    @Test
    void replacesPreviousContent() throws IOException {
        // Given
        CsrStore store = new CsrStore(dir);
        store.write("etcd-1", bytes("first"));

        // When
        store.write("etcd-1", bytes("second"));

        // Then
        assertThat(store.read("etcd-1")).hasValueSatisfying(content -> assertThat(content).isEqualTo(bytes("second")));
        try (var files = Files.list(dir)) {
            assertThat(files).containsExactly(dir.resolve("etcd-1"));
        }
    }

    @Test
    void unknownNameIsEmpty() throws IOException {
        assertThat(new CsrStore(dir).read("absent")).isEmpty();
    }

    @Test
    void createsMissingDirectory() throws IOException {
        // Given
        CsrStore store = new CsrStore(dir.resolve("nested").resolve("csrs"));

        // When
        store.write("etcd-1", bytes("{}"));

        // Then
        assertThat(dir.resolve("nested").resolve("csrs").resolve("etcd-1")).exists();
    }

    @Test
    void filesAreOwnerOnly() throws IOException {
        assumeThat(dir.getFileSystem().supportedFileAttributeViews()).contains("posix");

        // Given
        CsrStore store = new CsrStore(dir);

        // When
        store.write("etcd-1", bytes("{}"));

        // Then
        assertThat(PosixFilePermissions.toString(Files.getPosixFilePermissions(dir.resolve("etcd-1")))).isEqualTo("rw-------");
    }

    @ParameterizedTest
    @ValueSource(strings = { "", ".", "..", "../etc-passwd", "a/b", "a\\b" })
    void rejectsNamesThatAreNotPlainFileNames(String name) {
        // Given
        CsrStore store = new CsrStore(dir);

        // When/Then
        assertThatThrownBy(() -> store.write(name, bytes("{}"))).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.read(name)).isInstanceOf(IllegalArgumentException.class);
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }
}
