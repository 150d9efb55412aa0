/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.signer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileAttribute;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Optional;
import java.util.Set;

/**
 * Keeps signed requests on disk, one file per request name, so that they can be served again.
 */
public class CsrStore {

    private static final Set<PosixFilePermission> OWNER_ONLY = PosixFilePermissions.fromString("rw-------");

    private final Path directory;
    private final boolean posix;

    public CsrStore(Path directory) {
        this.directory = directory;
        this.posix = directory.getFileSystem().supportedFileAttributeViews().contains("posix");
    }

    public Path directory() {
        return directory;
    }

    /**
     * Writes a request, replacing any previous one of the same name.
     *
     * @throws IllegalArgumentException if the name is not a plain file name
     * @throws IOException if the file cannot be written
     */
    public void write(String name, byte[] content) throws IOException {
        Path target = resolve(name);
        Path temp = createTempFile();
        try {
            Files.write(temp, content);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        }
        finally {
            Files.deleteIfExists(temp);
        }
    }

    /**
     * @return the stored request, empty if none has been stored under the name
     * @throws IllegalArgumentException if the name is not a plain file name
     * @throws IOException if the file exists but cannot be read
     */
    public Optional<byte[]> read(String name) throws IOException {
        try {
            return Optional.of(Files.readAllBytes(resolve(name)));
        }
        catch (NoSuchFileException e) {
            return Optional.empty();
        }
    }

    private Path createTempFile() throws IOException {
        Files.createDirectories(directory);
        if (posix) {
            FileAttribute<Set<PosixFilePermission>> ownerOnly = PosixFilePermissions.asFileAttribute(OWNER_ONLY);
            return Files.createTempFile(directory, ".csr-", ".tmp", ownerOnly);
        }
        return Files.createTempFile(directory, ".csr-", ".tmp");
    }

    private Path resolve(String name) {
        if (name.isEmpty() || name.equals(".") || name.equals("..") || name.contains("/") || name.contains("\\")
                || name.indexOf('\0') >= 0) {
            throw new IllegalArgumentException("invalid signing request name '" + name + "'");
        }
        return directory.resolve(name);
    }
}
