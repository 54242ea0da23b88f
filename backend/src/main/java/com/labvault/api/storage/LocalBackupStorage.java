package com.labvault.api.storage;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;

/**
 * Stores backup artifacts in a directory on the local filesystem.
 * Writes go to a temporary sibling first and are moved into place, so a crashed write never
 * leaves a truncated artifact under the final name.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "backup.storage.type", havingValue = "local", matchIfMissing = true)
public class LocalBackupStorage implements BackupStorage {

    private final Path root;

    public LocalBackupStorage(@Value("${backup.storage.local.directory:backups}") String directory) {
        this.root = Paths.get(directory).toAbsolutePath().normalize();
    }

    @Override
    public void ensureDirectory() {
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new StorageException("Cannot create backup directory " + root, e);
        }
    }

    @Override
    public void write(String filename, byte[] content) {
        ensureDirectory();
        Path target = resolve(filename);
        Path temp = target.resolveSibling(target.getFileName() + ".part");
        try {
            Files.write(temp, content, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.WRITE);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Wrote {} bytes to {}", content.length, target);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw new StorageException("Failed to write backup file " + filename, e);
        }
    }

    @Override
    public byte[] read(String filename) {
        try {
            return Files.readAllBytes(resolve(filename));
        } catch (NoSuchFileException e) {
            throw new StorageException("Backup file not found: " + filename, e);
        } catch (IOException e) {
            throw new StorageException("Failed to read backup file " + filename, e);
        }
    }

    @Override
    public long size(String filename) {
        try {
            return Files.size(resolve(filename));
        } catch (IOException e) {
            throw new StorageException("Failed to stat backup file " + filename, e);
        }
    }

    @Override
    public boolean exists(String filename) {
        return Files.isRegularFile(resolve(filename));
    }

    @Override
    public boolean delete(String filename) {
        try {
            return Files.deleteIfExists(resolve(filename));
        } catch (IOException e) {
            throw new StorageException("Failed to delete backup file " + filename, e);
        }
    }

    @Override
    public String describe() {
        return "local:" + root;
    }

    Path getRoot() {
        return root;
    }

    /**
     * Resolve a filename under the root, rejecting anything that would escape it.
     */
    private Path resolve(String filename) {
        if (filename == null || filename.isBlank()) {
            throw new IllegalArgumentException("Backup filename must not be blank");
        }
        Path resolved = root.resolve(filename).normalize();
        if (!resolved.getParent().equals(root)) {
            throw new IllegalArgumentException("Invalid backup filename: " + filename);
        }
        return resolved;
    }
}
