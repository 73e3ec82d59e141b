package com.graphivault.infrastructure.persistence;

import lombok.Getter;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Directory structure under a vault root.
 */
@Getter
public final class VaultLayout {

    public static final String DATA_DIR = "data";
    public static final String ENCRYPTED_DIR = "encrypted";
    public static final String THUMBNAILS_DIR = "thumbnails";
    public static final String TEMP_DIR = "temp";
    public static final String BACKUPS_DIR = "backups";

    private final Path root;
    private final Path data;
    private final Path encrypted;
    private final Path thumbnails;
    private final Path temp;
    private final Path backups;

    private VaultLayout(Path root) {
        this.root = root;
        this.data = root.resolve(DATA_DIR);
        this.encrypted = root.resolve(ENCRYPTED_DIR);
        this.thumbnails = root.resolve(THUMBNAILS_DIR);
        this.temp = root.resolve(TEMP_DIR);
        this.backups = root.resolve(BACKUPS_DIR);
    }

    public static VaultLayout of(Path root) {
        return new VaultLayout(root.toAbsolutePath().normalize());
    }

    /**
     * Create the root and all subdirectories. Existing directories are left alone.
     */
    public void createDirectories() throws IOException {
        for (Path dir : List.of(root, data, encrypted, thumbnails, temp, backups)) {
            Files.createDirectories(dir);
        }
    }

    public Path databaseFile(String fileName) {
        return data.resolve(fileName);
    }

    /**
     * Resolve a stored path. Relative paths are taken against the vault root.
     */
    public Path resolve(String path) {
        Path candidate = Path.of(path);
        return candidate.isAbsolute() ? candidate.normalize() : root.resolve(candidate).normalize();
    }

    /**
     * Express a path relative to the vault root with {@code /} separators.
     * Paths outside the root are returned in absolute form.
     */
    public String relativize(Path path) {
        Path absolute = path.toAbsolutePath().normalize();
        if (!absolute.startsWith(root)) {
            return absolute.toString();
        }
        return root.relativize(absolute).toString().replace(absolute.getFileSystem().getSeparator(), "/");
    }
}
