package com.forecast.sync.archival;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Selects and configures the archival backend.
 *
 * @param directory target directory for {@link Type#FILESYSTEM}
 */
public record ArchivalConfig(Type type, Path directory) {

    public enum Type {
        FILESYSTEM,
        DISABLED;

        public static Type fromName(String name) {
            return switch (name.trim().toLowerCase(Locale.ROOT)) {
                case "filesystem", "fs" -> FILESYSTEM;
                case "disabled", "none" -> DISABLED;
                default -> throw new IllegalArgumentException("Unsupported archival backend: " + name);
            };
        }
    }

    public ArchivalConfig {
        Objects.requireNonNull(type, "type is required");
        if (type == Type.FILESYSTEM && directory == null) {
            throw new IllegalArgumentException("directory is required for the filesystem backend");
        }
    }

    public static ArchivalConfig disabled() {
        return new ArchivalConfig(Type.DISABLED, null);
    }

    public static ArchivalConfig filesystem(Path directory) {
        return new ArchivalConfig(Type.FILESYSTEM, directory);
    }
}
