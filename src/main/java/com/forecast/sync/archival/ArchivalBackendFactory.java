package com.forecast.sync.archival;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates the {@link ArchivalBackend} named by an {@link ArchivalConfig}.
 */
public final class ArchivalBackendFactory {
    private static final Logger log = LoggerFactory.getLogger(ArchivalBackendFactory.class);

    private ArchivalBackendFactory() {
    }

    public static ArchivalBackend create(ArchivalConfig config) {
        log.info("archival.backend type={}", config.type());
        return switch (config.type()) {
            case FILESYSTEM -> new FilesystemArchivalBackend(config.directory());
            case DISABLED -> new DisabledArchivalBackend();
        };
    }
}
