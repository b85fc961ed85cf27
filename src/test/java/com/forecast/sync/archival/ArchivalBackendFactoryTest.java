package com.forecast.sync.archival;

import com.forecast.sync.core.model.RawIntakeRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ArchivalBackendFactoryTest {

    @TempDir
    Path directory;

    @Test
    void createsFilesystemBackend() {
        assertInstanceOf(FilesystemArchivalBackend.class,
                ArchivalBackendFactory.create(ArchivalConfig.filesystem(directory)));
    }

    @Test
    @DisplayName("the disabled backend refuses to archive and reports itself up")
    void disabledBackend() {
        ArchivalBackend backend = ArchivalBackendFactory.create(ArchivalConfig.disabled());

        assertInstanceOf(DisabledArchivalBackend.class, backend);
        assertThrows(ArchivalException.class, () -> backend.archiveBatch(
                List.of(new RawIntakeRecord("r-1", "org-1", Instant.EPOCH, ""))));
        assertTrue(backend.listArchives(null, null).isEmpty());
        assertTrue(backend.healthCheck().isUp());
    }

    @ParameterizedTest
    @CsvSource({"filesystem, FILESYSTEM", "FS, FILESYSTEM", "none, DISABLED", " disabled , DISABLED"})
    void parsesTypeNames(String name, ArchivalConfig.Type expected) {
        assertEquals(expected, ArchivalConfig.Type.fromName(name));
    }

    @Test
    void rejectsUnknownTypesAndMissingDirectory() {
        assertThrows(IllegalArgumentException.class, () -> ArchivalConfig.Type.fromName("s3"));
        assertThrows(IllegalArgumentException.class,
                () -> new ArchivalConfig(ArchivalConfig.Type.FILESYSTEM, null));
    }
}
