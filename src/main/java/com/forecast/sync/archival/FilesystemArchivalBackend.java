package com.forecast.sync.archival;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.forecast.sync.core.model.RawIntakeRecord;
import com.forecast.sync.health.HealthStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Writes each batch as a gzip-compressed JSON Lines file named
 * {@code bronze-<timestamp>-<uuid>.jsonl.gz}. Files are written under a temporary name, forced to
 * disk and then moved into place, so a listed archive is always complete.
 */
public class FilesystemArchivalBackend implements ArchivalBackend {
    private static final Logger log = LoggerFactory.getLogger(FilesystemArchivalBackend.class);

    private static final String SUFFIX = ".jsonl.gz";

    private final Path directory;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Clock clock;

    public FilesystemArchivalBackend(Path directory) {
        this(directory, Clock.systemUTC());
    }

    public FilesystemArchivalBackend(Path directory, Clock clock) {
        this.directory = directory;
        this.clock = clock;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create archive directory " + directory, e);
        }
        log.info("archival.filesystem directory={}", directory.toAbsolutePath());
    }

    @Override
    public ArchivalMetadata archiveBatch(List<RawIntakeRecord> records) {
        Instant now = clock.instant();
        String archiveId = "bronze-" + now.toString().replace(':', '-') + "-" + UUID.randomUUID();
        Path target = path(archiveId);
        Path temp = directory.resolve("." + archiveId + ".tmp");
        long uncompressed = 0;
        try {
            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
                 GZIPOutputStream gzip = new GZIPOutputStream(Channels.newOutputStream(channel));
                 BufferedWriter writer = new BufferedWriter(new OutputStreamWriter(gzip, StandardCharsets.UTF_8))) {
                for (RawIntakeRecord record : records) {
                    String line = objectMapper.writeValueAsString(ArchiveLine.of(record)) + "\n";
                    uncompressed += line.getBytes(StandardCharsets.UTF_8).length;
                    writer.write(line);
                }
                writer.flush();
                gzip.finish();
                forceToDisk(channel);
            }
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
            long compressed = Files.size(target);
            log.info("archival.written archiveId={} records={} compressedBytes={}",
                    archiveId, records.size(), compressed);
            return new ArchivalMetadata(archiveId, records.size(), compressed, uncompressed, now);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new ArchivalException("Failed to write archive " + archiveId, e);
        }
    }

    @Override
    public List<RawIntakeRecord> retrieveArchive(String archiveId) {
        List<RawIntakeRecord> records = new ArrayList<>();
        try (BufferedReader reader = open(archiveId)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (!line.isBlank()) {
                    records.add(objectMapper.readValue(line, ArchiveLine.class).toRecord());
                }
            }
            return records;
        } catch (NoSuchFileException e) {
            throw new ArchivalException("Archive not found: " + archiveId, e);
        } catch (IOException e) {
            throw new ArchivalException("Failed to read archive " + archiveId, e);
        }
    }

    @Override
    public List<ArchivalMetadata> listArchives(Instant from, Instant to) {
        List<ArchivalMetadata> archives = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "bronze-*" + SUFFIX)) {
            for (Path file : files) {
                Instant modified = Files.getLastModifiedTime(file).toInstant();
                if ((from != null && modified.isBefore(from)) || (to != null && modified.isAfter(to))) {
                    continue;
                }
                archives.add(describe(file, modified));
            }
        } catch (IOException e) {
            throw new ArchivalException("Failed to list archives in " + directory, e);
        }
        archives.sort(Comparator.comparing(ArchivalMetadata::archiveDate));
        return archives;
    }

    @Override
    public void deleteArchive(String archiveId) {
        try {
            if (Files.deleteIfExists(path(archiveId))) {
                log.info("archival.deleted archiveId={}", archiveId);
            }
        } catch (IOException e) {
            throw new ArchivalException("Failed to delete archive " + archiveId, e);
        }
    }

    @Override
    public HealthStatus healthCheck() {
        Path probe = directory.resolve(".health-check");
        try {
            Files.writeString(probe, clock.instant().toString());
            Files.delete(probe);
            return HealthStatus.up().withDetail("directory", directory.toString());
        } catch (IOException e) {
            return HealthStatus.down("Archive directory not writable: " + e.getMessage())
                    .withDetail("directory", directory.toString());
        }
    }

    private ArchivalMetadata describe(Path file, Instant modified) throws IOException {
        String name = file.getFileName().toString();
        String archiveId = name.substring(0, name.length() - SUFFIX.length());
        int count = 0;
        long uncompressed = 0;
        try (BufferedReader reader = open(archiveId)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (!line.isBlank()) {
                    count++;
                }
                uncompressed += line.getBytes(StandardCharsets.UTF_8).length + 1;
            }
        }
        return new ArchivalMetadata(archiveId, count, Files.size(file), uncompressed, modified);
    }

    private BufferedReader open(String archiveId) throws IOException {
        return new BufferedReader(new InputStreamReader(
                new GZIPInputStream(Files.newInputStream(path(archiveId))), StandardCharsets.UTF_8));
    }

    private Path path(String archiveId) {
        if (archiveId.contains("/") || archiveId.contains("\\") || archiveId.startsWith(".")) {
            throw new IllegalArgumentException("Invalid archive id: " + archiveId);
        }
        return directory.resolve(archiveId + SUFFIX);
    }

    /**
     * Flushes the archive's bytes to the storage device; runs before the file is moved into place.
     */
    void forceToDisk(FileChannel channel) throws IOException {
        channel.force(true);
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("archival.cleanupFailed path={}", path, e);
        }
    }

    /**
     * One JSON line of an archive.
     */
    public record ArchiveLine(String id, String organizationId, String ingestedAt, String payload) {

        static ArchiveLine of(RawIntakeRecord record) {
            return new ArchiveLine(record.id(), record.organizationId(), record.ingestedAt().toString(),
                    record.payload());
        }

        RawIntakeRecord toRecord() {
            return new RawIntakeRecord(id, organizationId, Instant.parse(ingestedAt), payload);
        }
    }
}
