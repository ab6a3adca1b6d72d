package com.example.audioextract.service;

import com.example.audioextract.exception.StorageException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Service for handling per-job file storage.
 *
 * Every job owns one directory under the uploads root, named after its ID. The directory
 * holds the uploaded input and the produced WAV file and is removed as a whole.
 */
@Service
@Slf4j
public class FileStore {

    private static final String INPUT_BASENAME = "input";
    private static final String OUTPUT_EXTENSION = ".wav";

    private final Path uploadsDirectory;

    private final TaskScheduler cleanupScheduler;

    private final Map<String, PendingCleanup> pendingCleanups = new ConcurrentHashMap<>();

    public FileStore(@Value("${storage.uploads.directory:uploads}") String uploadsDirectory,
                     @Qualifier("cleanupScheduler") TaskScheduler cleanupScheduler) {
        this.uploadsDirectory = Paths.get(uploadsDirectory).toAbsolutePath().normalize();
        this.cleanupScheduler = cleanupScheduler;
    }

    /**
     * Initializes the uploads directory. The service cannot run without it.
     *
     * @throws StorageException if the directory cannot be created
     */
    @PostConstruct
    public void init() {
        try {
            Files.createDirectories(uploadsDirectory);
            log.info("Storage directory initialized: {}", uploadsDirectory);
        } catch (IOException e) {
            log.error("Failed to create storage directory {}", uploadsDirectory, e);
            throw new StorageException("Could not initialize storage directory " + uploadsDirectory, e);
        }
    }

    /**
     * Saves an uploaded file into the job's directory, keeping the original extension.
     *
     * @param content File content
     * @param originalFilename File name supplied by the uploader
     * @param jobId The job ID
     * @return Path to the stored input file
     */
    public Path store(byte[] content, String originalFilename, String jobId) {
        Path jobDir = jobDirectory(jobId);
        Path inputPath = jobDir.resolve(INPUT_BASENAME + getFileExtension(originalFilename));
        try {
            Files.createDirectories(jobDir);
            Files.write(inputPath, content);
            log.debug("Stored {} bytes for job {} at {}", content.length, jobId, inputPath);
            return inputPath;
        } catch (IOException e) {
            log.error("Failed to store upload for job {}: {}", jobId, e.getMessage(), e);
            throw new StorageException("Could not store upload for job " + jobId, e);
        }
    }

    /**
     * Gets the output file path for a job. Performs no I/O.
     *
     * @param jobId The job ID
     * @param originalFilename File name supplied by the uploader
     * @return Path to the WAV output file
     */
    public Path outputPathFor(String jobId, String originalFilename) {
        return jobDirectory(jobId).resolve(getBaseName(originalFilename) + OUTPUT_EXTENSION);
    }

    /**
     * Gets the directory owned by a job.
     *
     * @param jobId The job ID
     * @return Path to the job directory
     */
    public Path jobDirectory(String jobId) {
        Path jobDir = uploadsDirectory.resolve(jobId).normalize();
        if (jobId.isEmpty() || !uploadsDirectory.equals(jobDir.getParent())) {
            throw new IllegalArgumentException("Invalid job ID: " + jobId);
        }
        return jobDir;
    }

    /**
     * Removes the job directory and everything in it. A missing directory is not an error.
     * Any delayed cleanup pending for the job is cancelled.
     *
     * @param jobId The job ID
     * @throws IOException if the directory exists but cannot be removed
     */
    public void cleanup(String jobId) throws IOException {
        cancelPendingCleanup(jobId);
        if (deleteDirectory(jobDirectory(jobId))) {
            log.info("Cleaned up files for job {}", jobId);
        }
    }

    /**
     * Schedules removal of the job directory after a delay. A later call for the same job
     * replaces the earlier one, which then never fires.
     *
     * @param jobId The job ID
     * @param delayMs Delay in milliseconds
     */
    public void scheduleDelayedCleanup(String jobId, long delayMs) {
        PendingCleanup pending = new PendingCleanup();
        pendingCleanups.compute(jobId, (id, previous) -> {
            if (previous != null) {
                previous.cancel();
            }
            pending.future = cleanupScheduler.schedule(() -> runDelayedCleanup(id, pending),
                    Instant.now().plusMillis(delayMs));
            return pending;
        });
        log.debug("Scheduled cleanup of job {} in {} ms", jobId, delayMs);
    }

    /**
     * Removes every job directory last modified more than {@code maxAgeMs} ago.
     *
     * @param maxAgeMs Maximum age in milliseconds
     * @return Number of directories removed
     * @throws IOException if the uploads directory cannot be listed or a directory cannot be removed
     */
    public int sweepOlderThan(long maxAgeMs) throws IOException {
        Instant threshold = Instant.now().minus(Duration.ofMillis(maxAgeMs));
        List<Path> jobDirs;
        try (Stream<Path> entries = Files.list(uploadsDirectory)) {
            jobDirs = entries.filter(Files::isDirectory).collect(Collectors.toList());
        } catch (NoSuchFileException e) {
            return 0;
        }

        int removed = 0;
        for (Path jobDir : jobDirs) {
            Instant lastModified;
            try {
                lastModified = Files.getLastModifiedTime(jobDir).toInstant();
            } catch (NoSuchFileException e) {
                continue;
            }
            if (!lastModified.isBefore(threshold)) {
                continue;
            }
            String jobId = jobDir.getFileName().toString();
            cancelPendingCleanup(jobId);
            if (deleteDirectory(jobDir)) {
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Swept {} job directories older than {} ms", removed, maxAgeMs);
        }
        return removed;
    }

    /**
     * Checks whether a path exists. Never throws.
     *
     * @param path Path to probe
     * @return True if the path exists
     */
    public boolean exists(Path path) {
        try {
            return path != null && Files.exists(path);
        } catch (SecurityException e) {
            log.debug("Cannot access {}: {}", path, e.getMessage());
            return false;
        }
    }

    /**
     * Number of delayed cleanups that have not fired yet.
     *
     * @return Pending cleanup count
     */
    public int pendingCleanupCount() {
        return pendingCleanups.size();
    }

    private void runDelayedCleanup(String jobId, PendingCleanup pending) {
        // only the most recently scheduled cleanup may run
        if (!pendingCleanups.remove(jobId, pending)) {
            return;
        }
        try {
            if (deleteDirectory(jobDirectory(jobId))) {
                log.info("Delayed cleanup removed files for job {}", jobId);
            }
        } catch (IOException e) {
            log.warn("Delayed cleanup failed for job {}: {}", jobId, e.getMessage(), e);
        }
    }

    private void cancelPendingCleanup(String jobId) {
        PendingCleanup pending = pendingCleanups.remove(jobId);
        if (pending != null) {
            pending.cancel();
        }
    }

    private boolean deleteDirectory(Path dir) throws IOException {
        try {
            return FileSystemUtils.deleteRecursively(dir);
        } catch (NoSuchFileException e) {
            // removed concurrently
            return false;
        }
    }

    /**
     * Extracts file extension from filename.
     *
     * @param filename The filename
     * @return The file extension (with dot) or empty string if none
     */
    private String getFileExtension(String filename) {
        String name = stripDirectories(filename);
        int dotIndex = name.lastIndexOf('.');
        return (dotIndex > 0) ? name.substring(dotIndex) : "";
    }

    private String getBaseName(String filename) {
        String name = stripDirectories(filename);
        int dotIndex = name.lastIndexOf('.');
        return (dotIndex > 0) ? name.substring(0, dotIndex) : name;
    }

    private String stripDirectories(String filename) {
        int slash = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
        return filename.substring(slash + 1);
    }

    /**
     * Handle to a scheduled cleanup.
     */
    private static final class PendingCleanup {
        private volatile ScheduledFuture<?> future;

        void cancel() {
            ScheduledFuture<?> f = future;
            if (f != null) {
                f.cancel(false);
            }
        }
    }
}
