package com.example.audioextract.model;

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;
import java.time.Instant;
import java.util.UUID;

/**
 * Represents a video-to-WAV conversion job.
 *
 * <p>Instances are not thread-safe; {@code ConversionScheduler} is the only writer and
 * mutates them under its own lock.
 */
@Data
@Builder
public class ConversionJob {

    /**
     * Unique job identifier.
     */
    private final String jobId;

    /**
     * Path to the uploaded input file.
     */
    private final Path inputPath;

    /**
     * Path the WAV output is written to.
     */
    private final Path outputPath;

    /**
     * File name supplied by the uploader.
     */
    private final String originalFilename;

    /**
     * Time when job was created.
     */
    private final Instant createdAt;

    /**
     * Current status of the job.
     */
    private JobStatus status;

    /**
     * Progress percentage (0-100).
     */
    private int progress;

    /**
     * Time when job started processing.
     */
    private Instant startedAt;

    /**
     * Time when job completed/failed/cancelled.
     */
    private Instant completedAt;

    /**
     * Error message (if job failed).
     */
    private String error;

    /**
     * Metadata of the extracted audio (if job completed).
     */
    private AudioMetadata metadata;

    /**
     * Creates a new queued job.
     *
     * @param inputPath Path to the uploaded input file
     * @param outputPath Path the output will be written to
     * @param originalFilename File name supplied by the uploader
     * @return New ConversionJob instance
     */
    public static ConversionJob createNew(Path inputPath, Path outputPath, String originalFilename) {
        return createNew(UUID.randomUUID().toString(), inputPath, outputPath, originalFilename);
    }

    /**
     * Creates a new queued job with a caller-chosen ID.
     *
     * @param jobId Job ID
     * @param inputPath Path to the uploaded input file
     * @param outputPath Path the output will be written to
     * @param originalFilename File name supplied by the uploader
     * @return New ConversionJob instance
     */
    public static ConversionJob createNew(String jobId, Path inputPath, Path outputPath, String originalFilename) {
        return ConversionJob.builder()
                .jobId(jobId)
                .inputPath(inputPath)
                .outputPath(outputPath)
                .originalFilename(originalFilename)
                .status(JobStatus.QUEUED)
                .progress(0)
                .createdAt(Instant.now())
                .build();
    }

    /**
     * Raises progress to the given percentage. Values are clamped to [0, 100] and
     * anything not above the current progress is ignored.
     *
     * @param percent Reported progress
     * @return True if progress changed
     */
    public boolean advanceProgress(int percent) {
        int clamped = Math.max(0, Math.min(100, percent));
        if (status != JobStatus.PROCESSING || clamped <= progress) {
            return false;
        }
        progress = clamped;
        return true;
    }

    /**
     * Marks the job as processing.
     */
    public void markProcessing() {
        requireStatus(JobStatus.QUEUED);
        status = JobStatus.PROCESSING;
        progress = 0;
        startedAt = Instant.now();
    }

    /**
     * Marks the job as completed.
     *
     * @param audioMetadata Metadata produced by the engine
     */
    public void markCompleted(AudioMetadata audioMetadata) {
        requireStatus(JobStatus.PROCESSING);
        status = JobStatus.COMPLETED;
        progress = 100;
        metadata = audioMetadata;
        completedAt = Instant.now();
    }

    /**
     * Marks the job as failed with an error message.
     *
     * @param message Error message, must not be blank
     */
    public void markFailed(String message) {
        requireStatus(JobStatus.PROCESSING);
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("Failed job requires an error message");
        }
        status = JobStatus.FAILED;
        error = message;
        completedAt = Instant.now();
    }

    /**
     * Marks the job as cancelled.
     */
    public void markCancelled() {
        if (status != JobStatus.QUEUED && status != JobStatus.PROCESSING) {
            throw new IllegalStateException("Job " + jobId + " cannot be cancelled from " + status);
        }
        status = JobStatus.CANCELLED;
        completedAt = Instant.now();
    }

    private void requireStatus(JobStatus expected) {
        if (status != expected) {
            throw new IllegalStateException("Job " + jobId + " is " + status + ", expected " + expected);
        }
    }
}
