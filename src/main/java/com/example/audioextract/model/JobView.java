package com.example.audioextract.model;

import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;

/**
 * Read-only snapshot of a job, handed out to callers outside the scheduler.
 */
@Value
@Builder
public class JobView {
    String jobId;
    String originalFilename;
    JobStatus status;
    int progress;
    String message;

    /**
     * Output file, set only when the job completed.
     */
    Path outputFile;

    /**
     * Error message, set only when the job failed.
     */
    String error;

    /**
     * Extracted audio metadata, set only when the job completed.
     */
    AudioMetadata metadata;

    /**
     * Builds a snapshot of the given job.
     *
     * @param job The job to project
     * @return JobView instance
     */
    public static JobView of(ConversionJob job) {
        boolean completed = job.getStatus() == JobStatus.COMPLETED;
        return JobView.builder()
                .jobId(job.getJobId())
                .originalFilename(job.getOriginalFilename())
                .status(job.getStatus())
                .progress(job.getProgress())
                .message(messageFor(job))
                .outputFile(completed ? job.getOutputPath() : null)
                .error(job.getStatus() == JobStatus.FAILED ? job.getError() : null)
                .metadata(completed ? job.getMetadata() : null)
                .build();
    }

    private static String messageFor(ConversionJob job) {
        switch (job.getStatus()) {
            case QUEUED:
                return "Waiting in queue...";
            case PROCESSING:
                return "Converting audio... " + job.getProgress() + "%";
            case COMPLETED:
                return "Conversion completed successfully";
            case FAILED:
                return job.getError() != null ? job.getError() : "Conversion failed";
            case CANCELLED:
                return "Conversion cancelled";
            default:
                return "Unknown status";
        }
    }
}
