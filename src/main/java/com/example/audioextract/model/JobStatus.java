package com.example.audioextract.model;

/**
 * Enum representing the status of a conversion job.
 */
public enum JobStatus {
    QUEUED,
    PROCESSING,
    COMPLETED,
    FAILED,
    CANCELLED;

    /**
     * Whether no further transitions are possible from this status.
     *
     * @return True for COMPLETED, FAILED and CANCELLED
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
