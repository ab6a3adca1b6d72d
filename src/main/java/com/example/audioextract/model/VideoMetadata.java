package com.example.audioextract.model;

import lombok.Builder;
import lombok.Data;

/**
 * Represents the stream layout probed from an uploaded media file.
 */
@Data
@Builder
public class VideoMetadata {
    /**
     * Whether the container has at least one audio stream.
     */
    private boolean audioPresent;

    /**
     * Whether the container has at least one video stream.
     */
    private boolean videoPresent;

    /**
     * Duration in seconds.
     */
    private float durationSeconds;

    /**
     * Container format name as reported by ffprobe.
     */
    private String format;

    /**
     * Audio codec name, null without an audio stream.
     */
    private String audioCodec;
}
