package com.example.audioextract.model;

import lombok.Builder;
import lombok.Data;

/**
 * Describes the audio stream written by a conversion.
 */
@Data
@Builder
public class AudioMetadata {
    /**
     * Sample rate in Hz (e.g. 44100, 48000).
     */
    private int sampleRate;

    /**
     * Bits per sample: 16, 24 or 32.
     */
    private int bitDepth;

    /**
     * Number of channels.
     */
    private int channels;

    /**
     * Duration in seconds.
     */
    private float durationSeconds;

    /**
     * Codec of the source audio stream.
     */
    private String codec;

    /**
     * Bitrate of the source audio stream in bits per second, 0 if unknown.
     */
    private long bitrate;
}
