package com.example.audioextract.service;

import com.example.audioextract.exception.ConversionException;
import com.example.audioextract.model.AudioMetadata;

import java.nio.file.Path;

/**
 * Extracts the audio stream of a media file.
 *
 * Calls block until the output is written. Implementations must stop work and throw when the
 * calling thread is interrupted; this is how jobs are cancelled and timed out.
 */
public interface TranscodingEngine {

    /**
     * Extracts the audio of {@code inputPath} into {@code outputPath}.
     *
     * @param inputPath Input media file
     * @param outputPath File to write
     * @param progressListener Receives progress percentages, may be called from any thread
     * @return Metadata of the extracted audio
     * @throws ConversionException if the input has no audio stream or extraction fails
     */
    AudioMetadata extractAudio(Path inputPath, Path outputPath, ProgressListener progressListener);
}
