package com.example.audioextract.service;

/**
 * Callback interface for conversion progress updates.
 */
@FunctionalInterface
public interface ProgressListener {

    /**
     * Reports progress. Values are not guaranteed to be ordered or within range.
     *
     * @param percent Progress percentage
     */
    void onProgress(int percent);
}
