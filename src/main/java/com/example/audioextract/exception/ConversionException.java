package com.example.audioextract.exception;

import java.io.Serial;

/**
 * Thrown when audio cannot be extracted from an input file, e.g. it has no audio stream
 * or the ffmpeg process fails.
 */
public class ConversionException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = -2318406651277139915L;

    public ConversionException(String message) {
        super(message);
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
