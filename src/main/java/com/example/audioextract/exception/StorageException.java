package com.example.audioextract.exception;

import java.io.Serial;

/**
 * Thrown when the upload storage cannot be prepared or written.
 */
public class StorageException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 7710252390218364521L;

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
