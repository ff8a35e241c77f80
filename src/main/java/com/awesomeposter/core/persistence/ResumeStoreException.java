package com.awesomeposter.core.persistence;

/**
 * Thrown when a snapshot cannot be written to or read from the checkpoint saver.
 */
public class ResumeStoreException extends RuntimeException {

    public ResumeStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
