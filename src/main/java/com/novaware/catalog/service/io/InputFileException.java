package com.novaware.catalog.service.io;

/** An input file is not configured, missing or unreadable. Raised before a stage starts. */
public class InputFileException extends RuntimeException {
    public InputFileException(String message) {
        super(message);
    }
}
