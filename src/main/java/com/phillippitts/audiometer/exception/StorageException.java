package com.phillippitts.audiometer.exception;

/**
 * Thrown when a recording cannot be written, drained or finalized.
 * The recording is marked failed; live metering for the session is unaffected.
 */
public class StorageException extends AudioMeterException {

    private final String filename;

    public StorageException(String message, String filename) {
        super(message + " (file: " + filename + ")");
        this.filename = filename;
    }

    public StorageException(String message, String filename, Throwable cause) {
        super(message + " (file: " + filename + ")", cause);
        this.filename = filename;
    }

    public String getFilename() {
        return filename;
    }
}
