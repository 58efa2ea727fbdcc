package com.phillippitts.audiometer.exception;

/**
 * Base exception for all audiometer application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class AudioMeterException extends RuntimeException {

    public AudioMeterException(String message) {
        super(message);
    }

    public AudioMeterException(String message, Throwable cause) {
        super(message, cause);
    }

    public AudioMeterException(Throwable cause) {
        super(cause);
    }
}
