package com.phillippitts.audiometer.exception;

/**
 * Thrown when a control message is malformed or names an unknown action.
 * The message is ignored and logged; the session continues.
 */
public class ProtocolException extends AudioMeterException {

    private final String action;

    public ProtocolException(String message) {
        super(message);
        this.action = "unknown";
    }

    public ProtocolException(String message, String action) {
        super(message + " (action: " + action + ")");
        this.action = action;
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
        this.action = "unknown";
    }

    public String getAction() {
        return action;
    }
}
