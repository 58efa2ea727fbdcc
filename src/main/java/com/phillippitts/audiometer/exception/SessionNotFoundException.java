package com.phillippitts.audiometer.exception;

/**
 * Thrown when a message arrives for a session that was never initialized or has
 * already been torn down. The connection carrying it is closed.
 */
public class SessionNotFoundException extends AudioMeterException {

    private final String sessionId;

    public SessionNotFoundException(String sessionId) {
        super("No active session: " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
