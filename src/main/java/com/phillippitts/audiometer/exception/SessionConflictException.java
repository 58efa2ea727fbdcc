package com.phillippitts.audiometer.exception;

/**
 * Thrown when {@code init} names a session id that another open connection already owns.
 */
public class SessionConflictException extends AudioMeterException {

    private final String sessionId;

    public SessionConflictException(String sessionId) {
        super("Session id already bound to another connection: " + sessionId);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
