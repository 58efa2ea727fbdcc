package com.phillippitts.audiometer.exception;

/**
 * Thrown when a binary PCM frame cannot be decoded: empty, misaligned to the
 * 16-bit interleaved layout, or larger than the configured limit.
 * The frame is dropped; the session keeps running.
 */
public class InvalidFrameException extends AudioMeterException {

    private final int frameBytes;
    private final String reason;

    public InvalidFrameException(String reason) {
        super("Invalid PCM frame: " + reason);
        this.frameBytes = 0;
        this.reason = reason;
    }

    public InvalidFrameException(int frameBytes, String reason) {
        super("Invalid PCM frame (" + frameBytes + " bytes): " + reason);
        this.frameBytes = frameBytes;
        this.reason = reason;
    }

    public int getFrameBytes() {
        return frameBytes;
    }

    public String getReason() {
        return reason;
    }
}
