package com.phillippitts.audiometer.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Metadata for a finished recording.
 *
 * @param id              store-assigned identifier
 * @param filename        file name inside the recordings directory
 * @param durationSeconds frames written divided by sample rate
 * @param createdAt       when recording started
 * @param sessionId       session that produced the recording
 * @param sampleRate      sample rate of the WAV file
 * @param channels        channel count of the WAV file
 * @param settings        DSP parameters active when recording started
 */
public record Recording(
        long id,
        String filename,
        double durationSeconds,
        Instant createdAt,
        String sessionId,
        int sampleRate,
        int channels,
        DspParameters settings
) {

    public Recording {
        Objects.requireNonNull(filename, "filename must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(settings, "settings must not be null");
        if (durationSeconds < 0.0) {
            throw new IllegalArgumentException("durationSeconds must be >= 0, got: " + durationSeconds);
        }
    }

    /**
     * @param newId identifier assigned by a store
     * @return copy carrying the given id
     */
    public Recording withId(long newId) {
        return new Recording(newId, filename, durationSeconds, createdAt, sessionId,
                sampleRate, channels, settings);
    }
}
