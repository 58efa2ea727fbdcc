package com.phillippitts.audiometer.service.session;

import com.phillippitts.audiometer.service.dsp.DspEngine;
import com.phillippitts.audiometer.service.metering.SessionMeter;
import com.phillippitts.audiometer.service.recording.RecordingSink;

import java.time.Instant;
import java.util.Objects;

/**
 * One client's processing context: engine, metering state, outbound channel and the
 * recording in progress, if any.
 *
 * <p>The engine and meter are fixed for the lifetime of the object; re-initializing a
 * session replaces the whole {@code AudioSession} in the {@link SessionRegistry}.
 */
public final class AudioSession {

    private final String id;
    private final int sampleRate;
    private final int channels;
    private final DspEngine engine;
    private final SessionMeter meter;
    private final OutboundChannel outbound;
    private final Instant createdAt;

    private volatile RecordingSink recording;
    private volatile boolean closed;

    public AudioSession(String id, int sampleRate, int channels,
                        DspEngine engine, SessionMeter meter, OutboundChannel outbound) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        if (channels != 1 && channels != 2) {
            throw new IllegalArgumentException("channels must be 1 or 2: " + channels);
        }
        this.sampleRate = sampleRate;
        this.channels = channels;
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.meter = Objects.requireNonNull(meter, "meter must not be null");
        this.outbound = Objects.requireNonNull(outbound, "outbound must not be null");
        this.createdAt = Instant.now();
    }

    public String id() {
        return id;
    }

    public String connectionId() {
        return outbound.connectionId();
    }

    public int sampleRate() {
        return sampleRate;
    }

    /** @return channels declared by the client at init */
    public int channels() {
        return channels;
    }

    public DspEngine engine() {
        return engine;
    }

    public SessionMeter meter() {
        return meter;
    }

    public OutboundChannel outbound() {
        return outbound;
    }

    public Instant createdAt() {
        return createdAt;
    }

    /** @return active or stopping recording, or null */
    public RecordingSink recording() {
        return recording;
    }

    /**
     * Installs a new recording (or clears it with null).
     *
     * @return the previously installed recording, or null
     */
    public RecordingSink swapRecording(RecordingSink next) {
        RecordingSink previous = this.recording;
        this.recording = next;
        return previous;
    }

    public boolean isRecording() {
        RecordingSink current = recording;
        return current != null && current.isActive();
    }

    public boolean isClosed() {
        return closed;
    }

    void markClosed() {
        closed = true;
    }
}
