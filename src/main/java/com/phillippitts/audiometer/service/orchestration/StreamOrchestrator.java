package com.phillippitts.audiometer.service.orchestration;

import com.phillippitts.audiometer.domain.DspParameters;
import com.phillippitts.audiometer.domain.ParameterUpdate;
import com.phillippitts.audiometer.service.session.OutboundChannel;

/**
 * Routes one connection's control messages and audio frames to its session.
 *
 * <p><b>Session Lifecycle:</b>
 * <ol>
 *   <li>{@link #handleInit} creates (or re-creates) the session and starts metering</li>
 *   <li>{@link #handleFrame} processes audio; {@link #handleSetParams} changes DSP settings;
 *       {@link #handleStartRecord}/{@link #handleStopRecord} bracket a recording</li>
 *   <li>{@link #handleDisconnect} finalizes any recording and releases everything</li>
 * </ol>
 *
 * <p><b>Thread Safety:</b> calls for one connection arrive sequentially; calls for
 * different sessions may run concurrently.
 *
 * <p>Every method except {@link #handleInit} and {@link #handleDisconnect} throws
 * {@link com.phillippitts.audiometer.exception.SessionNotFoundException} when the
 * connection has no live session.
 */
public interface StreamOrchestrator {

    /**
     * @throws com.phillippitts.audiometer.exception.SessionConflictException if another
     *         connection owns the session id
     * @throws com.phillippitts.audiometer.exception.ProtocolException if the format is unsupported
     */
    void handleInit(String sessionId, OutboundChannel outbound, int sampleRate, int channels);

    /**
     * Opens a new recording; an active recording is finalized first.
     *
     * @param sampleRate header sample rate, or null for the session rate
     * @param channels   client-declared channels, or null; the recorded channel count
     *                   follows the configured recording source
     * @throws com.phillippitts.audiometer.exception.StorageException if the file cannot be opened
     */
    void handleStartRecord(String sessionId, String connectionId, Integer sampleRate, Integer channels);

    /** Finalizes the active recording and notifies the client if it was saved. */
    void handleStopRecord(String sessionId, String connectionId);

    /** @return parameters actually applied after clamping */
    DspParameters handleSetParams(String sessionId, String connectionId, ParameterUpdate update);

    /**
     * Decodes, processes and (when recording) persists one binary frame. Undecodable
     * frames are counted and dropped.
     *
     * @return true if the frame was processed
     */
    boolean handleFrame(String sessionId, String connectionId, byte[] payload);

    /** Tears the session down if it belongs to this connection. Safe to call repeatedly. */
    void handleDisconnect(String sessionId, String connectionId);
}
