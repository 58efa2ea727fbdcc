package com.phillippitts.audiometer.presentation.websocket;

import com.phillippitts.audiometer.config.logging.MdcFilter;
import com.phillippitts.audiometer.config.properties.WebSocketProperties;
import com.phillippitts.audiometer.exception.ProtocolException;
import com.phillippitts.audiometer.exception.SessionConflictException;
import com.phillippitts.audiometer.exception.SessionNotFoundException;
import com.phillippitts.audiometer.exception.StorageException;
import com.phillippitts.audiometer.service.audio.AudioFormat;
import com.phillippitts.audiometer.service.metrics.StreamMetrics;
import com.phillippitts.audiometer.service.orchestration.StreamOrchestrator;
import com.phillippitts.audiometer.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.BinaryMessage;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.AbstractWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import java.net.URI;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Per-connection protocol multiplexer for {@code /ws/audio?session_id=...}.
 *
 * <p>Text frames carry JSON control messages; binary frames carry raw PCM. Both are
 * routed to the {@link StreamOrchestrator} under the connection's session id. Outgoing
 * metering and recording notices go through a {@link WebSocketOutboundChannel}.
 *
 * <p><b>Error Handling:</b>
 * <ul>
 *   <li>missing {@code session_id}: connection closed with status 4000</li>
 *   <li>malformed or unknown control message: logged and ignored</li>
 *   <li>recording cannot be opened: logged; the session keeps metering</li>
 *   <li>message before {@code init}, or a session id owned by another connection:
 *       connection closed with POLICY_VIOLATION</li>
 * </ul>
 */
@Component
public class AudioStreamWebSocketHandler extends AbstractWebSocketHandler {

    private static final Logger LOG = LogManager.getLogger(AudioStreamWebSocketHandler.class);

    static final String SESSION_ID_PARAM = "session_id";
    static final String SESSION_ID_ATTR = "audiometer.sessionId";
    static final String OUTBOUND_ATTR = "audiometer.outbound";
    static final CloseStatus MISSING_SESSION_ID = new CloseStatus(4000, "session_id query parameter required");

    private static final int LOG_PREVIEW_CHARS = 200;

    private final StreamOrchestrator orchestrator;
    private final WebSocketProperties properties;
    private final StreamMetrics metrics;

    public AudioStreamWebSocketHandler(StreamOrchestrator orchestrator,
                                       WebSocketProperties properties,
                                       StreamMetrics metrics) {
        this.orchestrator = orchestrator;
        this.properties = properties;
        this.metrics = metrics;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        String sessionId = sessionIdFrom(session.getUri());
        if (sessionId == null) {
            LOG.warn("WebSocket connection without session_id; closing (connection={})", session.getId());
            session.close(MISSING_SESSION_ID);
            return;
        }
        session.setBinaryMessageSizeLimit(properties.getMaxBinaryMessageBytes());
        session.setTextMessageSizeLimit(properties.getMaxTextMessageBytes());
        session.getAttributes().put(SESSION_ID_ATTR, sessionId);
        session.getAttributes().put(OUTBOUND_ATTR, new WebSocketOutboundChannel(
                session, properties.getSendTimeLimitMs(), properties.getSendBufferSizeLimit()));

        ThreadContext.put(MdcFilter.SESSION_ID, sessionId);
        try {
            LOG.info("WebSocket connected (connection={})", session.getId());
        } finally {
            ThreadContext.remove(MdcFilter.SESSION_ID);
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        String sessionId = (String) session.getAttributes().get(SESSION_ID_ATTR);
        WebSocketOutboundChannel outbound = (WebSocketOutboundChannel) session.getAttributes().get(OUTBOUND_ATTR);
        if (sessionId == null || outbound == null) {
            return;
        }
        String text = message.getPayload();
        ThreadContext.put(MdcFilter.SESSION_ID, sessionId);
        try {
            ControlMessage control = ControlMessageParser.parse(text);
            metrics.incrementControlMessage(control.action().wireName());
            dispatch(sessionId, session.getId(), outbound, control);
        } catch (ProtocolException e) {
            metrics.incrementProtocolError();
            LOG.warn("Ignoring control message: {} (text={})", e.getMessage(),
                    LogSanitizer.preview(text, LOG_PREVIEW_CHARS));
        } catch (StorageException e) {
            LOG.warn("Recording unavailable: {}", e.getMessage());
        } catch (SessionNotFoundException | SessionConflictException e) {
            LOG.warn("Closing connection: {}", e.getMessage());
            outbound.close(policyViolation(e.getMessage()));
        } finally {
            ThreadContext.remove(MdcFilter.SESSION_ID);
        }
    }

    @Override
    protected void handleBinaryMessage(WebSocketSession session, BinaryMessage message) {
        String sessionId = (String) session.getAttributes().get(SESSION_ID_ATTR);
        WebSocketOutboundChannel outbound = (WebSocketOutboundChannel) session.getAttributes().get(OUTBOUND_ATTR);
        if (sessionId == null || outbound == null) {
            return;
        }
        // The container may reuse the payload buffer; the frame outlives this call when recorded
        ByteBuffer data = message.getPayload();
        byte[] pcm = new byte[data.remaining()];
        data.get(pcm);

        ThreadContext.put(MdcFilter.SESSION_ID, sessionId);
        try {
            orchestrator.handleFrame(sessionId, session.getId(), pcm);
        } catch (SessionNotFoundException e) {
            metrics.incrementFrameRejected("no-session");
            LOG.warn("Audio before init or after teardown; closing connection");
            outbound.close(policyViolation(e.getMessage()));
        } finally {
            ThreadContext.remove(MdcFilter.SESSION_ID);
        }
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        LOG.warn("WebSocket transport error (connection={}): {}", session.getId(), exception.getMessage());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        String sessionId = (String) session.getAttributes().get(SESSION_ID_ATTR);
        if (sessionId == null) {
            return;
        }
        ThreadContext.put(MdcFilter.SESSION_ID, sessionId);
        try {
            orchestrator.handleDisconnect(sessionId, session.getId());
            LOG.info("WebSocket disconnected: code={}, reason={}", status.getCode(), status.getReason());
        } finally {
            ThreadContext.remove(MdcFilter.SESSION_ID);
        }
    }

    private void dispatch(String sessionId, String connectionId, WebSocketOutboundChannel outbound,
                          ControlMessage control) {
        switch (control.action()) {
            case INIT -> orchestrator.handleInit(sessionId, outbound,
                    control.sampleRate() != null ? control.sampleRate() : AudioFormat.DEFAULT_SAMPLE_RATE,
                    control.channels() != null ? control.channels() : AudioFormat.PROCESSING_CHANNELS);
            case START_RECORD -> orchestrator.handleStartRecord(sessionId, connectionId,
                    control.sampleRate(), control.channels());
            case STOP_RECORD -> orchestrator.handleStopRecord(sessionId, connectionId);
            case SET_PARAMS -> orchestrator.handleSetParams(sessionId, connectionId, control.params());
        }
    }

    private static CloseStatus policyViolation(String reason) {
        return CloseStatus.POLICY_VIOLATION.withReason(LogSanitizer.closeReason(reason));
    }

    static String sessionIdFrom(URI uri) {
        if (uri == null) {
            return null;
        }
        String value = UriComponentsBuilder.fromUri(uri).build().getQueryParams().getFirst(SESSION_ID_PARAM);
        if (value == null) {
            return null;
        }
        String decoded = UriUtils.decode(value, StandardCharsets.UTF_8);
        return decoded.isBlank() ? null : decoded;
    }
}
