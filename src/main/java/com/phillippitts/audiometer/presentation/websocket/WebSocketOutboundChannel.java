package com.phillippitts.audiometer.presentation.websocket;

import com.phillippitts.audiometer.domain.MeteringSample;
import com.phillippitts.audiometer.domain.Recording;
import com.phillippitts.audiometer.service.session.OutboundChannel;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.SessionLimitExceededException;

import java.io.IOException;

/**
 * {@link OutboundChannel} over a Spring {@link WebSocketSession}.
 *
 * <p>Sends go through a {@link ConcurrentWebSocketSessionDecorator} with the DROP overflow
 * strategy: while one send is in flight, later messages are buffered up to the byte limit
 * and dropped beyond it, so metering ticks never wait on a slow client.
 */
final class WebSocketOutboundChannel implements OutboundChannel {

    private static final Logger LOG = LogManager.getLogger(WebSocketOutboundChannel.class);

    private final WebSocketSession session;

    WebSocketOutboundChannel(WebSocketSession delegate, int sendTimeLimitMs, int bufferSizeLimit) {
        this.session = new ConcurrentWebSocketSessionDecorator(delegate, sendTimeLimitMs, bufferSizeLimit,
                ConcurrentWebSocketSessionDecorator.OverflowStrategy.DROP);
    }

    @Override
    public void sendMeter(MeteringSample sample) {
        send(OutboundMessages.meter(sample));
    }

    @Override
    public void sendRecordingSaved(Recording recording) {
        send(OutboundMessages.recordingSaved(recording));
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public String connectionId() {
        return session.getId();
    }

    void close(CloseStatus status) {
        try {
            session.close(status);
        } catch (IOException e) {
            LOG.debug("Close failed: {}", e.getMessage());
        }
    }

    private void send(String json) {
        if (!session.isOpen()) {
            return;
        }
        try {
            session.sendMessage(new TextMessage(json));
        } catch (SessionLimitExceededException e) {
            // Decorator has already closed the session
            LOG.warn("Outbound limit exceeded, connection closed: {}", e.getMessage());
        } catch (IOException | IllegalStateException e) {
            LOG.debug("Send failed: {}", e.getMessage());
        }
    }
}
