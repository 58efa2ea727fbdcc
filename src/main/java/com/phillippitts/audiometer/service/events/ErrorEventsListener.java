package com.phillippitts.audiometer.service.events;

import com.phillippitts.audiometer.service.orchestration.event.FrameRejectedEvent;
import com.phillippitts.audiometer.service.recording.event.RecordingFailedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for stream error events. Throttled per key to avoid log spam when a
 * client keeps sending bad frames or a disk keeps failing.
 */
@Component
class ErrorEventsListener {
    private static final Logger LOG = LogManager.getLogger(ErrorEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onRecordingFailed(RecordingFailedEvent e) {
        String key = "recording-" + e.reason();
        if (shouldLog(key)) {
            LOG.warn("Recording failed: session={}, file={}, reason={}. Partial file kept; "
                    + "check disk space and recording.* settings.", e.sessionId(), e.filename(), e.reason());
        }
    }

    @EventListener
    void onFrameRejected(FrameRejectedEvent e) {
        String key = "frame-" + e.sessionId() + '-' + e.reason();
        if (shouldLog(key)) {
            LOG.warn("Dropping invalid audio frames: session={}, reason={}, bytes={}. "
                    + "Expected interleaved 16-bit little-endian PCM.", e.sessionId(), e.reason(), e.frameBytes());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
