package com.phillippitts.audiometer.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.function.ToDoubleFunction;

/**
 * Centralized metrics tracking for audio streaming sessions.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Frames processed and rejected (by reason)</li>
 *   <li>Control messages by action, and protocol errors</li>
 *   <li>Recordings saved and failed</li>
 *   <li>Per-frame processing latency</li>
 *   <li>Active sessions</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class StreamMetrics {

    static final String METRIC_PREFIX = "audiometer.stream";

    private final MeterRegistry registry;

    public StreamMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records one processed frame block.
     *
     * @param frames        stereo frames in the block
     * @param durationNanos decode + process + recording hand-off time
     */
    public void recordFrameProcessed(int frames, long durationNanos) {
        Counter.builder(METRIC_PREFIX + ".frames")
                .description("Number of PCM frame blocks processed")
                .register(registry)
                .increment();
        Counter.builder(METRIC_PREFIX + ".samples")
                .description("Number of stereo sample frames processed")
                .register(registry)
                .increment(frames);
        Timer.builder(METRIC_PREFIX + ".processing.latency")
                .description("Time taken to decode and process one frame block")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * @param reason short reason tag (empty, misaligned, no-session)
     */
    public void incrementFrameRejected(String reason) {
        Counter.builder(METRIC_PREFIX + ".frames.rejected")
                .description("Number of PCM frame blocks dropped as invalid")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * @param action control action name (init, start_record, stop_record, set_params)
     */
    public void incrementControlMessage(String action) {
        Counter.builder(METRIC_PREFIX + ".control")
                .description("Number of control messages handled")
                .tag("action", action)
                .register(registry)
                .increment();
    }

    public void incrementProtocolError() {
        Counter.builder(METRIC_PREFIX + ".protocol.errors")
                .description("Number of malformed or unrecognized control messages")
                .register(registry)
                .increment();
    }

    public void incrementRecordingSaved() {
        Counter.builder(METRIC_PREFIX + ".recordings.saved")
                .description("Number of recordings finalized and stored")
                .register(registry)
                .increment();
    }

    /**
     * @param reason failure reason (enqueue-timeout, io-error, finalize-timeout)
     */
    public void incrementRecordingFailed(String reason) {
        Counter.builder(METRIC_PREFIX + ".recordings.failed")
                .description("Number of recordings that failed while writing")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    /**
     * Registers the active-session gauge against a live source.
     *
     * @param source object sampled by the gauge (held weakly by Micrometer)
     * @param value  function reading the current session count
     */
    public <T> void registerActiveSessions(T source, ToDoubleFunction<T> value) {
        Gauge.builder(METRIC_PREFIX + ".sessions.active", source, value)
                .description("Number of sessions currently connected")
                .register(registry);
    }
}
