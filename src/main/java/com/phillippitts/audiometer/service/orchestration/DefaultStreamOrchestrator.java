package com.phillippitts.audiometer.service.orchestration;

import com.phillippitts.audiometer.config.properties.DspProperties;
import com.phillippitts.audiometer.config.properties.MeteringProperties;
import com.phillippitts.audiometer.config.properties.RecordingProperties;
import com.phillippitts.audiometer.domain.DspParameters;
import com.phillippitts.audiometer.domain.ParameterUpdate;
import com.phillippitts.audiometer.exception.InvalidFrameException;
import com.phillippitts.audiometer.exception.ProtocolException;
import com.phillippitts.audiometer.service.audio.AudioFormat;
import com.phillippitts.audiometer.service.audio.SampleCodec;
import com.phillippitts.audiometer.service.audio.StereoBuffer;
import com.phillippitts.audiometer.service.dsp.DspEngine;
import com.phillippitts.audiometer.service.metering.MeteringScheduler;
import com.phillippitts.audiometer.service.metering.SessionMeter;
import com.phillippitts.audiometer.service.metering.SpectrumAnalyzer;
import com.phillippitts.audiometer.service.metrics.StreamMetrics;
import com.phillippitts.audiometer.service.orchestration.event.FrameRejectedEvent;
import com.phillippitts.audiometer.service.recording.RecordingService;
import com.phillippitts.audiometer.service.recording.RecordingSink;
import com.phillippitts.audiometer.service.session.AudioSession;
import com.phillippitts.audiometer.service.session.OutboundChannel;
import com.phillippitts.audiometer.service.session.SessionRegistry;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.Objects;

/**
 * Default implementation of {@link StreamOrchestrator}.
 *
 * <p>Builds one {@link DspEngine} and {@link SessionMeter} per session, registers the
 * session with the {@link SessionRegistry} and {@link MeteringScheduler}, and hands audio
 * to the session's {@link RecordingSink} while a recording is active.
 *
 * <p><b>Error Handling:</b> undecodable frames are counted, published as
 * {@link FrameRejectedEvent} and dropped. Recording failures are reported by the
 * {@link RecordingService}; they never interrupt processing or metering.
 */
public class DefaultStreamOrchestrator implements StreamOrchestrator {

    private static final Logger LOG = LogManager.getLogger(DefaultStreamOrchestrator.class);

    private final SessionRegistry registry;
    private final MeteringScheduler meteringScheduler;
    private final RecordingService recordingService;
    private final DspProperties dspProperties;
    private final MeteringProperties meteringProperties;
    private final RecordingProperties recordingProperties;
    private final StreamMetrics metrics;
    private final ApplicationEventPublisher publisher;

    public DefaultStreamOrchestrator(SessionRegistry registry,
                                     MeteringScheduler meteringScheduler,
                                     RecordingService recordingService,
                                     DspProperties dspProperties,
                                     MeteringProperties meteringProperties,
                                     RecordingProperties recordingProperties,
                                     StreamMetrics metrics,
                                     ApplicationEventPublisher publisher) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.meteringScheduler = Objects.requireNonNull(meteringScheduler, "meteringScheduler must not be null");
        this.recordingService = Objects.requireNonNull(recordingService, "recordingService must not be null");
        this.dspProperties = Objects.requireNonNull(dspProperties, "dspProperties must not be null");
        this.meteringProperties = Objects.requireNonNull(meteringProperties, "meteringProperties must not be null");
        this.recordingProperties = Objects.requireNonNull(recordingProperties, "recordingProperties must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
    }

    @Override
    public void handleInit(String sessionId, OutboundChannel outbound, int sampleRate, int channels) {
        if (!AudioFormat.isSupportedSampleRate(sampleRate)) {
            throw new ProtocolException("Unsupported sample_rate " + sampleRate, "init");
        }
        if (channels != 1 && channels != 2) {
            throw new ProtocolException("Unsupported channels " + channels, "init");
        }

        int fftSize = meteringProperties.getFftSize();
        DspEngine engine = new DspEngine(sampleRate, dspProperties.toParameters(), fftSize);
        SessionMeter meter = new SessionMeter(new SpectrumAnalyzer(fftSize, meteringProperties.getSpectrumBins()));
        AudioSession session = new AudioSession(sessionId, sampleRate, channels, engine, meter, outbound);

        AudioSession previous = registry.register(session);
        if (previous != null) {
            meteringScheduler.unregister(previous);
            finishRecording(previous, true);
        }
        meteringScheduler.register(session);
        LOG.info("Session initialized: sampleRate={}, channels={}, params={}",
                sampleRate, channels, engine.parameters());
    }

    @Override
    public void handleStartRecord(String sessionId, String connectionId, Integer sampleRate, Integer channels) {
        AudioSession session = registry.require(sessionId, connectionId);
        int rate = sampleRate != null ? sampleRate : session.sampleRate();
        if (!AudioFormat.isSupportedSampleRate(rate)) {
            throw new ProtocolException("Unsupported sample_rate " + rate, "start_record");
        }
        int recordedChannels = recordingProperties.getSource() == RecordingProperties.Source.RAW
                ? session.channels() : AudioFormat.PROCESSING_CHANNELS;
        if (channels != null && channels != recordedChannels) {
            LOG.debug("start_record channels={} ignored; recording {} channel(s) of {} audio",
                    channels, recordedChannels, recordingProperties.getSource());
        }

        if (session.isRecording()) {
            LOG.info("start_record while recording; finalizing the current recording first");
            finishRecording(session, true);
        }
        RecordingSink sink = recordingService.start(session.id(), rate, recordedChannels,
                session.engine().parameters());
        session.swapRecording(sink);
    }

    @Override
    public void handleStopRecord(String sessionId, String connectionId) {
        AudioSession session = registry.require(sessionId, connectionId);
        if (!finishRecording(session, true)) {
            LOG.debug("stop_record without an active recording; ignoring");
        }
    }

    @Override
    public DspParameters handleSetParams(String sessionId, String connectionId, ParameterUpdate update) {
        AudioSession session = registry.require(sessionId, connectionId);
        DspEngine engine = session.engine();
        DspParameters requested = update.applyTo(engine.parameters());
        DspParameters applied = engine.configure(requested);
        if (!applied.equals(requested)) {
            LOG.debug("Parameters clamped: requested={}, applied={}", requested, applied);
        } else {
            LOG.debug("Parameters updated: {}", applied);
        }
        return applied;
    }

    @Override
    public boolean handleFrame(String sessionId, String connectionId, byte[] payload) {
        AudioSession session = registry.require(sessionId, connectionId);
        long start = System.nanoTime();

        StereoBuffer input;
        try {
            input = SampleCodec.decode(payload, session.channels());
        } catch (InvalidFrameException e) {
            String reason = e.getFrameBytes() == 0 ? "empty" : "misaligned";
            metrics.incrementFrameRejected(reason);
            publisher.publishEvent(new FrameRejectedEvent(sessionId, payload.length, reason, Instant.now()));
            LOG.debug("Frame dropped: {}", e.getMessage());
            return false;
        }

        StereoBuffer processed = session.engine().process(input);

        RecordingSink sink = session.recording();
        if (sink != null && sink.isActive()) {
            byte[] chunk = recordingProperties.getSource() == RecordingProperties.Source.RAW
                    ? payload : SampleCodec.encode(processed);
            sink.append(chunk);
        }

        metrics.recordFrameProcessed(processed.frames(), System.nanoTime() - start);
        return true;
    }

    @Override
    public void handleDisconnect(String sessionId, String connectionId) {
        registry.remove(sessionId, connectionId).ifPresent(session -> {
            meteringScheduler.unregister(session);
            finishRecording(session, false);
            if (recordingProperties.isDeleteOnDisconnect()) {
                recordingService.deleteSessionRecordings(session.id());
            }
            LOG.info("Session closed: framesProcessed={}", session.engine().framesProcessed());
        });
    }

    @PreDestroy
    void shutdown() {
        for (AudioSession session : registry.sessions()) {
            handleDisconnect(session.id(), session.connectionId());
        }
    }

    /**
     * Detaches and finalizes the session's recording, if any.
     *
     * @param notify send {@code recording_saved} to the client on success
     * @return true if a recording was attached
     */
    private boolean finishRecording(AudioSession session, boolean notify) {
        RecordingSink sink = session.swapRecording(null);
        if (sink == null) {
            return false;
        }
        recordingService.stop(sink).ifPresent(recording -> {
            if (notify && session.outbound().isOpen()) {
                session.outbound().sendRecordingSaved(recording);
            }
        });
        return true;
    }
}
