package com.phillippitts.audiometer.service.orchestration;

import com.phillippitts.audiometer.config.properties.DspProperties;
import com.phillippitts.audiometer.config.properties.MeteringProperties;
import com.phillippitts.audiometer.config.properties.RecordingProperties;
import com.phillippitts.audiometer.domain.DspParameters;
import com.phillippitts.audiometer.domain.ParameterUpdate;
import com.phillippitts.audiometer.domain.Recording;
import com.phillippitts.audiometer.exception.ProtocolException;
import com.phillippitts.audiometer.exception.SessionConflictException;
import com.phillippitts.audiometer.exception.SessionNotFoundException;
import com.phillippitts.audiometer.service.audio.AudioFormat;
import com.phillippitts.audiometer.service.metering.MeteringScheduler;
import com.phillippitts.audiometer.service.metrics.StreamMetrics;
import com.phillippitts.audiometer.service.orchestration.event.FrameRejectedEvent;
import com.phillippitts.audiometer.service.recording.InMemoryRecordingStore;
import com.phillippitts.audiometer.service.recording.RecordingService;
import com.phillippitts.audiometer.service.session.AudioSession;
import com.phillippitts.audiometer.service.session.SessionRegistry;
import com.phillippitts.audiometer.testutil.CapturingOutboundChannel;
import com.phillippitts.audiometer.testutil.EventCapturingPublisher;
import com.phillippitts.audiometer.testutil.PcmFrames;
import com.phillippitts.audiometer.testutil.SyncExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.scheduling.TaskScheduler;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.concurrent.ScheduledFuture;

import static com.phillippitts.audiometer.testutil.PcmFrames.readLEInt;
import static com.phillippitts.audiometer.testutil.PcmFrames.readLEShort;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;

/**
 * Unit tests for {@link DefaultStreamOrchestrator} wired to real session, metering and
 * recording collaborators. Metering ticks are never scheduled; recording drains inline.
 */
class DefaultStreamOrchestratorTest {

    private static final int RATE = 44_100;
    private static final int CHUNK = 1024;

    @TempDir
    Path tempDir;

    private SimpleMeterRegistry meterRegistry;
    private EventCapturingPublisher publisher;
    private SessionRegistry registry;
    private MeteringScheduler meteringScheduler;
    private InMemoryRecordingStore store;
    private CapturingOutboundChannel outbound;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        publisher = new EventCapturingPublisher();
        registry = new SessionRegistry(new StreamMetrics(meterRegistry));
        TaskScheduler taskScheduler = mock(TaskScheduler.class);
        doReturn(mock(ScheduledFuture.class))
                .when(taskScheduler).scheduleAtFixedRate(any(Runnable.class), any(Duration.class));
        meteringScheduler = new MeteringScheduler(taskScheduler, meteringProperties());
        store = new InMemoryRecordingStore();
        outbound = new CapturingOutboundChannel("conn-1");
    }

    @Test
    void initShouldRegisterSessionWithDefaultParameters() {
        // Arrange
        DefaultStreamOrchestrator orchestrator = orchestrator(RecordingProperties.Source.PROCESSED, false);

        // Act
        orchestrator.handleInit("tab-1", outbound, RATE, 2);

        // Assert
        AudioSession session = registry.require("tab-1", "conn-1");
        assertThat(session.sampleRate()).isEqualTo(RATE);
        assertThat(session.channels()).isEqualTo(2);
        assertThat(session.engine().parameters()).isEqualTo(DspParameters.DEFAULTS);
        assertThat(meteringScheduler.isRegistered(session)).isTrue();
    }

    @Test
    void initShouldRejectUnsupportedFormat() {
        DefaultStreamOrchestrator orchestrator = orchestrator(RecordingProperties.Source.PROCESSED, false);

        assertThatThrownBy(() -> orchestrator.handleInit("tab-1", outbound, 1_000, 2))
                .isInstanceOf(ProtocolException.class)
                .hasMessageContaining("sample_rate");
        assertThatThrownBy(() -> orchestrator.handleInit("tab-1", outbound, RATE, 6))
                .isInstanceOf(ProtocolException.class)
                .hasMessageContaining("channels");
        assertThat(registry.size()).isZero();
    }

    @Test
    void frameBeforeInitShouldBeRejected() {
        DefaultStreamOrchestrator orchestrator = orchestrator(RecordingProperties.Source.PROCESSED, false);

        assertThatThrownBy(() -> orchestrator.handleFrame("tab-1", "conn-1", new byte[16]))
                .isInstanceOf(SessionNotFoundException.class);
    }

    @Test
    void initFromAnotherConnectionShouldConflict() {
        DefaultStreamOrchestrator orchestrator = orchestrator(RecordingProperties.Source.PROCESSED, false);
        orchestrator.handleInit("tab-1", outbound, RATE, 2);

        assertThatThrownBy(() -> orchestrator.handleInit("tab-1", new CapturingOutboundChannel("conn-2"), RATE, 2))
                .isInstanceOf(SessionConflictException.class);
    }

    @Test
    void frameShouldAdvanceEngineAndCountMetrics() {
        // Arrange
        DefaultStreamOrchestrator orchestrator = orchestrator(RecordingProperties.Source.PROCESSED, false);
        orchestrator.handleInit("tab-1", outbound, RATE, 2);

        // Act
        boolean accepted = orchestrator.handleFrame("tab-1", "conn-1",
                PcmFrames.sineStereo(CHUNK, 440.0, RATE, 0.5, 0.5));

        // Assert
        assertThat(accepted).isTrue();
        assertThat(registry.require("tab-1", "conn-1").engine().framesProcessed()).isEqualTo(CHUNK);
        assertThat(meterRegistry.find("audiometer.stream.frames").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.find("audiometer.stream.samples").counter().count()).isEqualTo(CHUNK);
    }

    @Test
    void misalignedFrameShouldBeDroppedAndReported() {
        // Arrange
        DefaultStreamOrchestrator orchestrator = orchestrator(RecordingProperties.Source.PROCESSED, false);
        orchestrator.handleInit("tab-1", outbound, RATE, 2);

        // Act
        boolean accepted = orchestrator.handleFrame("tab-1", "conn-1", new byte[6]);

        // Assert
        assertThat(accepted).isFalse();
        assertThat(publisher.eventsOfType(FrameRejectedEvent.class))
                .singleElement()
                .satisfies(e -> {
                    assertThat(e.frameBytes()).isEqualTo(6);
                    assertThat(e.reason()).isEqualTo("misaligned");
                });
        assertThat(meterRegistry.find("audiometer.stream.frames.rejected").tag("reason", "misaligned")
                .counter().count()).isEqualTo(1.0);
        // The session keeps accepting valid audio
        assertThat(orchestrator.handleFrame("tab-1", "conn-1", new byte[8])).isTrue();
    }

    @Test
    void emptyFrameShouldBeDroppedAsEmpty() {
        DefaultStreamOrchestrator orchestrator = orchestrator(RecordingProperties.Source.PROCESSED, false);
        orchestrator.handleInit("tab-1", outbound, RATE, 2);

        assertThat(orchestrator.handleFrame("tab-1", "conn-1", new byte[0])).isFalse();

        assertThat(publisher.eventsOfType(FrameRejectedEvent.class))
                .extracting(FrameRejectedEvent::reason)
                .containsExactly("empty");
    }

    @Test
    void setParamsShouldOnlyChangeProvidedFields() {
        // Arrange
        DefaultStreamOrchestrator orchestrator = orchestrator(RecordingProperties.Source.PROCESSED, false);
        orchestrator.handleInit("tab-1", outbound, RATE, 2);
        orchestrator.handleSetParams("tab-1", "conn-1", new ParameterUpdate(12.0, true, 2500.0, 0.2));

        // Act
        DspParameters applied = orchestrator.handleSetParams("tab-1", "conn-1",
                new ParameterUpdate(3.0, null, null, null));

        // Assert
        assertThat(applied).isEqualTo(new DspParameters(3.0, true, 2500.0, 0.2));
        assertThat(registry.require("tab-1", "conn-1").engine().parameters()).isEqualTo(applied);
    }

    @Test
    void setParamsShouldClampOutOfRangeValues() {
        DefaultStreamOrchestrator orchestrator = orchestrator(RecordingProperties.Source.PROCESSED, false);
        orchestrator.handleInit("tab-1", outbound, 16_000, 2);

        DspParameters applied = orchestrator.handleSetParams("tab-1", "conn-1",
                new ParameterUpdate(-5.0, null, 15_000.0, 99.0));

        assertThat(applied.gainDb()).isEqualTo(DspParameters.MIN_GAIN_DB);
        assertThat(applied.cutoffHz()).isEqualTo(16_000 * DspParameters.MAX_CUTOFF_RATIO);
        assertThat(applied.integrationTimeSeconds()).isEqualTo(DspParameters.MAX_INTEGRATION_SECONDS);
    }

    @Test
    void recordingShouldCaptureProcessedStereoAndNotifyClient() throws IOException {
        // Arrange
        DefaultStreamOrchestrator orchestrator = orchestrator(RecordingProperties.Source.PROCESSED, false);
        orchestrator.handleInit("tab-1", outbound, RATE, 1);
        orchestrator.handleSetParams("tab-1", "conn-1", new ParameterUpdate(6.0, null, null, null));
        byte[] monoChunk = PcmFrames.mono(new short[CHUNK]);
        Arrays.fill(monoChunk, (byte) 0x10);

        // Act
        orchestrator.handleStartRecord("tab-1", "conn-1", null, null);
        for (int i = 0; i < 10; i++) {
            orchestrator.handleFrame("tab-1", "conn-1", monoChunk);
        }
        orchestrator.handleStopRecord("tab-1", "conn-1");

        // Assert
        assertThat(outbound.savedRecordings()).hasSize(1);
        Recording recording = outbound.savedRecordings().get(0);
        assertThat(recording.durationSeconds()).isCloseTo(10.0 * CHUNK / RATE, within(1e-9));
        assertThat(recording.channels()).isEqualTo(AudioFormat.PROCESSING_CHANNELS);
        assertThat(recording.settings().gainDb()).isEqualTo(6.0);

        byte[] wav = Files.readAllBytes(recordingsDir().resolve(recording.filename()));
        assertThat(readLEShort(wav, AudioFormat.WAV_CHANNELS_OFFSET)).isEqualTo(2);
        assertThat(readLEInt(wav, AudioFormat.WAV_SAMPLE_RATE_OFFSET)).isEqualTo(RATE);
        assertThat(readLEInt(wav, AudioFormat.WAV_DATA_SIZE_OFFSET)).isEqualTo(10 * CHUNK * 4);
        // 6 dB of gain means the stored samples are not the client's bytes
        assertThat(wav[AudioFormat.WAV_HEADER_SIZE + 1]).isNotEqualTo((byte) 0x10);
    }

    @Test
    void rawRecordingShouldStoreClientBytesUnchanged() throws IOException {
        // Arrange
        DefaultStreamOrchestrator orchestrator = orchestrator(RecordingProperties.Source.RAW, false);
        orchestrator.handleInit("tab-1", outbound, 48_000, 1);
        orchestrator.handleSetParams("tab-1", "conn-1", new ParameterUpdate(20.0, true, 500.0, null));
        byte[] chunk = PcmFrames.mono((short) 1, (short) -2, (short) 3, (short) -4);

        // Act
        orchestrator.handleStartRecord("tab-1", "conn-1", null, null);
        orchestrator.handleFrame("tab-1", "conn-1", chunk);
        orchestrator.handleStopRecord("tab-1", "conn-1");

        // Assert
        Recording recording = outbound.savedRecordings().get(0);
        byte[] wav = Files.readAllBytes(recordingsDir().resolve(recording.filename()));
        assertThat(readLEShort(wav, AudioFormat.WAV_CHANNELS_OFFSET)).isEqualTo(1);
        assertThat(readLEInt(wav, AudioFormat.WAV_SAMPLE_RATE_OFFSET)).isEqualTo(48_000);
        assertThat(Arrays.copyOfRange(wav, AudioFormat.WAV_HEADER_SIZE, wav.length)).containsExactly(chunk);
    }

    @Test
    void startRecordShouldHonorRequestedSampleRate() throws IOException {
        DefaultStreamOrchestrator orchestrator = orchestrator(RecordingProperties.Source.PROCESSED, false);
        orchestrator.handleInit("tab-1", outbound, RATE, 2);

        orchestrator.handleStartRecord("tab-1", "conn-1", 48_000, 2);
        orchestrator.handleFrame("tab-1", "conn-1", new byte[16]);
        orchestrator.handleStopRecord("tab-1", "conn-1");

        Recording recording = outbound.savedRecordings().get(0);
        assertThat(recording.sampleRate()).isEqualTo(48_000);
        byte[] wav = Files.readAllBytes(recordingsDir().resolve(recording.filename()));
        assertThat(readLEInt(wav, AudioFormat.WAV_SAMPLE_RATE_OFFSET)).isEqualTo(48_000);
    }

    @Test
    void startRecordWhileRecordingShouldFinalizeCurrentRecordingFirst() {
        // Arrange
        DefaultStreamOrchestrator orchestrator = orchestrator(RecordingProperties.Source.PROCESSED, false);
        orchestrator.handleInit("tab-1", outbound, RATE, 2);
        orchestrator.handleStartRecord("tab-1", "conn-1", null, null);
        orchestrator.handleFrame("tab-1", "conn-1", new byte[CHUNK * 4]);

        // Act
        orchestrator.handleStartRecord("tab-1", "conn-1", null, null);

        // Assert
        assertThat(outbound.savedRecordings()).hasSize(1);
        assertThat(registry.require("tab-1", "conn-1").isRecording()).isTrue();
    }

    @Test
    void stopRecordWithoutRecordingShouldBeIgnored() {
        DefaultStreamOrchestrator orchestrator = orchestrator(RecordingProperties.Source.PROCESSED, false);
        orchestrator.handleInit("tab-1", outbound, RATE, 2);

        orchestrator.handleStopRecord("tab-1", "conn-1");

        assertThat(outbound.savedRecordings()).isEmpty();
        assertThat(store.count()).isZero();
    }

    @Test
    void emptyRecordingShouldNotNotifyClient() {
        DefaultStreamOrchestrator orchestrator = orchestrator(RecordingProperties.Source.PROCESSED, false);
        orchestrator.handleInit("tab-1", outbound, RATE, 2);

        orchestrator.handleStartRecord("tab-1", "conn-1", null, null);
        orchestrator.handleStopRecord("tab-1", "conn-1");

        assertThat(outbound.savedRecordings()).isEmpty();
    }

    @Test
    void disconnectShouldFinalizeRecordingWithoutNotice() {
        // Arrange
        DefaultStreamOrchestrator orchestrator = orchestrator(RecordingProperties.Source.PROCESSED, false);
        orchestrator.handleInit("tab-1", outbound, RATE, 2);
        AudioSession session = registry.require("tab-1", "conn-1");
        orchestrator.handleStartRecord("tab-1", "conn-1", null, null);
        orchestrator.handleFrame("tab-1", "conn-1", new byte[CHUNK * 4]);

        // Act
        orchestrator.handleDisconnect("tab-1", "conn-1");

        // Assert
        assertThat(outbound.savedRecordings()).isEmpty();
        assertThat(store.findBySession("tab-1")).hasSize(1);
        assertThat(registry.size()).isZero();
        assertThat(meteringScheduler.isRegistered(session)).isFalse();
        assertThatThrownBy(() -> orchestrator.handleFrame("tab-1", "conn-1", new byte[4]))
                .isInstanceOf(SessionNotFoundException.class);
    }

    @Test
    void disconnectShouldDeleteRecordingsWhenConfigured() {
        DefaultStreamOrchestrator orchestrator = orchestrator(RecordingProperties.Source.PROCESSED, true);
        orchestrator.handleInit("tab-1", outbound, RATE, 2);
        orchestrator.handleStartRecord("tab-1", "conn-1", null, null);
        orchestrator.handleFrame("tab-1", "conn-1", new byte[CHUNK * 4]);
        orchestrator.handleStopRecord("tab-1", "conn-1");
        String filename = outbound.savedRecordings().get(0).filename();

        orchestrator.handleDisconnect("tab-1", "conn-1");

        assertThat(store.count()).isZero();
        assertThat(Files.exists(recordingsDir().resolve(filename))).isFalse();
    }

    @Test
    void disconnectFromForeignConnectionShouldNotTearDownSession() {
        DefaultStreamOrchestrator orchestrator = orchestrator(RecordingProperties.Source.PROCESSED, false);
        orchestrator.handleInit("tab-1", outbound, RATE, 2);

        orchestrator.handleDisconnect("tab-1", "conn-2");

        assertThat(registry.require("tab-1", "conn-1")).isNotNull();
    }

    @Test
    void reInitShouldResetEngineAndFinalizeRecording() {
        // Arrange
        DefaultStreamOrchestrator orchestrator = orchestrator(RecordingProperties.Source.PROCESSED, false);
        orchestrator.handleInit("tab-1", outbound, RATE, 2);
        AudioSession first = registry.require("tab-1", "conn-1");
        orchestrator.handleSetParams("tab-1", "conn-1", new ParameterUpdate(12.0, null, null, null));
        orchestrator.handleStartRecord("tab-1", "conn-1", null, null);
        orchestrator.handleFrame("tab-1", "conn-1", new byte[CHUNK * 4]);

        // Act
        orchestrator.handleInit("tab-1", outbound, 48_000, 1);

        // Assert
        AudioSession second = registry.require("tab-1", "conn-1");
        assertThat(second).isNotSameAs(first);
        assertThat(first.isClosed()).isTrue();
        assertThat(second.sampleRate()).isEqualTo(48_000);
        assertThat(second.engine().parameters()).isEqualTo(DspParameters.DEFAULTS);
        assertThat(second.isRecording()).isFalse();
        assertThat(outbound.savedRecordings()).hasSize(1);
        assertThat(meteringScheduler.isRegistered(first)).isFalse();
        assertThat(meteringScheduler.isRegistered(second)).isTrue();
    }

    @Test
    void shutdownShouldDisconnectEverySession() {
        DefaultStreamOrchestrator orchestrator = orchestrator(RecordingProperties.Source.PROCESSED, false);
        orchestrator.handleInit("tab-1", outbound, RATE, 2);
        orchestrator.handleInit("tab-2", new CapturingOutboundChannel("conn-2"), RATE, 2);

        orchestrator.shutdown();

        assertThat(registry.size()).isZero();
        assertThat(meteringScheduler.activeCount()).isZero();
    }

    private DefaultStreamOrchestrator orchestrator(RecordingProperties.Source source, boolean deleteOnDisconnect) {
        RecordingProperties recordingProperties = new RecordingProperties(recordingsDir().toString(),
                64, 1000, 5000, source, deleteOnDisconnect);
        StreamMetrics metrics = new StreamMetrics(meterRegistry);
        RecordingService recordingService = new RecordingService(recordingProperties, store,
                new SyncExecutor(), publisher, metrics);
        createRecordingsDir();
        return new DefaultStreamOrchestrator(registry, meteringScheduler, recordingService,
                new DspProperties(null, null, null, null), meteringProperties(), recordingProperties,
                metrics, publisher);
    }

    private void createRecordingsDir() {
        try {
            Files.createDirectories(recordingsDir());
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }

    private Path recordingsDir() {
        return tempDir.resolve("recordings");
    }

    private static MeteringProperties meteringProperties() {
        return new MeteringProperties(50, 32, 1024);
    }
}
