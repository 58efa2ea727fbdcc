package com.phillippitts.audiometer.service.recording;

import com.phillippitts.audiometer.config.properties.RecordingProperties;
import com.phillippitts.audiometer.domain.DspParameters;
import com.phillippitts.audiometer.domain.Recording;
import com.phillippitts.audiometer.exception.StorageException;
import com.phillippitts.audiometer.service.audio.WavFileWriter;
import com.phillippitts.audiometer.service.metrics.StreamMetrics;
import com.phillippitts.audiometer.service.recording.event.RecordingFailedEvent;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Opens, finalizes and deletes recordings.
 *
 * <p>Each recording is a WAV file named {@code rec_<yyyyMMdd_HHmmss>_<id>.wav} in the
 * configured directory, written by a {@link RecordingSink} on the shared recording
 * executor. Finished recordings are registered in the {@link RecordingStore}.
 */
@Service
public class RecordingService {

    private static final Logger LOG = LogManager.getLogger(RecordingService.class);

    private static final DateTimeFormatter FILE_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneId.systemDefault());

    private final RecordingProperties properties;
    private final RecordingStore store;
    private final Executor recordingExecutor;
    private final ApplicationEventPublisher publisher;
    private final StreamMetrics metrics;

    public RecordingService(RecordingProperties properties,
                            RecordingStore store,
                            @Qualifier("recordingExecutor") Executor recordingExecutor,
                            ApplicationEventPublisher publisher,
                            StreamMetrics metrics) {
        this.properties = Objects.requireNonNull(properties);
        this.store = Objects.requireNonNull(store);
        this.recordingExecutor = Objects.requireNonNull(recordingExecutor);
        this.publisher = Objects.requireNonNull(publisher);
        this.metrics = Objects.requireNonNull(metrics);
    }

    @PostConstruct
    void ensureDirectory() {
        Path dir = properties.getDirectory();
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new StorageException("Cannot create recordings directory", dir.toString(), e);
        }
        LOG.info("Recordings directory: {} (source={}, deleteOnDisconnect={})",
                dir.toAbsolutePath(), properties.getSource(), properties.isDeleteOnDisconnect());
    }

    /**
     * Opens a new recording file.
     *
     * @param sessionId  owning session
     * @param sampleRate sample rate written to the WAV header
     * @param channels   interleaved channels of the audio that will be appended
     * @param settings   DSP parameters in effect when recording starts
     * @return sink accepting audio
     * @throws StorageException if the file cannot be created
     */
    public RecordingSink start(String sessionId, int sampleRate, int channels, DspParameters settings) {
        Instant startedAt = Instant.now();
        String filename = "rec_" + FILE_TIMESTAMP.format(startedAt) + "_"
                + UUID.randomUUID().toString().substring(0, 8) + ".wav";
        Path path = properties.getDirectory().resolve(filename);

        WavFileWriter writer;
        try {
            writer = WavFileWriter.open(path, sampleRate, channels);
        } catch (IOException e) {
            metrics.incrementRecordingFailed("open-error");
            throw new StorageException("Cannot open recording", filename, e);
        }
        LOG.info("Recording started: file={}, sampleRate={}, channels={}", filename, sampleRate, channels);
        return new RecordingSink(sessionId, filename, sampleRate, channels, startedAt, settings, writer,
                recordingExecutor, properties.getQueueCapacity(), properties.getEnqueueTimeoutMs(),
                this::onSinkFailure);
    }

    /**
     * Drains and finalizes a recording, then stores its metadata.
     *
     * @param sink recording to stop
     * @return the stored recording, or empty if it failed or captured no audio
     */
    public Optional<Recording> stop(RecordingSink sink) {
        long frames;
        try {
            frames = sink.finish().get(properties.getFinalizeTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            sink.fail("finalize-timeout", e);
            return Optional.empty();
        } catch (ExecutionException e) {
            LOG.debug("Recording {} ended in failure: {}", sink.filename(), e.getCause().getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            sink.fail("interrupted", e);
            return Optional.empty();
        }

        if (frames == 0) {
            LOG.info("Recording {} captured no audio; discarding", sink.filename());
            deleteFile(sink.filename());
            return Optional.empty();
        }

        double duration = (double) frames / sink.sampleRate();
        Recording saved = store.save(new Recording(0L, sink.filename(), duration, sink.startedAt(),
                sink.sessionId(), sink.sampleRate(), sink.channels(), sink.settings()));
        metrics.incrementRecordingSaved();
        LOG.info("Recording saved: id={}, file={}, durationSeconds={}",
                saved.id(), saved.filename(), String.format("%.3f", duration));
        return Optional.of(saved);
    }

    /**
     * Deletes every recording of a session, files and metadata.
     *
     * @return number of recordings removed
     */
    public int deleteSessionRecordings(String sessionId) {
        List<Recording> recordings = store.findBySession(sessionId);
        for (Recording recording : recordings) {
            deleteFile(recording.filename());
            store.delete(recording.id());
        }
        if (!recordings.isEmpty()) {
            LOG.info("Deleted {} recording(s) for disconnected session", recordings.size());
        }
        return recordings.size();
    }

    public Path directory() {
        return properties.getDirectory();
    }

    /** @return true if the recordings directory exists and accepts new files */
    public boolean isDirectoryWritable() {
        Path dir = properties.getDirectory();
        return Files.isDirectory(dir) && Files.isWritable(dir);
    }

    private void deleteFile(String filename) {
        Path path = properties.getDirectory().resolve(filename);
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.error("Failed to delete recording file {}: {}", path, e.getMessage());
        }
    }

    private void onSinkFailure(RecordingSink sink, String reason, StorageException error) {
        metrics.incrementRecordingFailed(reason);
        publisher.publishEvent(new RecordingFailedEvent(sink.sessionId(), sink.filename(), reason, Instant.now()));
    }
}
