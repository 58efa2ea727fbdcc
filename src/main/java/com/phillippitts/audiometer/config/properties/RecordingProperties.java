package com.phillippitts.audiometer.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;

/**
 * Typed properties for recording persistence.
 */
@Validated
@ConfigurationProperties(prefix = "recording")
public class RecordingProperties {

    /** Which signal is written to disk. */
    public enum Source { PROCESSED, RAW }

    /** Directory that receives WAV files; created at startup if missing. */
    private final Path directory;

    /** Maximum chunks waiting to be written per recording. */
    @Min(1)
    @Max(65_536)
    private final int queueCapacity;

    /** How long an append waits for queue space before the recording is failed. */
    @Min(0)
    @Max(60_000)
    private final int enqueueTimeoutMs;

    /** How long stop waits for queued chunks to drain and the header to be patched. */
    @Min(100)
    @Max(300_000)
    private final int finalizeTimeoutMs;

    private final Source source;

    /** Delete a session's recordings (files and metadata) when its connection closes. */
    private final boolean deleteOnDisconnect;

    @ConstructorBinding
    public RecordingProperties(String directory,
                               Integer queueCapacity,
                               Integer enqueueTimeoutMs,
                               Integer finalizeTimeoutMs,
                               Source source,
                               Boolean deleteOnDisconnect) {
        this.directory = Path.of(directory == null || directory.isBlank() ? "recordings_data" : directory);
        this.queueCapacity = queueCapacity == null ? 256 : queueCapacity;
        this.enqueueTimeoutMs = enqueueTimeoutMs == null ? 2000 : enqueueTimeoutMs;
        this.finalizeTimeoutMs = finalizeTimeoutMs == null ? 10_000 : finalizeTimeoutMs;
        this.source = source == null ? Source.PROCESSED : source;
        this.deleteOnDisconnect = deleteOnDisconnect != null && deleteOnDisconnect;
    }

    public Path getDirectory() { return directory; }
    public int getQueueCapacity() { return queueCapacity; }
    public int getEnqueueTimeoutMs() { return enqueueTimeoutMs; }
    public int getFinalizeTimeoutMs() { return finalizeTimeoutMs; }
    public Source getSource() { return source; }
    public boolean isDeleteOnDisconnect() { return deleteOnDisconnect; }
}
