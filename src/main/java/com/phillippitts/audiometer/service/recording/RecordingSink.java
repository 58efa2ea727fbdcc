package com.phillippitts.audiometer.service.recording;

import com.phillippitts.audiometer.domain.DspParameters;
import com.phillippitts.audiometer.exception.StorageException;
import com.phillippitts.audiometer.service.audio.WavFileWriter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Asynchronous, ordered writer for one recording.
 *
 * <p>Ingestion hands PCM chunks to {@link #append(byte[])}, which only enqueues. A single
 * drain task at a time runs on the shared recording executor and writes chunks in arrival
 * order, so many recordings can share a small pool without interleaving.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * RECORDING → FINALIZED (via finish, after the queue drains)
 * RECORDING → FAILED    (enqueue timeout, write error, or {@link #fail(String, Throwable)})
 * </pre>
 * A failed recording rejects further audio and reports the failure once through its
 * {@link FailureListener}. Chunks already accepted are still written before the partial file
 * is closed, unless the failure is a write error, in which case the queue is dropped.
 *
 * <p><b>Thread Safety:</b> {@link #append(byte[])} and {@link #finish()} are called from
 * the session's ingest thread; drain runs on the executor. Writer access and state
 * transitions are guarded by a {@link ReentrantLock}.
 */
public final class RecordingSink {

    private static final Logger LOG = LogManager.getLogger(RecordingSink.class);

    /** Lifecycle of a sink. */
    public enum State { RECORDING, FAILED, FINALIZED }

    /** Receives the single failure notification of a sink. */
    @FunctionalInterface
    public interface FailureListener {
        void onFailure(RecordingSink sink, String reason, StorageException error);
    }

    private final String sessionId;
    private final String filename;
    private final int sampleRate;
    private final int channels;
    private final Instant startedAt;
    private final DspParameters settings;
    private final WavFileWriter writer;
    private final Executor executor;
    private final long enqueueTimeoutMs;
    private final FailureListener failureListener;

    private final BlockingQueue<byte[]> queue;
    private final AtomicBoolean draining = new AtomicBoolean(false);
    private final CompletableFuture<Long> completion = new CompletableFuture<>();
    private final Lock lock = new ReentrantLock();

    private volatile State state = State.RECORDING;
    private volatile boolean endRequested;
    private volatile boolean flushing;

    RecordingSink(String sessionId,
                  String filename,
                  int sampleRate,
                  int channels,
                  Instant startedAt,
                  DspParameters settings,
                  WavFileWriter writer,
                  Executor executor,
                  int queueCapacity,
                  long enqueueTimeoutMs,
                  FailureListener failureListener) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId must not be null");
        this.filename = Objects.requireNonNull(filename, "filename must not be null");
        this.sampleRate = sampleRate;
        this.channels = channels;
        this.startedAt = Objects.requireNonNull(startedAt, "startedAt must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.writer = Objects.requireNonNull(writer, "writer must not be null");
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.queue = new LinkedBlockingQueue<>(queueCapacity);
        this.enqueueTimeoutMs = enqueueTimeoutMs;
        this.failureListener = Objects.requireNonNull(failureListener, "failureListener must not be null");
    }

    /**
     * Queues a chunk for writing. Waits at most the configured enqueue timeout when the
     * queue is full; on timeout the chunk is rejected and the recording fails.
     *
     * @param pcm interleaved PCM16LE bytes (the array must not be modified afterwards)
     * @return true if the chunk was accepted
     */
    public boolean append(byte[] pcm) {
        if (state != State.RECORDING || endRequested || pcm.length == 0) {
            return false;
        }
        try {
            if (!queue.offer(pcm, enqueueTimeoutMs, TimeUnit.MILLISECONDS)) {
                fail("enqueue-timeout", null, false);
                return false;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fail("interrupted", e, false);
            return false;
        }
        scheduleDrain();
        return true;
    }

    /**
     * Stops accepting audio. Completes with the number of frames written once every
     * queued chunk is on disk and the header is patched; completes exceptionally with a
     * {@link StorageException} if the recording failed.
     *
     * @return completion of this recording
     */
    public CompletableFuture<Long> finish() {
        endRequested = true;
        if (state == State.RECORDING) {
            scheduleDrain();
        }
        return completion;
    }

    /**
     * Marks the recording failed. Chunks already queued are written before the partial file
     * is closed. Only the first failure is reported.
     *
     * @param reason short failure reason
     * @param cause  underlying error, may be null
     */
    public void fail(String reason, Throwable cause) {
        fail(reason, cause, false);
    }

    private void fail(String reason, Throwable cause, boolean discardQueued) {
        StorageException error;
        lock.lock();
        try {
            if (state != State.RECORDING) {
                return;
            }
            state = State.FAILED;
            error = new StorageException("Recording failed: " + reason, filename, cause);
            if (discardQueued) {
                queue.clear();
                try {
                    writer.close();
                } catch (IOException closeError) {
                    error.addSuppressed(closeError);
                }
            } else {
                flushing = true;
            }
        } finally {
            lock.unlock();
        }
        LOG.warn("Recording failed: file={}, reason={}, framesWritten={}, queued={}",
                filename, reason, writer.framesWritten(), queue.size(), cause);
        completion.completeExceptionally(error);
        failureListener.onFailure(this, reason, error);
        if (!discardQueued) {
            scheduleDrain();
        }
    }

    private void scheduleDrain() {
        if (draining.compareAndSet(false, true)) {
            executor.execute(this::drain);
        }
    }

    private void drain() {
        while (true) {
            byte[] chunk = queue.poll();
            if (chunk != null) {
                write(chunk);
                continue;
            }
            if (endRequested || flushing) {
                finalizeFile();
                return;
            }
            draining.set(false);
            // Re-check: an append, finish or fail may have raced with the release above
            if ((queue.isEmpty() && !endRequested && !flushing) || !draining.compareAndSet(false, true)) {
                return;
            }
        }
    }

    private void write(byte[] chunk) {
        lock.lock();
        try {
            if (state == State.RECORDING || flushing) {
                writer.append(chunk);
            }
        } catch (IOException e) {
            if (flushing) {
                queue.clear();
                LOG.warn("Dropping queued audio of failed recording: file={}", filename, e);
            } else {
                // fail() re-acquires the lock; ReentrantLock allows it
                fail("io-error", e, true);
            }
        } finally {
            lock.unlock();
        }
    }

    private void finalizeFile() {
        lock.lock();
        try {
            if (flushing) {
                flushing = false;
                closeFailed();
                return;
            }
            if (state != State.RECORDING) {
                return;
            }
            try {
                writer.close();
            } catch (IOException e) {
                fail("io-error", e, true);
                return;
            }
            state = State.FINALIZED;
        } finally {
            lock.unlock();
        }
        LOG.debug("Recording finalized: file={}, frames={}", filename, writer.framesWritten());
        completion.complete(writer.framesWritten());
    }

    private void closeFailed() {
        try {
            writer.close();
            LOG.debug("Partial recording closed: file={}, frames={}", filename, writer.framesWritten());
        } catch (IOException e) {
            LOG.warn("Cannot close partial recording: file={}", filename, e);
        }
    }

    public State state() {
        return state;
    }

    public boolean isActive() {
        return state == State.RECORDING && !endRequested;
    }

    public String sessionId() {
        return sessionId;
    }

    public String filename() {
        return filename;
    }

    public int sampleRate() {
        return sampleRate;
    }

    public int channels() {
        return channels;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public DspParameters settings() {
        return settings;
    }

    /** @return chunks waiting to be written */
    public int pending() {
        return queue.size();
    }
}
