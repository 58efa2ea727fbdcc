package com.phillippitts.audiometer.service.audio;

import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.io.RandomAccessFile;
import java.nio.file.Path;
import java.util.Objects;

import static com.phillippitts.audiometer.service.audio.AudioFormat.BITS_PER_SAMPLE;
import static com.phillippitts.audiometer.service.audio.AudioFormat.BYTES_PER_SAMPLE;
import static com.phillippitts.audiometer.service.audio.AudioFormat.WAV_DATA_SIZE_OFFSET;
import static com.phillippitts.audiometer.service.audio.AudioFormat.WAV_HEADER_SIZE;
import static com.phillippitts.audiometer.service.audio.AudioFormat.WAV_RIFF_SIZE_OFFSET;

/**
 * Streams 16-bit PCM into a WAV file without holding the payload in memory.
 *
 * <p>The header is written up front with zero sizes; {@link #close()} patches the RIFF
 * and data chunk sizes so the file is valid even for recordings of unknown length.
 * Not thread-safe: callers serialize appends.
 */
public final class WavFileWriter implements Closeable {

    private final Path path;
    private final int channels;
    private final RandomAccessFile file;
    private long dataBytes;
    private boolean closed;

    private WavFileWriter(Path path, int channels, RandomAccessFile file) {
        this.path = path;
        this.channels = channels;
        this.file = file;
    }

    /**
     * Creates (or truncates) the file and writes a placeholder header.
     *
     * @param wavPath    output file path
     * @param sampleRate sample rate in Hz
     * @param channels   number of interleaved channels
     * @return writer positioned after the header
     * @throws IOException if the file cannot be created or written
     */
    public static WavFileWriter open(Path wavPath, int sampleRate, int channels) throws IOException {
        Objects.requireNonNull(wavPath, "wavPath must not be null");
        if (sampleRate <= 0 || channels <= 0) {
            throw new IllegalArgumentException("sampleRate and channels must be positive");
        }
        RandomAccessFile raf = new RandomAccessFile(wavPath.toFile(), "rw");
        try {
            raf.setLength(0);
            raf.write(header(sampleRate, channels));
        } catch (IOException e) {
            raf.close();
            throw e;
        }
        return new WavFileWriter(wavPath, channels, raf);
    }

    /**
     * Appends interleaved PCM16LE bytes to the data chunk.
     *
     * @param pcm raw PCM bytes; length must be a whole number of frames
     * @throws IOException if the write fails or the file would exceed the WAV size limit
     */
    public void append(byte[] pcm) throws IOException {
        Objects.requireNonNull(pcm, "pcm must not be null");
        if (closed) {
            throw new IOException("WAV writer already closed: " + path);
        }
        if (dataBytes + pcm.length > WavFormat.MAX_DATA_BYTES) {
            throw new IOException("WAV data limit reached for " + path);
        }
        file.write(pcm);
        dataBytes += pcm.length;
    }

    /** @return PCM payload bytes written so far */
    public long dataBytes() {
        return dataBytes;
    }

    /** @return whole frames written so far */
    public long framesWritten() {
        return dataBytes / ((long) BYTES_PER_SAMPLE * channels);
    }

    public Path path() {
        return path;
    }

    /**
     * Patches the header sizes, forces content to disk and closes the file.
     * Calling close twice is a no-op.
     */
    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        try {
            file.seek(WAV_RIFF_SIZE_OFFSET);
            writeLEInt(file, (int) (36 + dataBytes));
            file.seek(WAV_DATA_SIZE_OFFSET);
            writeLEInt(file, (int) dataBytes);
            file.getFD().sync();
        } finally {
            file.close();
        }
    }

    private static byte[] header(int sampleRate, int channels) throws IOException {
        int blockAlign = channels * BYTES_PER_SAMPLE;
        ByteArrayOutputStream os = new ByteArrayOutputStream(WAV_HEADER_SIZE);
        // ChunkID: "RIFF"
        os.write(new byte[] { 'R', 'I', 'F', 'F' });
        // ChunkSize: patched on close
        writeLEInt(os, 36);
        // Format: "WAVE"
        os.write(new byte[] { 'W', 'A', 'V', 'E' });

        // Subchunk1ID: "fmt "
        os.write(new byte[] { 'f', 'm', 't', ' ' });
        writeLEInt(os, WavFormat.FMT_CHUNK_MIN_SIZE);
        writeLEShort(os, (short) WavFormat.AUDIO_FORMAT_PCM);
        writeLEShort(os, (short) channels);
        writeLEInt(os, sampleRate);
        // ByteRate: SampleRate * NumChannels * BitsPerSample/8
        writeLEInt(os, sampleRate * blockAlign);
        writeLEShort(os, (short) blockAlign);
        writeLEShort(os, (short) BITS_PER_SAMPLE);

        // Subchunk2ID: "data", size patched on close
        os.write(new byte[] { 'd', 'a', 't', 'a' });
        writeLEInt(os, 0);
        return os.toByteArray();
    }

    private static void writeLEShort(OutputStream os, short v) throws IOException {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
    }

    private static void writeLEInt(OutputStream os, int v) throws IOException {
        os.write(v & 0xFF);
        os.write((v >>> 8) & 0xFF);
        os.write((v >>> 16) & 0xFF);
        os.write((v >>> 24) & 0xFF);
    }

    private static void writeLEInt(RandomAccessFile raf, int v) throws IOException {
        raf.write(new byte[] {
                (byte) (v & 0xFF),
                (byte) ((v >>> 8) & 0xFF),
                (byte) ((v >>> 16) & 0xFF),
                (byte) ((v >>> 24) & 0xFF)
        });
    }
}
