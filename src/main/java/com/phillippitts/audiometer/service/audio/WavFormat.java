package com.phillippitts.audiometer.service.audio;

/**
 * Constants for the WAV (RIFF/WAVE) container written by {@link WavFileWriter}.
 *
 * <p><b>WAV File Structure:</b>
 * <pre>
 * ┌─────────────────────────────────────┐
 * │ RIFF Header (12 bytes)              │  RIFF_HEADER_SIZE
 * ├─────────────────────────────────────┤
 * │ fmt chunk:                          │
 * │   - Chunk ID + Size (8 bytes)       │  CHUNK_HEADER_SIZE
 * │   - Chunk Data (16 bytes)           │  FMT_CHUNK_MIN_SIZE
 * ├─────────────────────────────────────┤
 * │ data chunk:                         │
 * │   - Chunk ID + Size (8 bytes)       │  CHUNK_HEADER_SIZE
 * │   - PCM Audio Data (variable)       │
 * └─────────────────────────────────────┘
 * </pre>
 *
 * <p>The RIFF and data sizes are unknown while a recording streams; the writer emits
 * zero placeholders and patches them on close.
 *
 * @see WavFileWriter
 * @since 1.0
 */
public final class WavFormat {

    /** "RIFF" chunk ID + file size - 8 + "WAVE" format ID. */
    public static final int RIFF_HEADER_SIZE = 12;

    /** Chunk ID (4 bytes) + chunk data size (4 bytes, little-endian uint32). */
    public static final int CHUNK_HEADER_SIZE = 8;

    /** Size of a plain PCM fmt chunk body. */
    public static final int FMT_CHUNK_MIN_SIZE = 16;

    /** Audio format code for uncompressed PCM. */
    public static final int AUDIO_FORMAT_PCM = 1;

    /**
     * Largest data chunk a 32-bit RIFF size field can describe once the 36 bytes of
     * header that follow the RIFF size are accounted for.
     */
    public static final long MAX_DATA_BYTES = 0xFFFF_FFFFL - 36;

    private WavFormat() {
        // Utility class - prevent instantiation
    }
}
