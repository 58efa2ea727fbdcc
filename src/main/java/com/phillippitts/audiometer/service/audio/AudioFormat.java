package com.phillippitts.audiometer.service.audio;

/**
 * Single source of truth for the streaming audio format.
 * Wire and recording format: 16-bit signed PCM, little-endian, interleaved L,R.
 */
public final class AudioFormat {

    /** Bits per sample on the wire and in recordings. */
    public static final int BITS_PER_SAMPLE = 16;
    /** Bytes per single-channel sample. */
    public static final int BYTES_PER_SAMPLE = BITS_PER_SAMPLE / 8;
    /** Channels used for processing; mono input is duplicated to both. */
    public static final int PROCESSING_CHANNELS = 2;

    /** Endian flag (false = little-endian). */
    public static final boolean BIG_ENDIAN = false;

    /** Bytes per stereo frame (L + R). */
    public static final int STEREO_BLOCK_ALIGN = BYTES_PER_SAMPLE * PROCESSING_CHANNELS; // 4 bytes

    /** Sample rate assumed until a client sends {@code init}. */
    public static final int DEFAULT_SAMPLE_RATE = 44_100;
    public static final int MIN_SAMPLE_RATE = 8_000;
    public static final int MAX_SAMPLE_RATE = 192_000;

    // WAV header constants (PCM simple header)
    public static final int WAV_HEADER_SIZE = 44;
    public static final int WAV_RIFF_SIZE_OFFSET = 4;            // 4 bytes (LE)
    public static final int WAV_CHANNELS_OFFSET = 22;            // 2 bytes (LE)
    public static final int WAV_SAMPLE_RATE_OFFSET = 24;         // 4 bytes (LE)
    public static final int WAV_BYTE_RATE_OFFSET = 28;           // 4 bytes (LE)
    public static final int WAV_BLOCK_ALIGN_OFFSET = 32;         // 2 bytes (LE)
    public static final int WAV_BITS_PER_SAMPLE_OFFSET = 34;     // 2 bytes (LE)
    public static final int WAV_DATA_SIZE_OFFSET = 40;           // 4 bytes (LE)

    private AudioFormat() {}

    /**
     * Bytes per second of stereo PCM at the given rate.
     *
     * @param sampleRate sample rate in Hz
     * @return byte rate for {@link #PROCESSING_CHANNELS} channels of 16-bit audio
     */
    public static int stereoByteRate(int sampleRate) {
        return sampleRate * STEREO_BLOCK_ALIGN;
    }

    /**
     * Checks whether a client-declared sample rate is acceptable.
     *
     * @param sampleRate sample rate in Hz
     * @return true if within [{@link #MIN_SAMPLE_RATE}, {@link #MAX_SAMPLE_RATE}]
     */
    public static boolean isSupportedSampleRate(int sampleRate) {
        return sampleRate >= MIN_SAMPLE_RATE && sampleRate <= MAX_SAMPLE_RATE;
    }
}
