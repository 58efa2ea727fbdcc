package com.phillippitts.audiometer.service.audio;

import com.phillippitts.audiometer.exception.InvalidFrameException;

import static com.phillippitts.audiometer.service.audio.AudioFormat.BYTES_PER_SAMPLE;
import static com.phillippitts.audiometer.service.audio.AudioFormat.STEREO_BLOCK_ALIGN;

/**
 * Converts between PCM16LE byte frames and normalized per-channel doubles.
 *
 * <p>Scaling is asymmetric so that both ends of the 16-bit range map exactly to ±1.0:
 * negative samples divide by 32768, non-negative samples by 32767. Encoding reverses
 * the mapping and truncates toward zero.
 *
 * <p>Stateless and thread-safe.
 */
public final class SampleCodec {

    private static final double NEGATIVE_SCALE = 32768.0;
    private static final double POSITIVE_SCALE = 32767.0;

    /**
     * Added (away from zero) before truncation so that a value produced by
     * {@link #toDouble(int)} truncates back to the same integer despite division round-off.
     */
    private static final double TRUNCATION_GUARD = 1e-7;

    private SampleCodec() {
        // Utility class
    }

    /**
     * Decodes a frame for a session that declared the given channel count.
     *
     * @param pcm      PCM16LE bytes
     * @param channels 1 (mono, duplicated to both channels) or 2 (interleaved L,R)
     * @return decoded stereo buffer
     * @throws InvalidFrameException if the frame is empty or misaligned
     */
    public static StereoBuffer decode(byte[] pcm, int channels) {
        return channels == 1 ? decodeMono(pcm) : decodeStereo(pcm);
    }

    /**
     * Decodes interleaved L,R PCM16LE.
     *
     * @param pcm interleaved bytes; length must be a positive multiple of 4
     * @return decoded stereo buffer
     * @throws InvalidFrameException if the frame is empty or misaligned
     */
    public static StereoBuffer decodeStereo(byte[] pcm) {
        requireAligned(pcm, STEREO_BLOCK_ALIGN);
        int frames = pcm.length / STEREO_BLOCK_ALIGN;
        double[] left = new double[frames];
        double[] right = new double[frames];
        int pos = 0;
        for (int i = 0; i < frames; i++) {
            left[i] = toDouble(readSample(pcm, pos));
            right[i] = toDouble(readSample(pcm, pos + BYTES_PER_SAMPLE));
            pos += STEREO_BLOCK_ALIGN;
        }
        return new StereoBuffer(left, right);
    }

    /**
     * Decodes mono PCM16LE and duplicates each sample to both channels.
     *
     * @param pcm mono bytes; length must be a positive multiple of 2
     * @return decoded stereo buffer with identical channels
     * @throws InvalidFrameException if the frame is empty or misaligned
     */
    public static StereoBuffer decodeMono(byte[] pcm) {
        requireAligned(pcm, BYTES_PER_SAMPLE);
        int frames = pcm.length / BYTES_PER_SAMPLE;
        double[] left = new double[frames];
        for (int i = 0; i < frames; i++) {
            left[i] = toDouble(readSample(pcm, i * BYTES_PER_SAMPLE));
        }
        return new StereoBuffer(left, left.clone());
    }

    /**
     * Encodes a stereo buffer as interleaved L,R PCM16LE.
     * Values outside [-1, 1] are clamped.
     *
     * @param buffer samples to encode
     * @return interleaved bytes, {@code 4 * frames} long
     */
    public static byte[] encode(StereoBuffer buffer) {
        double[] left = buffer.left();
        double[] right = buffer.right();
        byte[] out = new byte[buffer.frames() * STEREO_BLOCK_ALIGN];
        int pos = 0;
        for (int i = 0; i < left.length; i++) {
            writeSample(out, pos, toPcm(left[i]));
            writeSample(out, pos + BYTES_PER_SAMPLE, toPcm(right[i]));
            pos += STEREO_BLOCK_ALIGN;
        }
        return out;
    }

    /**
     * @param sample signed 16-bit value
     * @return normalized value in [-1, 1]
     */
    public static double toDouble(int sample) {
        return sample < 0 ? sample / NEGATIVE_SCALE : sample / POSITIVE_SCALE;
    }

    /**
     * @param value normalized value; clamped to [-1, 1]
     * @return signed 16-bit value, truncated toward zero
     */
    public static short toPcm(double value) {
        if (Double.isNaN(value)) {
            return 0;
        }
        double v = Math.max(-1.0, Math.min(1.0, value));
        if (v < 0) {
            return (short) Math.max(-32768, (int) (v * NEGATIVE_SCALE - TRUNCATION_GUARD));
        }
        return (short) Math.min(32767, (int) (v * POSITIVE_SCALE + TRUNCATION_GUARD));
    }

    private static void requireAligned(byte[] pcm, int blockAlign) {
        if (pcm == null || pcm.length == 0) {
            throw new InvalidFrameException("frame is empty");
        }
        if (pcm.length % blockAlign != 0) {
            throw new InvalidFrameException(pcm.length,
                    "length is not a multiple of " + blockAlign + " bytes");
        }
    }

    private static int readSample(byte[] pcm, int pos) {
        return (short) ((pcm[pos] & 0xFF) | (pcm[pos + 1] << 8));
    }

    private static void writeSample(byte[] out, int pos, short sample) {
        out[pos] = (byte) (sample & 0xFF);
        out[pos + 1] = (byte) ((sample >>> 8) & 0xFF);
    }
}
