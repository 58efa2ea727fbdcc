package com.phillippitts.audiometer.service.dsp;

/**
 * Fourth-order Butterworth low-pass for two channels.
 *
 * <p>Built from two cascaded biquad sections in Direct Form II Transposed, each section
 * using the bilinear-transform low-pass design with the Butterworth pole Q values
 * {@code 1/(2cos(pi/8))} and {@code 1/(2cos(3pi/8))}.
 *
 * <p>Coefficients are recomputed by {@link #configure(double, int)}; the delay state
 * ({@code z1}, {@code z2} per section and channel) is only ever advanced by
 * {@link #step(int, double)}, so retuning mid-stream continues from the current signal
 * instead of restarting from zero.
 *
 * <p>Not thread-safe; owned by a single {@link DspEngine}.
 */
final class ButterworthLowPass {

    static final int ORDER = 4;
    static final int SECTIONS = ORDER / 2;
    static final int CHANNELS = 2;

    private static final double[] SECTION_Q = {
            1.0 / (2.0 * Math.cos(Math.PI / 8.0)),        // 0.5412
            1.0 / (2.0 * Math.cos(3.0 * Math.PI / 8.0))   // 1.3066
    };

    // Per-section coefficients, a0 normalised to 1
    private final double[] b0 = new double[SECTIONS];
    private final double[] b1 = new double[SECTIONS];
    private final double[] b2 = new double[SECTIONS];
    private final double[] a1 = new double[SECTIONS];
    private final double[] a2 = new double[SECTIONS];

    // Delay state z1[section][channel], z2[section][channel]
    private final double[][] z1 = new double[SECTIONS][CHANNELS];
    private final double[][] z2 = new double[SECTIONS][CHANNELS];

    private double cutoffHz = Double.NaN;
    private int sampleRate;

    ButterworthLowPass(double cutoffHz, int sampleRate) {
        configure(cutoffHz, sampleRate);
    }

    /**
     * Recomputes coefficients if cutoff or sample rate changed. Never touches the
     * delay state.
     *
     * @param newCutoffHz  cutoff in Hz, must be below Nyquist
     * @param newSampleRate sample rate in Hz
     * @return true if coefficients were recomputed
     */
    boolean configure(double newCutoffHz, int newSampleRate) {
        if (newSampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive: " + newSampleRate);
        }
        if (!(newCutoffHz > 0.0) || newCutoffHz >= newSampleRate / 2.0) {
            throw new IllegalArgumentException(
                    "cutoff must be in (0, Nyquist): cutoff=" + newCutoffHz + ", sampleRate=" + newSampleRate);
        }
        if (newCutoffHz == cutoffHz && newSampleRate == sampleRate) {
            return false;
        }
        cutoffHz = newCutoffHz;
        sampleRate = newSampleRate;

        double w0 = 2.0 * Math.PI * newCutoffHz / newSampleRate;
        double cos = Math.cos(w0);
        double sin = Math.sin(w0);
        for (int s = 0; s < SECTIONS; s++) {
            double alpha = sin / (2.0 * SECTION_Q[s]);
            double aa0 = 1.0 + alpha;
            b0[s] = ((1.0 - cos) / 2.0) / aa0;
            b1[s] = (1.0 - cos) / aa0;
            b2[s] = ((1.0 - cos) / 2.0) / aa0;
            a1[s] = (-2.0 * cos) / aa0;
            a2[s] = (1.0 - alpha) / aa0;
        }
        return true;
    }

    /**
     * Advances the filter by one sample on the given channel.
     *
     * @param channel 0 = left, 1 = right
     * @param x       input sample
     * @return filtered sample
     */
    double step(int channel, double x) {
        double y = x;
        for (int s = 0; s < SECTIONS; s++) {
            double in = y;
            y = b0[s] * in + z1[s][channel];
            z1[s][channel] = b1[s] * in - a1[s] * y + z2[s][channel];
            z2[s][channel] = b2[s] * in - a2[s] * y;
        }
        return y;
    }

    /** Visible for tests. */
    double cutoffHz() {
        return cutoffHz;
    }

    /** Visible for tests: copy of the delay state as {section}{channel}{z1, z2}. */
    double[][][] stateSnapshot() {
        double[][][] out = new double[SECTIONS][CHANNELS][2];
        for (int s = 0; s < SECTIONS; s++) {
            for (int ch = 0; ch < CHANNELS; ch++) {
                out[s][ch][0] = z1[s][ch];
                out[s][ch][1] = z2[s][ch];
            }
        }
        return out;
    }
}
