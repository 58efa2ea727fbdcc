package com.phillippitts.audiometer.service.dsp;

import com.phillippitts.audiometer.domain.MeteringSample;

/**
 * Exponentially smoothed per-channel mean-square estimator.
 *
 * <p>Each processed block of {@code n} frames updates
 * {@code ms = alpha * ms + (1 - alpha) * blockMeanSquare} with
 * {@code alpha = exp(-n / (sampleRate * integrationTime))}, so the response depends on
 * elapsed audio time rather than on block size.
 *
 * <p>A run of digitally silent input at least one integration window long settles both
 * channels to zero, which lets the meter reach its floor instead of decaying forever.
 * Silence is reported by the caller from the pre-filter signal, since a low-pass tail
 * keeps the filtered samples non-zero long after the input stops.
 *
 * <p>Not thread-safe; guarded by the owning {@link DspEngine}.
 */
final class LevelMeter {

    /** Denominator below which both channels count as silent for panning. */
    static final double PAN_EPSILON = 1e-9;

    private double meanSquareLeft;
    private double meanSquareRight;
    private long silentFrames;

    /**
     * @param left            post-filter left samples
     * @param right           post-filter right samples
     * @param sampleRate      sample rate in Hz
     * @param integrationTime smoothing time constant in seconds
     * @param silentInput     true if every input sample of the block was zero
     */
    void accumulate(double[] left, double[] right, int sampleRate, double integrationTime,
                    boolean silentInput) {
        int frames = left.length;
        if (frames == 0) {
            return;
        }
        double sumL = 0.0;
        double sumR = 0.0;
        for (int i = 0; i < frames; i++) {
            sumL += left[i] * left[i];
            sumR += right[i] * right[i];
        }

        double alpha = Math.exp(-frames / (sampleRate * integrationTime));
        meanSquareLeft = alpha * meanSquareLeft + (1.0 - alpha) * (sumL / frames);
        meanSquareRight = alpha * meanSquareRight + (1.0 - alpha) * (sumR / frames);

        if (silentInput) {
            silentFrames += frames;
            if (silentFrames >= (long) Math.ceil(sampleRate * integrationTime)) {
                meanSquareLeft = 0.0;
                meanSquareRight = 0.0;
            }
        } else {
            silentFrames = 0;
        }
    }

    /** @return smoothed level of both channels in dBFS, floored */
    double rmsDb() {
        double meanSquare = (meanSquareLeft + meanSquareRight) / 2.0;
        if (meanSquare <= 0.0) {
            return MeteringSample.FLOOR_DB;
        }
        return Math.max(MeteringSample.FLOOR_DB, 20.0 * Math.log10(Math.sqrt(meanSquare)));
    }

    /** @return {@code (R - L) / (R + L)} of the smoothed channel RMS values, 0 when silent */
    double panning() {
        double rmsL = Math.sqrt(meanSquareLeft);
        double rmsR = Math.sqrt(meanSquareRight);
        double denominator = rmsL + rmsR;
        if (denominator < PAN_EPSILON) {
            return 0.0;
        }
        return Math.max(-1.0, Math.min(1.0, (rmsR - rmsL) / denominator));
    }

    double meanSquareLeft() {
        return meanSquareLeft;
    }

    double meanSquareRight() {
        return meanSquareRight;
    }
}
