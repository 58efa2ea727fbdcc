package com.phillippitts.audiometer.service.dsp;

import com.phillippitts.audiometer.domain.DspParameters;
import com.phillippitts.audiometer.service.audio.StereoBuffer;

import java.util.Objects;

/**
 * Per-session processing pipeline: gain, low-pass filter, metering accumulation.
 *
 * <p>Each {@link #process(StereoBuffer)} call consumes one frame block and advances all
 * state by exactly that many samples, in this order:
 * <ol>
 *   <li>Gain by {@code 10^(dB/20)}, then hard clip to [-1, 1]</li>
 *   <li>Butterworth low-pass; the filter runs even while disabled so its delay line
 *       always reflects the live signal</li>
 *   <li>Level and analysis-window accumulation on the post-filter signal</li>
 * </ol>
 *
 * <p>The output is {@code raw + (filtered - raw) * mix}. On a toggle, {@code mix} moves
 * toward 1 (enabled) or 0 (disabled) by {@code 1 / TOGGLE_RAMP_FRAMES} per frame, starting
 * from wherever it currently is, so a toggle during a ramp or an on/off pair between two
 * blocks never jumps. Cutoff changes only swap coefficients.
 *
 * <p><b>Thread Safety:</b> ingestion and metering reads may run on different threads;
 * every method synchronizes on the engine so {@link #read()} sees a consistent state.
 */
public final class DspEngine {

    /** Frames over which an enable/disable toggle crossfades. */
    public static final int TOGGLE_RAMP_FRAMES = 256;

    private final int sampleRate;
    private final ButterworthLowPass filter;
    private final LevelMeter levels = new LevelMeter();
    private final AnalysisRing window;

    private DspParameters params;
    private double linearGain;
    private double filterMix;
    private long framesProcessed;

    /**
     * @param sampleRate   session sample rate in Hz
     * @param initial      starting parameters (clamped before use)
     * @param analysisSize analysis window length for spectrum estimation
     */
    public DspEngine(int sampleRate, DspParameters initial, int analysisSize) {
        if (sampleRate <= 0) {
            throw new IllegalArgumentException("sampleRate must be positive: " + sampleRate);
        }
        Objects.requireNonNull(initial, "initial parameters must not be null");
        this.sampleRate = sampleRate;
        this.params = initial.clamped(sampleRate);
        this.linearGain = params.linearGain();
        this.filterMix = params.filterEnabled() ? 1.0 : 0.0;
        this.filter = new ButterworthLowPass(params.cutoffHz(), sampleRate);
        this.window = new AnalysisRing(analysisSize);
    }

    /**
     * Applies new parameters from the next processed block on.
     *
     * @param requested client-supplied parameters
     * @return the clamped parameters actually in effect
     */
    public synchronized DspParameters configure(DspParameters requested) {
        Objects.requireNonNull(requested, "requested parameters must not be null");
        DspParameters applied = requested.clamped(sampleRate);
        filter.configure(applied.cutoffHz(), sampleRate);
        linearGain = applied.linearGain();
        params = applied;
        return applied;
    }

    /**
     * Processes one block. The input buffer is not modified.
     *
     * @param input decoded stereo block
     * @return processed block of the same length
     */
    public synchronized StereoBuffer process(StereoBuffer input) {
        int frames = input.frames();
        double[] inL = input.left();
        double[] inR = input.right();
        StereoBuffer output = StereoBuffer.allocate(frames);
        double[] outL = output.left();
        double[] outR = output.right();
        double targetMix = params.filterEnabled() ? 1.0 : 0.0;
        double step = 1.0 / TOGGLE_RAMP_FRAMES;
        boolean silentInput = true;

        for (int i = 0; i < frames; i++) {
            double rawL = clip(inL[i] * linearGain);
            double rawR = clip(inR[i] * linearGain);
            double filteredL = filter.step(0, rawL);
            double filteredR = filter.step(1, rawR);
            if (rawL != 0.0 || rawR != 0.0) {
                silentInput = false;
            }

            if (filterMix < targetMix) {
                filterMix = Math.min(targetMix, filterMix + step);
            } else if (filterMix > targetMix) {
                filterMix = Math.max(targetMix, filterMix - step);
            }
            if (filterMix == 1.0) {
                outL[i] = filteredL;
                outR[i] = filteredR;
            } else if (filterMix == 0.0) {
                outL[i] = rawL;
                outR[i] = rawR;
            } else {
                outL[i] = rawL + (filteredL - rawL) * filterMix;
                outR[i] = rawR + (filteredR - rawR) * filterMix;
            }
        }

        // Silence is judged on the pre-filter signal
        levels.accumulate(outL, outR, sampleRate, params.integrationTimeSeconds(), silentInput);
        window.writeMix(outL, outR);
        framesProcessed += frames;
        return output;
    }

    /** @return consistent copy of the metering state */
    public synchronized MeterReading read() {
        return new MeterReading(
                levels.rmsDb(),
                levels.panning(),
                window.toArray(),
                params.integrationTimeSeconds(),
                framesProcessed);
    }

    public synchronized DspParameters parameters() {
        return params;
    }

    public int sampleRate() {
        return sampleRate;
    }

    public synchronized long framesProcessed() {
        return framesProcessed;
    }

    /** Visible for tests. */
    synchronized double filterMix() {
        return filterMix;
    }

    /** Visible for tests. */
    synchronized double[][][] filterState() {
        return filter.stateSnapshot();
    }

    private static double clip(double v) {
        return Math.max(-1.0, Math.min(1.0, v));
    }
}
