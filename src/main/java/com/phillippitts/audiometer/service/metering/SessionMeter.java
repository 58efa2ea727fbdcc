package com.phillippitts.audiometer.service.metering;

import com.phillippitts.audiometer.domain.MeteringSample;
import com.phillippitts.audiometer.service.dsp.MeterReading;

import java.util.Arrays;

/**
 * Turns engine readings into metering samples for one session.
 *
 * <p>The spectrum of each reading's analysis window is smoothed across ticks with
 * {@code alpha = exp(-interval / integrationTime)}, the same time constant that drives the
 * level meter. A silent window resets the smoothed spectrum to zero.
 *
 * <p>Not thread-safe: owned by the session's metering task, which never overlaps itself.
 */
public final class SessionMeter {

    private final SpectrumAnalyzer analyzer;
    private final double[] smoothed;

    public SessionMeter(SpectrumAnalyzer analyzer) {
        this.analyzer = analyzer;
        this.smoothed = new double[analyzer.bands()];
    }

    /** @return required analysis window length */
    public int windowSize() {
        return analyzer.fftSize();
    }

    public int bins() {
        return smoothed.length;
    }

    /**
     * @param reading         consistent engine snapshot
     * @param intervalSeconds time since the previous tick
     * @return sample to emit
     */
    public MeteringSample tick(MeterReading reading, double intervalSeconds) {
        if (reading.framesProcessed() == 0) {
            return MeteringSample.silent(smoothed.length);
        }
        double[] current = analyzer.analyze(reading.window());
        if (isSilent(current)) {
            Arrays.fill(smoothed, 0.0);
        } else {
            double alpha = Math.exp(-intervalSeconds / reading.integrationTimeSeconds());
            for (int i = 0; i < smoothed.length; i++) {
                smoothed[i] = alpha * smoothed[i] + (1.0 - alpha) * current[i];
            }
        }
        return new MeteringSample(reading.rmsDb(), smoothed, reading.panning());
    }

    private static boolean isSilent(double[] spectrum) {
        for (double v : spectrum) {
            if (v != 0.0) {
                return false;
            }
        }
        return true;
    }
}
