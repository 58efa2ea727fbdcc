package com.phillippitts.audiometer.domain;

/**
 * User-adjustable processing parameters for one session.
 *
 * <p>Values arrive straight from clients, so the record itself accepts anything;
 * {@link #clamped(int)} produces the copy the engine actually applies.
 *
 * @param gainDb                 gain in decibels, applied before the filter
 * @param filterEnabled          whether the low-pass output is used
 * @param cutoffHz               low-pass cutoff frequency in Hz
 * @param integrationTimeSeconds smoothing time constant for metering
 */
public record DspParameters(
        double gainDb,
        boolean filterEnabled,
        double cutoffHz,
        double integrationTimeSeconds
) {

    public static final double MIN_GAIN_DB = 0.0;
    public static final double MAX_GAIN_DB = 60.0;
    public static final double MIN_CUTOFF_HZ = 20.0;
    /** Upper cutoff bound as a fraction of the sample rate (kept below Nyquist). */
    public static final double MAX_CUTOFF_RATIO = 0.45;
    public static final double MIN_INTEGRATION_SECONDS = 0.01;
    public static final double MAX_INTEGRATION_SECONDS = 10.0;

    /** 0 dB, filter off, 1 kHz cutoff, 0.5 s integration. */
    public static final DspParameters DEFAULTS = new DspParameters(0.0, false, 1000.0, 0.5);

    /**
     * Returns a copy with every field forced into its valid range for the given
     * sample rate. Non-finite values fall back to {@link #DEFAULTS}.
     *
     * @param sampleRate session sample rate in Hz
     * @return clamped parameters (may be {@code this} when already valid)
     */
    public DspParameters clamped(int sampleRate) {
        double maxCutoff = Math.max(MIN_CUTOFF_HZ, sampleRate * MAX_CUTOFF_RATIO);
        DspParameters result = new DspParameters(
                clamp(gainDb, MIN_GAIN_DB, MAX_GAIN_DB, DEFAULTS.gainDb),
                filterEnabled,
                clamp(cutoffHz, MIN_CUTOFF_HZ, maxCutoff, Math.min(DEFAULTS.cutoffHz, maxCutoff)),
                clamp(integrationTimeSeconds, MIN_INTEGRATION_SECONDS, MAX_INTEGRATION_SECONDS,
                        DEFAULTS.integrationTimeSeconds));
        return result.equals(this) ? this : result;
    }

    /**
     * @param sampleRate session sample rate in Hz
     * @return true if {@link #clamped(int)} would change nothing
     */
    public boolean isWithinBounds(int sampleRate) {
        return clamped(sampleRate) == this;
    }

    /** @return linear amplitude factor for {@link #gainDb} */
    public double linearGain() {
        return Math.pow(10.0, gainDb / 20.0);
    }

    private static double clamp(double v, double lo, double hi, double fallback) {
        if (!Double.isFinite(v)) {
            return fallback;
        }
        return Math.max(lo, Math.min(hi, v));
    }
}
