package com.phillippitts.audiometer.domain;

import java.util.Arrays;
import java.util.Objects;

/**
 * One metering report sent back to a session.
 *
 * @param rmsDb    smoothed RMS level in dBFS, never below {@link #FLOOR_DB}
 * @param spectrum normalized band magnitudes in [0, 1]
 * @param panning  stereo balance in [-1, 1]; negative is left
 */
public record MeteringSample(double rmsDb, double[] spectrum, double panning) {

    /** Lowest reportable level; silence is reported as this value. */
    public static final double FLOOR_DB = -100.0;

    public MeteringSample {
        Objects.requireNonNull(spectrum, "spectrum must not be null");
        if (Double.isNaN(rmsDb) || rmsDb < FLOOR_DB) {
            rmsDb = FLOOR_DB;
        }
        if (Double.isNaN(panning)) {
            panning = 0.0;
        }
        panning = Math.max(-1.0, Math.min(1.0, panning));
        spectrum = spectrum.clone();
    }

    /**
     * @param bins spectrum band count
     * @return floor level, empty spectrum, centered panning
     */
    public static MeteringSample silent(int bins) {
        return new MeteringSample(FLOOR_DB, new double[bins], 0.0);
    }

    @Override
    public double[] spectrum() {
        return spectrum.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MeteringSample other)) {
            return false;
        }
        return Double.compare(rmsDb, other.rmsDb) == 0
                && Double.compare(panning, other.panning) == 0
                && Arrays.equals(spectrum, other.spectrum);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(rmsDb, panning) + Arrays.hashCode(spectrum);
    }

    @Override
    public String toString() {
        return "MeteringSample[rmsDb=" + rmsDb + ", bins=" + spectrum.length + ", panning=" + panning + "]";
    }
}
