package com.phillippitts.audiometer.domain;

/**
 * Partial change to a session's {@link DspParameters}, as sent by a client.
 * A null field leaves the current value unchanged.
 *
 * @param gainDb                 new gain in dB, or null
 * @param filterEnabled          new filter switch, or null
 * @param cutoffHz               new cutoff in Hz, or null
 * @param integrationTimeSeconds new integration time in seconds, or null
 */
public record ParameterUpdate(
        Double gainDb,
        Boolean filterEnabled,
        Double cutoffHz,
        Double integrationTimeSeconds
) {

    /**
     * @param current parameters in effect
     * @return current parameters with every non-null field of this update applied (unclamped)
     */
    public DspParameters applyTo(DspParameters current) {
        return new DspParameters(
                gainDb != null ? gainDb : current.gainDb(),
                filterEnabled != null ? filterEnabled : current.filterEnabled(),
                cutoffHz != null ? cutoffHz : current.cutoffHz(),
                integrationTimeSeconds != null ? integrationTimeSeconds : current.integrationTimeSeconds());
    }

    public boolean isEmpty() {
        return gainDb == null && filterEnabled == null && cutoffHz == null && integrationTimeSeconds == null;
    }
}
