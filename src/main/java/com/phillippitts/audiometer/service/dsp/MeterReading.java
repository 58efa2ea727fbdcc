package com.phillippitts.audiometer.service.dsp;

/**
 * Consistent copy of a {@link DspEngine}'s metering state, taken under its lock.
 *
 * @param rmsDb                  smoothed level in dBFS
 * @param panning                smoothed stereo balance
 * @param window                 latest mono-mix samples, oldest first (owned by the reading)
 * @param integrationTimeSeconds integration time in effect
 * @param framesProcessed        total frames processed since the engine was created
 */
public record MeterReading(
        double rmsDb,
        double panning,
        double[] window,
        double integrationTimeSeconds,
        long framesProcessed
) {
}
