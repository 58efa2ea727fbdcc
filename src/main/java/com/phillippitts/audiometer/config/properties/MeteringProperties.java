package com.phillippitts.audiometer.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for metering emission and spectrum analysis.
 */
@Validated
@ConfigurationProperties(prefix = "metering")
public class MeteringProperties {

    /** Wall-clock interval between metering messages, in milliseconds. */
    @Min(10)
    @Max(1000)
    private final int intervalMs;

    /** Number of spectrum bands reported per metering message. */
    @Min(8)
    @Max(512)
    private final int spectrumBins;

    /** Analysis window length for the spectrum (power of two). */
    @Min(256)
    @Max(16384)
    private final int fftSize;

    @ConstructorBinding
    public MeteringProperties(Integer intervalMs, Integer spectrumBins, Integer fftSize) {
        this.intervalMs = intervalMs == null ? 50 : intervalMs;
        this.spectrumBins = spectrumBins == null ? 64 : spectrumBins;
        this.fftSize = fftSize == null ? 2048 : fftSize;
        if (Integer.bitCount(this.fftSize) != 1) {
            throw new IllegalArgumentException("metering.fft-size must be a power of two: " + this.fftSize);
        }
    }

    public int getIntervalMs() { return intervalMs; }
    public int getSpectrumBins() { return spectrumBins; }
    public int getFftSize() { return fftSize; }
}
