package com.phillippitts.audiometer.service.metering;

import org.jtransforms.fft.DoubleFFT_1D;

/**
 * Magnitude spectrum of an analysis window, grouped into a fixed number of bands.
 *
 * <p>Algorithm:
 * <ol>
 *   <li>Apply a Hann window and run a real FFT</li>
 *   <li>Scale bin magnitudes by {@code 2 / sum(window)} so a full-scale sine reads ≈ 1.0</li>
 *   <li>Group bins 1..N/2 into {@code bands} logarithmically spaced bands (max per band)</li>
 *   <li>Divide by the loudest band; if that band is below {@link #SILENCE_MAGNITUDE}
 *       every band is reported as 0</li>
 * </ol>
 *
 * <p>Not thread-safe: holds a scratch buffer. One instance per session meter.
 */
public final class SpectrumAnalyzer {

    /** Magnitude below which the window counts as silent (-100 dBFS). */
    static final double SILENCE_MAGNITUDE = 1e-5;

    private final int fftSize;
    private final int bands;
    private final DoubleFFT_1D fft;
    private final double[] hann;
    private final double magnitudeScale;
    private final int[] bandLo;
    private final int[] bandHi;
    private final double[] scratch;

    /**
     * @param fftSize window length; power of two, at least 16
     * @param bands   number of output bands; at least 1 and at most {@code fftSize / 2}
     */
    public SpectrumAnalyzer(int fftSize, int bands) {
        if (fftSize < 16 || Integer.bitCount(fftSize) != 1) {
            throw new IllegalArgumentException("fftSize must be a power of two >= 16: " + fftSize);
        }
        if (bands < 1 || bands > fftSize / 2) {
            throw new IllegalArgumentException("bands must be in [1, fftSize/2]: " + bands);
        }
        this.fftSize = fftSize;
        this.bands = bands;
        this.fft = new DoubleFFT_1D(fftSize);
        this.hann = new double[fftSize];
        double windowSum = 0.0;
        for (int i = 0; i < fftSize; i++) {
            hann[i] = 0.5 - 0.5 * Math.cos(2.0 * Math.PI * i / (fftSize - 1));
            windowSum += hann[i];
        }
        this.magnitudeScale = 2.0 / windowSum;
        this.bandLo = new int[bands];
        this.bandHi = new int[bands];
        computeBandEdges();
        this.scratch = new double[fftSize];
    }

    public int fftSize() {
        return fftSize;
    }

    public int bands() {
        return bands;
    }

    /**
     * @param window {@code fftSize} samples, oldest first
     * @return {@code bands} normalized magnitudes in [0, 1]
     */
    public double[] analyze(double[] window) {
        if (window.length != fftSize) {
            throw new IllegalArgumentException(
                    "window length " + window.length + " does not match fftSize " + fftSize);
        }
        for (int i = 0; i < fftSize; i++) {
            scratch[i] = window[i] * hann[i];
        }
        fft.realForward(scratch);

        double[] result = new double[bands];
        double loudest = 0.0;
        for (int b = 0; b < bands; b++) {
            double peak = 0.0;
            for (int k = bandLo[b]; k <= bandHi[b]; k++) {
                peak = Math.max(peak, magnitude(k));
            }
            result[b] = peak;
            loudest = Math.max(loudest, peak);
        }

        if (loudest < SILENCE_MAGNITUDE) {
            return new double[bands];
        }
        for (int b = 0; b < bands; b++) {
            result[b] = Math.min(1.0, result[b] / loudest);
        }
        return result;
    }

    /** Magnitude of bin k (1..N/2) in the packed realForward layout. */
    private double magnitude(int k) {
        int half = fftSize / 2;
        if (k == half) {
            return Math.abs(scratch[1]) * magnitudeScale;
        }
        double re = scratch[2 * k];
        double im = scratch[2 * k + 1];
        return Math.sqrt(re * re + im * im) * magnitudeScale;
    }

    private void computeBandEdges() {
        int maxBin = fftSize / 2;
        double ratio = Math.log(maxBin);
        for (int b = 0; b < bands; b++) {
            int lo = (int) Math.floor(Math.exp(ratio * b / bands));
            int hi = (int) Math.floor(Math.exp(ratio * (b + 1) / bands)) - 1;
            lo = Math.max(1, Math.min(maxBin, lo));
            hi = Math.max(lo, Math.min(maxBin, hi));
            bandLo[b] = lo;
            bandHi[b] = hi;
        }
        bandHi[bands - 1] = maxBin;
    }
}
