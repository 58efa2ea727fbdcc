package com.phillippitts.audiometer.service.dsp;

/**
 * Fixed-size ring of the most recent mono-mix samples, read by spectrum analysis.
 * Oldest samples are overwritten; starts out filled with silence.
 *
 * <p>Not thread-safe; guarded by the owning {@link DspEngine}.
 */
final class AnalysisRing {

    private final double[] buffer;
    private int writePos = 0;

    AnalysisRing(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.buffer = new double[capacity];
    }

    int capacity() {
        return buffer.length;
    }

    /** Appends {@code (left[i] + right[i]) / 2} for every frame. */
    void writeMix(double[] left, double[] right) {
        int len = left.length;
        // Only the tail can survive when the block is longer than the ring
        int start = Math.max(0, len - buffer.length);
        for (int i = start; i < len; i++) {
            buffer[writePos] = (left[i] + right[i]) * 0.5;
            writePos = (writePos + 1) % buffer.length;
        }
    }

    /** @return samples oldest first */
    double[] toArray() {
        double[] out = new double[buffer.length];
        int first = buffer.length - writePos;
        System.arraycopy(buffer, writePos, out, 0, first);
        System.arraycopy(buffer, 0, out, first, writePos);
        return out;
    }
}
