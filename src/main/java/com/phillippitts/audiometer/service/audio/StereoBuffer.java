package com.phillippitts.audiometer.service.audio;

import java.util.Objects;

/**
 * De-interleaved stereo block of normalized samples.
 *
 * <p>Both channels always hold the same number of frames. The arrays are owned by the
 * buffer; processors may mutate them in place.
 */
public final class StereoBuffer {

    private final double[] left;
    private final double[] right;

    public StereoBuffer(double[] left, double[] right) {
        Objects.requireNonNull(left, "left must not be null");
        Objects.requireNonNull(right, "right must not be null");
        if (left.length != right.length) {
            throw new IllegalArgumentException(
                    "Channel length mismatch: left=" + left.length + ", right=" + right.length);
        }
        this.left = left;
        this.right = right;
    }

    public static StereoBuffer allocate(int frames) {
        return new StereoBuffer(new double[frames], new double[frames]);
    }

    public double[] left() {
        return left;
    }

    public double[] right() {
        return right;
    }

    public int frames() {
        return left.length;
    }

    /** @return deep copy with independent arrays */
    public StereoBuffer copy() {
        return new StereoBuffer(left.clone(), right.clone());
    }
}
