package com.sashkomusic.keytagger.domain.model;

import java.util.Arrays;

public final class FeatureVector {

    public static final int DIMENSIONS = 12;

    private final double[] values;

    private FeatureVector(double[] values) {
        this.values = values;
    }

    public static FeatureVector normalized(double... raw) {
        if (raw == null || raw.length != DIMENSIONS) {
            throw new IllegalArgumentException("Feature vector needs " + DIMENSIONS + " values, got "
                    + (raw == null ? "null" : raw.length));
        }

        double sumOfSquares = 0;
        for (double v : raw) {
            if (v < 0 || Double.isNaN(v) || Double.isInfinite(v)) {
                throw new IllegalArgumentException("Feature vector values must be finite and non-negative: "
                        + Arrays.toString(raw));
            }
            sumOfSquares += v * v;
        }

        double norm = Math.sqrt(sumOfSquares);
        if (norm == 0) {
            throw new IllegalArgumentException("Feature vector has no energy");
        }

        double[] scaled = new double[DIMENSIONS];
        for (int i = 0; i < DIMENSIONS; i++) {
            scaled[i] = raw[i] / norm;
        }
        return new FeatureVector(scaled);
    }

    /**
     * Copy shifted right by {@code steps} positions, so that index 0 moves to {@code steps}.
     */
    public FeatureVector rotate(int steps) {
        double[] rotated = new double[DIMENSIONS];
        for (int i = 0; i < DIMENSIONS; i++) {
            rotated[Math.floorMod(i + steps, DIMENSIONS)] = values[i];
        }
        return new FeatureVector(rotated);
    }

    public double dot(FeatureVector other) {
        double sum = 0;
        for (int i = 0; i < DIMENSIONS; i++) {
            sum += values[i] * other.values[i];
        }
        return sum;
    }

    public double get(int pitchClass) {
        return values[pitchClass];
    }

    public double[] toArray() {
        return values.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FeatureVector that)) return false;
        return Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "FeatureVector" + Arrays.toString(values);
    }
}
