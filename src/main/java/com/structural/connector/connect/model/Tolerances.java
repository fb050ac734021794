package com.structural.connector.connect.model;

import lombok.Value;

/**
 * Geometric tolerance and the elevation tolerance used to decide whether two
 * lines lie on the same story.
 */
@Value
public class Tolerances {

    public static final double DEFAULT_TOLERANCE = 1e-6;

    /** Coordinate, collinearity and parametric comparisons. */
    double tolerance;

    /** Maximum difference between two lines' average elevations. */
    double elevationTolerance;

    public static Tolerances of(double tolerance) {
        return new Tolerances(tolerance, defaultElevationTolerance(tolerance));
    }

    public static Tolerances defaults() {
        return of(DEFAULT_TOLERANCE);
    }

    /**
     * Ten times the geometric tolerance, never tighter than the tolerance itself.
     */
    public static double defaultElevationTolerance(double tolerance) {
        return Math.max(tolerance, 10.0 * tolerance);
    }

    public boolean sameElevation(double z1, double z2) {
        return Math.abs(z1 - z2) <= elevationTolerance;
    }
}
