package com.structural.connector.connect.geometry;

import lombok.Value;

/**
 * Immutable 2D vector in plan.
 */
@Value
public class PlanVector {
    double x;
    double y;

    /**
     * Vector from point a to point b.
     */
    public static PlanVector between(PlanPoint a, PlanPoint b) {
        return new PlanVector(b.getX() - a.getX(), b.getY() - a.getY());
    }

    public double dot(PlanVector other) {
        return x * other.x + y * other.y;
    }

    /**
     * 2D cross product (returns scalar).
     */
    public double cross(PlanVector other) {
        return x * other.y - y * other.x;
    }

    public double lengthSquared() {
        return x * x + y * y;
    }
}
