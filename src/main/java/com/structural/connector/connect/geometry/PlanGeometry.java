package com.structural.connector.connect.geometry;

import java.util.Optional;

import lombok.experimental.UtilityClass;

/**
 * Segment math on the plan projection. All comparisons are absolute against
 * the caller's tolerance.
 */
@UtilityClass
public class PlanGeometry {

    public static double crossSign(PlanVector u, PlanVector v) {
        return u.cross(v);
    }

    /**
     * Intersects segment p1-p2 with q1-q2.
     *
     * Touching endpoints count: parameters within [-tol, 1+tol] are accepted and
     * clamped to [0, 1]. Parallel segments (|determinant| <= tol) and results
     * with non-finite coordinates yield empty.
     */
    public static Optional<SegmentHit> intersectSegmentsXY(PlanPoint p1, PlanPoint p2,
                                                           PlanPoint q1, PlanPoint q2,
                                                           double tol) {
        PlanVector dp = PlanVector.between(p1, p2);
        PlanVector dq = PlanVector.between(q1, q2);
        double den = crossSign(dp, dq);
        if (Math.abs(den) <= tol) {
            return Optional.empty();
        }

        PlanVector r = PlanVector.between(p1, q1);
        double t = crossSign(r, dq) / den;
        double u = crossSign(r, dp) / den;
        if (t < -tol || t > 1 + tol || u < -tol || u > 1 + tol) {
            return Optional.empty();
        }
        t = clamp01(t);
        u = clamp01(u);

        double xi = p1.getX() + t * dp.getX();
        double yi = p1.getY() + t * dp.getY();
        if (!Double.isFinite(xi) || !Double.isFinite(yi)) {
            return Optional.empty();
        }
        return Optional.of(new SegmentHit(xi, yi, t, u));
    }

    /**
     * True when the signed area of triangle abc is within tolerance of zero.
     */
    public static boolean collinearXY(PlanPoint a, PlanPoint b, PlanPoint c, double tol) {
        return Math.abs(crossSign(PlanVector.between(a, b), PlanVector.between(a, c))) <= tol;
    }

    /**
     * Projection parameter of p on a-b; 0 for a degenerate segment.
     */
    public static double paramOnSegmentXY(PlanPoint a, PlanPoint b, PlanPoint p) {
        PlanVector ab = PlanVector.between(a, b);
        double denom = ab.lengthSquared();
        if (denom == 0.0) {
            return 0.0;
        }
        return PlanVector.between(a, p).dot(ab) / denom;
    }

    public static boolean pointOnSegmentXY(PlanPoint a, PlanPoint b, PlanPoint p, double tol) {
        if (!collinearXY(a, b, p, tol)) {
            return false;
        }
        double t = paramOnSegmentXY(a, b, p);
        return t >= -tol && t <= 1.0 + tol;
    }

    private static double clamp01(double value) {
        return Math.min(Math.max(value, 0.0), 1.0);
    }
}
