package com.structural.connector.connect.geometry;

import lombok.Value;

/**
 * Plan intersection of two segments p1-p2 and q1-q2. {@code t} runs along p,
 * {@code u} along q, both clamped to [0, 1].
 */
@Value
public class SegmentHit {
    double x;
    double y;
    double t;
    double u;
}
