package com.structural.connector.connect.geometry;

import com.structural.connector.connect.model.Node;

import lombok.Value;

/**
 * Plan (XY) projection of a node.
 */
@Value
public class PlanPoint {
    double x;
    double y;

    public static PlanPoint of(Node node) {
        return new PlanPoint(node.getX(), node.getY());
    }
}
