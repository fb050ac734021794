package com.structural.connector.connect.model;

import lombok.Value;

/**
 * A node lying on a line at parameter {@code t} (0 at Ni, 1 at Nj).
 */
@Value
public class SplitPoint {
    double t;
    int nodeId;
}
