package com.structural.connector.connect.model;

import lombok.Value;

/**
 * Straight connector between two nodes, referenced by id.
 */
@Value
public class Line {
    int id;
    int ni;
    int nj;
}
