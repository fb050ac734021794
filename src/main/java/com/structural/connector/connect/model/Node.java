package com.structural.connector.connect.model;

import lombok.Value;

/**
 * A point of the structural graph. Identity is the id; coordinates are never
 * changed after creation.
 */
@Value
public class Node {
    int id;
    double x;
    double y;
    double z;
}
