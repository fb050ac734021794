package com.structural.connector.connect.service;

import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.structural.connector.connect.model.Line;
import com.structural.connector.connect.model.ModelIntegrityException;
import com.structural.connector.connect.model.Node;

/**
 * Working copy of the node collection for one connection pass.
 *
 * Owns the node id counter: synthetic nodes get ascending ids starting at
 * max(input ids) + 1, in the order they are discovered.
 */
public class NodeRegistry {

    private static final Logger log = LoggerFactory.getLogger(NodeRegistry.class);

    private final Map<Integer, Node> nodes;
    private final double tolerance;
    private int nextNodeId;
    private int createdCount;

    public NodeRegistry(Map<Integer, Node> inputNodes, double tolerance) {
        this.nodes = new LinkedHashMap<>(inputNodes);
        this.tolerance = tolerance;
        this.nextNodeId = nodes.keySet().stream().mapToInt(Integer::intValue).max().orElse(0) + 1;
    }

    /**
     * Returns the id of a node within tolerance of (x, y, z) on every axis,
     * creating one when none exists.
     */
    public int findOrCreateNode(double x, double y, double z) {
        for (Node node : nodes.values()) {
            if (Math.abs(node.getX() - x) <= tolerance
                    && Math.abs(node.getY() - y) <= tolerance
                    && Math.abs(node.getZ() - z) <= tolerance) {
                return node.getId();
            }
        }

        int id = nextNodeId++;
        nodes.put(id, new Node(id, x, y, z));
        createdCount++;
        log.debug("Created intersection node {} at ({}, {}, {})", id, x, y, z);
        return id;
    }

    public Node start(Line line) {
        return requireFor(line, line.getNi());
    }

    public Node end(Line line) {
        return requireFor(line, line.getNj());
    }

    /**
     * Mean elevation of the line's two endpoints.
     */
    public double averageElevation(Line line) {
        return (start(line).getZ() + end(line).getZ()) * 0.5;
    }

    public Map<Integer, Node> getNodes() {
        return nodes;
    }

    public int getCreatedCount() {
        return createdCount;
    }

    private Node requireFor(Line line, int nodeId) {
        Node node = nodes.get(nodeId);
        if (node == null) {
            throw new ModelIntegrityException("Line " + line.getId() + " references missing node " + nodeId);
        }
        return node;
    }
}
