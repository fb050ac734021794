package com.structural.connector.connect;

import java.nio.file.Path;
import java.util.Map;

import lombok.Builder;
import lombok.Data;

/**
 * Result of a connection run.
 */
@Data
@Builder
public class ConnectorResult {
    private boolean success;
    private String errorMessage;
    private Path outputPath;
    private Path reportPath;
    private Path updatedExportPath;

    private int inputNodes;
    private int inputLines;
    /** Input node count per elevation, lowest first. */
    private Map<Double, Integer> nodesPerElevation;
    private int skippedMembers;
    private int mergedNodes;

    private int outputNodes;
    private int outputLines;
    private int outputMembers;
    private int splitMothers;
    private int childLines;

    // Solver round trip
    private int governedMothers;
    private int unmatchedMothers;
    private int appliedChildren;
    private int updatedMothers;
    private int overriddenMembers;

    public static ConnectorResult failure(String errorMessage) {
        return ConnectorResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }
}
