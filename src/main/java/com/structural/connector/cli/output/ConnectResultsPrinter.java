package com.structural.connector.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.structural.connector.cli.model.ConnectOptions;
import com.structural.connector.cli.model.ValidatedConnectOptions;
import com.structural.connector.connect.ConnectorResult;

/**
 * Responsible only for printing CLI output for the "connect" command.
 * No validation, no execution.
 */
public class ConnectResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(ConnectResultsPrinter.class);

    public void printBanner(ConnectOptions o, ValidatedConnectOptions v) {
        log.info("=================================================");
        log.info("Structural Graph Connector");
        log.info("=================================================");
        log.info("Input Export: {}", v.getInputFile());
        log.info("Output File: {}", v.getOutputFile());
        log.info("Tolerance: {}", v.getTolerances().getTolerance());
        log.info("Elevation Tolerance: {}", v.getTolerances().getElevationTolerance());
        log.info("Merge Duplicate Nodes: {}", o.isMergeDuplicateNodes());
        log.info("Lineage Report: {}", v.getReportFile() != null ? v.getReportFile() : "None");

        if (v.getSectionResultsFile() != null || v.getUpdatedExportFile() != null) {
            log.info("-------------------------------------------------");
            log.info("Solver Round Trip:");
            log.info("  Section Results: {}", v.getSectionResultsFile() != null ? v.getSectionResultsFile() : "None");
            log.info("  Section Override: {}", o.getSectionOverride() != null ? o.getSectionOverride() : "None");
            log.info("  Updated Export:  {}", v.getUpdatedExportFile() != null ? v.getUpdatedExportFile() : "None");
        }

        log.info("=================================================");
    }

    public void printSuccess(ValidatedConnectOptions v, ConnectorResult result) {
        log.info("");
        log.info("=================================================");
        log.info("CONNECTION SUCCESSFUL");
        log.info("=================================================");
        log.info("Output Path: {}", result.getOutputPath());
        log.info("Input: {} nodes, {} lines ({} members skipped)",
                result.getInputNodes(), result.getInputLines(), result.getSkippedMembers());
        if (result.getNodesPerElevation() != null) {
            result.getNodesPerElevation().forEach((z, count) -> log.info("  Elevation {}: {} nodes", z, count));
        }
        if (result.getMergedNodes() > 0) {
            log.info("Duplicate Nodes Merged: {}", result.getMergedNodes());
        }
        log.info("Output: {} nodes, {} lines, {} members",
                result.getOutputNodes(), result.getOutputLines(), result.getOutputMembers());
        log.info("Mothers Split: {}", result.getSplitMothers());
        log.info("Child Lines Created: {}", result.getChildLines());

        if (v.getSectionResultsFile() != null) {
            log.info("");
            log.info("Solver Round Trip Summary:");
            log.info("  Mothers Governed: {}", result.getGovernedMothers());
            log.info("  Mothers Without Results: {}", result.getUnmatchedMothers());
        }
        if (result.getUpdatedExportPath() != null) {
            log.info("");
            log.info("Updated Export: {}", result.getUpdatedExportPath());
            log.info("  Members Overridden: {}", result.getOverriddenMembers());
            log.info("  Children Updated: {}", result.getAppliedChildren());
            log.info("  Mothers Updated: {}", result.getUpdatedMothers());
        }

        if (result.getReportPath() != null) {
            log.info("");
            log.info("Lineage Report: {}", result.getReportPath());
        }
        log.info("=================================================");
    }

    public void printFailure(ConnectorResult result) {
        log.error("Connection failed: {}", result.getErrorMessage());
    }
}
