package com.structural.connector.connect;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.structural.connector.connect.model.ConnectionResult;
import com.structural.connector.connect.model.GoverningSelection;
import com.structural.connector.connect.model.SectionResults;
import com.structural.connector.connect.model.StructuralModel;
import com.structural.connector.connect.model.Tolerances;
import com.structural.connector.connect.service.DuplicateNodeMerger;
import com.structural.connector.connect.service.GoverningSectionReducer;
import com.structural.connector.connect.service.IntersectionConnector;
import com.structural.connector.io.AnalyticalModelReader;
import com.structural.connector.io.ConnectionResultWriter;
import com.structural.connector.io.SectionResultsReader;
import com.structural.connector.io.SectionWriteBack;
import com.structural.connector.report.LineageReportWriter;

/**
 * Runs a full connection: read the export, optionally merge duplicate nodes,
 * connect intersecting lines, write the result, and optionally reduce solver
 * sections back onto the mother members.
 */
public class ConnectionPipeline {
    private static final Logger log = LoggerFactory.getLogger(ConnectionPipeline.class);

    private final ConnectorConfig config;
    private final AnalyticalModelReader modelReader = new AnalyticalModelReader();
    private final IntersectionConnector connector = new IntersectionConnector();
    private final ConnectionResultWriter resultWriter = new ConnectionResultWriter();
    private final LineageReportWriter reportWriter = new LineageReportWriter();

    public ConnectionPipeline(ConnectorConfig config) {
        this.config = config;
    }

    public ConnectorResult run() {
        try {
            log.info("Starting connection run...");
            Tolerances tolerances = config.getTolerances();

            // Step 1: Read export
            log.info("Step 1: Reading analytical model from {}...", config.getInputFile());
            StructuralModel model = modelReader.read(config.getInputFile());
            int inputNodes = model.getNodes().size();
            int inputLines = model.getLines().size();
            Map<Double, Integer> nodesPerElevation = countNodesPerElevation(model);

            // Step 2: Merge duplicate nodes
            int mergedNodes = 0;
            if (config.isMergeDuplicateNodes()) {
                log.info("Step 2: Merging duplicate nodes...");
                mergedNodes = new DuplicateNodeMerger().merge(model);
            }

            // Step 3: Connect
            log.info("Step 3: Connecting lines (tolerance={}, elevation tolerance={})...",
                    tolerances.getTolerance(), tolerances.getElevationTolerance());
            ConnectionResult result = connector.connect(model.getNodes(), model.getLines(), model.getMembers(),
                    tolerances);

            // Step 4: Write result
            log.info("Step 4: Writing connected model to {}...", config.getOutputFile());
            resultWriter.write(config.getOutputFile(), result, model.getCrossSections(), tolerances);

            ConnectorResult.ConnectorResultBuilder summary = ConnectorResult.builder()
                    .success(true)
                    .outputPath(config.getOutputFile())
                    .inputNodes(inputNodes)
                    .inputLines(inputLines)
                    .nodesPerElevation(nodesPerElevation)
                    .skippedMembers(modelReader.getSkippedCount())
                    .mergedNodes(mergedNodes)
                    .outputNodes(result.getNodes().size())
                    .outputLines(result.getLines().size())
                    .outputMembers(result.getMembers().size())
                    .splitMothers(result.splitMotherCount())
                    .childLines(result.getLines().size() - (model.getLines().size() - result.splitMotherCount()));

            // Step 5: Reduce solver sections
            GoverningSelection selection = null;
            SectionResults sectionResults = null;
            if (config.hasSectionResults()) {
                log.info("Step 5: Reducing solver sections from {}...", config.getSectionResultsFile());
                sectionResults = new SectionResultsReader().read(config.getSectionResultsFile());
                selection = new GoverningSectionReducer().reduce(result.getMotherToChildren(), sectionResults);
                summary.governedMothers(selection.getGoverningByMother().size())
                        .unmatchedMothers(selection.getUnmatchedMothers().size());
                if (!selection.getUnmatchedMothers().isEmpty()) {
                    log.warn("Mothers with no children found in solver output (count={})",
                            selection.getUnmatchedMothers().size());
                }
            }

            // Step 5.5: Updated export
            if (config.writesUpdatedExport()) {
                log.info("Step 5.5: Writing updated export to {}...", config.getUpdatedExportFile());
                SectionWriteBack.Summary writeBack = new SectionWriteBack().apply(config.getInputFile(),
                        config.getUpdatedExportFile(), config.getSectionOverride(), sectionResults, selection);
                summary.updatedExportPath(config.getUpdatedExportFile())
                        .overriddenMembers(writeBack.getOverriddenMembers())
                        .appliedChildren(writeBack.getAppliedChildren())
                        .updatedMothers(writeBack.getUpdatedMothers());
            }

            // Step 6: Report
            if (config.getReportFile() != null) {
                log.info("Step 6: Writing lineage report to {}...", config.getReportFile());
                reportWriter.write(config.getReportFile(), result, tolerances, selection);
                summary.reportPath(config.getReportFile());
            }

            log.info("Connection run complete!");
            return summary.build();

        } catch (Exception e) {
            log.error("Connection run failed", e);
            return ConnectorResult.failure(e.getMessage());
        }
    }

    private static Map<Double, Integer> countNodesPerElevation(StructuralModel model) {
        Map<Double, Integer> counts = new LinkedHashMap<>();
        for (double z : model.elevations()) {
            List<Integer> ids = model.nodeIdsAtElevation(z);
            counts.put(z, ids.size());
            log.debug("Elevation {}: nodes {}", z, ids);
        }
        log.info("Model spans {} elevations", counts.size());
        return counts;
    }
}
