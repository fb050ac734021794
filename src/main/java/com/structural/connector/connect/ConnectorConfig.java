package com.structural.connector.connect;

import java.nio.file.Path;

import com.structural.connector.connect.model.Tolerances;

import lombok.Builder;
import lombok.Data;

/**
 * Configuration for one connection run.
 */
@Data
@Builder
public class ConnectorConfig {
    private Path inputFile;
    private Path outputFile;
    private Path reportFile;

    @Builder.Default
    private double tolerance = Tolerances.DEFAULT_TOLERANCE;

    /**
     * Null means {@link Tolerances#defaultElevationTolerance(double)}.
     */
    private Double elevationTolerance;

    private boolean mergeDuplicateNodes;

    // Solver round trip
    private Path sectionResultsFile;
    private Path updatedExportFile;

    /**
     * Section name written to every member of the updated export; null leaves
     * the exported sections alone.
     */
    private String sectionOverride;

    public Tolerances getTolerances() {
        double elevation = elevationTolerance != null
                ? elevationTolerance
                : Tolerances.defaultElevationTolerance(tolerance);
        return new Tolerances(tolerance, elevation);
    }

    public boolean hasSectionResults() {
        return sectionResultsFile != null;
    }

    public boolean writesUpdatedExport() {
        return updatedExportFile != null;
    }
}
