package com.structural.connector.cli.model;

import java.nio.file.Path;

import com.structural.connector.connect.model.Tolerances;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps ConnectCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedConnectOptions {
    Path inputFile;
    Path outputFile;
    Path reportFile;
    Path sectionResultsFile;
    Path updatedExportFile;
    Tolerances tolerances;
}
