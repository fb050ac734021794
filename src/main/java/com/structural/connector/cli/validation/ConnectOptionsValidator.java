package com.structural.connector.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.structural.connector.cli.exception.OptionsValidationException;
import com.structural.connector.cli.model.ConnectOptions;
import com.structural.connector.cli.model.ValidatedConnectOptions;
import com.structural.connector.connect.model.Tolerances;

public class ConnectOptionsValidator {

	public ValidatedConnectOptions validate(ConnectOptions o) {
		List<String> errors = new ArrayList<>();

		if (o.getInput() == null) {
			errors.add("Input export is required (--input / -i).");
		} else if (!existsFile(o.getInput())) {
			errors.add("Input export does not exist or is not a file: " + o.getInput());
		}

		if (o.getOutput() == null) {
			errors.add("Output file is required (--output / -o).");
		}

		if (!Double.isFinite(o.getTolerance()) || o.getTolerance() <= 0) {
			errors.add("Tolerance must be a positive number. Got: " + o.getTolerance());
		}
		if (o.getElevationTolerance() != null
				&& (!Double.isFinite(o.getElevationTolerance()) || o.getElevationTolerance() < 0)) {
			errors.add("Elevation tolerance must be >= 0. Got: " + o.getElevationTolerance());
		}

		if (o.getSectionResults() != null && !existsFile(o.getSectionResults())) {
			errors.add("Section results file does not exist or is not a file: " + o.getSectionResults());
		}
		if (o.getUpdatedExport() != null && o.getSectionResults() == null && o.getSectionOverride() == null) {
			errors.add("--updated-export requires --section-results or --section-override.");
		}
		if (o.getSectionOverride() != null && o.getUpdatedExport() == null) {
			errors.add("--section-override requires --updated-export.");
		}

		Path outputFile = normalize(o.getOutput());
		Path reportFile = normalize(o.getReport());
		Path updatedExportFile = normalize(o.getUpdatedExport());

		rejectExisting(outputFile, "Output file", o.isForce(), errors);
		rejectExisting(reportFile, "Report file", o.isForce(), errors);
		rejectExisting(updatedExportFile, "Updated export file", o.isForce(), errors);

		Path inputFile = normalize(o.getInput());
		if (inputFile != null && (inputFile.equals(outputFile) || inputFile.equals(updatedExportFile))) {
			errors.add("Output files must not overwrite the input export: " + inputFile);
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		double elevationTolerance = o.getElevationTolerance() != null ? o.getElevationTolerance()
				: Tolerances.defaultElevationTolerance(o.getTolerance());
		return new ValidatedConnectOptions(inputFile, outputFile, reportFile, normalize(o.getSectionResults()),
				updatedExportFile, new Tolerances(o.getTolerance(), elevationTolerance));
	}

	private static boolean existsFile(Path p) {
		return p != null && Files.exists(p) && Files.isRegularFile(p);
	}

	private static Path normalize(Path p) {
		return p == null ? null : p.toAbsolutePath().normalize();
	}

	private static void rejectExisting(Path p, String label, boolean force, List<String> errors) {
		if (p != null && Files.exists(p) && !force) {
			errors.add(label + " already exists: " + p + ". Use --force to overwrite.");
		}
	}
}
