package com.structural.connector.cli.model;

import java.nio.file.Path;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "connect" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class ConnectOptions {

	@Option(names = { "--input", "-i" }, description = "Analytical-member export (JSON) to connect")
	private Path input;

	@Option(names = { "--output", "-o" }, description = "Where to write the connected model and lineage maps (JSON)")
	private Path output;

	@Option(names = { "--tolerance", "-t" }, defaultValue = "1e-6", description = "Geometric tolerance (default: ${DEFAULT-VALUE})")
	private double tolerance;

	@Option(names = {
			"--elevation-tolerance" }, description = "Maximum elevation difference between lines on one story (default: 10 x tolerance)")
	private Double elevationTolerance;

	@Option(names = {
			"--merge-duplicate-nodes" }, description = "Merge nodes with identical coordinates before connecting")
	private boolean mergeDuplicateNodes;

	@Option(names = { "--report", "-r" }, description = "Write a Markdown lineage report to this file")
	private Path report;

	// Solver round trip
	@Option(names = {
			"--section-results" }, description = "Solver output with the section selected per child line (JSON)")
	private Path sectionResults;

	@Option(names = {
			"--updated-export" }, description = "Write the export with governing sections applied to this file (requires --section-results or --section-override)")
	private Path updatedExport;

	@Option(names = {
			"--section-override" }, description = "Section name to set on every member of the updated export (\"Original Sections\" keeps them)")
	private String sectionOverride;

	@Option(names = { "--force", "-f" }, description = "Overwrite existing output files")
	private boolean force;

}
