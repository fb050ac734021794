package com.structural.connector.cli.validation;

import com.structural.connector.cli.exception.OptionsValidationException;
import com.structural.connector.cli.model.ConnectOptions;
import com.structural.connector.cli.model.ValidatedConnectOptions;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ConnectOptionsValidator.
 */
class ConnectOptionsValidatorTest {

    @TempDir
    Path tempDir;

    private final ConnectOptionsValidator validator = new ConnectOptionsValidator();
    private Path input;

    @BeforeEach
    void setUp() throws IOException {
        input = tempDir.resolve("export.json");
        Files.writeString(input, "{}");
    }

    private static ConnectOptions parse(String... args) {
        return CommandLine.populateCommand(new ConnectOptions(), args);
    }

    @Test
    void testValidOptionsUseDefaultTolerances() {
        ValidatedConnectOptions validated = validator.validate(parse(
                "-i", input.toString(), "-o", tempDir.resolve("result.json").toString()));

        assertThat(validated.getInputFile()).isEqualTo(input.toAbsolutePath().normalize());
        assertThat(validated.getTolerances().getTolerance()).isEqualTo(1e-6);
        assertThat(validated.getTolerances().getElevationTolerance()).isCloseTo(1e-5, within(1e-18));
        assertThat(validated.getReportFile()).isNull();
    }

    @Test
    void testExplicitElevationToleranceIsKept() {
        ValidatedConnectOptions validated = validator.validate(parse(
                "-i", input.toString(), "-o", tempDir.resolve("result.json").toString(),
                "-t", "0.001", "--elevation-tolerance", "0.05"));

        assertThat(validated.getTolerances().getTolerance()).isEqualTo(0.001);
        assertThat(validated.getTolerances().getElevationTolerance()).isEqualTo(0.05);
    }

    @Test
    void testAllErrorsAreReportedTogether() {
        ConnectOptions options = parse(
                "-i", tempDir.resolve("missing.json").toString(),
                "-t", "0",
                "--elevation-tolerance", "-1",
                "--updated-export", tempDir.resolve("updated.json").toString());

        assertThatThrownBy(() -> validator.validate(options))
                .isInstanceOfSatisfying(OptionsValidationException.class, e -> assertThat(e.getErrors())
                        .hasSize(5)
                        .anyMatch(msg -> msg.startsWith("Input export does not exist"))
                        .anyMatch(msg -> msg.startsWith("Output file is required"))
                        .anyMatch(msg -> msg.startsWith("Tolerance must be a positive number"))
                        .anyMatch(msg -> msg.startsWith("Elevation tolerance must be >= 0"))
                        .anyMatch(msg -> msg.contains("--updated-export requires --section-results")));
    }

    @Test
    void testExistingOutputRequiresForce() throws IOException {
        Path output = tempDir.resolve("result.json");
        Files.writeString(output, "{}");

        assertThatThrownBy(() -> validator.validate(parse("-i", input.toString(), "-o", output.toString())))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("Use --force to overwrite");

        ValidatedConnectOptions validated = validator.validate(
                parse("-i", input.toString(), "-o", output.toString(), "--force"));
        assertThat(validated.getOutputFile()).isEqualTo(output.toAbsolutePath().normalize());
    }

    @Test
    void testOutputMustNotOverwriteInput() {
        assertThatThrownBy(() -> validator.validate(
                parse("-i", input.toString(), "-o", input.toString(), "-f")))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("must not overwrite the input export");
    }

    @Test
    void testSectionOverrideStandsInForSectionResults() {
        ValidatedConnectOptions validated = validator.validate(parse(
                "-i", input.toString(), "-o", tempDir.resolve("result.json").toString(),
                "--section-override", "UB406x178x60",
                "--updated-export", tempDir.resolve("updated.json").toString()));

        assertThat(validated.getUpdatedExportFile()).isEqualTo(tempDir.resolve("updated.json").toAbsolutePath().normalize());
        assertThat(validated.getSectionResultsFile()).isNull();
    }

    @Test
    void testSectionOverrideRequiresUpdatedExport() {
        assertThatThrownBy(() -> validator.validate(parse(
                "-i", input.toString(), "-o", tempDir.resolve("result.json").toString(),
                "--section-override", "UB406x178x60")))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("--section-override requires --updated-export");
    }

    @Test
    void testMissingSectionResultsFileIsRejected() {
        assertThatThrownBy(() -> validator.validate(parse(
                "-i", input.toString(), "-o", tempDir.resolve("result.json").toString(),
                "--section-results", tempDir.resolve("solver.json").toString())))
                .isInstanceOf(OptionsValidationException.class)
                .hasMessageContaining("Section results file does not exist");
    }
}
