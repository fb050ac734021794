package com.structural.connector.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.structural.connector.cli.exception.OptionsValidationException;
import com.structural.connector.cli.model.ConnectOptions;
import com.structural.connector.cli.model.ValidatedConnectOptions;
import com.structural.connector.cli.output.ConnectResultsPrinter;
import com.structural.connector.cli.validation.ConnectOptionsValidator;
import com.structural.connector.connect.ConnectionPipeline;
import com.structural.connector.connect.ConnectorConfig;
import com.structural.connector.connect.ConnectorResult;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command that connects intersecting members of an analytical export.
 */
@Command(
        name = "connect",
        mixinStandardHelpOptions = true,
        version = "structural-graph-connector 1.0.0",
        description = "Splits structural members where they cross or touch in plan and records which pieces belong to which original member."
)
public class ConnectCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ConnectCommand.class);

    @Mixin
    private ConnectOptions options = new ConnectOptions();

    private final ConnectOptionsValidator validator = new ConnectOptionsValidator();
    private final ConnectResultsPrinter printer = new ConnectResultsPrinter();

    @Override
    public Integer call() {
        ValidatedConnectOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(error -> log.error("{}", error));
            return 1;
        }

        printer.printBanner(options, validated);

        ConnectorConfig config = ConnectorConfig.builder()
                .inputFile(validated.getInputFile())
                .outputFile(validated.getOutputFile())
                .reportFile(validated.getReportFile())
                .tolerance(validated.getTolerances().getTolerance())
                .elevationTolerance(validated.getTolerances().getElevationTolerance())
                .mergeDuplicateNodes(options.isMergeDuplicateNodes())
                .sectionResultsFile(validated.getSectionResultsFile())
                .updatedExportFile(validated.getUpdatedExportFile())
                .sectionOverride(options.getSectionOverride())
                .build();

        ConnectorResult result = new ConnectionPipeline(config).run();
        if (!result.isSuccess()) {
            printer.printFailure(result);
            return 1;
        }

        printer.printSuccess(validated, result);
        return 0;
    }
}
