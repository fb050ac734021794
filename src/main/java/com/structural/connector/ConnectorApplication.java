package com.structural.connector;

import com.structural.connector.cli.ConnectCommand;
import picocli.CommandLine;

/**
 * Main entry point for the Structural Graph Connector.
 * This CLI tool joins structural members that cross or touch in plan into a
 * single analysis graph and keeps track of which pieces came from which
 * original member.
 */
public class ConnectorApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ConnectCommand()).execute(args);
        System.exit(exitCode);
    }
}
