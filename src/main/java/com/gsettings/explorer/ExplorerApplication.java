package com.gsettings.explorer;

import com.gsettings.explorer.cli.ExplorerCommand;
import picocli.CommandLine;

/**
 * Main entry point for the settings value tree explorer.
 */
public class ExplorerApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new ExplorerCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
