package com.gsettings.explorer.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.util.concurrent.Callable;

/**
 * Top-level command; the work is done by its subcommands.
 */
@Command(
        name = "gsettings-explorer",
        mixinStandardHelpOptions = true,
        version = "gsettings-explorer 1.0.0",
        description = "Inspects and edits typed settings values as trees.",
        subcommands = { SignatureCommand.class, ShowCommand.class, EditCommand.class }
)
public class ExplorerCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing subcommand: signature, show or edit");
    }
}
