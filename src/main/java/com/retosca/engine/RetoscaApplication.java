package com.retosca.engine;

import com.retosca.engine.cli.ReverseCommand;
import picocli.CommandLine.Command;
import picocli.CommandLine;

/**
 * Main entry point of the retosca command-line tool.
 */
@Command(
        name = "retosca",
        mixinStandardHelpOptions = true,
        version = "retosca 1.0.0",
        description = "Turns deployment plans into TOSCA service templates.",
        subcommands = ReverseCommand.class,
        exitCodeOnInvalidInput = 1
)
public class RetoscaApplication implements Runnable {

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    static CommandLine commandLine() {
        return new CommandLine(new RetoscaApplication())
                .setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Override
    public void run() {
        spec.commandLine().usage(System.out);
    }
}
