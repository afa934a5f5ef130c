package io.github.manjago.mepa.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * MEPA CLI - interpreter and debugger for the MEPA stack machine.
 *
 * Usage:
 *   mepa run &lt;file&gt;          - Run a program to completion
 *   mepa debug &lt;file&gt;        - Step through a program, tracing every instruction
 *   mepa list &lt;file&gt;         - Show a program
 *   mepa shell [file]         - Interactive editor and debugger
 *   mepa info                 - Show version and config
 */
@Command(
    name = "mepa",
    description = "Interpreter for the MEPA stack machine",
    mixinStandardHelpOptions = true,
    version = "MEPA 1.0.0",
    subcommands = {
        RunCommand.class,
        DebugCommand.class,
        ListCommand.class,
        ShellCommand.class,
        InfoCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class MepaCli implements Runnable {

    @Override
    public void run() {
        // If no subcommand, show help
        CommandLine.usage(this, System.out);
    }

    public static CommandLine commandLine() {
        return new CommandLine(new MepaCli())
                .setCaseInsensitiveEnumValuesAllowed(true);
    }

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
