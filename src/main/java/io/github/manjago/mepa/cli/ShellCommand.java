package io.github.manjago.mepa.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Parameters;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: shell
 *
 * Starts the interactive editor and debugger.
 *
 * Usage:
 *   mepa shell
 *   mepa shell fact.mepa     (load a program first)
 */
@Command(
    name = "shell",
    description = "Interactive program editor and debugger",
    mixinStandardHelpOptions = true
)
public class ShellCommand implements Callable<Integer> {

    @Mixin
    ConfigOptions configOptions;

    @Parameters(index = "0", arity = "0..1", description = "Program file to load")
    private Path programFile;

    @Override
    public Integer call() {
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        PrintWriter out = new PrintWriter(System.out, true);

        MepaShell shell = new MepaShell(configOptions.load(), in, out);
        if (programFile != null) {
            shell.execute("LOAD " + programFile);
        }
        shell.run();
        return 0;
    }
}
