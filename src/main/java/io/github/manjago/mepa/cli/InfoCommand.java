package io.github.manjago.mepa.cli;

import io.github.manjago.mepa.core.OpCode;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

/**
 * Show information about the interpreter.
 */
@Command(
    name = "info",
    description = "Show version, configuration and instruction set",
    mixinStandardHelpOptions = true
)
public class InfoCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Mixin
    ConfigOptions configOptions;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();

        out.println();
        out.println("MEPA interpreter, version 1.0.0");
        out.println();

        out.println("Configuration:");
        out.println(configOptions.load());

        out.println("Instruction set:");
        StringBuilder row = new StringBuilder("  ");
        OpCode[] ops = OpCode.values();
        for (int i = 0; i < ops.length; i++) {
            row.append(String.format("%-6s", ops[i].getMnemonic()));
            if ((i + 1) % 8 == 0 || i == ops.length - 1) {
                out.println(row.toString().stripTrailing());
                row.setLength(0);
                row.append("  ");
            }
        }
        out.println();
        return 0;
    }
}
