package io.github.manjago.mepa.cli;

import io.github.manjago.mepa.core.Instruction;
import io.github.manjago.mepa.core.InstructionParser;
import io.github.manjago.mepa.core.ProgramImage;
import io.github.manjago.mepa.persistence.ProgramStore;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: list
 *
 * Prints a program in ascending line order.
 *
 * Usage:
 *   mepa list fact.mepa
 *   mepa list fact.mepa --check   (flag lines the engine would reject)
 */
@Command(
    name = "list",
    description = "Show a program",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", description = "Program file (.mepa)")
    private Path programFile;

    @Option(names = {"-c", "--check"}, description = "Mark lines with unknown instructions")
    private boolean check;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try {
            ProgramImage image = new ProgramImage();
            int skipped = ProgramStore.load(image, programFile);

            if (image.isEmpty()) {
                out.println("No code in memory");
                return 0;
            }

            int unknown = 0;
            for (ProgramImage.Line line : image.sortedLines()) {
                Instruction insn = InstructionParser.parse(line.text());
                boolean rejected = check && !insn.isEmpty() && insn.opCode() == null;
                if (rejected) {
                    unknown++;
                }
                out.println(line + (rejected ? "    ; unknown instruction" : ""));
            }

            if (check) {
                out.printf("%d lines, %d unknown instructions, %d lines skipped%n",
                        image.size(), unknown, skipped);
            }
            return unknown > 0 ? 1 : 0;

        } catch (IOException e) {
            err.println("Error: cannot read " + programFile + ": " + e.getMessage());
            return 1;
        }
    }
}
