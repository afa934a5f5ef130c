package io.github.manjago.mepa.cli;

import io.github.manjago.mepa.config.MepaConfig;
import io.github.manjago.mepa.core.MepaException;
import io.github.manjago.mepa.core.ProgramImage;
import io.github.manjago.mepa.core.RunReport;
import io.github.manjago.mepa.core.VirtualMachine;
import io.github.manjago.mepa.persistence.ProgramStore;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import picocli.CommandLine.Model.CommandSpec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Run a program to completion.
 *
 * Examples:
 *   mepa run fact.mepa                  # Run until PARA or end of program
 *   mepa run fact.mepa --max-steps 1000 # Give up after 1000 instructions
 */
@Command(
    name = "run",
    description = "Run a program to completion",
    mixinStandardHelpOptions = true
)
public class RunCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Mixin
    ConfigOptions configOptions;

    @Parameters(index = "0", description = "Program file (.mepa)")
    private Path programFile;

    @Option(names = {"-n", "--max-steps"}, description = "Maximum instructions to execute (0 = unlimited)")
    private Long maxSteps;

    @Option(names = {"-v", "--verbose"}, description = "Print a summary after the run")
    private boolean verbose;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try {
            MepaConfig config = configOptions.load();
            long budget = maxSteps != null ? maxSteps : config.maxSteps();

            ProgramImage image = new ProgramImage();
            ProgramStore.load(image, programFile);

            VirtualMachine vm = new VirtualMachine(image, (line, value) -> {
                out.println(value);
                out.flush();
            });
            vm.setMaxMemory(config.maxMemory());
            RunReport report = vm.run(budget);

            if (report.status() == RunReport.Status.STEP_LIMIT) {
                err.printf("Stopped after %,d steps (limit reached)%n", report.steps());
                return 2;
            }
            if (verbose) {
                out.printf("Finished (%s) after %,d steps at line %d%n",
                        report.status(), report.steps(), report.lastLine());
            }
            return 0;

        } catch (MepaException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            err.println("Error: cannot read " + programFile + ": " + e.getMessage());
            return 1;
        }
    }
}
