package io.github.manjago.mepa.cli;

import io.github.manjago.mepa.config.MepaConfig;
import io.github.manjago.mepa.core.MepaException;
import io.github.manjago.mepa.core.ProgramImage;
import io.github.manjago.mepa.core.VirtualMachine;
import io.github.manjago.mepa.debug.DebugController;
import io.github.manjago.mepa.debug.DebugReport;
import io.github.manjago.mepa.debug.SnapshotPrinter;
import io.github.manjago.mepa.persistence.ProgramStore;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: debug
 *
 * Steps through a program one instruction at a time, printing every
 * instruction before it executes.
 *
 * Usage:
 *   mepa debug fact.mepa                    # Trace until the program stops
 *   mepa debug fact.mepa --stack            # Dump stack and memory after each step
 *   mepa debug loop.mepa --max-steps 50     # Stop tracing after 50 steps
 */
@Command(
    name = "debug",
    description = "Trace a program step by step",
    mixinStandardHelpOptions = true
)
public class DebugCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Mixin
    ConfigOptions configOptions;

    @Parameters(index = "0", description = "Program file (.mepa)")
    private Path programFile;

    @Option(names = {"-s", "--stack"}, description = "Dump stack and memory after each step")
    private Boolean showStack;

    @Option(names = {"-n", "--max-steps"}, description = "Maximum steps to trace (0 = unlimited)", defaultValue = "1000")
    private long maxSteps;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try {
            MepaConfig config = configOptions.load();
            boolean dumpStack = showStack != null ? showStack : config.showStack();

            ProgramImage image = new ProgramImage();
            ProgramStore.load(image, programFile);

            VirtualMachine vm = new VirtualMachine(image);
            vm.setMaxMemory(config.maxMemory());
            DebugController debugger = new DebugController(vm);
            SnapshotPrinter printer = new SnapshotPrinter(out);

            out.println("Starting debug mode:");
            DebugReport report = debugger.start();
            printer.printReport(report);

            long steps = 0;
            while (!report.isHalted()) {
                if (maxSteps > 0 && steps >= maxSteps) {
                    out.printf("Stopped after %,d steps%n", steps);
                    debugger.stop();
                    return 2;
                }
                report = debugger.step();
                steps++;
                printer.printReport(report);
                if (dumpStack) {
                    printer.printSnapshot(debugger.inspect());
                }
            }
            debugger.stop();
            return 0;

        } catch (MepaException e) {
            out.flush();
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            err.println("Error: cannot read " + programFile + ": " + e.getMessage());
            return 1;
        } finally {
            out.flush();
        }
    }
}
