package org.taskfarm.cli.commands;

import java.util.concurrent.Callable;

import org.taskfarm.cli.CommandLineInterface;
import org.taskfarm.farm.FarmReport;
import org.taskfarm.farm.TaskFarm;
import org.taskfarm.farm.TaskFarmException;
import org.taskfarm.farm.api.FarmParameters;

import com.typesafe.config.Config;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Runs dispatcher and workers in this process.
 */
@Command(
    name = "run",
    description = "Generate values with in-process workers"
)
public class RunCommand implements Callable<Integer> {

    @Mixin
    private FarmOptions farmOptions;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        Config config = farmOptions.applyTo(parent.getConfig());
        FarmParameters parameters;
        try {
            parameters = farmOptions.toParameters(config);
        } catch (IllegalArgumentException e) {
            throw new ParameterException(spec.commandLine(), e.getMessage(), e);
        }

        try {
            FarmReport report = new TaskFarm(config).runInMemory(parameters);
            Reports.print(spec.commandLine().getOut(), report);
            return 0;
        } catch (TaskFarmException e) {
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return 1;
        }
    }
}
