package org.taskfarm.cli.commands;

import java.util.Map;
import java.util.concurrent.Callable;

import org.taskfarm.cli.CommandLineInterface;
import org.taskfarm.farm.FarmReport;
import org.taskfarm.farm.TaskFarm;
import org.taskfarm.farm.TaskFarmException;
import org.taskfarm.farm.api.FarmParameters;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Coordinates a run whose workers are separate {@code taskfarm work} processes.
 */
@Command(
    name = "dispatch",
    description = "Coordinate workers that connect over TCP"
)
public class DispatchCommand implements Callable<Integer> {

    @Mixin
    private FarmOptions farmOptions;

    @Option(names = {"-p", "--port"}, description = "Port to listen on (default: farm.transport.socket.port)")
    private Integer port;

    @Option(names = {"--bind"}, description = "Address to bind (default: farm.transport.socket.host)")
    private String bindAddress;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        Config config = farmOptions.applyTo(parent.getConfig());
        if (port != null) {
            config = ConfigFactory.parseMap(Map.of("farm.transport.socket.port", port)).withFallback(config);
        }
        if (bindAddress != null) {
            config = ConfigFactory.parseMap(Map.of("farm.transport.socket.host", bindAddress)).withFallback(config);
        }
        FarmParameters parameters;
        try {
            parameters = farmOptions.toParameters(config);
        } catch (IllegalArgumentException e) {
            throw new ParameterException(spec.commandLine(), e.getMessage(), e);
        }

        try {
            FarmReport report = new TaskFarm(config).runDispatcher(parameters);
            Reports.print(spec.commandLine().getOut(), report);
            return 0;
        } catch (IllegalArgumentException e) {
            throw new ParameterException(spec.commandLine(), e.getMessage(), e);
        } catch (TaskFarmException e) {
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return 1;
        }
    }
}
