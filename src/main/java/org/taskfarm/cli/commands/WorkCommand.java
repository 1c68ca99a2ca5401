package org.taskfarm.cli.commands;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Callable;

import org.taskfarm.cli.CommandLineInterface;
import org.taskfarm.farm.TaskFarm;
import org.taskfarm.farm.TaskFarmException;
import org.taskfarm.farm.WorkerReport;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Joins a {@code taskfarm dispatch} run as one worker and exits when terminated.
 */
@Command(
    name = "work",
    description = "Work for a dispatcher reachable over TCP"
)
public class WorkCommand implements Callable<Integer> {

    @Option(names = {"-H", "--host"}, defaultValue = "localhost", description = "Dispatcher host (default: ${DEFAULT-VALUE})")
    private String host;

    @Option(names = {"-p", "--port"}, description = "Dispatcher port (default: farm.transport.socket.port)")
    private Integer port;

    @Option(names = {"-s", "--seed"}, description = "Random seed for reproducible output")
    private Long seed;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        Map<String, Object> overrides = new HashMap<>();
        if (seed != null) {
            overrides.put("farm.seed", seed);
        }
        Config config = ConfigFactory.parseMap(overrides).withFallback(parent.getConfig());
        int dispatcherPort = port != null ? port : config.getInt("farm.transport.socket.port");
        if (dispatcherPort < 1 || dispatcherPort > 65535) {
            throw new ParameterException(spec.commandLine(), "port must be within [1, 65535], got: " + dispatcherPort);
        }

        try {
            WorkerReport report = new TaskFarm(config).runWorker(host, dispatcherPort);
            spec.commandLine().getOut().printf("Worker %d produced %d values in %d batches%n",
                report.workerId(), report.valuesProduced(), report.batchesProduced());
            return 0;
        } catch (TaskFarmException e) {
            spec.commandLine().getErr().println("Error: " + e.getMessage());
            return 1;
        }
    }
}
