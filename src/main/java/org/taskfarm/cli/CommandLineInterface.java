package org.taskfarm.cli;

import java.io.File;
import java.net.URL;
import java.util.concurrent.Callable;

import org.taskfarm.cli.commands.DispatchCommand;
import org.taskfarm.cli.commands.RunCommand;
import org.taskfarm.cli.commands.WorkCommand;
import org.taskfarm.cli.config.ConfigLoader;
import org.taskfarm.cli.config.LoggingConfigurator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

@Command(
    name = "taskfarm",
    mixinStandardHelpOptions = true,
    version = "TaskFarm 1.0",
    description = "TaskFarm - dynamic master/worker distribution of random number generation",
    subcommands = {
        RunCommand.class,
        DispatchCommand.class,
        WorkCommand.class,
        CommandLine.HelpCommand.class
    },
    footer = {
        "",
        "Examples:",
        "  taskfarm run --count 1000000 --workers 4",
        "  taskfarm dispatch --count 1000000 --workers 2 --port 7420",
        "  taskfarm work --host coordinator --port 7420"
    }
)
public class CommandLineInterface implements Callable<Integer> {

    @Option(
        names = {"-c", "--config"},
        description = "Path to custom configuration file (default: config/taskfarm.conf)"
    )
    private File configFile;

    @Spec
    private CommandSpec spec;

    private Config config;

    @Override
    public Integer call() {
        // No subcommand: show usage
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }

    public static void main(final String[] args) {
        System.exit(createCommandLine().execute(args));
    }

    /**
     * Creates a fully configured CommandLine instance. Tests use this to get the same
     * setup as the entry point.
     *
     * @return A configured CommandLine instance.
     */
    public static CommandLine createCommandLine() {
        CommandLine commandLine = new CommandLine(new CommandLineInterface());
        commandLine.setCommandName("taskfarm");
        return commandLine;
    }

    /**
     * Loads the configuration on first use and applies its logging settings.
     *
     * @return the resolved configuration.
     * @throws CommandLine.ParameterException if the configuration file is missing or invalid.
     */
    public Config getConfig() {
        if (config != null) {
            return config;
        }
        Logger logger = LoggerFactory.getLogger(CommandLineInterface.class);
        try {
            config = ConfigLoader.resolve(configFile, (level, message) -> {
                switch (level) {
                    case INFO -> logger.debug(message);
                    case WARN -> logger.warn(message);
                }
            });
        } catch (IllegalArgumentException | ConfigException e) {
            throw new CommandLine.ParameterException(spec.commandLine(),
                "Failed to load configuration: " + e.getMessage(), e);
        }

        if (config.hasPath("logging.format")) {
            String format = config.getString("logging.format");
            System.setProperty("taskfarm.logging.format", "PLAIN".equalsIgnoreCase(format) ? "STDOUT_PLAIN" : "STDOUT");
            reconfigureLogback();
        }
        LoggingConfigurator.configure(config);
        return config;
    }

    private void reconfigureLogback() {
        URL configUrl = CommandLineInterface.class.getClassLoader().getResource("logback.xml");
        if (configUrl == null) {
            return;
        }
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();
        try {
            configurator.doConfigure(configUrl);
        } catch (JoranException e) {
            spec.commandLine().getErr().println("Failed to reconfigure Logback: " + e.getMessage());
        }
    }
}
