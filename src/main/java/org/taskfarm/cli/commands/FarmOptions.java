package org.taskfarm.cli.commands;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;

import org.taskfarm.farm.api.FarmParameters;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import picocli.CommandLine.Option;

/**
 * Run parameters shared by {@code run} and {@code dispatch}. Options left out fall back to
 * the {@code farm} configuration section.
 */
public class FarmOptions {

    @Option(names = {"-n", "--count"}, description = "Total number of values to generate (default: farm.target)")
    Long count;

    @Option(names = {"-b", "--batch-size"}, description = "Maximum values per work unit (default: farm.batchSize)")
    Integer batchSize;

    @Option(names = {"-w", "--workers"}, description = "Number of workers (default: farm.workers)")
    Integer workers;

    @Option(names = {"-m", "--mean"}, description = "Mean of the generated values (default: day of the month)")
    Double mean;

    @Option(names = {"-o", "--output"}, description = "Output file (default: random_<count>_nums.txt)")
    Path output;

    @Option(names = {"-s", "--seed"}, description = "Random seed for reproducible output")
    Long seed;

    /**
     * @param config the application configuration.
     * @return validated run parameters.
     * @throws IllegalArgumentException if a value is out of range.
     */
    FarmParameters toParameters(Config config) {
        Config farm = config.getConfig("farm");
        return new FarmParameters(
            count != null ? count : farm.getLong("target"),
            batchSize != null ? batchSize : farm.getInt("batchSize"),
            mean != null ? mean : LocalDate.now().getDayOfMonth(),
            workers != null ? workers : farm.getInt("workers"));
    }

    /**
     * @param config the application configuration.
     * @return {@code config} with the seed and output path options layered on top.
     */
    Config applyTo(Config config) {
        Map<String, Object> overrides = new HashMap<>();
        if (seed != null) {
            overrides.put("farm.seed", seed);
        }
        if (output != null) {
            overrides.put("farm.sink.options.path", output.toString());
        }
        return ConfigFactory.parseMap(overrides).withFallback(config);
    }
}
