package org.taskfarm.farm.api.generation;

/**
 * Produces the values of one work unit.
 * <p>
 * Implementations are loaded from configuration and must provide a public constructor
 * taking {@code (IRandomProvider, com.typesafe.config.Config)}. Each worker gets its own
 * instance, so implementations need not be thread-safe.
 */
@FunctionalInterface
public interface IValueGenerator {

    /**
     * Produces exactly {@code count} values drawn from a process parameterized by
     * {@code parameter}.
     *
     * @param parameter the distribution parameter from the work unit.
     * @param count     number of values to produce, {@code >= 1}.
     * @return an array of length {@code count}.
     * @throws GenerationException if the values cannot be produced.
     */
    double[] generate(double parameter, int count) throws GenerationException;
}
