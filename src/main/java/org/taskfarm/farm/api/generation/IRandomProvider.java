package org.taskfarm.farm.api.generation;

import java.util.Random;

/**
 * Source of randomness for value generators.
 * <p>
 * A provider created from a fixed seed yields the same sequence on every run. Each worker
 * receives its own provider from {@link #deriveFor(int)} so that workers never share
 * generator state.
 */
public interface IRandomProvider {

    /**
     * @return the {@link Random} backing this provider.
     */
    Random asJavaRandom();

    /**
     * @return the seed this provider was created from.
     */
    long seed();

    /**
     * Creates an independent provider for one worker. Deterministic in
     * ({@link #seed()}, {@code workerId}).
     *
     * @param workerId the worker the provider is for.
     * @return a new provider.
     */
    IRandomProvider deriveFor(int workerId);
}
