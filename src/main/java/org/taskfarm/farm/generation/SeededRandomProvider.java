package org.taskfarm.farm.generation;

import java.util.Random;

import org.taskfarm.farm.api.generation.IRandomProvider;

/**
 * {@link IRandomProvider} backed by a {@link Random} created from a fixed seed.
 * <p>
 * Derived providers mix the parent seed with the worker id through the SplitMix64
 * finalizer, which spreads adjacent worker ids over unrelated seeds.
 */
public class SeededRandomProvider implements IRandomProvider {

    private final long seed;
    private final Random random;

    /**
     * @param seed the seed for the underlying {@link Random}.
     */
    public SeededRandomProvider(long seed) {
        this.seed = seed;
        this.random = new Random(seed);
    }

    @Override
    public Random asJavaRandom() {
        return random;
    }

    @Override
    public long seed() {
        return seed;
    }

    @Override
    public IRandomProvider deriveFor(int workerId) {
        return new SeededRandomProvider(mix(seed + 0x9E3779B97F4A7C15L * (workerId + 1L)));
    }

    private static long mix(long z) {
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        return z ^ (z >>> 31);
    }
}
