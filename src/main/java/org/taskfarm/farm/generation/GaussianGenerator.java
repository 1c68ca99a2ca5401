package org.taskfarm.farm.generation;

import java.util.Random;

import org.taskfarm.farm.api.generation.GenerationException;
import org.taskfarm.farm.api.generation.IRandomProvider;
import org.taskfarm.farm.api.generation.IValueGenerator;

import com.typesafe.config.Config;

/**
 * Draws values from a normal distribution whose mean is the work unit's parameter.
 *
 * <h3>Configuration Options:</h3>
 * <ul>
 *   <li><b>standardDeviation</b>: spread of the distribution (default: 1.0, must be &gt;= 0).</li>
 * </ul>
 */
public class GaussianGenerator implements IValueGenerator {

    private final Random random;
    private final double standardDeviation;

    /**
     * Creates a generator from configuration.
     *
     * @param randomProvider source of randomness, owned by one worker.
     * @param options        generator options.
     */
    public GaussianGenerator(IRandomProvider randomProvider, Config options) {
        this(randomProvider,
            options.hasPath("standardDeviation") ? options.getDouble("standardDeviation") : 1.0);
    }

    /**
     * Convenience constructor for tests.
     *
     * @param randomProvider    source of randomness.
     * @param standardDeviation spread of the distribution.
     */
    GaussianGenerator(IRandomProvider randomProvider, double standardDeviation) {
        if (standardDeviation < 0.0 || Double.isNaN(standardDeviation)) {
            throw new IllegalArgumentException("standardDeviation must be >= 0, got: " + standardDeviation);
        }
        this.random = randomProvider.asJavaRandom();
        this.standardDeviation = standardDeviation;
    }

    @Override
    public double[] generate(double parameter, int count) throws GenerationException {
        if (count < 1) {
            throw new GenerationException("Cannot generate " + count + " values");
        }
        double[] values = new double[count];
        for (int i = 0; i < count; i++) {
            values[i] = parameter + standardDeviation * random.nextGaussian();
        }
        return values;
    }
}
