package org.taskfarm.farm.api;

/**
 * Validated run parameters handed from the command line to the farm.
 *
 * @param target      total number of values wanted, {@code >= 0}.
 * @param batchSize   maximum number of values per work unit, {@code >= 1}.
 * @param parameter   distribution parameter passed to every work unit (e.g. the mean).
 * @param workerCount number of workers, {@code >= 1}.
 */
public record FarmParameters(long target, int batchSize, double parameter, int workerCount) {

    public FarmParameters {
        if (target < 0) {
            throw new IllegalArgumentException("target must be >= 0, got: " + target);
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1, got: " + batchSize);
        }
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be >= 1, got: " + workerCount);
        }
        if (Double.isNaN(parameter) || Double.isInfinite(parameter)) {
            throw new IllegalArgumentException("parameter must be a finite number, got: " + parameter);
        }
    }
}
