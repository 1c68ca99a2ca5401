package org.taskfarm.farm;

/**
 * Outcome of a remote worker process.
 *
 * @param workerId        id assigned by the dispatcher.
 * @param batchesProduced number of batches sent.
 * @param valuesProduced  number of values sent.
 */
public record WorkerReport(int workerId, long batchesProduced, long valuesProduced) {
}
