package org.taskfarm.farm.api.resources;

import java.io.IOException;

/**
 * Persists the values of completed result batches. Written by the dispatcher thread only.
 * <p>
 * Implementations are instantiated from configuration via a public constructor taking
 * {@code (FarmParameters, com.typesafe.config.Config)}.
 */
public interface ISink extends AutoCloseable {

    /**
     * Appends the values of one batch.
     *
     * @param values the values, in production order.
     * @throws IOException if the values cannot be persisted; fatal for the run.
     */
    void append(double[] values) throws IOException;

    /**
     * @return total number of values appended so far.
     */
    long valuesWritten();

    /**
     * @return a short description of the destination, e.g. the file path.
     */
    String describe();

    /**
     * Flushes and releases the destination. Content written so far stays in place.
     */
    @Override
    void close() throws IOException;
}
