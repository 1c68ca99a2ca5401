package org.taskfarm.farm.api.resources;

import org.taskfarm.farm.api.messages.ResultBatch;
import org.taskfarm.farm.api.messages.WorkerMessage;

/**
 * A worker's side of a transport. Used by exactly one worker thread.
 */
public interface IWorkerChannel {

    /**
     * @return this worker's identity, as seen in {@link ResultBatch#producerId()}.
     */
    int workerId();

    /**
     * Blocks until the dispatcher sends the next message.
     *
     * @return the next message.
     * @throws TransportException   if the connection to the dispatcher is lost.
     * @throws InterruptedException if interrupted while waiting.
     */
    WorkerMessage receive() throws TransportException, InterruptedException;

    /**
     * Reports a completed batch to the dispatcher.
     *
     * @param batch the batch.
     * @throws TransportException if the batch cannot be delivered or the run was aborted.
     */
    void send(ResultBatch batch) throws TransportException;

    /**
     * Tells the dispatcher that this worker is lost. The dispatcher's next
     * {@link IDispatcherChannel#receiveAny()} fails with a {@link TransportException}.
     *
     * @param cause why the worker gives up.
     */
    void reportFailure(Throwable cause);

    /**
     * Joins the final rendezvous.
     *
     * @throws TransportException   if the barrier is broken or does not complete in time.
     * @throws InterruptedException if interrupted while waiting.
     */
    void awaitRendezvous() throws TransportException, InterruptedException;
}
