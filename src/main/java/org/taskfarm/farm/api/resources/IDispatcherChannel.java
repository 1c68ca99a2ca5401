package org.taskfarm.farm.api.resources;

import java.util.List;

import org.taskfarm.farm.api.messages.ResultBatch;
import org.taskfarm.farm.api.messages.WorkerMessage;

/**
 * The dispatcher's side of a transport: point-to-point sends to named workers,
 * "receive from any", the collective rendezvous and the abort broadcast.
 * <p>
 * Implementations must reject any send to a worker that has already been sent
 * {@link org.taskfarm.farm.api.messages.Termination} with a
 * {@link org.taskfarm.farm.api.ProtocolViolationException}.
 * <p>
 * <strong>Thread safety:</strong> all methods except {@link #abort(String)} are called from
 * the dispatcher thread only. {@code abort} may be called from any thread.
 */
public interface IDispatcherChannel {

    /**
     * @return the ids of all workers in this run, in ascending order. Fixed for the whole run.
     */
    List<Integer> workerIds();

    /**
     * Sends a message to one worker.
     *
     * @param workerId the receiving worker.
     * @param message  the message.
     * @throws TransportException if the worker is unreachable or the run was aborted.
     */
    void send(int workerId, WorkerMessage message) throws TransportException;

    /**
     * Blocks until any worker reports a result batch.
     *
     * @return the next batch, from whichever worker finished first.
     * @throws TransportException   if a worker was lost, the receive timed out, or the run was aborted.
     * @throws InterruptedException if the calling thread is interrupted while waiting.
     */
    ResultBatch receiveAny() throws TransportException, InterruptedException;

    /**
     * Waits on the barrier that every worker joins after leaving its loop.
     *
     * @throws TransportException   if the barrier is broken by an abort or does not complete in time.
     * @throws InterruptedException if the calling thread is interrupted while waiting.
     */
    void awaitRendezvous() throws TransportException, InterruptedException;

    /**
     * Broadcasts an abort to all reachable workers and breaks the rendezvous.
     * Idempotent; later sends fail with {@link TransportException}.
     *
     * @param reason human-readable cause.
     */
    void abort(String reason);
}
