package org.taskfarm.farm.api.resources;

/**
 * Thrown when a send, receive or rendezvous cannot complete.
 * <p>
 * This covers lost workers (closed connection, failed generation reported by the worker),
 * timeouts while waiting for a result or for the rendezvous, and any operation attempted
 * after the run has been aborted.
 * <p>
 * <strong>Error Handling Pattern:</strong> a transport failure is fatal for the whole run.
 * The dispatcher lets it propagate; {@link org.taskfarm.farm.TaskFarm} then aborts the
 * transport and stops all workers:
 * <pre>{@code
 * try {
 *     accounting = dispatcher.run(target, batchSize, parameter);
 * } catch (TransportException e) {
 *     log.error("Run failed: {}", e.getMessage());
 *     channel.abort(e.getMessage());
 *     throw new TaskFarmException("Run failed: " + e.getMessage(), e);
 * }
 * }</pre>
 */
public class TransportException extends Exception {

    /**
     * @param message the detail message.
     */
    public TransportException(String message) {
        super(message);
    }

    /**
     * @param message the detail message.
     * @param cause   the underlying cause.
     */
    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
