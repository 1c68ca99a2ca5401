package org.taskfarm.farm.api.generation;

/**
 * Thrown when a value generator cannot produce the requested values.
 * <p>
 * Fatal for the worker that hit it. The worker reports itself lost through its channel,
 * so the dispatcher sees a {@link org.taskfarm.farm.api.resources.TransportException}.
 */
public class GenerationException extends Exception {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
