package org.taskfarm.farm.api.messages;

/**
 * One dispatchable batch of work: produce {@code requestedCount} values for {@code parameter}.
 * <p>
 * A count of zero is reserved for the termination sentinel and cannot be expressed as a
 * {@code WorkUnit}; use {@link Termination#INSTANCE} instead.
 *
 * @param parameter      the distribution parameter handed to the value generator (e.g. the mean).
 * @param requestedCount the exact number of values the worker must return, at least 1.
 */
public record WorkUnit(double parameter, int requestedCount) implements WorkerMessage {

    public WorkUnit {
        if (requestedCount < 1) {
            throw new IllegalArgumentException(
                "requestedCount must be >= 1 (0 is reserved for termination), got: " + requestedCount);
        }
        if (Double.isNaN(parameter)) {
            throw new IllegalArgumentException("parameter must not be NaN");
        }
    }
}
