package org.taskfarm.farm.api;

/**
 * Signals a broken dispatch protocol invariant, never a transient fault.
 * <p>
 * Examples: assigning work to a busy or terminated worker, terminating a worker twice,
 * receiving a batch from a worker that has nothing outstanding, or a batch whose length
 * differs from the requested count. It is unchecked because it indicates a bug; the run
 * is aborted as soon as it surfaces.
 */
public class ProtocolViolationException extends IllegalStateException {

    public ProtocolViolationException(String message) {
        super(message);
    }
}
