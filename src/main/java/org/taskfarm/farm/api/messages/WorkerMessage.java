package org.taskfarm.farm.api.messages;

/**
 * A message sent from the dispatcher to exactly one worker.
 * <p>
 * The set of messages is closed: a worker either gets a {@link WorkUnit} to process,
 * the {@link Termination} sentinel that ends its loop normally, or an {@link Abort}
 * that ends it immediately after a fatal failure elsewhere in the run.
 */
public sealed interface WorkerMessage permits WorkUnit, Termination, Abort {
}
