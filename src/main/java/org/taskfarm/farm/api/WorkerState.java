package org.taskfarm.farm.api;

/**
 * Protocol state of one worker: {@code IDLE -> BUSY -> IDLE -> ... -> TERMINATED}.
 * <p>
 * {@code TERMINATED} is reached only from {@code IDLE}, on the termination sentinel,
 * and is final.
 */
public enum WorkerState {
    /** No outstanding work unit. */
    IDLE,
    /** Exactly one outstanding work unit. */
    BUSY,
    /** Received the termination sentinel; receives nothing more. */
    TERMINATED
}
