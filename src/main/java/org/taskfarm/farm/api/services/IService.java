package org.taskfarm.farm.api.services;

import java.util.concurrent.TimeUnit;

/**
 * A long-running component with its own thread and a simple lifecycle.
 */
public interface IService {

    /**
     * Lifecycle states of a service.
     */
    enum State {
        /** Not started yet, or finished normally. */
        STOPPED,
        /** The service thread is running. */
        RUNNING,
        /** The service thread ended with a fatal error. */
        ERROR
    }

    /**
     * Starts the service thread.
     *
     * @throws IllegalStateException if the service is not {@link State#STOPPED}.
     */
    void start();

    /**
     * Requests a graceful stop, interrupts the service thread and waits for it to end.
     *
     * @throws IllegalStateException if the service is not {@link State#RUNNING}.
     */
    void stop();

    /**
     * Waits for the service thread to end on its own.
     *
     * @param timeout maximum time to wait.
     * @param unit    unit of {@code timeout}.
     * @return {@code true} if the thread ended (or never started) within the timeout.
     * @throws InterruptedException if interrupted while waiting.
     */
    boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException;

    /**
     * @return the current lifecycle state.
     */
    State getCurrentState();
}
