package org.taskfarm.farm.services;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import org.taskfarm.farm.api.services.IMonitorable;
import org.taskfarm.farm.api.services.IService;
import org.taskfarm.farm.api.services.OperationalError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

/**
 * An abstract base class for services that run on a dedicated thread, providing lifecycle
 * management and error tracking. Subclasses implement {@link #run()}.
 * <p>
 * Collaborators (channels, generators) are passed to subclass constructors explicitly;
 * the base class only reads its own options:
 * <ul>
 *   <li><b>shutdownTimeout</b>: seconds {@link #stop()} waits for the thread (default: 5).</li>
 * </ul>
 */
public abstract class AbstractService implements IService, IMonitorable {

    protected final Logger log = LoggerFactory.getLogger(this.getClass());
    protected final String serviceName;
    protected final Config options;
    private final AtomicReference<State> currentState = new AtomicReference<>(State.STOPPED);
    private final int shutdownTimeoutSeconds;
    private volatile Thread serviceThread;

    /**
     * Flag indicating that a graceful shutdown has been requested.
     * Services check {@link #isStopRequested()} in their main loop.
     */
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);

    /** Recorded errors; the oldest are dropped beyond {@link #MAX_ERRORS}. */
    private final ConcurrentLinkedDeque<OperationalError> errors = new ConcurrentLinkedDeque<>();

    private static final int MAX_ERRORS = 100;

    /**
     * @param name    the name of the service instance, also used as thread name.
     * @param options the configuration for this service.
     */
    protected AbstractService(String name, Config options) {
        this.serviceName = name;
        this.options = options;
        this.shutdownTimeoutSeconds = options.hasPath("shutdownTimeout")
            ? options.getInt("shutdownTimeout")
            : 5;
    }

    @Override
    public final void start() {
        if (!currentState.compareAndSet(State.STOPPED, State.RUNNING)) {
            throw new IllegalStateException(String.format(
                "Cannot start service '%s' as it is already in state %s", serviceName, getCurrentState()));
        }
        stopRequested.set(false);
        Thread thread = new Thread(this::runService);
        thread.setName(serviceName);
        serviceThread = thread;
        thread.start();
        log.debug("{} started", serviceName);
    }

    @Override
    public final void stop() {
        State state = getCurrentState();
        if (state != State.RUNNING) {
            throw new IllegalStateException(String.format(
                "Cannot stop service '%s' as it is in state %s", serviceName, state));
        }
        stopRequested.set(true);

        Thread thread = serviceThread;
        if (thread != null) {
            try {
                // Workers block on receive(), which responds to interrupt
                thread.interrupt();
                thread.join(shutdownTimeoutSeconds * 1000L);

                if (thread.isAlive()) {
                    log.warn("{} did not stop within {}s, interrupting again", serviceName, shutdownTimeoutSeconds);
                    thread.interrupt();
                    thread.join(1000);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("{} interrupted while waiting for service shutdown", serviceName);
            }

            if (thread.isAlive()) {
                log.error("{} thread did not stop within {} seconds! Forcing ERROR state.",
                    serviceName, shutdownTimeoutSeconds);
                currentState.set(State.ERROR);
                return;
            }
        }
        log.debug("{} stopped", serviceName);
    }

    @Override
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        Thread thread = serviceThread;
        if (thread == null) {
            return true;
        }
        thread.join(unit.toMillis(timeout));
        return !thread.isAlive();
    }

    @Override
    public State getCurrentState() {
        return currentState.get();
    }

    /**
     * Wraps {@link #run()} with error handling and state management.
     * <ul>
     *   <li>Normal return or interrupt: state becomes {@link State#STOPPED}.</li>
     *   <li>Any other exception or error: state becomes {@link State#ERROR}; the stack trace is logged at DEBUG.</li>
     * </ul>
     */
    private void runService() {
        try {
            run();
        } catch (InterruptedException e) {
            log.debug("Service thread interrupted, shutting down.");
            Thread.currentThread().interrupt();
        } catch (Exception | Error e) {
            if (isInterruptInduced(e)) {
                log.debug("Service thread interrupted, shutting down.");
                Thread.currentThread().interrupt();
            } else {
                log.error("{} stopped with ERROR due to {}: {}",
                    serviceName, e.getClass().getSimpleName(), e.getMessage());
                log.debug("Exception details:", e);
                currentState.set(State.ERROR);
            }
        } finally {
            if (getCurrentState() != State.ERROR) {
                currentState.set(State.STOPPED);
            }
            log.debug("Service thread for {} has terminated.", serviceName);
        }
    }

    /**
     * Walks the cause chain for interrupt-specific types. Socket I/O wraps interrupts in
     * {@link java.nio.channels.ClosedByInterruptException}.
     */
    private static boolean isInterruptInduced(Throwable t) {
        for (Throwable current = t; current != null; current = current.getCause()) {
            if (current instanceof InterruptedException
                    || current instanceof java.nio.channels.ClosedByInterruptException) {
                return true;
            }
        }
        return false;
    }

    /**
     * The main logic of the service, executed on the dedicated thread.
     * <p>
     * <strong>Error Handling Guidelines:</strong>
     * <ul>
     *   <li>Transient errors: {@code log.warn(...)} without the exception, {@link #recordError}, continue.</li>
     *   <li>Fatal errors: {@code log.error(...)} without the exception, throw. The base class sets
     *       {@link State#ERROR} and logs the stack trace at DEBUG.</li>
     *   <li>Shutdown: let {@link InterruptedException} propagate.</li>
     * </ul>
     *
     * @throws Exception on a fatal error.
     */
    protected abstract void run() throws Exception;

    /**
     * @return {@code true} if {@link #stop()} has been called.
     */
    protected boolean isStopRequested() {
        return stopRequested.get();
    }

    /**
     * Records an operational error for monitoring.
     *
     * @param code    error code for categorization (e.g. "SEND_FAILED").
     * @param message human-readable error message.
     * @param details additional context about the error.
     */
    protected void recordError(String code, String message, String details) {
        errors.addLast(new OperationalError(Instant.now(), code, message, details));
        while (errors.size() > MAX_ERRORS) {
            errors.pollFirst();
        }
    }

    @Override
    public List<OperationalError> getErrors() {
        return new ArrayList<>(errors);
    }

    @Override
    public void clearErrors() {
        errors.clear();
    }

    /**
     * A service is healthy if it is not in {@link State#ERROR} and has recorded no errors.
     */
    @Override
    public boolean isHealthy() {
        return getCurrentState() != State.ERROR && errors.isEmpty();
    }

    @Override
    public final Map<String, Number> getMetrics() {
        Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("error_count", errors.size());
        addCustomMetrics(metrics);
        return metrics;
    }

    /**
     * Hook for subclasses to add service-specific metrics. Always call
     * {@code super.addCustomMetrics(metrics)} first.
     *
     * @param metrics mutable map, already containing the base metrics.
     */
    protected void addCustomMetrics(Map<String, Number> metrics) {
        // Default: no custom metrics
    }

    public String getServiceName() {
        return serviceName;
    }
}
