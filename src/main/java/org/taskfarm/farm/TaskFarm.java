package org.taskfarm.farm;

import java.io.IOException;
import java.lang.reflect.InvocationTargetException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.taskfarm.farm.api.FarmParameters;
import org.taskfarm.farm.api.ProtocolViolationException;
import org.taskfarm.farm.api.generation.IRandomProvider;
import org.taskfarm.farm.api.generation.IValueGenerator;
import org.taskfarm.farm.api.messages.Accounting;
import org.taskfarm.farm.api.resources.ISink;
import org.taskfarm.farm.api.resources.ITransport;
import org.taskfarm.farm.api.resources.IWorkerChannel;
import org.taskfarm.farm.api.resources.TransportException;
import org.taskfarm.farm.api.services.IService;
import org.taskfarm.farm.generation.SeededRandomProvider;
import org.taskfarm.farm.resources.transport.InMemoryTransport;
import org.taskfarm.farm.resources.transport.socket.SocketTransport;
import org.taskfarm.farm.resources.transport.socket.SocketWorkerChannel;
import org.taskfarm.farm.services.Dispatcher;
import org.taskfarm.farm.services.WorkerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Wires a run together from the {@code farm} configuration section and supervises it.
 * <p>
 * The generator and the sink are loaded by {@code className} plus {@code options}, the same
 * way for every mode:
 * <ul>
 *   <li>{@link #runInMemory(FarmParameters)}: workers are threads of this JVM.</li>
 *   <li>{@link #runDispatcher(FarmParameters)}: this process coordinates workers that connect over TCP.</li>
 *   <li>{@link #runWorker(String, int)}: this process is one such remote worker.</li>
 * </ul>
 * On any fatal condition the transport is aborted, local workers are stopped, the sink is
 * closed and a {@link TaskFarmException} is thrown.
 */
public class TaskFarm {

    private static final Logger log = LoggerFactory.getLogger(TaskFarm.class);

    private final Config farmConfig;
    private final long seed;

    /**
     * @param rootConfig the application configuration; the {@code farm} section is read,
     *                   falling back to the classpath defaults.
     */
    public TaskFarm(Config rootConfig) {
        this.farmConfig = rootConfig.withFallback(ConfigFactory.defaultReference()).getConfig("farm");
        this.seed = farmConfig.hasPath("seed") ? farmConfig.getLong("seed") : System.nanoTime();
    }

    /**
     * Runs with the transport selected by {@code farm.transport.mode}
     * ({@code in-memory} or {@code socket}).
     *
     * @param parameters the run parameters.
     * @return the report of the completed run.
     * @throws TaskFarmException if the run failed.
     */
    public FarmReport run(FarmParameters parameters) throws TaskFarmException {
        String mode = farmConfig.getString("transport.mode");
        return switch (mode) {
            case "in-memory" -> runInMemory(parameters);
            case "socket" -> runDispatcher(parameters);
            default -> throw new IllegalArgumentException(
                "Unknown transport mode '" + mode + "', expected 'in-memory' or 'socket'");
        };
    }

    /**
     * Runs dispatcher and workers in this JVM.
     *
     * @param parameters the run parameters.
     * @return the report of the completed run.
     * @throws TaskFarmException if the run failed.
     */
    public FarmReport runInMemory(FarmParameters parameters) throws TaskFarmException {
        ITransport transport = new InMemoryTransport("in-memory", parameters.workerCount(),
            farmConfig.getConfig("transport"));
        IRandomProvider root = new SeededRandomProvider(seed);
        List<WorkerService> workers = new ArrayList<>();
        for (IWorkerChannel channel : transport.localWorkerChannels()) {
            IValueGenerator generator = createGenerator(root.deriveFor(channel.workerId()));
            workers.add(new WorkerService("worker-" + channel.workerId(), farmConfig.getConfig("worker"),
                channel, generator));
        }
        log.debug("Using seed {} for {} local worker(s)", seed, workers.size());
        return supervise(parameters, transport, workers);
    }

    /**
     * Listens for {@code workerCount} remote workers and coordinates the run.
     *
     * @param parameters the run parameters.
     * @return the report of the completed run.
     * @throws TaskFarmException if the run failed, including when not all workers connected in time.
     * @throws IllegalArgumentException if the batch size exceeds what the transport accepts in one frame.
     */
    public FarmReport runDispatcher(FarmParameters parameters) throws TaskFarmException {
        int maxBatchValues = socketOptions().getInt("maxBatchValues");
        if (parameters.batchSize() > maxBatchValues) {
            throw new IllegalArgumentException(String.format(
                "Batch size %d exceeds the socket transport limit of %d values (farm.transport.socket.maxBatchValues)",
                parameters.batchSize(), maxBatchValues));
        }
        SocketTransport transport;
        try {
            transport = new SocketTransport("socket", parameters.workerCount(), socketOptions());
        } catch (IOException e) {
            throw new TaskFarmException("Cannot listen for workers: " + e.getMessage(), e);
        }
        log.info("Waiting for {} worker(s) on port {}", parameters.workerCount(), transport.getLocalPort());
        try {
            transport.acceptWorkers();
        } catch (TransportException e) {
            closeQuietly(transport);
            throw new TaskFarmException(e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            closeQuietly(transport);
            throw new TaskFarmException("Interrupted while waiting for workers", e);
        }
        return supervise(parameters, transport, List.of());
    }

    /**
     * Connects to a dispatcher and works until terminated or aborted.
     *
     * @param host dispatcher host.
     * @param port dispatcher port.
     * @return what this worker produced.
     * @throws TaskFarmException if the connection failed, generation failed or the run was aborted.
     */
    public WorkerReport runWorker(String host, int port) throws TaskFarmException {
        SocketWorkerChannel channel;
        try {
            channel = SocketWorkerChannel.connect(host, port, socketOptions());
        } catch (TransportException e) {
            throw new TaskFarmException(e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TaskFarmException("Interrupted while connecting to the dispatcher", e);
        }

        WorkerService worker;
        try {
            IValueGenerator generator = createGenerator(new SeededRandomProvider(seed).deriveFor(channel.workerId()));
            worker = new WorkerService("worker-" + channel.workerId(), farmConfig.getConfig("worker"),
                channel, generator);
        } catch (TaskFarmException | RuntimeException e) {
            closeQuietly(channel);
            throw e;
        }
        log.info("Connected to {}:{} as worker {} of {}", host, port, channel.workerId(), channel.workerCount());

        worker.start();
        try {
            while (!worker.awaitTermination(1, TimeUnit.SECONDS)) {
                log.trace("Worker {} still running", channel.workerId());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            closeQuietly(channel);
            stopQuietly(worker);
            throw new TaskFarmException("Interrupted while working", e);
        } finally {
            closeQuietly(channel);
        }

        WorkerReport report = new WorkerReport(channel.workerId(),
            worker.getMetrics().get("batches_produced").longValue(),
            worker.getMetrics().get("values_produced").longValue());
        if (worker.getCurrentState() == IService.State.ERROR) {
            throw new TaskFarmException("Worker " + channel.workerId() + " failed; see log for details");
        }
        if (worker.wasAborted()) {
            throw new TaskFarmException("Worker " + channel.workerId() + " was aborted by the dispatcher");
        }
        return report;
    }

    private FarmReport supervise(FarmParameters parameters, ITransport transport, List<WorkerService> workers)
            throws TaskFarmException {
        ISink sink;
        try {
            sink = createSink(parameters);
        } catch (TaskFarmException e) {
            closeQuietly(transport);
            throw e;
        }

        log.info("Generating {} values in batches of {} with {} worker(s), parameter {}",
            parameters.target(), parameters.batchSize(), parameters.workerCount(), parameters.parameter());
        long startNanos = System.nanoTime();
        try {
            for (WorkerService worker : workers) {
                worker.start();
            }
            Dispatcher dispatcher = new Dispatcher(transport.dispatcherChannel(), sink,
                farmConfig.getConfig("dispatcher"));
            Accounting accounting = dispatcher.run(parameters.target(), parameters.batchSize(), parameters.parameter());
            awaitWorkers(workers);
            sink.close();
            transport.close();

            Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
            FarmReport report = new FarmReport(accounting, elapsed, sink.describe());
            log.info("Wrote {} values in {} batches to {} ({} ms)", accounting.deliveredTotal(),
                accounting.batchesDelivered(), sink.describe(), elapsed.toMillis());
            return report;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw fail("Run interrupted", e, transport, workers, sink);
        } catch (TransportException | IOException | ProtocolViolationException e) {
            throw fail(e.getMessage(), e, transport, workers, sink);
        } catch (RuntimeException e) {
            throw fail(e.getClass().getSimpleName() + ": " + e.getMessage(), e, transport, workers, sink);
        }
    }

    private void awaitWorkers(List<WorkerService> workers) throws InterruptedException, TransportException {
        long timeoutSeconds = farmConfig.getInt("worker.shutdownTimeout");
        for (WorkerService worker : workers) {
            if (!worker.awaitTermination(timeoutSeconds, TimeUnit.SECONDS)) {
                throw new TransportException(String.format("Worker %d did not finish within %d s after the rendezvous",
                    worker.getWorkerId(), timeoutSeconds));
            }
            if (worker.getCurrentState() == IService.State.ERROR) {
                throw new TransportException("Worker " + worker.getWorkerId() + " ended with an error");
            }
        }
    }

    private TaskFarmException fail(String reason, Exception cause, ITransport transport,
                                   List<WorkerService> workers, ISink sink) {
        log.error("Run failed: {}", reason);
        log.debug("Failure details:", cause);

        transport.dispatcherChannel().abort(reason);
        for (WorkerService worker : workers) {
            stopQuietly(worker);
        }
        TaskFarmException failure = new TaskFarmException("Run failed: " + reason, cause);
        try {
            sink.close();
            log.info("Partial output ({} values) left in {}", sink.valuesWritten(), sink.describe());
        } catch (IOException e) {
            log.warn("Failed to close sink {}: {}", sink.describe(), e.getMessage());
            failure.addSuppressed(e);
        }
        closeQuietly(transport);
        return failure;
    }

    private IValueGenerator createGenerator(IRandomProvider randomProvider) throws TaskFarmException {
        Config definition = farmConfig.getConfig("generator");
        String className = definition.getString("className");
        Config options = definition.hasPath("options") ? definition.getConfig("options") : ConfigFactory.empty();
        try {
            return (IValueGenerator) Class.forName(className)
                .getConstructor(IRandomProvider.class, Config.class)
                .newInstance(randomProvider, options);
        } catch (ReflectiveOperationException | ClassCastException e) {
            throw new TaskFarmException("Failed to create generator '" + className + "': " + rootMessage(e), e);
        }
    }

    private ISink createSink(FarmParameters parameters) throws TaskFarmException {
        Config definition = farmConfig.getConfig("sink");
        String className = definition.getString("className");
        Config options = definition.hasPath("options") ? definition.getConfig("options") : ConfigFactory.empty();
        try {
            return (ISink) Class.forName(className)
                .getConstructor(FarmParameters.class, Config.class)
                .newInstance(parameters, options);
        } catch (ReflectiveOperationException | ClassCastException e) {
            throw new TaskFarmException("Failed to create sink '" + className + "': " + rootMessage(e), e);
        }
    }

    private Config socketOptions() {
        Config transport = farmConfig.getConfig("transport");
        return transport.getConfig("socket").withFallback(transport.withoutPath("socket"));
    }

    private static String rootMessage(Throwable t) {
        Throwable cause = t instanceof InvocationTargetException && t.getCause() != null ? t.getCause() : t;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    private static void stopQuietly(WorkerService worker) {
        if (worker.getCurrentState() != IService.State.RUNNING) {
            return;
        }
        log.debug("Stopping {}", worker.getServiceName());
        try {
            worker.stop();
        } catch (IllegalStateException e) {
            log.debug("{} ended while being stopped: {}", worker.getServiceName(), e.getMessage());
        }
    }

    private static void closeQuietly(AutoCloseable closeable) {
        try {
            closeable.close();
        } catch (Exception e) {
            log.debug("Ignoring failure while closing {}: {}", closeable, e.getMessage());
        }
    }
}
