package org.taskfarm.farm.resources.transport;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.Phaser;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

import org.taskfarm.farm.api.ProtocolViolationException;
import org.taskfarm.farm.api.messages.Abort;
import org.taskfarm.farm.api.messages.ResultBatch;
import org.taskfarm.farm.api.messages.Termination;
import org.taskfarm.farm.api.messages.WorkerMessage;
import org.taskfarm.farm.api.resources.IDispatcherChannel;
import org.taskfarm.farm.api.resources.ITransport;
import org.taskfarm.farm.api.resources.IWorkerChannel;
import org.taskfarm.farm.api.resources.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

/**
 * Transport for workers running as threads in the same JVM.
 * <p>
 * Each worker owns an inbox ({@link LinkedBlockingDeque}; an abort is pushed to the
 * front so it overtakes anything still queued). All workers reply into one shared
 * {@link LinkedBlockingQueue}, which is what gives the dispatcher its "receive from any".
 * The rendezvous is a {@link Phaser} with one party per worker plus the dispatcher;
 * {@link IDispatcherChannel#abort(String) abort} force-terminates it so nobody stays
 * blocked on it.
 * <p>
 * Worker ids are {@code 1..workerCount}; id 0 is reserved for the dispatcher.
 *
 * <h3>Configuration Options:</h3>
 * <ul>
 *   <li><b>receiveTimeout</b>: how long the dispatcher waits for any batch (default: 0 = no limit).</li>
 *   <li><b>barrierTimeout</b>: how long a participant waits on the rendezvous (default: 60s).</li>
 *   <li><b>pollInterval</b>: how often a waiting worker re-checks for disconnection (default: 50ms).</li>
 * </ul>
 */
public class InMemoryTransport implements ITransport {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTransport.class);

    private final String name;
    private final List<Integer> workerIds;
    private final Map<Integer, LinkedBlockingDeque<WorkerMessage>> inboxes = new LinkedHashMap<>();
    private final LinkedBlockingQueue<Envelope> replies = new LinkedBlockingQueue<>();
    private final Phaser rendezvous;
    private final Set<Integer> terminated = ConcurrentHashMap.newKeySet();
    private final Set<Integer> lost = ConcurrentHashMap.newKeySet();
    private final AtomicReference<String> abortReason = new AtomicReference<>();

    private final long receiveTimeoutMs;
    private final long barrierTimeoutMs;
    private final long pollIntervalMs;

    private final DispatcherSide dispatcherSide = new DispatcherSide();
    private final List<IWorkerChannel> workerSides;

    /**
     * Creates a transport for {@code workerCount} in-process workers.
     *
     * @param name        name for logging.
     * @param workerCount number of workers, {@code >= 1}.
     * @param options     transport options.
     * @throws IllegalArgumentException if the configuration is invalid.
     */
    public InMemoryTransport(String name, int workerCount, Config options) {
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be >= 1 for transport '" + name + "'.");
        }
        Config defaults = ConfigFactory.parseMap(Map.of(
            "receiveTimeout", "0s",
            "barrierTimeout", "60s",
            "pollInterval", "50ms"
        ));
        Config finalConfig = options.withFallback(defaults);
        try {
            this.receiveTimeoutMs = finalConfig.getDuration("receiveTimeout", TimeUnit.MILLISECONDS);
            this.barrierTimeoutMs = finalConfig.getDuration("barrierTimeout", TimeUnit.MILLISECONDS);
            this.pollIntervalMs = finalConfig.getDuration("pollInterval", TimeUnit.MILLISECONDS);
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid configuration for InMemoryTransport '" + name + "'", e);
        }
        if (receiveTimeoutMs < 0 || barrierTimeoutMs <= 0 || pollIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "Timeouts must be positive (receiveTimeout may be 0) for transport '" + name + "'.");
        }

        this.name = name;
        List<Integer> ids = new ArrayList<>(workerCount);
        List<IWorkerChannel> sides = new ArrayList<>(workerCount);
        for (int id = 1; id <= workerCount; id++) {
            ids.add(id);
            inboxes.put(id, new LinkedBlockingDeque<>());
            sides.add(new WorkerSide(id));
        }
        this.workerIds = Collections.unmodifiableList(ids);
        this.workerSides = Collections.unmodifiableList(sides);
        this.rendezvous = new Phaser(workerCount + 1);
    }

    @Override
    public IDispatcherChannel dispatcherChannel() {
        return dispatcherSide;
    }

    @Override
    public List<IWorkerChannel> localWorkerChannels() {
        return workerSides;
    }

    /**
     * Simulates the loss of a worker's connection: the worker's next receive or send fails,
     * and the dispatcher's next receive reports the worker as lost.
     *
     * @param workerId the worker to cut off.
     */
    public void disconnect(int workerId) {
        requireKnown(workerId);
        if (lost.add(workerId)) {
            log.debug("Transport '{}': worker {} disconnected", name, workerId);
            replies.offer(new Envelope.WorkerLost(workerId, "connection lost", null));
        }
    }

    /**
     * @return {@code true} once the transport has been aborted.
     */
    public boolean isAborted() {
        return abortReason.get() != null;
    }

    @Override
    public void close() throws IOException {
        if (!rendezvous.isTerminated()) {
            rendezvous.forceTermination();
        }
    }

    private void requireKnown(int workerId) {
        if (!inboxes.containsKey(workerId)) {
            throw new ProtocolViolationException("Unknown worker id " + workerId + " on transport '" + name + "'");
        }
    }

    private void checkNotAborted() throws TransportException {
        String reason = abortReason.get();
        if (reason != null) {
            throw new TransportException("Transport '" + name + "' was aborted: " + reason);
        }
    }

    private void awaitBarrier(String participant) throws TransportException, InterruptedException {
        checkNotAborted();
        int phase = rendezvous.arrive();
        if (phase < 0) {
            throw new TransportException("Rendezvous aborted before " + participant + " arrived");
        }
        try {
            int next = rendezvous.awaitAdvanceInterruptibly(phase, barrierTimeoutMs, TimeUnit.MILLISECONDS);
            if (next < 0) {
                throw new TransportException("Rendezvous aborted while " + participant + " was waiting");
            }
        } catch (TimeoutException e) {
            throw new TransportException(String.format(
                "Rendezvous not complete after %d ms (%d of %d parties arrived)",
                barrierTimeoutMs, rendezvous.getArrivedParties(), rendezvous.getRegisteredParties()), e);
        }
    }

    private final class DispatcherSide implements IDispatcherChannel {

        @Override
        public List<Integer> workerIds() {
            return workerIds;
        }

        @Override
        public void send(int workerId, WorkerMessage message) throws TransportException {
            requireKnown(workerId);
            checkNotAborted();
            if (terminated.contains(workerId)) {
                throw new ProtocolViolationException(String.format(
                    "Worker %d has already been terminated; refusing to send %s", workerId, message));
            }
            if (lost.contains(workerId)) {
                throw new TransportException("Worker " + workerId + " is unreachable");
            }
            if (message instanceof Termination) {
                terminated.add(workerId);
            }
            inboxes.get(workerId).offer(message);
        }

        @Override
        public ResultBatch receiveAny() throws TransportException, InterruptedException {
            checkNotAborted();
            Envelope envelope = receiveTimeoutMs == 0
                ? replies.take()
                : replies.poll(receiveTimeoutMs, TimeUnit.MILLISECONDS);
            if (envelope == null) {
                throw new TransportException("No result received within " + Duration.ofMillis(receiveTimeoutMs));
            }
            if (envelope instanceof Envelope.Delivered delivered) {
                return delivered.batch();
            }
            if (envelope instanceof Envelope.WorkerLost workerLost) {
                throw new TransportException(
                    "Worker " + workerLost.workerId() + " lost: " + workerLost.reason(), workerLost.cause());
            }
            if (envelope instanceof Envelope.Aborted aborted) {
                throw new TransportException("Transport '" + name + "' was aborted: " + aborted.reason());
            }
            throw new ProtocolViolationException("Unexpected envelope " + envelope);
        }

        @Override
        public void awaitRendezvous() throws TransportException, InterruptedException {
            awaitBarrier("dispatcher");
        }

        @Override
        public void abort(String reason) {
            if (!abortReason.compareAndSet(null, reason)) {
                return;
            }
            log.debug("Transport '{}' aborting: {}", name, reason);
            for (Map.Entry<Integer, LinkedBlockingDeque<WorkerMessage>> entry : inboxes.entrySet()) {
                entry.getValue().offerFirst(new Abort(reason));
            }
            rendezvous.forceTermination();
            replies.offer(new Envelope.Aborted(reason));
        }
    }

    private final class WorkerSide implements IWorkerChannel {

        private final int workerId;
        private final LinkedBlockingDeque<WorkerMessage> inbox;

        WorkerSide(int workerId) {
            this.workerId = workerId;
            this.inbox = inboxes.get(workerId);
        }

        @Override
        public int workerId() {
            return workerId;
        }

        @Override
        public WorkerMessage receive() throws TransportException, InterruptedException {
            while (true) {
                if (lost.contains(workerId)) {
                    throw new TransportException("Worker " + workerId + " is disconnected");
                }
                WorkerMessage message = inbox.poll(pollIntervalMs, TimeUnit.MILLISECONDS);
                if (message != null) {
                    return message;
                }
            }
        }

        @Override
        public void send(ResultBatch batch) throws TransportException {
            if (batch.producerId() != workerId) {
                throw new ProtocolViolationException(String.format(
                    "Worker %d cannot send a batch tagged with producer %d", workerId, batch.producerId()));
            }
            checkNotAborted();
            if (lost.contains(workerId)) {
                throw new TransportException("Worker " + workerId + " is disconnected");
            }
            replies.offer(new Envelope.Delivered(batch));
        }

        @Override
        public void reportFailure(Throwable cause) {
            if (lost.add(workerId)) {
                replies.offer(new Envelope.WorkerLost(workerId, String.valueOf(cause.getMessage()), cause));
            }
        }

        @Override
        public void awaitRendezvous() throws TransportException, InterruptedException {
            if (lost.contains(workerId)) {
                throw new TransportException("Worker " + workerId + " is disconnected");
            }
            awaitBarrier("worker " + workerId);
        }
    }
}
