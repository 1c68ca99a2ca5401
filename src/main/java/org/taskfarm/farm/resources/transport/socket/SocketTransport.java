package org.taskfarm.farm.resources.transport.socket;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
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
import org.taskfarm.farm.resources.transport.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

/**
 * Dispatcher side of the TCP transport. Workers run as separate processes and connect with
 * {@link SocketWorkerChannel}.
 * <p>
 * The constructor binds the listening socket; {@link #acceptWorkers()} then waits until
 * {@code workerCount} workers completed the {@code HELLO}/{@code WELCOME} handshake. Worker ids
 * are handed out in connection order, starting at 1. One reader thread per connection decodes
 * incoming frames into the shared reply queue; a closed or broken connection becomes a
 * worker-lost entry, so the dispatcher fails instead of waiting forever.
 * <p>
 * The rendezvous collects one {@code BARRIER_ARRIVE} per worker and then answers every worker
 * with {@code BARRIER_RELEASE}.
 *
 * <h3>Configuration Options:</h3>
 * <ul>
 *   <li><b>host</b>: address to bind (default: 0.0.0.0).</li>
 *   <li><b>port</b>: port to listen on, 0 picks a free port (default: 7420).</li>
 *   <li><b>acceptTimeout</b>: how long to wait for all workers to connect (default: 60s).</li>
 *   <li><b>receiveTimeout</b>: how long to wait for any batch (default: 0 = no limit).</li>
 *   <li><b>barrierTimeout</b>: how long to wait for all workers at the rendezvous (default: 60s).</li>
 *   <li><b>maxBatchValues</b>: largest batch accepted from a worker (default: 10000000).</li>
 * </ul>
 */
public class SocketTransport implements ITransport {

    private static final Logger log = LoggerFactory.getLogger(SocketTransport.class);

    private final String name;
    private final int workerCount;
    private final ServerSocket serverSocket;
    private final long acceptTimeoutMs;
    private final long receiveTimeoutMs;
    private final long barrierTimeoutMs;
    private final int maxBatchValues;

    private final Map<Integer, Connection> connections = new LinkedHashMap<>();
    private final LinkedBlockingQueue<Envelope> replies = new LinkedBlockingQueue<>();
    private final Set<Integer> terminated = ConcurrentHashMap.newKeySet();
    private final AtomicReference<String> abortReason = new AtomicReference<>();
    private volatile boolean closing;
    private volatile List<Integer> workerIds = List.of();

    private final DispatcherSide dispatcherSide = new DispatcherSide();

    /**
     * Binds the listening socket.
     *
     * @param name        name for logging and thread names.
     * @param workerCount number of workers to wait for, {@code >= 1}.
     * @param options     transport options.
     * @throws IOException              if the socket cannot be bound.
     * @throws IllegalArgumentException if the configuration is invalid.
     */
    public SocketTransport(String name, int workerCount, Config options) throws IOException {
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be >= 1 for transport '" + name + "'.");
        }
        Config defaults = ConfigFactory.parseMap(Map.of(
            "host", "0.0.0.0",
            "port", 7420,
            "acceptTimeout", "60s",
            "receiveTimeout", "0s",
            "barrierTimeout", "60s",
            "maxBatchValues", 10_000_000
        ));
        Config finalConfig = options.withFallback(defaults);
        String host;
        int port;
        try {
            host = finalConfig.getString("host");
            port = finalConfig.getInt("port");
            this.acceptTimeoutMs = finalConfig.getDuration("acceptTimeout", TimeUnit.MILLISECONDS);
            this.receiveTimeoutMs = finalConfig.getDuration("receiveTimeout", TimeUnit.MILLISECONDS);
            this.barrierTimeoutMs = finalConfig.getDuration("barrierTimeout", TimeUnit.MILLISECONDS);
            this.maxBatchValues = finalConfig.getInt("maxBatchValues");
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid configuration for SocketTransport '" + name + "'", e);
        }
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port must be within [0, 65535], got: " + port);
        }
        if (acceptTimeoutMs <= 0 || receiveTimeoutMs < 0 || barrierTimeoutMs <= 0 || maxBatchValues < 1) {
            throw new IllegalArgumentException(
                "Timeouts and maxBatchValues must be positive (receiveTimeout may be 0) for transport '" + name + "'.");
        }

        this.name = name;
        this.workerCount = workerCount;
        this.serverSocket = new ServerSocket();
        serverSocket.setReuseAddress(true);
        serverSocket.bind(new InetSocketAddress(host, port));
        log.debug("Transport '{}' listening on {}:{}", name, host, serverSocket.getLocalPort());
    }

    /**
     * @return the port the transport listens on.
     */
    public int getLocalPort() {
        return serverSocket.getLocalPort();
    }

    /**
     * Blocks until every worker has connected and completed the handshake.
     *
     * @throws TransportException   if not all workers connected within the accept timeout.
     * @throws InterruptedException if the calling thread is interrupted.
     */
    public void acceptWorkers() throws TransportException, InterruptedException {
        if (!connections.isEmpty()) {
            throw new IllegalStateException("Workers have already been accepted on transport '" + name + "'");
        }
        long deadline = System.currentTimeMillis() + acceptTimeoutMs;
        int nextId = 1;
        while (nextId <= workerCount) {
            if (Thread.interrupted()) {
                throw new InterruptedException("Interrupted while accepting workers");
            }
            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0) {
                throw new TransportException(String.format(
                    "Only %d of %d workers connected within %s", nextId - 1, workerCount,
                    Duration.ofMillis(acceptTimeoutMs)));
            }
            Socket socket;
            try {
                serverSocket.setSoTimeout((int) Math.min(remaining, Integer.MAX_VALUE));
                socket = serverSocket.accept();
            } catch (SocketTimeoutException e) {
                continue;
            } catch (IOException e) {
                throw new TransportException("Failed to accept worker connection on transport '" + name + "'", e);
            }

            try {
                Connection connection = handshake(socket, nextId);
                connections.put(nextId, connection);
                log.info("Worker {} connected from {}", nextId, socket.getRemoteSocketAddress());
                nextId++;
            } catch (IOException e) {
                log.warn("Rejected connection from {}: {}", socket.getRemoteSocketAddress(), e.getMessage());
                closeQuietly(socket);
            }
        }

        List<Integer> ids = new ArrayList<>(connections.keySet());
        this.workerIds = Collections.unmodifiableList(ids);
        for (Connection connection : connections.values()) {
            connection.reader.start();
        }
    }

    private Connection handshake(Socket socket, int workerId) throws IOException {
        socket.setTcpNoDelay(true);
        socket.setSoTimeout((int) Math.min(acceptTimeoutMs, Integer.MAX_VALUE));
        DataInputStream in = new DataInputStream(new BufferedInputStream(socket.getInputStream()));
        DataOutputStream out = new DataOutputStream(new BufferedOutputStream(socket.getOutputStream()));

        byte tag = in.readByte();
        if (tag != Frames.HELLO) {
            throw new IOException("Expected HELLO, got frame tag " + tag);
        }
        int version = in.readInt();
        if (version != Frames.PROTOCOL_VERSION) {
            throw new IOException("Unsupported protocol version " + version);
        }
        out.writeByte(Frames.WELCOME);
        out.writeInt(workerId);
        out.writeInt(workerCount);
        out.flush();
        socket.setSoTimeout(0);
        return new Connection(workerId, socket, in, out);
    }

    @Override
    public IDispatcherChannel dispatcherChannel() {
        return dispatcherSide;
    }

    /**
     * @return always empty: socket workers live in other processes.
     */
    @Override
    public List<IWorkerChannel> localWorkerChannels() {
        return List.of();
    }

    @Override
    public void close() throws IOException {
        closing = true;
        IOException failure = null;
        for (Connection connection : connections.values()) {
            try {
                connection.socket.close();
            } catch (IOException e) {
                failure = e;
            }
        }
        serverSocket.close();
        if (failure != null) {
            throw failure;
        }
    }

    private Connection requireKnown(int workerId) {
        Connection connection = connections.get(workerId);
        if (connection == null) {
            throw new ProtocolViolationException("Unknown worker id " + workerId + " on transport '" + name + "'");
        }
        return connection;
    }

    private void checkNotAborted() throws TransportException {
        String reason = abortReason.get();
        if (reason != null) {
            throw new TransportException("Transport '" + name + "' was aborted: " + reason);
        }
    }

    private static void closeQuietly(Socket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            log.debug("Ignoring failure while closing socket: {}", e.getMessage());
        }
    }

    private final class Connection {

        private final int workerId;
        private final Socket socket;
        private final DataInputStream in;
        private final DataOutputStream out;
        private final Thread reader;
        private volatile boolean released;

        Connection(int workerId, Socket socket, DataInputStream in, DataOutputStream out) {
            this.workerId = workerId;
            this.socket = socket;
            this.in = in;
            this.out = out;
            this.reader = new Thread(this::readLoop, name + "-reader-" + workerId);
            this.reader.setDaemon(true);
        }

        synchronized void write(WorkerMessage message) throws IOException {
            Frames.writeWorkerMessage(out, message);
        }

        synchronized void writeSignal(byte tag) throws IOException {
            Frames.writeSignal(out, tag);
        }

        private void readLoop() {
            try {
                while (true) {
                    byte tag = in.readByte();
                    switch (tag) {
                        case Frames.RESULT -> {
                            double[] values = Frames.readValues(in, maxBatchValues);
                            replies.offer(new Envelope.Delivered(new ResultBatch(workerId, values)));
                        }
                        case Frames.FAILED -> {
                            String reason = in.readUTF();
                            replies.offer(new Envelope.WorkerLost(workerId, "worker reported failure: " + reason, null));
                            return;
                        }
                        case Frames.BARRIER_ARRIVE -> replies.offer(new Envelope.BarrierArrival(workerId));
                        default -> throw new IOException("Unexpected frame tag " + tag + " from worker " + workerId);
                    }
                }
            } catch (EOFException e) {
                connectionEnded("connection closed", null);
            } catch (IOException e) {
                connectionEnded(e.getMessage(), e);
            }
        }

        private void connectionEnded(String reason, Throwable cause) {
            if (closing || released || abortReason.get() != null) {
                log.debug("Connection to worker {} ended: {}", workerId, reason);
                return;
            }
            replies.offer(new Envelope.WorkerLost(workerId, reason, cause));
        }
    }

    private final class DispatcherSide implements IDispatcherChannel {

        @Override
        public List<Integer> workerIds() {
            return workerIds;
        }

        @Override
        public void send(int workerId, WorkerMessage message) throws TransportException {
            Connection connection = requireKnown(workerId);
            checkNotAborted();
            if (terminated.contains(workerId)) {
                throw new ProtocolViolationException(String.format(
                    "Worker %d has already been terminated; refusing to send %s", workerId, message));
            }
            if (message instanceof Termination) {
                terminated.add(workerId);
            }
            try {
                connection.write(message);
            } catch (IOException e) {
                throw new TransportException("Failed to send to worker " + workerId + ": " + e.getMessage(), e);
            }
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
            if (envelope instanceof Envelope.BarrierArrival arrival) {
                throw new ProtocolViolationException(
                    "Worker " + arrival.workerId() + " arrived at the rendezvous before being terminated");
            }
            throw new ProtocolViolationException("Unexpected envelope " + envelope);
        }

        @Override
        public void awaitRendezvous() throws TransportException, InterruptedException {
            checkNotAborted();
            Set<Integer> arrived = new HashSet<>();
            long deadline = System.currentTimeMillis() + barrierTimeoutMs;
            while (arrived.size() < workerIds.size()) {
                long remaining = deadline - System.currentTimeMillis();
                Envelope envelope = remaining > 0 ? replies.poll(remaining, TimeUnit.MILLISECONDS) : null;
                if (envelope == null) {
                    throw new TransportException(String.format(
                        "Rendezvous not complete after %d ms (%d of %d workers arrived)",
                        barrierTimeoutMs, arrived.size(), workerIds.size()));
                }
                if (envelope instanceof Envelope.BarrierArrival arrival) {
                    arrived.add(arrival.workerId());
                } else if (envelope instanceof Envelope.WorkerLost workerLost) {
                    if (!arrived.contains(workerLost.workerId())) {
                        throw new TransportException("Worker " + workerLost.workerId()
                            + " lost before the rendezvous: " + workerLost.reason(), workerLost.cause());
                    }
                } else if (envelope instanceof Envelope.Aborted aborted) {
                    throw new TransportException("Rendezvous aborted: " + aborted.reason());
                } else {
                    throw new ProtocolViolationException("Unexpected " + envelope + " during the rendezvous");
                }
            }

            for (Connection connection : connections.values()) {
                connection.released = true;
                try {
                    connection.writeSignal(Frames.BARRIER_RELEASE);
                } catch (IOException e) {
                    throw new TransportException(
                        "Failed to release worker " + connection.workerId + ": " + e.getMessage(), e);
                }
            }
        }

        @Override
        public void abort(String reason) {
            if (!abortReason.compareAndSet(null, reason)) {
                return;
            }
            log.debug("Transport '{}' aborting: {}", name, reason);
            for (Connection connection : connections.values()) {
                try {
                    connection.write(new Abort(reason));
                } catch (IOException e) {
                    log.debug("Could not deliver abort to worker {}: {}", connection.workerId, e.getMessage());
                }
                closeQuietly(connection.socket);
            }
            replies.offer(new Envelope.Aborted(reason));
        }
    }
}
