package org.taskfarm.farm.resources.transport.socket;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.taskfarm.farm.api.ProtocolViolationException;
import org.taskfarm.farm.api.messages.ResultBatch;
import org.taskfarm.farm.api.messages.WorkerMessage;
import org.taskfarm.farm.api.resources.IWorkerChannel;
import org.taskfarm.farm.api.resources.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

/**
 * Worker side of the TCP transport: one connection to a {@link SocketTransport}.
 * <p>
 * Reads block on the socket and do not react to thread interruption; {@link #close()} from
 * another thread unblocks them.
 *
 * <h3>Configuration Options:</h3>
 * <ul>
 *   <li><b>connectTimeout</b>: how long to keep retrying the connection (default: 30s).</li>
 *   <li><b>retryInterval</b>: pause between connection attempts (default: 500ms).</li>
 *   <li><b>barrierTimeout</b>: how long to wait for the release at the rendezvous (default: 60s).</li>
 * </ul>
 */
public class SocketWorkerChannel implements IWorkerChannel, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SocketWorkerChannel.class);

    private final Socket socket;
    private final DataInputStream in;
    private final DataOutputStream out;
    private final int workerId;
    private final int workerCount;
    private final long barrierTimeoutMs;
    private final AtomicBoolean failed = new AtomicBoolean(false);

    private SocketWorkerChannel(Socket socket, DataInputStream in, DataOutputStream out,
                                int workerId, int workerCount, long barrierTimeoutMs) {
        this.socket = socket;
        this.in = in;
        this.out = out;
        this.workerId = workerId;
        this.workerCount = workerCount;
        this.barrierTimeoutMs = barrierTimeoutMs;
    }

    /**
     * Connects to a dispatcher and performs the handshake, retrying until the connect timeout
     * expires (the dispatcher may start after its workers).
     *
     * @param host    dispatcher host.
     * @param port    dispatcher port.
     * @param options channel options.
     * @return the connected channel, with the worker id assigned by the dispatcher.
     * @throws TransportException   if no connection could be established.
     * @throws InterruptedException if interrupted while waiting between attempts.
     */
    public static SocketWorkerChannel connect(String host, int port, Config options)
            throws TransportException, InterruptedException {
        Config defaults = ConfigFactory.parseMap(Map.of(
            "connectTimeout", "30s",
            "retryInterval", "500ms",
            "barrierTimeout", "60s"
        ));
        Config finalConfig = options.withFallback(defaults);
        long connectTimeoutMs;
        long retryIntervalMs;
        long barrierTimeoutMs;
        try {
            connectTimeoutMs = finalConfig.getDuration("connectTimeout", TimeUnit.MILLISECONDS);
            retryIntervalMs = finalConfig.getDuration("retryInterval", TimeUnit.MILLISECONDS);
            barrierTimeoutMs = finalConfig.getDuration("barrierTimeout", TimeUnit.MILLISECONDS);
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid configuration for SocketWorkerChannel", e);
        }

        long deadline = System.currentTimeMillis() + connectTimeoutMs;
        IOException lastFailure = null;
        while (System.currentTimeMillis() < deadline) {
            Socket socket = new Socket();
            try {
                socket.setTcpNoDelay(true);
                socket.connect(new InetSocketAddress(host, port),
                    (int) Math.max(1, Math.min(deadline - System.currentTimeMillis(), Integer.MAX_VALUE)));
                return handshake(socket, barrierTimeoutMs);
            } catch (IOException e) {
                lastFailure = e;
                try {
                    socket.close();
                } catch (IOException closeFailure) {
                    e.addSuppressed(closeFailure);
                }
                log.debug("Connection to {}:{} failed ({}), retrying", host, port, e.getMessage());
                Thread.sleep(retryIntervalMs);
            }
        }
        throw new TransportException(String.format("Could not connect to dispatcher at %s:%d within %d ms",
            host, port, connectTimeoutMs), lastFailure);
    }

    private static SocketWorkerChannel handshake(Socket socket, long barrierTimeoutMs) throws IOException {
        DataInputStream in = new DataInputStream(new BufferedInputStream(socket.getInputStream()));
        DataOutputStream out = new DataOutputStream(new BufferedOutputStream(socket.getOutputStream()));
        out.writeByte(Frames.HELLO);
        out.writeInt(Frames.PROTOCOL_VERSION);
        out.flush();

        byte tag = in.readByte();
        if (tag != Frames.WELCOME) {
            throw new IOException("Expected WELCOME, got frame tag " + tag);
        }
        int workerId = in.readInt();
        int workerCount = in.readInt();
        log.debug("Connected to dispatcher as worker {} of {}", workerId, workerCount);
        return new SocketWorkerChannel(socket, in, out, workerId, workerCount, barrierTimeoutMs);
    }

    @Override
    public int workerId() {
        return workerId;
    }

    /**
     * @return number of workers in the run, as announced by the dispatcher.
     */
    public int workerCount() {
        return workerCount;
    }

    @Override
    public WorkerMessage receive() throws TransportException {
        try {
            byte tag = in.readByte();
            return Frames.readWorkerMessage(tag, in);
        } catch (EOFException e) {
            throw new TransportException("Dispatcher closed the connection of worker " + workerId, e);
        } catch (IOException e) {
            throw new TransportException("Worker " + workerId + " failed to receive: " + e.getMessage(), e);
        }
    }

    @Override
    public void send(ResultBatch batch) throws TransportException {
        if (batch.producerId() != workerId) {
            throw new ProtocolViolationException(String.format(
                "Worker %d cannot send a batch tagged with producer %d", workerId, batch.producerId()));
        }
        try {
            synchronized (out) {
                Frames.writeValues(out, batch.values());
            }
        } catch (IOException e) {
            throw new TransportException("Worker " + workerId + " failed to send: " + e.getMessage(), e);
        }
    }

    @Override
    public void reportFailure(Throwable cause) {
        if (!failed.compareAndSet(false, true)) {
            return;
        }
        try {
            synchronized (out) {
                Frames.writeReason(out, Frames.FAILED, String.valueOf(cause.getMessage()));
            }
        } catch (IOException e) {
            log.debug("Worker {} could not report its failure: {}", workerId, e.getMessage());
        }
    }

    @Override
    public void awaitRendezvous() throws TransportException {
        try {
            synchronized (out) {
                Frames.writeSignal(out, Frames.BARRIER_ARRIVE);
            }
            socket.setSoTimeout((int) Math.min(barrierTimeoutMs, Integer.MAX_VALUE));
            byte tag = in.readByte();
            if (tag == Frames.BARRIER_RELEASE) {
                return;
            }
            if (tag == Frames.ABORT) {
                throw new TransportException("Rendezvous aborted: " + in.readUTF());
            }
            throw new TransportException("Unexpected frame tag " + tag + " while waiting at the rendezvous");
        } catch (SocketTimeoutException e) {
            throw new TransportException("No rendezvous release within " + barrierTimeoutMs + " ms", e);
        } catch (EOFException e) {
            throw new TransportException("Dispatcher closed the connection during the rendezvous", e);
        } catch (IOException e) {
            throw new TransportException("Rendezvous failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() throws IOException {
        socket.close();
    }
}
