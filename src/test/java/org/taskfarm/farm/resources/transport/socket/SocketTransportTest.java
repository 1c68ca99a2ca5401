package org.taskfarm.farm.resources.transport.socket;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.taskfarm.farm.api.ProtocolViolationException;
import org.taskfarm.farm.api.generation.GenerationException;
import org.taskfarm.farm.api.generation.IValueGenerator;
import org.taskfarm.farm.api.messages.Abort;
import org.taskfarm.farm.api.messages.Accounting;
import org.taskfarm.farm.api.messages.ResultBatch;
import org.taskfarm.farm.api.messages.Termination;
import org.taskfarm.farm.api.messages.WorkUnit;
import org.taskfarm.farm.api.resources.ISink;
import org.taskfarm.farm.api.resources.TransportException;
import org.taskfarm.farm.api.services.IService;
import org.taskfarm.farm.services.Dispatcher;
import org.taskfarm.farm.services.WorkerService;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

@Tag("integration")
class SocketTransportTest {

    private static final Config DISPATCHER_OPTIONS = ConfigFactory.parseString(
        "host = \"127.0.0.1\"\nport = 0\nacceptTimeout = 10s\nreceiveTimeout = 10s\nbarrierTimeout = 10s");
    private static final Config WORKER_OPTIONS = ConfigFactory.parseString(
        "connectTimeout = 5s\nretryInterval = 50ms\nbarrierTimeout = 10s");

    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final List<SocketWorkerChannel> workerChannels = new ArrayList<>();
    private final List<WorkerService> workers = new ArrayList<>();
    private SocketTransport transport;

    @BeforeEach
    void setUp() {
        workerChannels.clear();
        workers.clear();
    }

    @AfterEach
    void tearDown() throws Exception {
        for (SocketWorkerChannel channel : workerChannels) {
            channel.close();
        }
        if (transport != null) {
            transport.close();
        }
        executor.shutdownNow();
    }

    @Test
    void completeRunOverLoopback() throws Exception {
        transport = new SocketTransport("test", 2, DISPATCHER_OPTIONS);
        connectWorkers(2);
        startWorkers((parameter, count) -> constant(parameter, count));
        CollectingSink sink = new CollectingSink();

        Accounting accounting = new Dispatcher(transport.dispatcherChannel(), sink, ConfigFactory.empty())
            .run(53, 5, 7.5);

        assertThat(accounting.deliveredTotal()).isEqualTo(53);
        assertThat(accounting.batchesDelivered()).isEqualTo(11);
        assertThat(sink.values).hasSize(53).containsOnly(7.5);
        for (WorkerService worker : workers) {
            assertThat(worker.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
            assertThat(worker.getCurrentState()).isEqualTo(IService.State.STOPPED);
            assertThat(worker.getMetrics()).containsEntry("terminations", 1L);
        }
        assertThat(transport.localWorkerChannels()).isEmpty();
    }

    @Test
    void handshakeAssignsDistinctIdsAndAnnouncesWorkerCount() throws Exception {
        transport = new SocketTransport("test", 3, DISPATCHER_OPTIONS);
        connectWorkers(3);

        assertThat(transport.dispatcherChannel().workerIds()).containsExactly(1, 2, 3);
        assertThat(workerChannels).extracting(SocketWorkerChannel::workerId).containsExactlyInAnyOrder(1, 2, 3);
        assertThat(workerChannels).extracting(SocketWorkerChannel::workerCount).containsOnly(3);
    }

    @Test
    void emptyTargetOnlyTerminates() throws Exception {
        transport = new SocketTransport("test", 2, DISPATCHER_OPTIONS);
        connectWorkers(2);
        startWorkers((parameter, count) -> {
            throw new GenerationException("must not be called");
        });

        Accounting accounting = new Dispatcher(transport.dispatcherChannel(), new CollectingSink(), ConfigFactory.empty())
            .run(0, 5, 1.0);

        assertThat(accounting.deliveredTotal()).isZero();
        for (WorkerService worker : workers) {
            assertThat(worker.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
            assertThat(worker.getMetrics()).containsEntry("batches_produced", 0L).containsEntry("terminations", 1L);
        }
    }

    @Test
    void terminationIsSentAsZeroCountAndOnlyOnce() throws Exception {
        transport = new SocketTransport("test", 1, DISPATCHER_OPTIONS);
        connectWorkers(1);

        transport.dispatcherChannel().send(1, Termination.INSTANCE);

        assertThat(workerChannels.get(0).receive()).isEqualTo(Termination.INSTANCE);
        assertThatThrownBy(() -> transport.dispatcherChannel().send(1, Termination.INSTANCE))
            .isInstanceOf(ProtocolViolationException.class);
    }

    @Test
    void generationFailureReachesTheDispatcher() throws Exception {
        transport = new SocketTransport("test", 1, DISPATCHER_OPTIONS);
        connectWorkers(1);
        startWorkers((parameter, count) -> {
            throw new GenerationException("entropy exhausted");
        });

        assertThatThrownBy(() -> new Dispatcher(transport.dispatcherChannel(), new CollectingSink(), ConfigFactory.empty())
            .run(10, 5, 0.0))
            .isInstanceOf(TransportException.class)
            .hasMessageContaining("entropy exhausted");
        await().atMost(5, TimeUnit.SECONDS)
            .until(() -> workers.get(0).getCurrentState() == IService.State.ERROR);
    }

    @Test
    void closedWorkerConnectionIsReportedAsLost() throws Exception {
        transport = new SocketTransport("test", 1, DISPATCHER_OPTIONS);
        connectWorkers(1);
        transport.dispatcherChannel().send(1, new WorkUnit(1.0, 3));

        workerChannels.get(0).close();

        assertThatThrownBy(() -> transport.dispatcherChannel().receiveAny())
            .isInstanceOf(TransportException.class)
            .hasMessageContaining("Worker 1 lost");
    }

    @Test
    void abortReachesRemoteWorker() throws Exception {
        transport = new SocketTransport("test", 1, DISPATCHER_OPTIONS);
        connectWorkers(1);

        transport.dispatcherChannel().abort("dispatcher failed");

        assertThat(workerChannels.get(0).receive()).isEqualTo(new Abort("dispatcher failed"));
        assertThatThrownBy(() -> transport.dispatcherChannel().receiveAny())
            .isInstanceOf(TransportException.class)
            .hasMessageContaining("aborted");
    }

    @Test
    void batchesAreTaggedWithTheConnectionsWorkerId() throws Exception {
        transport = new SocketTransport("test", 1, DISPATCHER_OPTIONS);
        connectWorkers(1);
        SocketWorkerChannel worker = workerChannels.get(0);

        worker.send(new ResultBatch(1, new double[] {0.25, -1.5}));

        assertThat(transport.dispatcherChannel().receiveAny()).isEqualTo(new ResultBatch(1, new double[] {0.25, -1.5}));
        assertThatThrownBy(() -> worker.send(new ResultBatch(2, new double[1])))
            .isInstanceOf(ProtocolViolationException.class);
    }

    @Test
    void acceptGivesUpWhenWorkersDoNotConnect() throws Exception {
        transport = new SocketTransport("test", 2,
            ConfigFactory.parseString("acceptTimeout = 300ms").withFallback(DISPATCHER_OPTIONS));

        assertThatThrownBy(() -> transport.acceptWorkers())
            .isInstanceOf(TransportException.class)
            .hasMessageContaining("Only 0 of 2 workers connected");
    }

    @Test
    void workerGivesUpWhenNoDispatcherListens() throws Exception {
        transport = new SocketTransport("test", 1, DISPATCHER_OPTIONS);
        int port = transport.getLocalPort();
        transport.close();

        assertThatThrownBy(() -> SocketWorkerChannel.connect("127.0.0.1", port,
            ConfigFactory.parseString("connectTimeout = 300ms").withFallback(WORKER_OPTIONS)))
            .isInstanceOf(TransportException.class)
            .hasMessageContaining("Could not connect");
    }

    private void connectWorkers(int count) throws Exception {
        int port = transport.getLocalPort();
        List<Future<SocketWorkerChannel>> pending = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            pending.add(executor.submit(() -> SocketWorkerChannel.connect("127.0.0.1", port, WORKER_OPTIONS)));
        }
        transport.acceptWorkers();
        for (Future<SocketWorkerChannel> future : pending) {
            workerChannels.add(future.get(5, TimeUnit.SECONDS));
        }
    }

    private void startWorkers(IValueGenerator generator) {
        for (SocketWorkerChannel channel : workerChannels) {
            WorkerService worker = new WorkerService("remote-worker-" + channel.workerId(),
                ConfigFactory.parseString("shutdownTimeout = 2"), channel, generator);
            workers.add(worker);
            worker.start();
        }
    }

    private static double[] constant(double value, int count) {
        double[] values = new double[count];
        java.util.Arrays.fill(values, value);
        return values;
    }

    private static final class CollectingSink implements ISink {

        final List<Double> values = new ArrayList<>();

        @Override
        public void append(double[] batch) {
            for (double value : batch) {
                values.add(value);
            }
        }

        @Override
        public long valuesWritten() {
            return values.size();
        }

        @Override
        public String describe() {
            return "memory";
        }

        @Override
        public void close() {
        }
    }
}
