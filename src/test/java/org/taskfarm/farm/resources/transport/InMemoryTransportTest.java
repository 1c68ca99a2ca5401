package org.taskfarm.farm.resources.transport;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
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
import org.taskfarm.farm.api.resources.IDispatcherChannel;
import org.taskfarm.farm.api.resources.ISink;
import org.taskfarm.farm.api.resources.IWorkerChannel;
import org.taskfarm.farm.api.resources.TransportException;
import org.taskfarm.farm.api.services.IService;
import org.taskfarm.farm.services.Dispatcher;
import org.taskfarm.farm.services.WorkerService;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

@Tag("integration")
class InMemoryTransportTest {

    private static final Config OPTIONS = ConfigFactory.parseString(
        "receiveTimeout = 5s\nbarrierTimeout = 5s\npollInterval = 10ms");
    private static final Config WORKER_OPTIONS = ConfigFactory.parseString("shutdownTimeout = 2");

    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final List<WorkerService> workers = new ArrayList<>();

    @AfterEach
    void tearDown() {
        for (WorkerService worker : workers) {
            if (worker.getCurrentState() == IService.State.RUNNING) {
                worker.stop();
            }
        }
        executor.shutdownNow();
    }

    @Test
    void workerIdsStartAtOne() {
        InMemoryTransport transport = new InMemoryTransport("test", 3, OPTIONS);

        assertThat(transport.dispatcherChannel().workerIds()).containsExactly(1, 2, 3);
        assertThat(transport.localWorkerChannels()).extracting(IWorkerChannel::workerId).containsExactly(1, 2, 3);
    }

    @Test
    void completeRunDeliversTargetAndTerminatesEveryWorkerOnce() throws Exception {
        InMemoryTransport transport = new InMemoryTransport("test", 3, OPTIONS);
        startWorkers(transport, (parameter, count) -> filled(parameter, count));
        RecordingSink sink = new RecordingSink();

        Accounting accounting = new Dispatcher(transport.dispatcherChannel(), sink, ConfigFactory.empty())
            .run(100, 7, 2.0);

        assertThat(accounting.deliveredTotal()).isEqualTo(100);
        assertThat(sink.values).hasSize(100).containsOnly(2.0);
        for (WorkerService worker : workers) {
            assertThat(worker.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
            assertThat(worker.getCurrentState()).isEqualTo(IService.State.STOPPED);
            assertThat(worker.getMetrics()).containsEntry("terminations", 1L);
        }
        long produced = workers.stream().mapToLong(w -> w.getMetrics().get("values_produced").longValue()).sum();
        assertThat(produced).isEqualTo(100);
    }

    @Test
    void secondTerminationIsRejected() throws Exception {
        InMemoryTransport transport = new InMemoryTransport("test", 2, OPTIONS);
        IDispatcherChannel channel = transport.dispatcherChannel();

        channel.send(1, Termination.INSTANCE);

        assertThatThrownBy(() -> channel.send(1, Termination.INSTANCE))
            .isInstanceOf(ProtocolViolationException.class);
        assertThatThrownBy(() -> channel.send(1, new WorkUnit(0.0, 3)))
            .isInstanceOf(ProtocolViolationException.class);
        assertThatThrownBy(() -> channel.send(9, new WorkUnit(0.0, 3)))
            .isInstanceOf(ProtocolViolationException.class);
    }

    @Test
    void receiveGivesUpAfterTimeout() {
        InMemoryTransport transport = new InMemoryTransport("test", 1,
            ConfigFactory.parseString("receiveTimeout = 100ms").withFallback(OPTIONS));

        assertThatThrownBy(() -> transport.dispatcherChannel().receiveAny())
            .isInstanceOf(TransportException.class)
            .hasMessageContaining("No result received");
    }

    @Test
    void reportedFailureSurfacesAsLostWorker() {
        InMemoryTransport transport = new InMemoryTransport("test", 2, OPTIONS);
        GenerationException failure = new GenerationException("entropy exhausted");

        transport.localWorkerChannels().get(1).reportFailure(failure);

        assertThatThrownBy(() -> transport.dispatcherChannel().receiveAny())
            .isInstanceOf(TransportException.class)
            .hasMessageContaining("Worker 2 lost")
            .hasCause(failure);
    }

    @Test
    void workerCannotSendOnBehalfOfAnother() {
        InMemoryTransport transport = new InMemoryTransport("test", 2, OPTIONS);

        assertThatThrownBy(() -> transport.localWorkerChannels().get(0).send(new ResultBatch(2, new double[1])))
            .isInstanceOf(ProtocolViolationException.class);
    }

    @Test
    void abortOvertakesQueuedWork() throws Exception {
        InMemoryTransport transport = new InMemoryTransport("test", 1, OPTIONS);
        transport.dispatcherChannel().send(1, new WorkUnit(1.0, 5));

        transport.dispatcherChannel().abort("shutting down");
        transport.dispatcherChannel().abort("ignored second reason");

        assertThat(transport.localWorkerChannels().get(0).receive()).isEqualTo(new Abort("shutting down"));
        assertThat(transport.isAborted()).isTrue();
        assertThatThrownBy(() -> transport.dispatcherChannel().send(1, new WorkUnit(1.0, 5)))
            .isInstanceOf(TransportException.class)
            .hasMessageContaining("shutting down");
    }

    @Test
    void abortReleasesParticipantsWaitingAtRendezvous() throws Exception {
        InMemoryTransport transport = new InMemoryTransport("test", 2, OPTIONS);
        IWorkerChannel worker = transport.localWorkerChannels().get(0);
        Future<?> waiting = executor.submit(() -> {
            worker.awaitRendezvous();
            return null;
        });
        await().atMost(2, TimeUnit.SECONDS).pollDelay(50, TimeUnit.MILLISECONDS).until(() -> !waiting.isDone());

        transport.dispatcherChannel().abort("worker 2 lost");

        assertThatThrownBy(() -> waiting.get(5, TimeUnit.SECONDS))
            .isInstanceOf(ExecutionException.class)
            .hasCauseInstanceOf(TransportException.class);
    }

    @Test
    void rendezvousTimesOutWhenAParticipantNeverArrives() {
        InMemoryTransport transport = new InMemoryTransport("test", 1,
            ConfigFactory.parseString("barrierTimeout = 200ms").withFallback(OPTIONS));

        assertThatThrownBy(() -> transport.dispatcherChannel().awaitRendezvous())
            .isInstanceOf(TransportException.class)
            .hasMessageContaining("Rendezvous not complete");
    }

    @Test
    void lostWorkerFailsTheRunAndAbortLetsEveryoneExit() throws Exception {
        InMemoryTransport transport = new InMemoryTransport("test", 3, OPTIONS);
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        startWorkers(transport, (parameter, count) -> {
            started.countDown();
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new GenerationException("interrupted", e);
            }
            return filled(parameter, count);
        });
        executor.submit(() -> {
            started.await();
            transport.disconnect(2);
            return null;
        });

        IDispatcherChannel channel = transport.dispatcherChannel();
        assertThatThrownBy(() -> new Dispatcher(channel, new RecordingSink(), ConfigFactory.empty()).run(50, 5, 0.0))
            .isInstanceOf(TransportException.class)
            .hasMessageContaining("Worker 2 lost");

        channel.abort("worker 2 lost");
        release.countDown();

        await().atMost(5, TimeUnit.SECONDS).untilAsserted(() ->
            assertThat(workers).allSatisfy(worker ->
                assertThat(worker.getCurrentState()).isNotEqualTo(IService.State.RUNNING)));
    }

    private void startWorkers(InMemoryTransport transport, IValueGenerator generator) {
        for (IWorkerChannel channel : transport.localWorkerChannels()) {
            WorkerService worker = new WorkerService("worker-" + channel.workerId(), WORKER_OPTIONS, channel, generator);
            workers.add(worker);
            worker.start();
        }
    }

    private static double[] filled(double value, int count) {
        double[] values = new double[count];
        Arrays.fill(values, value);
        return values;
    }

    static final class RecordingSink implements ISink {

        final List<Double> values = new ArrayList<>();

        @Override
        public synchronized void append(double[] batch) {
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
