package org.taskfarm.farm.services;

import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import org.taskfarm.farm.api.ProtocolViolationException;
import org.taskfarm.farm.api.WorkerState;
import org.taskfarm.farm.api.generation.GenerationException;
import org.taskfarm.farm.api.generation.IValueGenerator;
import org.taskfarm.farm.api.messages.Abort;
import org.taskfarm.farm.api.messages.ResultBatch;
import org.taskfarm.farm.api.messages.Termination;
import org.taskfarm.farm.api.messages.WorkUnit;
import org.taskfarm.farm.api.messages.WorkerMessage;
import org.taskfarm.farm.api.resources.IWorkerChannel;
import org.taskfarm.farm.api.resources.TransportException;

import com.typesafe.config.Config;

/**
 * A worker: receives work units, generates their values and reports each batch back,
 * until it receives the termination sentinel. It then joins the rendezvous and ends.
 * <p>
 * On {@link Abort} the worker ends immediately, without replying and without joining the
 * rendezvous. If generation fails, or the worker ends abnormally for any other reason
 * (including an {@link Error}), it reports itself lost through its channel and ends in
 * {@link State#ERROR}.
 *
 * <h3>Metrics:</h3>
 * <ul>
 *   <li><b>batches_produced</b>, <b>values_produced</b>: work done so far.</li>
 *   <li><b>terminations</b>: 0 or 1.</li>
 * </ul>
 */
public class WorkerService extends AbstractService {

    private final IWorkerChannel channel;
    private final IValueGenerator generator;

    private volatile WorkerState workerState = WorkerState.IDLE;
    private final AtomicLong batchesProduced = new AtomicLong(0);
    private final AtomicLong valuesProduced = new AtomicLong(0);
    private final AtomicLong terminations = new AtomicLong(0);
    private volatile boolean aborted;

    /**
     * @param name      service name, used as thread name.
     * @param options   service options (see {@link AbstractService}).
     * @param channel   this worker's side of the transport.
     * @param generator the value generator owned by this worker.
     */
    public WorkerService(String name, Config options, IWorkerChannel channel, IValueGenerator generator) {
        super(name, options);
        this.channel = channel;
        this.generator = generator;
    }

    @Override
    protected void run() throws Exception {
        try {
            serve();
        } catch (InterruptedException e) {
            throw e;
        } catch (Exception | Error e) {
            // Any abnormal end marks this worker lost on the dispatcher side
            if (!isStopRequested()) {
                channel.reportFailure(e);
            }
            throw e;
        }
    }

    private void serve() throws Exception {
        if (workerState == WorkerState.TERMINATED) {
            throw new ProtocolViolationException("Worker " + channel.workerId() + " was already terminated");
        }

        while (!isStopRequested()) {
            WorkerMessage message = channel.receive();

            if (message instanceof WorkUnit unit) {
                process(unit);
            } else if (message instanceof Termination) {
                transitionTo(WorkerState.TERMINATED);
                terminations.incrementAndGet();
                log.debug("Worker {} received termination after {} batches",
                    channel.workerId(), batchesProduced.get());
                channel.awaitRendezvous();
                return;
            } else if (message instanceof Abort abort) {
                aborted = true;
                log.debug("Worker {} aborted: {}", channel.workerId(), abort.reason());
                return;
            }
        }
    }

    private void process(WorkUnit unit) throws TransportException, GenerationException {
        transitionTo(WorkerState.BUSY);

        double[] values;
        try {
            values = generator.generate(unit.parameter(), unit.requestedCount());
            if (values == null || values.length != unit.requestedCount()) {
                throw new GenerationException(String.format("Generator returned %s values, %d requested",
                    values == null ? "no" : String.valueOf(values.length), unit.requestedCount()));
            }
        } catch (GenerationException | RuntimeException | Error e) {
            log.error("Worker {} failed to generate {} values: {}",
                channel.workerId(), unit.requestedCount(), e.getMessage());
            recordError("GENERATION_FAILED", "Value generation failed",
                String.format("Requested: %d, Parameter: %s", unit.requestedCount(), unit.parameter()));
            throw e;
        }

        channel.send(new ResultBatch(channel.workerId(), values));
        batchesProduced.incrementAndGet();
        valuesProduced.addAndGet(values.length);
        transitionTo(WorkerState.IDLE);
    }

    private void transitionTo(WorkerState next) {
        WorkerState current = workerState;
        boolean legal = switch (next) {
            case BUSY, TERMINATED -> current == WorkerState.IDLE;
            case IDLE -> current == WorkerState.BUSY;
        };
        if (!legal) {
            throw new ProtocolViolationException(String.format(
                "Worker %d cannot move from %s to %s", channel.workerId(), current, next));
        }
        workerState = next;
    }

    public int getWorkerId() {
        return channel.workerId();
    }

    public WorkerState getWorkerState() {
        return workerState;
    }

    /**
     * @return {@code true} if the worker ended because it received an abort.
     */
    public boolean wasAborted() {
        return aborted;
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("batches_produced", batchesProduced.get());
        metrics.put("values_produced", valuesProduced.get());
        metrics.put("terminations", terminations.get());
    }
}
