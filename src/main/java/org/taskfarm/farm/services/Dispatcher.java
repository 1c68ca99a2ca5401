package org.taskfarm.farm.services;

import java.io.IOException;
import java.util.List;

import org.taskfarm.farm.api.ProtocolViolationException;
import org.taskfarm.farm.api.messages.Accounting;
import org.taskfarm.farm.api.messages.ResultBatch;
import org.taskfarm.farm.api.messages.Termination;
import org.taskfarm.farm.api.messages.WorkUnit;
import org.taskfarm.farm.api.resources.IDispatcherChannel;
import org.taskfarm.farm.api.resources.ISink;
import org.taskfarm.farm.api.resources.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

/**
 * Coordinates one run: hands work units to idle workers, collects their batches in
 * arrival order, writes them to the sink, and terminates every worker exactly once.
 * <p>
 * <b>Dispatch loop:</b>
 * <ol>
 *   <li>Fill: while a worker is idle and values remain to be requested, assign
 *       {@code min(batchSize, target - requested)} values to it.</li>
 *   <li>Drain: if any worker is busy, wait for the next batch from any worker, free that
 *       worker, check the batch length, append the values to the sink.</li>
 *   <li>Repeat until no worker is busy. At that point every requested value has been
 *       delivered and {@code requested == target}.</li>
 *   <li>Send the termination sentinel to every worker the roster still holds as idle.</li>
 *   <li>Wait on the rendezvous with all workers.</li>
 * </ol>
 * The loop never terminates a worker while any worker is busy, so no batch is left in
 * flight when workers start exiting.
 * <p>
 * The dispatcher is the only writer of the sink. It runs on the calling thread and is
 * not reusable: create one per run.
 *
 * <h3>Configuration Options:</h3>
 * <ul>
 *   <li><b>progressLogPercent</b>: log progress at INFO every this many percent of the target
 *       (default: 10, 0 disables).</li>
 * </ul>
 */
public class Dispatcher {

    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    private final IDispatcherChannel channel;
    private final ISink sink;
    private final int progressLogPercent;
    private boolean used;

    /**
     * @param channel the dispatcher side of the transport.
     * @param sink    destination of all delivered values.
     * @param options dispatcher options.
     */
    public Dispatcher(IDispatcherChannel channel, ISink sink, Config options) {
        this.channel = channel;
        this.sink = sink;
        this.progressLogPercent = options.hasPath("progressLogPercent")
            ? options.getInt("progressLogPercent")
            : 10;
        if (progressLogPercent < 0 || progressLogPercent > 100) {
            throw new IllegalArgumentException("progressLogPercent must be within [0, 100], got: " + progressLogPercent);
        }
    }

    /**
     * Runs the dispatch loop to completion.
     *
     * @param target    total number of values wanted, {@code >= 0}.
     * @param batchSize maximum values per work unit, {@code >= 1}.
     * @param parameter distribution parameter for every work unit.
     * @return the final accounting, with {@code deliveredTotal == target}.
     * @throws TransportException         if a send, receive or the rendezvous fails.
     * @throws IOException                if the sink fails.
     * @throws InterruptedException       if the dispatcher thread is interrupted.
     * @throws ProtocolViolationException if a worker breaks the protocol.
     */
    public Accounting run(long target, int batchSize, double parameter)
            throws TransportException, IOException, InterruptedException {
        if (target < 0) {
            throw new IllegalArgumentException("target must be >= 0, got: " + target);
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1, got: " + batchSize);
        }
        if (used) {
            throw new IllegalStateException("Dispatcher has already been run");
        }
        used = true;

        WorkerRoster roster = new WorkerRoster(channel.workerIds());
        Accounting accounting = Accounting.start(target);
        long nextProgressMark = progressStep(target);

        log.debug("Dispatching {} values in batches of {} to {} worker(s)",
            target, batchSize, channel.workerIds().size());

        while (true) {
            while (roster.hasIdle() && accounting.remainingToRequest() > 0) {
                int count = (int) Math.min(batchSize, accounting.remainingToRequest());
                int workerId = roster.assign(count);
                channel.send(workerId, new WorkUnit(parameter, count));
                accounting = accounting.request(count);
                log.trace("Assigned {} values to worker {}", count, workerId);
            }

            if (!roster.hasBusy()) {
                break;
            }

            ResultBatch batch = channel.receiveAny();
            int expected = roster.release(batch.producerId());
            if (batch.size() != expected) {
                throw new ProtocolViolationException(String.format(
                    "Worker %d returned %d values but %d were requested",
                    batch.producerId(), batch.size(), expected));
            }
            sink.append(batch.values());
            accounting = accounting.deliver(batch.size());
            log.debug("Worker {} sent {} values ({}/{})",
                batch.producerId(), batch.size(), accounting.deliveredTotal(), target);

            if (nextProgressMark > 0 && accounting.deliveredTotal() >= nextProgressMark) {
                log.info("Progress: {}/{} values ({}%)", accounting.deliveredTotal(), target,
                    accounting.deliveredTotal() * 100 / target);
                long step = progressStep(target);
                while (nextProgressMark <= accounting.deliveredTotal()) {
                    nextProgressMark += step;
                }
            }
        }

        if (!accounting.isComplete()) {
            throw new ProtocolViolationException(String.format(
                "Dispatch loop ended with %d of %d values delivered", accounting.deliveredTotal(), target));
        }

        List<Integer> toTerminate = roster.terminateIdle();
        for (int workerId : toTerminate) {
            channel.send(workerId, Termination.INSTANCE);
        }
        log.debug("Sent termination to {} worker(s), waiting for rendezvous", toTerminate.size());

        channel.awaitRendezvous();
        log.debug("Rendezvous complete: {} values in {} batches",
            accounting.deliveredTotal(), accounting.batchesDelivered());
        return accounting;
    }

    private long progressStep(long target) {
        if (progressLogPercent == 0 || target == 0) {
            return 0;
        }
        return Math.max(1, target * progressLogPercent / 100);
    }
}
