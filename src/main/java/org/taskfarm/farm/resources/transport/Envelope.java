package org.taskfarm.farm.resources.transport;

import org.taskfarm.farm.api.messages.ResultBatch;

/**
 * An entry of the dispatcher's reply queue. Shared by the transport implementations.
 */
public sealed interface Envelope {

    /**
     * A batch reported by a worker.
     *
     * @param batch the batch.
     */
    record Delivered(ResultBatch batch) implements Envelope {
    }

    /**
     * A worker became unreachable: its connection closed or it reported a failure.
     *
     * @param workerId the lost worker.
     * @param reason   human-readable cause.
     * @param cause    underlying exception, may be {@code null}.
     */
    record WorkerLost(int workerId, String reason, Throwable cause) implements Envelope {
    }

    /**
     * The run was aborted; wakes a dispatcher blocked in receive.
     *
     * @param reason the abort reason.
     */
    record Aborted(String reason) implements Envelope {
    }

    /**
     * A worker arrived at the rendezvous (socket transport only).
     *
     * @param workerId the arriving worker.
     */
    record BarrierArrival(int workerId) implements Envelope {
    }
}
