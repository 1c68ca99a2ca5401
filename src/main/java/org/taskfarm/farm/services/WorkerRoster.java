package org.taskfarm.farm.services;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.taskfarm.farm.api.ProtocolViolationException;
import org.taskfarm.farm.api.WorkerState;

/**
 * The dispatcher's view of every worker's protocol state.
 * <p>
 * Every transition is checked, so the dispatcher cannot assign a second unit to a busy
 * worker, release a worker that has nothing outstanding, or terminate a worker twice.
 * Violations throw {@link ProtocolViolationException}.
 * <p>
 * Idle workers are handed out most-recently-released first.
 * <p>
 * <strong>Thread safety:</strong> not thread-safe; owned by the dispatcher thread.
 */
public class WorkerRoster {

    private final Map<Integer, WorkerState> states = new LinkedHashMap<>();
    private final Map<Integer, Integer> outstanding = new LinkedHashMap<>();
    private final Deque<Integer> idle = new ArrayDeque<>();
    private int busyCount;

    /**
     * Creates a roster with all workers idle.
     *
     * @param workerIds the ids of all workers; must be non-empty and distinct.
     */
    public WorkerRoster(Collection<Integer> workerIds) {
        if (workerIds.isEmpty()) {
            throw new IllegalArgumentException("At least one worker is required");
        }
        for (Integer id : workerIds) {
            if (states.put(id, WorkerState.IDLE) != null) {
                throw new IllegalArgumentException("Duplicate worker id: " + id);
            }
            idle.push(id);
        }
    }

    public boolean hasIdle() {
        return !idle.isEmpty();
    }

    public boolean hasBusy() {
        return busyCount > 0;
    }

    public int busyCount() {
        return busyCount;
    }

    /**
     * Takes any idle worker and marks it busy with {@code count} outstanding values.
     *
     * @param count number of values requested from the worker.
     * @return the id of the assigned worker.
     * @throws ProtocolViolationException if no worker is idle.
     */
    public int assign(int count) {
        Integer id = idle.poll();
        if (id == null) {
            throw new ProtocolViolationException("No idle worker available for assignment");
        }
        states.put(id, WorkerState.BUSY);
        outstanding.put(id, count);
        busyCount++;
        return id;
    }

    /**
     * Marks a busy worker idle again after its batch arrived.
     *
     * @param workerId the worker that replied.
     * @return the number of values that were outstanding for it.
     * @throws ProtocolViolationException if the worker is unknown or not busy.
     */
    public int release(int workerId) {
        WorkerState state = states.get(workerId);
        if (state == null) {
            throw new ProtocolViolationException("Received a batch from unknown worker " + workerId);
        }
        if (state != WorkerState.BUSY) {
            throw new ProtocolViolationException(String.format(
                "Received a batch from worker %d which is %s, not BUSY", workerId, state));
        }
        states.put(workerId, WorkerState.IDLE);
        busyCount--;
        idle.push(workerId);
        return outstanding.remove(workerId);
    }

    /**
     * Marks every idle worker terminated and returns them. Each worker is returned by at
     * most one call over the roster's lifetime.
     *
     * @return ids of the workers that must now be sent the termination sentinel.
     * @throws ProtocolViolationException if a worker is still busy.
     */
    public List<Integer> terminateIdle() {
        if (busyCount > 0) {
            throw new ProtocolViolationException(
                "Cannot terminate while " + busyCount + " worker(s) are busy");
        }
        List<Integer> terminated = new ArrayList<>(idle.size());
        while (!idle.isEmpty()) {
            int id = idle.poll();
            states.put(id, WorkerState.TERMINATED);
            terminated.add(id);
        }
        return terminated;
    }

    /**
     * @param workerId a worker id.
     * @return its current state.
     * @throws IllegalArgumentException if the id is unknown.
     */
    public WorkerState stateOf(int workerId) {
        WorkerState state = states.get(workerId);
        if (state == null) {
            throw new IllegalArgumentException("Unknown worker id: " + workerId);
        }
        return state;
    }

    /**
     * @return {@code true} if every worker has been terminated.
     */
    public boolean allTerminated() {
        return states.values().stream().allMatch(s -> s == WorkerState.TERMINATED);
    }
}
