package org.taskfarm.farm.services;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.taskfarm.farm.api.ProtocolViolationException;
import org.taskfarm.farm.api.WorkerState;

@Tag("unit")
class WorkerRosterTest {

    @Test
    void allWorkersStartIdle() {
        WorkerRoster roster = new WorkerRoster(List.of(1, 2, 3));

        assertThat(roster.hasIdle()).isTrue();
        assertThat(roster.hasBusy()).isFalse();
        assertThat(roster.stateOf(2)).isEqualTo(WorkerState.IDLE);
    }

    @Test
    void assignMarksWorkerBusyUntilReleased() {
        WorkerRoster roster = new WorkerRoster(List.of(1, 2));

        int first = roster.assign(10);
        int second = roster.assign(5);

        assertThat(first).isNotEqualTo(second);
        assertThat(roster.hasIdle()).isFalse();
        assertThat(roster.busyCount()).isEqualTo(2);
        assertThat(roster.release(second)).isEqualTo(5);
        assertThat(roster.stateOf(second)).isEqualTo(WorkerState.IDLE);
        assertThat(roster.stateOf(first)).isEqualTo(WorkerState.BUSY);
    }

    @Test
    void mostRecentlyReleasedWorkerIsAssignedNext() {
        WorkerRoster roster = new WorkerRoster(List.of(1, 2, 3));
        int a = roster.assign(1);
        roster.assign(1);
        roster.release(a);

        assertThat(roster.assign(1)).isEqualTo(a);
    }

    @Test
    void cannotAssignWithoutIdleWorker() {
        WorkerRoster roster = new WorkerRoster(List.of(1));
        roster.assign(3);

        assertThatThrownBy(() -> roster.assign(3)).isInstanceOf(ProtocolViolationException.class);
    }

    @Test
    void releasingANonBusyWorkerIsAViolation() {
        WorkerRoster roster = new WorkerRoster(List.of(1, 2));

        assertThatThrownBy(() -> roster.release(1))
            .isInstanceOf(ProtocolViolationException.class)
            .hasMessageContaining("not BUSY");
        assertThatThrownBy(() -> roster.release(7))
            .isInstanceOf(ProtocolViolationException.class)
            .hasMessageContaining("unknown worker");
    }

    @Test
    void terminateIdleReturnsEachWorkerExactlyOnce() {
        WorkerRoster roster = new WorkerRoster(List.of(1, 2, 3));

        assertThat(roster.terminateIdle()).containsExactlyInAnyOrder(1, 2, 3);
        assertThat(roster.allTerminated()).isTrue();
        assertThat(roster.terminateIdle()).isEmpty();
        assertThat(roster.hasIdle()).isFalse();
    }

    @Test
    void cannotTerminateWhileAWorkerIsBusy() {
        WorkerRoster roster = new WorkerRoster(List.of(1, 2));
        roster.assign(4);

        assertThatThrownBy(roster::terminateIdle).isInstanceOf(ProtocolViolationException.class);
        assertThat(roster.allTerminated()).isFalse();
    }

    @Test
    void terminatedWorkerCannotReplyOrBeReassigned() {
        WorkerRoster roster = new WorkerRoster(List.of(1));
        roster.terminateIdle();

        assertThatThrownBy(() -> roster.release(1)).isInstanceOf(ProtocolViolationException.class);
        assertThatThrownBy(() -> roster.assign(1)).isInstanceOf(ProtocolViolationException.class);
        assertThat(roster.stateOf(1)).isEqualTo(WorkerState.TERMINATED);
    }

    @Test
    void rejectsEmptyOrDuplicateIds() {
        assertThatThrownBy(() -> new WorkerRoster(List.of())).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new WorkerRoster(List.of(1, 1))).isInstanceOf(IllegalArgumentException.class);
    }
}
