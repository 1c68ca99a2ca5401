package org.taskfarm.farm;

import java.time.Duration;

import org.taskfarm.farm.api.messages.Accounting;

/**
 * Outcome of a completed run.
 *
 * @param accounting      final accounting, complete.
 * @param elapsed         wall-clock time from the first assignment to the rendezvous.
 * @param sinkDescription where the values went.
 */
public record FarmReport(Accounting accounting, Duration elapsed, String sinkDescription) {

    /**
     * @return values per second over the run, 0 for an empty or instantaneous run.
     */
    public double valuesPerSecond() {
        long millis = elapsed.toMillis();
        return millis == 0 ? 0.0 : accounting.deliveredTotal() * 1000.0 / millis;
    }
}
