package org.taskfarm.farm.api.messages;

/**
 * Immutable progress snapshot of a dispatch run.
 * <p>
 * Invariants enforced on construction:
 * <ul>
 *   <li>{@code 0 <= requestedTotal <= target}</li>
 *   <li>{@code deliveredTotal >= 0} and {@code batchesDelivered >= 0}</li>
 * </ul>
 * {@link #deliver(int)} only ever grows {@code deliveredTotal}.
 *
 * @param target           total number of values wanted.
 * @param requestedTotal   values requested from workers so far.
 * @param deliveredTotal   values received from workers so far.
 * @param batchesDelivered number of result batches received so far.
 */
public record Accounting(long target, long requestedTotal, long deliveredTotal, long batchesDelivered) {

    public Accounting {
        if (target < 0) {
            throw new IllegalArgumentException("target must be >= 0, got: " + target);
        }
        if (requestedTotal < 0 || requestedTotal > target) {
            throw new IllegalArgumentException(String.format(
                "requestedTotal must be within [0, %d], got: %d", target, requestedTotal));
        }
        if (deliveredTotal < 0) {
            throw new IllegalArgumentException("deliveredTotal must be >= 0, got: " + deliveredTotal);
        }
        if (batchesDelivered < 0) {
            throw new IllegalArgumentException("batchesDelivered must be >= 0, got: " + batchesDelivered);
        }
    }

    /**
     * @param target total number of values wanted.
     * @return a fresh snapshot with nothing requested or delivered.
     */
    public static Accounting start(long target) {
        return new Accounting(target, 0, 0, 0);
    }

    /**
     * @return the number of values that still have to be requested.
     */
    public long remainingToRequest() {
        return target - requestedTotal;
    }

    /**
     * @param count number of values just requested.
     * @return the snapshot after requesting {@code count} more values.
     */
    public Accounting request(int count) {
        return new Accounting(target, requestedTotal + count, deliveredTotal, batchesDelivered);
    }

    /**
     * @param count length of the batch just received.
     * @return the snapshot after receiving a batch of {@code count} values.
     */
    public Accounting deliver(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Delivered count must be >= 0, got: " + count);
        }
        return new Accounting(target, requestedTotal, deliveredTotal + count, batchesDelivered + 1);
    }

    public boolean isComplete() {
        return deliveredTotal >= target;
    }
}
