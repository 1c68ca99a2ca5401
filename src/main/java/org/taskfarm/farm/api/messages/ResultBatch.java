package org.taskfarm.farm.api.messages;

import java.util.Arrays;

/**
 * The values a worker produced for one {@link WorkUnit}, tagged with the worker's id.
 * <p>
 * The array is copied on construction and on access, so a batch cannot change after it
 * has been sent.
 */
public final class ResultBatch {

    private final int producerId;
    private final double[] values;

    /**
     * Creates a batch.
     *
     * @param producerId id of the worker that produced the values.
     * @param values     the produced values; copied.
     */
    public ResultBatch(int producerId, double[] values) {
        if (values == null) {
            throw new NullPointerException("values must not be null");
        }
        this.producerId = producerId;
        this.values = values.clone();
    }

    public int producerId() {
        return producerId;
    }

    /**
     * @return a copy of the produced values, in production order.
     */
    public double[] values() {
        return values.clone();
    }

    public int size() {
        return values.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResultBatch other)) return false;
        return producerId == other.producerId && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * Integer.hashCode(producerId) + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "ResultBatch[producerId=" + producerId + ", size=" + values.length + "]";
    }
}
