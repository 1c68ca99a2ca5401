package org.taskfarm.farm.api.messages;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class ResultBatchTest {

    @Test
    void valuesAreCopiedOnTheWayInAndOut() {
        double[] source = {1.0, 2.0, 3.0};
        ResultBatch batch = new ResultBatch(2, source);

        source[0] = 99.0;
        batch.values()[1] = 99.0;

        assertThat(batch.values()).containsExactly(1.0, 2.0, 3.0);
        assertThat(batch.size()).isEqualTo(3);
        assertThat(batch.producerId()).isEqualTo(2);
    }

    @Test
    void equalityIsByProducerAndContent() {
        assertThat(new ResultBatch(1, new double[] {0.5}))
            .isEqualTo(new ResultBatch(1, new double[] {0.5}))
            .isNotEqualTo(new ResultBatch(2, new double[] {0.5}));
    }
}
