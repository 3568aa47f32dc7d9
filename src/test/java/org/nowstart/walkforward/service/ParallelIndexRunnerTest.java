package org.nowstart.walkforward.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;
import org.junit.jupiter.api.Test;

class ParallelIndexRunnerTest {

    @Test
    void run_visitsEveryIndexOnceSequentiallyAndInParallel() {
        int[] sequential = new int[50];
        int[] parallel = new int[50];

        ParallelIndexRunner.run(50, 1, index -> sequential[index]++, "sequential");
        ParallelIndexRunner.run(50, 4, index -> parallel[index]++, "parallel");

        assertThat(Arrays.stream(sequential).allMatch(count -> count == 1)).isTrue();
        assertThat(Arrays.stream(parallel).allMatch(count -> count == 1)).isTrue();
    }

    @Test
    void run_wrapsTaskFailureWithLabel() {
        assertThatThrownBy(() -> ParallelIndexRunner.run(8, 2, index -> {
            throw new IllegalArgumentException("bad index " + index);
        }, "Grid search"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Grid search failed");
    }
}
