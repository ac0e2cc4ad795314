package com.chicu.causalimpact.engine;

import com.chicu.causalimpact.config.CausalImpactProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class DrawExecutorTest {

    private DrawExecutor executor;

    private DrawExecutor executor(int threads, int chunk) {
        CausalImpactProperties p = new CausalImpactProperties();
        p.setDrawThreads(threads);
        p.setDrawChunkSize(chunk);
        executor = new DrawExecutor(p);
        return executor;
    }

    @AfterEach
    void tearDown() {
        if (executor != null) executor.shutdown();
    }

    @Test
    void resultsKeepIndexOrder() {
        List<Integer> out = executor(4, 3).map(50, i -> {
            // нечётные задачи медленнее, чтобы перемешать порядок завершения
            if (i % 2 == 1) Thread.yield();
            return i * i;
        });

        assertEquals(IntStream.range(0, 50).map(i -> i * i).boxed().toList(), out);
    }

    @Test
    void runsInlineForSmallBatches() {
        String caller = Thread.currentThread().getName();
        List<String> out = executor(4, 64).map(3, i -> Thread.currentThread().getName());

        assertEquals(List.of(caller, caller, caller), out);
    }

    @Test
    void taskFailureIsRethrown() {
        DrawExecutor ex = executor(2, 2);

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> ex.map(10, i -> {
            if (i == 7) throw new IllegalStateException("boom " + i);
            return i;
        }));
        assertEquals("boom 7", e.getMessage());
    }

    @Test
    void zeroAndNegativeCounts() {
        DrawExecutor ex = executor(2, 2);

        assertTrue(ex.map(0, i -> i).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> ex.map(-1, i -> i));
    }
}
