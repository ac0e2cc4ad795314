package com.chicu.causalimpact.engine;

import com.chicu.causalimpact.config.CausalImpactProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntFunction;

/**
 * Fan-out / fan-in для независимых выборок.
 * <p>
 * Каждый результат пишется в слот со своим индексом, поэтому порядок на выходе
 * всегда 0..count-1, как бы ни завершались задачи.
 */
@Slf4j
@Component
public class DrawExecutor {

    private final int threads;
    private final int chunkSize;
    private final ExecutorService pool;

    public DrawExecutor(CausalImpactProperties props) {
        this.threads = Math.max(1, props.getDrawThreads());
        this.chunkSize = Math.max(1, props.getDrawChunkSize());

        AtomicInteger seq = new AtomicInteger();
        this.pool = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "impact-draws-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        log.info("🧵 DrawExecutor поднят: threads={} chunk={}", threads, chunkSize);
    }

    public <T> List<T> map(int count, IntFunction<T> task) {
        if (count < 0) throw new IllegalArgumentException("count must be >= 0: " + count);

        Object[] slots = new Object[count];

        if (threads == 1 || count <= chunkSize) {
            for (int i = 0; i < count; i++) {
                slots[i] = task.apply(i);
            }
            return asList(slots);
        }

        List<Future<?>> futures = new ArrayList<>();
        for (int from = 0; from < count; from += chunkSize) {
            final int lo = from;
            final int hi = Math.min(count, from + chunkSize);
            futures.add(pool.submit(() -> {
                for (int i = lo; i < hi; i++) {
                    slots[i] = task.apply(i);
                }
            }));
        }

        try {
            for (Future<?> f : futures) {
                f.get();
            }
        } catch (InterruptedException e) {
            futures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new IllegalStateException("draw computation interrupted", e);
        } catch (ExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw new IllegalStateException("draw computation failed: " + cause, cause);
        }

        return asList(slots);
    }

    @PreDestroy
    public void shutdown() {
        pool.shutdownNow();
    }

    @SuppressWarnings("unchecked")
    private static <T> List<T> asList(Object[] slots) {
        return (List<T>) Arrays.asList(slots);
    }
}
