package com.chicu.causalimpact.engine.group;

import com.chicu.causalimpact.common.error.CausalImpactException;
import com.chicu.causalimpact.config.CausalImpactProperties;
import com.chicu.causalimpact.engine.CausalImpactService;
import com.chicu.causalimpact.engine.ImpactAnalysis;
import com.chicu.causalimpact.engine.ImpactConfig;
import com.chicu.causalimpact.engine.ImpactConfigResolver;
import com.chicu.causalimpact.engine.ImpactRequest;
import com.chicu.causalimpact.series.TimeSeries;
import com.chicu.causalimpact.series.TimeSeriesPreprocessor;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Каждая группа таблицы считается как отдельная изолированная задача со своим seed.
 * Ошибка в одной группе превращается в её {@link GroupOutcome}, остальные группы доводятся до конца.
 */
@Slf4j
@Service
public class GroupImpactOrchestrator {

    private final CausalImpactService impactService;
    private final TimeSeriesPreprocessor preprocessor;
    private final ImpactConfigResolver configResolver;
    private final ExecutorService pool;

    /**
     * ✅ Защита от дублей: один (seriesId, группа) - один анализ одновременно.
     */
    private final Set<GroupKey> inFlight = ConcurrentHashMap.newKeySet();

    public GroupImpactOrchestrator(CausalImpactService impactService,
                                   TimeSeriesPreprocessor preprocessor,
                                   ImpactConfigResolver configResolver,
                                   CausalImpactProperties props) {
        this.impactService = impactService;
        this.preprocessor = preprocessor;
        this.configResolver = configResolver;

        int threads = Math.max(1, props.getGroupThreads());
        AtomicInteger seq = new AtomicInteger();
        this.pool = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "impact-groups-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        log.info("🧠 GroupImpactOrchestrator поднят. Потоков на группы: {}", threads);
    }

    public GroupImpactReport analyze(GroupImpactRequest request) {
        if (request == null || request.table() == null || request.schema() == null) {
            throw new IllegalArgumentException("table and schema are required");
        }

        // схема проверяется один раз для всей таблицы
        List<String> all = preprocessor.groups(request.table(), request.schema());
        List<String> selected = request.groups() == null || request.groups().isEmpty() ? all : request.groups();

        ImpactConfig base = request.config() == null
                ? configResolver.defaults()
                : configResolver.validate(request.config());

        long started = System.currentTimeMillis();

        log.info("🧠 GROUPS START seriesId={} groups={} seed={} draws={}",
                safe(request.seriesId()), selected, base.seed(), base.numDraws());

        List<Future<GroupOutcome>> futures = new ArrayList<>();
        for (String group : selected) {
            int ordinal = all.indexOf(group);
            if (ordinal < 0) {
                futures.add(pool.submit(() -> reject(group, -1, base.seed(), "UNKNOWN_GROUP",
                        "group '" + group + "' is not present in the table")));
                continue;
            }
            long seed = base.seed() + ordinal;
            ImpactConfig config = base.toBuilder().seed(seed).build();
            futures.add(pool.submit(() -> runGroup(request, group, ordinal, config)));
        }

        List<GroupOutcome> outcomes = new ArrayList<>(futures.size());
        try {
            for (Future<GroupOutcome> f : futures) {
                outcomes.add(f.get());
            }
        } catch (InterruptedException e) {
            futures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new IllegalStateException("group analysis interrupted", e);
        } catch (ExecutionException e) {
            // runGroup сам ловит ошибки, сюда попадают только Error
            futures.forEach(f -> f.cancel(true));
            throw new IllegalStateException("group analysis failed: " + e.getCause(), e.getCause());
        }

        GroupImpactReport report = GroupImpactReport.builder()
                .seriesId(request.seriesId())
                .outcomes(outcomes)
                .tookMs(System.currentTimeMillis() - started)
                .build();

        log.info("✅ GROUPS DONE seriesId={} ok={} failed={} tookMs={}",
                safe(request.seriesId()), report.succeeded(), report.failed(), report.tookMs());

        return report;
    }

    @PreDestroy
    public void shutdown() {
        pool.shutdownNow();
    }

    // =========================================================
    // one group
    // =========================================================

    private GroupOutcome runGroup(GroupImpactRequest request, String group, int ordinal, ImpactConfig config) {
        GroupKey key = request.seriesId() == null ? null : new GroupKey(request.seriesId(), group);

        if (key != null && !inFlight.add(key)) {
            return reject(group, ordinal, config.seed(), "IN_FLIGHT", "analysis is already running for this group");
        }

        long started = System.currentTimeMillis();
        try {
            TimeSeries series = preprocessor.extract(request.table(), request.schema(), group);

            ImpactAnalysis analysis = impactService.analyze(ImpactRequest.builder()
                    .seriesId(request.seriesId())
                    .series(series)
                    .interventionAt(request.interventionAt())
                    .pre(request.pre())
                    .post(request.post())
                    .config(config)
                    .build());

            return GroupOutcome.builder()
                    .groupKey(group)
                    .ordinal(ordinal)
                    .seed(config.seed())
                    .ok(true)
                    .analysis(analysis)
                    .build();

        } catch (CausalImpactException e) {
            log.warn("⚠️ GROUP FAILED group={} stage={} code={} tookMs={} : {}",
                    group, e.getStage(), e.getCode(), System.currentTimeMillis() - started, e.getMessage());

            return GroupOutcome.builder()
                    .groupKey(group)
                    .ordinal(ordinal)
                    .seed(config.seed())
                    .ok(false)
                    .errorCode(e.getCode())
                    .errorStage(e.getStage())
                    .errorMessage(safe(e.getMessage()))
                    .errorDetails(e.getDetails())
                    .build();

        } catch (IllegalArgumentException e) {
            log.warn("⚠️ GROUP REJECTED group={} : {}", group, e.getMessage());
            return GroupOutcome.builder()
                    .groupKey(group)
                    .ordinal(ordinal)
                    .seed(config.seed())
                    .ok(false)
                    .errorCode("INVALID_ARGUMENT")
                    .errorMessage(safe(e.getMessage()))
                    .errorDetails(Map.of())
                    .build();

        } catch (RuntimeException e) {
            log.error("❌ GROUP FAILED group={} tookMs={} : {}",
                    group, System.currentTimeMillis() - started, e.getMessage(), e);

            return GroupOutcome.builder()
                    .groupKey(group)
                    .ordinal(ordinal)
                    .seed(config.seed())
                    .ok(false)
                    .errorCode("INTERNAL")
                    .errorMessage("Ошибка анализа: " + safe(e.getMessage()))
                    .errorDetails(Map.of())
                    .build();

        } finally {
            if (key != null) inFlight.remove(key);
        }
    }

    // =========================================================
    // helpers
    // =========================================================

    private static GroupOutcome reject(String group, int ordinal, long seed, String code, String reason) {
        return GroupOutcome.builder()
                .groupKey(group)
                .ordinal(ordinal)
                .seed(seed)
                .ok(false)
                .errorCode(code)
                .errorMessage(reason)
                .errorDetails(Map.of())
                .build();
    }

    private static String safe(String s) {
        if (s == null) return "";
        String x = s.trim();
        return x.length() > 200 ? x.substring(0, 200) : x;
    }

    private record GroupKey(String seriesId, String groupKey) {}
}
