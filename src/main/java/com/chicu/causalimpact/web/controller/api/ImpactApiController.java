package com.chicu.causalimpact.web.controller.api;

import com.chicu.causalimpact.engine.CausalImpactService;
import com.chicu.causalimpact.engine.ImpactAnalysis;
import com.chicu.causalimpact.engine.ImpactConfig;
import com.chicu.causalimpact.engine.ImpactConfigResolver;
import com.chicu.causalimpact.engine.ImpactRequest;
import com.chicu.causalimpact.engine.group.GroupImpactOrchestrator;
import com.chicu.causalimpact.engine.group.GroupImpactReport;
import com.chicu.causalimpact.engine.group.GroupImpactRequest;
import com.chicu.causalimpact.series.RawTable;
import com.chicu.causalimpact.series.TableSchema;
import com.chicu.causalimpact.series.TimeSeries;
import com.chicu.causalimpact.series.TimeSeriesPreprocessor;
import com.chicu.causalimpact.web.dto.GroupImpactResponse;
import com.chicu.causalimpact.web.dto.ImpactAnalyzeRequest;
import com.chicu.causalimpact.web.dto.ImpactAnalyzeResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * JSON-адаптер над конвейером. Ничего не рисует: только таблица результата, сводка и диагностика.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/impact")
public class ImpactApiController {

    private final TimeSeriesPreprocessor preprocessor;
    private final CausalImpactService impactService;
    private final GroupImpactOrchestrator groupOrchestrator;
    private final ImpactConfigResolver configResolver;

    /**
     * Анализ одной группы.
     */
    @PostMapping("/analyze")
    public ImpactAnalyzeResponse analyze(@RequestBody ImpactAnalyzeRequest req) {
        RawTable table = req.toTable();
        TableSchema schema = req.toSchema();
        String group = resolveGroup(req, table, schema);

        log.info("📈 [WEB] analyze: seriesId={}, group={}, rows={}", req.seriesId(), group, table.size());

        TimeSeries series = preprocessor.extract(table, schema, group);
        ImpactConfig config = configResolver.resolve(req.config());

        ImpactAnalysis analysis = impactService.analyze(ImpactRequest.builder()
                .seriesId(req.seriesId())
                .series(series)
                .interventionAt(req.interventionAt())
                .pre(req.pre())
                .post(req.post())
                .config(config)
                .build());

        return ImpactAnalyzeResponse.from(analysis);
    }

    /**
     * Все (или выбранные) группы таблицы, каждая со своим seed.
     */
    @PostMapping("/analyze-groups")
    public GroupImpactResponse analyzeGroups(@RequestBody ImpactAnalyzeRequest req) {
        RawTable table = req.toTable();

        log.info("📈 [WEB] analyze-groups: seriesId={}, groups={}, rows={}", req.seriesId(), req.groups(), table.size());

        GroupImpactReport report = groupOrchestrator.analyze(GroupImpactRequest.builder()
                .seriesId(req.seriesId())
                .table(table)
                .schema(req.toSchema())
                .groups(req.groups())
                .interventionAt(req.interventionAt())
                .pre(req.pre())
                .post(req.post())
                .config(configResolver.resolve(req.config()))
                .build());

        return GroupImpactResponse.from(report);
    }

    /**
     * Группы таблицы в порядке первого появления (порядковый номер = сдвиг seed).
     */
    @PostMapping("/groups")
    public Map<String, Object> groups(@RequestBody ImpactAnalyzeRequest req) {
        List<String> groups = preprocessor.groups(req.toTable(), req.toSchema());
        return Map.of("groups", groups);
    }

    @DeleteMapping("/cache/{seriesId}")
    public ResponseEntity<Map<String, Object>> invalidate(@PathVariable String seriesId) {
        log.info("🧹 [WEB] cache invalidate: seriesId={}", seriesId);
        int removed = impactService.invalidate(seriesId);
        return ResponseEntity.ok(Map.of("series_id", seriesId, "removed", removed));
    }

    // ---------- helpers ----------

    private String resolveGroup(ImpactAnalyzeRequest req, RawTable table, TableSchema schema) {
        if (req.groupKey() != null && !req.groupKey().isBlank()) {
            return req.groupKey().trim();
        }
        List<String> groups = preprocessor.groups(table, schema);
        if (groups.size() != 1) {
            throw new IllegalArgumentException("group_key is required: the table has " + groups.size() + " groups " + groups);
        }
        return groups.get(0);
    }
}
