package com.chicu.causalimpact.engine.group;

import com.chicu.causalimpact.common.enums.PipelineStage;
import com.chicu.causalimpact.common.error.InsufficientDataException;
import com.chicu.causalimpact.common.error.SchemaException;
import com.chicu.causalimpact.config.CausalImpactProperties;
import com.chicu.causalimpact.engine.CausalImpactService;
import com.chicu.causalimpact.engine.ImpactAnalysis;
import com.chicu.causalimpact.engine.ImpactConfig;
import com.chicu.causalimpact.engine.ImpactConfigResolver;
import com.chicu.causalimpact.engine.ImpactRequest;
import com.chicu.causalimpact.series.RawTable;
import com.chicu.causalimpact.series.TableSchema;
import com.chicu.causalimpact.series.TimeSeriesPreprocessor;
import com.chicu.causalimpact.support.SyntheticSeries;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class GroupImpactOrchestratorTest {

    @Mock private CausalImpactService impactService;

    private GroupImpactOrchestrator orchestrator;

    private final ImpactConfig base = ImpactConfig.defaults().toBuilder().seed(100L).numDraws(10).build();

    @BeforeEach
    void setUp() {
        CausalImpactProperties props = new CausalImpactProperties();
        props.setGroupThreads(2);
        orchestrator = new GroupImpactOrchestrator(
                impactService, new TimeSeriesPreprocessor(), new ImpactConfigResolver(props), props);
    }

    @AfterEach
    void tearDown() {
        orchestrator.shutdown();
    }

    private static RawTable table(String... groups) {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (String g : groups) {
            rows.addAll(SyntheticSeries.rows(SyntheticSeries.step(20, 12, 10.0, 12.0), g));
        }
        return RawTable.fromRows(rows);
    }

    private GroupImpactRequest.GroupImpactRequestBuilder request(RawTable table) {
        return GroupImpactRequest.builder()
                .seriesId("sales")
                .table(table)
                .schema(TableSchema.withCovariates(List.of()))
                .interventionAt(SyntheticSeries.week(12))
                .config(base);
    }

    private static ImpactAnalysis echo(ImpactRequest r) {
        return ImpactAnalysis.builder()
                .seriesId(r.seriesId())
                .groupKey(r.series().groupKey())
                .seed(r.config().seed())
                .build();
    }

    @Test
    void eachGroupGetsSeedOffsetByTablePosition() {
        when(impactService.analyze(any())).thenAnswer(inv -> echo(inv.getArgument(0)));

        GroupImpactReport report = orchestrator.analyze(request(table("A", "B", "C")).build());

        assertEquals(3, report.succeeded());
        assertEquals(0, report.failed());
        assertEquals(List.of("A", "B", "C"), report.outcomes().stream().map(GroupOutcome::groupKey).toList());
        assertEquals(List.of(100L, 101L, 102L), report.outcomes().stream().map(GroupOutcome::seed).toList());

        ArgumentCaptor<ImpactRequest> captor = ArgumentCaptor.forClass(ImpactRequest.class);
        verify(impactService, times(3)).analyze(captor.capture());
        for (ImpactRequest r : captor.getAllValues()) {
            assertEquals(20, r.series().size());
            assertEquals(SyntheticSeries.week(12), r.interventionAt());
            assertEquals(10, r.config().numDraws());
        }
    }

    @Test
    void seedDoesNotDependOnRequestedSubset() {
        when(impactService.analyze(any())).thenAnswer(inv -> echo(inv.getArgument(0)));

        GroupImpactReport report = orchestrator.analyze(request(table("A", "B", "C")).groups(List.of("C", "A")).build());

        assertEquals(List.of("C", "A"), report.outcomes().stream().map(GroupOutcome::groupKey).toList());
        assertEquals(102L, report.outcomes().get(0).analysis().seed());
        assertEquals(2, report.outcomes().get(0).ordinal());
        assertEquals(100L, report.outcomes().get(1).analysis().seed());
    }

    @Test
    void failingGroupDoesNotAffectOthers() {
        when(impactService.analyze(any())).thenAnswer(inv -> {
            ImpactRequest r = inv.getArgument(0);
            if ("B".equals(r.series().groupKey())) {
                throw new InsufficientDataException("pre-period is too short", 8, 3, Map.of("groupKey", "B"));
            }
            if ("C".equals(r.series().groupKey())) {
                throw new IllegalStateException("unexpected");
            }
            return echo(r);
        });

        GroupImpactReport report = orchestrator.analyze(request(table("A", "B", "C")).build());

        assertEquals(1, report.succeeded());
        assertEquals(2, report.failed());

        GroupOutcome a = report.outcomes().get(0);
        assertTrue(a.ok());
        assertNotNull(a.analysis());

        GroupOutcome b = report.outcomes().get(1);
        assertFalse(b.ok());
        assertEquals("INSUFFICIENT_DATA", b.errorCode());
        assertEquals(PipelineStage.PREPROCESSING, b.errorStage());
        assertEquals(8, b.errorDetails().get("required"));
        assertNull(b.analysis());

        GroupOutcome c = report.outcomes().get(2);
        assertFalse(c.ok());
        assertEquals("INTERNAL", c.errorCode());
    }

    @Test
    void unknownGroupIsReportedWithoutRunning() {
        when(impactService.analyze(any())).thenAnswer(inv -> echo(inv.getArgument(0)));

        GroupImpactReport report = orchestrator.analyze(request(table("A")).groups(List.of("A", "ZZ")).build());

        GroupOutcome unknown = report.outcomes().get(1);
        assertFalse(unknown.ok());
        assertEquals("UNKNOWN_GROUP", unknown.errorCode());
        assertEquals(-1, unknown.ordinal());
        verify(impactService, times(1)).analyze(any());
    }

    @Test
    void missingColumnsFailTheWholeRequest() {
        RawTable broken = RawTable.fromRows(List.of(Map.of("timestamp", "2024-01-01", "response", 1.0)));

        assertThrows(SchemaException.class, () -> orchestrator.analyze(request(broken).build()));
        assertThrows(IllegalArgumentException.class, () -> orchestrator.analyze(request(null).build()));
        verifyNoInteractions(impactService);
    }
}
