package com.chicu.causalimpact.web.dto;

import com.chicu.causalimpact.common.enums.PipelineStage;
import com.chicu.causalimpact.engine.group.GroupImpactReport;
import com.chicu.causalimpact.engine.group.GroupOutcome;

import java.util.List;
import java.util.Map;

public record GroupImpactResponse(
        String seriesId,
        long succeeded,
        long failed,
        long tookMs,
        List<Group> groups
) {

    public static GroupImpactResponse from(GroupImpactReport report) {
        List<Group> groups = report.outcomes().stream().map(Group::from).toList();
        return new GroupImpactResponse(report.seriesId(), report.succeeded(), report.failed(), report.tookMs(), groups);
    }

    public record Group(
            String groupKey,
            int ordinal,
            long seed,
            boolean ok,
            ImpactAnalyzeResponse analysis,
            String errorCode,
            PipelineStage errorStage,
            String errorMessage,
            Map<String, Object> errorDetails
    ) {

        static Group from(GroupOutcome o) {
            return new Group(
                    o.groupKey(),
                    o.ordinal(),
                    o.seed(),
                    o.ok(),
                    o.analysis() == null ? null : ImpactAnalyzeResponse.from(o.analysis()),
                    o.errorCode(),
                    o.errorStage(),
                    o.errorMessage(),
                    o.errorDetails()
            );
        }
    }
}
