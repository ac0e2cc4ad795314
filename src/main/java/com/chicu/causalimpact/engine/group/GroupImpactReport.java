package com.chicu.causalimpact.engine.group;

import lombok.Builder;

import java.util.List;

@Builder
public record GroupImpactReport(
        String seriesId,
        List<GroupOutcome> outcomes,
        long tookMs
) {

    public GroupImpactReport {
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
    }

    public long succeeded() {
        return outcomes.stream().filter(GroupOutcome::ok).count();
    }

    public long failed() {
        return outcomes.size() - succeeded();
    }
}
