package com.chicu.causalimpact.engine.group;

import com.chicu.causalimpact.common.enums.PipelineStage;
import com.chicu.causalimpact.engine.ImpactAnalysis;
import lombok.Builder;

import java.util.Map;

/**
 * Результат одной группы: либо анализ, либо причина отказа.
 * Ошибка одной группы не влияет на остальные.
 */
@Builder
public record GroupOutcome(
        String groupKey,
        int ordinal,
        long seed,
        boolean ok,
        ImpactAnalysis analysis,
        String errorCode,
        PipelineStage errorStage,
        String errorMessage,
        Map<String, Object> errorDetails
) {
}
