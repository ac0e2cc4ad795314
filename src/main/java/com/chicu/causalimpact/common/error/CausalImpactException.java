package com.chicu.causalimpact.common.error;

import com.chicu.causalimpact.common.enums.PipelineStage;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Базовая ошибка конвейера: всегда знает этап и входные значения, которые её вызвали.
 */
@Getter
public abstract class CausalImpactException extends RuntimeException {

    private final PipelineStage stage;
    private final Map<String, Object> details;

    protected CausalImpactException(PipelineStage stage, String message, Map<String, Object> details) {
        super("[" + stage + "] " + message);
        this.stage = stage;
        this.details = details == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    /** Машинный код ошибки для API (например, INSUFFICIENT_DATA). */
    public abstract String getCode();
}
