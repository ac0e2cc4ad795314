package com.chicu.causalimpact.common.error;

import com.chicu.causalimpact.common.enums.PipelineStage;
import lombok.Getter;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Слишком мало наблюдений в периоде (или период вообще пустой).
 */
@Getter
public class InsufficientDataException extends CausalImpactException {

    private final int required;
    private final int available;

    public InsufficientDataException(String what, int required, int available, Map<String, Object> context) {
        super(PipelineStage.PREPROCESSING,
                what + ": required at least " + required + " observations, available " + available,
                details(required, available, context));
        this.required = required;
        this.available = available;
    }

    @Override
    public String getCode() {
        return "INSUFFICIENT_DATA";
    }

    private static Map<String, Object> details(int required, int available, Map<String, Object> context) {
        Map<String, Object> d = new LinkedHashMap<>();
        d.put("required", required);
        d.put("available", available);
        if (context != null) d.putAll(context);
        return d;
    }
}
