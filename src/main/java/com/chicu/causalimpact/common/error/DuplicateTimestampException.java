package com.chicu.causalimpact.common.error;

import com.chicu.causalimpact.common.enums.PipelineStage;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

public class DuplicateTimestampException extends CausalImpactException {

    public DuplicateTimestampException(String groupKey, Instant timestamp) {
        super(PipelineStage.PREPROCESSING,
                "duplicate timestamp " + timestamp + " in group '" + groupKey + "'",
                details(groupKey, timestamp));
    }

    @Override
    public String getCode() {
        return "DUPLICATE_TIMESTAMP";
    }

    private static Map<String, Object> details(String groupKey, Instant timestamp) {
        Map<String, Object> d = new LinkedHashMap<>();
        d.put("groupKey", groupKey);
        d.put("timestamp", String.valueOf(timestamp));
        return d;
    }
}
