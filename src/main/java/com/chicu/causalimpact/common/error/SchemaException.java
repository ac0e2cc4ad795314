package com.chicu.causalimpact.common.error;

import com.chicu.causalimpact.common.enums.PipelineStage;

import java.util.Map;

/**
 * Отсутствует обязательная колонка или значение не приводится к нужному типу.
 */
public class SchemaException extends CausalImpactException {

    public SchemaException(String message, Map<String, Object> details) {
        super(PipelineStage.PREPROCESSING, message, details);
    }

    @Override
    public String getCode() {
        return "SCHEMA";
    }
}
