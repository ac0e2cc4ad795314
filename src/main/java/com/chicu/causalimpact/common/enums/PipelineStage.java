package com.chicu.causalimpact.common.enums;

/**
 * Этап конвейера, на котором анализ был остановлен ошибкой.
 * Прогноз, агрегация и отчёт работают только с уже проверенными данными и сами не отказывают.
 */
public enum PipelineStage {
    PREPROCESSING,
    ESTIMATION
}
