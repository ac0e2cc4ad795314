package com.chicu.causalimpact.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Значения по умолчанию для анализа; запрос может переопределить любое из них.
 */
@Data
@ConfigurationProperties(prefix = "causalimpact")
public class CausalImpactProperties {

    /**
     * Вероятность для интервалов (0..1).
     */
    private double credibleLevel = 0.95;

    /**
     * Число апостериорных выборок.
     */
    private int numDraws = 1000;

    /**
     * Жёсткий потолок на num-draws из запроса.
     */
    private int maxDraws = 100_000;

    private long seed = 42L;

    /**
     * Выкидывать вырожденные ковариаты с предупреждением вместо ошибки.
     */
    private boolean autoDropDegenerate = false;

    /**
     * Нижняя граница длины pre; фактическая граница = max(это, 2 * число свободных параметров).
     */
    private int minPrePeriodObservations = 3;

    /**
     * Коэффициенты регрессии дрейфуют во времени.
     */
    private boolean dynamicRegression = false;

    /**
     * Не падать при исчерпании бюджета оптимизатора, а вернуть лучшую оценку с converged=false.
     */
    private boolean allowNonConverged = false;

    private boolean standardize = true;

    private int maxOptimizerEvaluations = 2000;

    /**
     * Учитывать неопределённость дисперсий шумов (смесь по кандидатам), а не только MLE-точку.
     */
    private boolean parameterUncertainty = true;

    /**
     * Знаков после запятой в округлённой сводке и тексте.
     */
    private int reportPrecision = 2;

    /**
     * Пул для выборок: потоки и размер пачки выборок на задачу.
     */
    private int drawThreads = Math.max(1, Runtime.getRuntime().availableProcessors());
    private int drawChunkSize = 64;

    /**
     * Сколько групп (рынков) считать одновременно.
     */
    private int groupThreads = 2;

    private Cache cache = new Cache();

    @Data
    public static class Cache {
        private boolean enabled = true;
        private int maxEntries = 64;
    }
}
