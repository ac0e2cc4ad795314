package com.chicu.causalimpact.model;

/**
 * Как ведут себя коэффициенты регрессии во времени.
 */
public enum RegressionMode {
    /** Коэффициенты постоянны (по умолчанию: лучше идентифицируются на коротком pre). */
    STATIC,
    /** Коэффициенты медленно дрейфуют как случайное блуждание. */
    DYNAMIC
}
