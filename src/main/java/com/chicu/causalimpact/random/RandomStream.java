package com.chicu.causalimpact.random;

/**
 * Независимые потоки случайных чисел внутри одного анализа.
 */
public enum RandomStream {
    /** Кандидаты дисперсий вокруг MLE (индекс = номер кандидата). */
    HYPERPARAMETERS,
    /** Выбор кандидата дисперсий для выборки (индекс = номер выборки). */
    MIXTURE,
    /** Обратная выборка траектории состояний по pre-периоду. */
    SMOOTHING,
    /** Прогон модели вперёд по post-периоду. */
    FORECAST
}
