package com.chicu.causalimpact.random;

import org.apache.commons.math3.random.RandomGenerator;

/**
 * Явный источник случайности: один генератор на (seed, поток, номер выборки).
 * Благодаря этому выборки можно считать параллельно и в любом порядке,
 * а результат остаётся побитово воспроизводимым.
 */
public interface RandomSourceFactory {

    RandomGenerator create(long seed, RandomStream stream, int drawIndex);
}
