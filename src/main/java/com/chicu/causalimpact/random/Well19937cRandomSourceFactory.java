package com.chicu.causalimpact.random;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.springframework.stereotype.Component;

@Component
public class Well19937cRandomSourceFactory implements RandomSourceFactory {

    @Override
    public RandomGenerator create(long seed, RandomStream stream, int drawIndex) {
        if (drawIndex < 0) throw new IllegalArgumentException("drawIndex must be >= 0: " + drawIndex);
        if (stream == null) throw new IllegalArgumentException("stream is null");

        int[] key = new int[]{
                (int) seed,
                (int) (seed >>> 32),
                stream.ordinal(),
                drawIndex
        };
        return new Well19937c(key);
    }
}
