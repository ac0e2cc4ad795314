package com.chicu.causalimpact.model;

/**
 * Линейное преобразование одной колонки: (v - mean) / scale.
 */
public record Scaling(double mean, double scale) {

    public static final Scaling IDENTITY = new Scaling(0.0, 1.0);

    public Scaling {
        if (!(scale > 0) || Double.isInfinite(scale)) {
            throw new IllegalArgumentException("scale must be positive, got " + scale);
        }
    }

    public double apply(double v) {
        return (v - mean) / scale;
    }

    public double restore(double v) {
        return v * scale + mean;
    }

    /** Для стандартных отклонений/разбросов: без сдвига. */
    public double restoreSpread(double v) {
        return v * scale;
    }
}
