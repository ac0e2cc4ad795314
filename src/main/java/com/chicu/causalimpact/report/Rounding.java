package com.chicu.causalimpact.report;

import lombok.experimental.UtilityClass;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Округление только для показа; внутренние расчёты идут в полной точности.
 */
@UtilityClass
public class Rounding {

    public Double round(Double v, int scale) {
        if (v == null || v.isNaN() || v.isInfinite()) return v;
        return BigDecimal.valueOf(v).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }

    public double round(double v, int scale) {
        if (Double.isNaN(v) || Double.isInfinite(v)) return v;
        return BigDecimal.valueOf(v).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }
}
