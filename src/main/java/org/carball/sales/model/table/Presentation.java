package org.carball.sales.model.table;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Rounding applied when results are turned into tables. Analysis values stay unrounded.
 */
public final class Presentation {

    public static final int MONEY_SCALE = 2;
    public static final int CORRELATION_SCALE = 3;

    private Presentation() {
        // Utility class - prevent instantiation
    }

    public static BigDecimal round2(BigDecimal value) {
        return value == null ? null : value.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }

    public static double round(double value, int scale) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }
}
