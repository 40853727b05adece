package org.carball.sales.model.aggregation;

public enum Reduction {
    SUM,
    MEAN,
    COUNT,
    NUNIQUE;

    /**
     * Whether the reduced value is a whole count rather than a decimal quantity.
     */
    public boolean isCount() {
        return this == COUNT || this == NUNIQUE;
    }
}
