package com.iimsoft.allocation.domain;

/**
 * 某一周期的子件到货量（两种子件，成品产量取两者较小值）。
 */
public class SupplyRecord {
    private final int period;
    private final int subcomponentAQty;
    private final int subcomponentBQty;

    public SupplyRecord(int period, int subcomponentAQty, int subcomponentBQty) {
        if (subcomponentAQty < 0 || subcomponentBQty < 0) {
            throw new InvalidInputException("supply quantities must be non-negative, period " + period
                    + ": A=" + subcomponentAQty + ", B=" + subcomponentBQty);
        }
        this.period = period;
        this.subcomponentAQty = subcomponentAQty;
        this.subcomponentBQty = subcomponentBQty;
    }

    public static SupplyRecord empty(int period) {
        return new SupplyRecord(period, 0, 0);
    }

    public int getPeriod() { return period; }
    public int getSubcomponentAQty() { return subcomponentAQty; }
    public int getSubcomponentBQty() { return subcomponentBQty; }

    /** min(A, B) */
    public int getBuildableQty() {
        return Math.min(subcomponentAQty, subcomponentBQty);
    }

    @Override
    public String toString() {
        return "Supply{#" + period + " A=" + subcomponentAQty + " B=" + subcomponentBQty + "}";
    }
}
