package com.iimsoft.allocation.engine;

/**
 * 下一周期的已知需求与预计可用供给，用于提前预留产能。
 */
public class LookaheadForecast {
    private final long nextPeriodDemand;
    private final long nextPeriodSupply;

    public LookaheadForecast(long nextPeriodDemand, long nextPeriodSupply) {
        this.nextPeriodDemand = nextPeriodDemand;
        this.nextPeriodSupply = nextPeriodSupply;
    }

    public long getNextPeriodDemand() { return nextPeriodDemand; }
    public long getNextPeriodSupply() { return nextPeriodSupply; }

    /** Positive when next period is forecast to be short, otherwise 0. */
    public long getDeficit() {
        return Math.max(0L, nextPeriodDemand - nextPeriodSupply);
    }
}
