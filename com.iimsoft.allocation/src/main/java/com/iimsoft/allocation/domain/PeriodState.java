package com.iimsoft.allocation.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 单个周期的分配状态。
 * <p>
 * 每个周期显式传入、显式传出，不存在进程级的“当前 backlog”单例。
 * backlog = 之前周期未满足完的订单 + 本周期新产生的订单。
 */
public class PeriodState {
    private final int period;
    private final List<DemandOrder> backlog;
    private long globalLimit;
    private long remainingLimit;

    public PeriodState(int period, List<DemandOrder> backlog) {
        this.period = period;
        this.backlog = new ArrayList<>(backlog);
    }

    public int getPeriod() { return period; }
    public long getGlobalLimit() { return globalLimit; }
    public long getRemainingLimit() { return remainingLimit; }

    public List<DemandOrder> getBacklog() {
        return Collections.unmodifiableList(backlog);
    }

    /**
     * Sets the limit for this period and resets the unused remainder to it.
     */
    public void applyGlobalLimit(long globalLimit) {
        if (globalLimit < 0) {
            throw new IllegalArgumentException("global limit must be non-negative: " + globalLimit);
        }
        this.globalLimit = globalLimit;
        this.remainingLimit = globalLimit;
    }

    public void consume(long qty) {
        if (qty < 0 || qty > remainingLimit) {
            throw new IllegalStateException("cannot consume " + qty + " of remaining " + remainingLimit
                    + " in period " + period);
        }
        remainingLimit -= qty;
    }

    @Override
    public String toString() {
        return "PeriodState{#" + period + " limit=" + globalLimit + " remaining=" + remainingLimit
                + " backlog=" + backlog.size() + "}";
    }
}
