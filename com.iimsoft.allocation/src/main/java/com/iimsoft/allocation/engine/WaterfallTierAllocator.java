package com.iimsoft.allocation.engine;

import com.iimsoft.allocation.domain.PriorityTier;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 瀑布分配：按优先级从高到低，每档拿 min(档位需求, 剩余上限)。
 * <p>
 * 上限耗尽后仍会遍历剩余档位，写出 0 分配行供报表使用。
 */
public class WaterfallTierAllocator {

    /**
     * @param tierDemand unmet demand per tier; absent tiers count as 0
     * @return one row per tier in precedence order
     */
    public List<TierAllocation> allocate(int period, long globalLimit, Map<PriorityTier, Long> tierDemand) {
        if (globalLimit < 0) {
            throw new IllegalArgumentException("global limit must be non-negative: " + globalLimit);
        }
        List<TierAllocation> rows = new ArrayList<>(PriorityTier.values().length);
        long remaining = globalLimit;
        for (PriorityTier tier : PriorityTier.values()) {
            long demand = tierDemand.getOrDefault(tier, 0L);
            if (demand < 0) {
                throw new IllegalArgumentException("tier demand must be non-negative: " + tier + "=" + demand);
            }
            long granted = Math.min(demand, remaining);
            remaining -= granted;
            rows.add(new TierAllocation(period, tier, demand, granted));
        }
        return rows;
    }
}
