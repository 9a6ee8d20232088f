package com.iimsoft.allocation.engine;

import com.iimsoft.allocation.domain.PriorityTier;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 某周期某档位的需求与瀑布分配结果
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class TierAllocation {
    private final int period;
    private final PriorityTier tier;
    private final long tierDemand;
    private final long tierAllocation;
}
