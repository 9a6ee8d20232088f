package com.iimsoft.allocation.engine;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 子件 A 的累计到货与累计需求目标对比（负数表示 A 落后于目标）
 */
@Getter
@ToString
@EqualsAndHashCode
@AllArgsConstructor
public class ComponentCommit {
    private final int period;
    // 累计需求，含下一周期的新订单
    private final long targetCumulative;
    private final long supplyACumulative;
    private final long supplyAStanding;
}
