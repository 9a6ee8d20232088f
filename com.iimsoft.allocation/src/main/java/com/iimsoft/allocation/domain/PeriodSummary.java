package com.iimsoft.allocation.domain;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 周期汇总（对应报表 Summary 页的一列）
 */
@Getter
@ToString
@AllArgsConstructor
public class PeriodSummary {
    private final int period;
    private final int subcomponentAQty;
    private final int subcomponentBQty;
    // min(A, B)
    private final long baseLimit;
    // 为下一周期缺口预留的数量
    private final long reservedQty;
    private final long globalLimit;
    // 本周期新下的订单量
    private final long newDemand;
    // 本周期 backlog 的未满足总量（含滚入的旧订单）
    private final long totalDemand;
    private final long totalAllocated;
    // 周期结束后仍未满足、滚入下一周期的数量
    private final long closingBacklog;
    private final ConstrainingInput constrainingSubcomponent;

    // 以下为从第一个周期起的累计值
    private final long cumulativeSupplyA;
    private final long cumulativeSupplyB;
    // 累计新下订单量
    private final long cumulativeDemand;
    private final long cumulativeAllocated;
    // 累计分配 - 累计需求，不为正；负数即尚欠的数量
    private final long cumulativeBacklog;
}
