package com.iimsoft.allocation.engine;

import com.iimsoft.allocation.domain.ConstrainingInput;
import com.iimsoft.allocation.domain.SupplyRecord;

/**
 * 计算周期的全局可承诺上限（Global Build Limit）。
 * <pre>
 * base     = min(A, B)
 * deficit  = max(0, nextDemand - nextSupply)
 * reserved = min(deficit, base)
 * limit    = base - reserved
 * </pre>
 * 纯函数：只依赖入参，输入已经过校验（非负）。
 */
public class ConstraintResolver {

    /**
     * No lookahead: the limit is the weaker of the two subcomponents.
     */
    public BuildLimit resolve(SupplyRecord current) {
        long base = current.getBuildableQty();
        return new BuildLimit(base, 0L, base, weakerSubcomponent(current));
    }

    public BuildLimit resolve(SupplyRecord current, LookaheadForecast next) {
        if (next == null) {
            return resolve(current);
        }
        long base = current.getBuildableQty();
        long reserved = Math.min(next.getDeficit(), base);
        if (reserved <= 0) {
            return new BuildLimit(base, 0L, base, weakerSubcomponent(current));
        }
        return new BuildLimit(base, reserved, base - reserved, ConstrainingInput.LOOKAHEAD);
    }

    // 相等时记为 A
    private static ConstrainingInput weakerSubcomponent(SupplyRecord supply) {
        return supply.getSubcomponentAQty() <= supply.getSubcomponentBQty()
                ? ConstrainingInput.A
                : ConstrainingInput.B;
    }
}
