package com.iimsoft.allocation.engine;

import com.iimsoft.allocation.domain.DemandOrder;

import java.util.Collection;

/**
 * 数量累加工具：溢出时直接失败，不允许静默回绕或截断。
 */
public final class Quantities {

    private Quantities() {
    }

    public static long add(long a, long b) {
        try {
            return Math.addExact(a, b);
        } catch (ArithmeticException e) {
            throw new AllocationComputationException("quantity overflow: " + a + " + " + b, e);
        }
    }

    public static int toInt(long value) {
        try {
            return Math.toIntExact(value);
        } catch (ArithmeticException e) {
            throw new AllocationComputationException("quantity does not fit an int: " + value, e);
        }
    }

    public static long sumRemaining(Collection<DemandOrder> orders) {
        long total = 0;
        for (DemandOrder order : orders) {
            total = add(total, order.getQtyRemaining());
        }
        return total;
    }
}
