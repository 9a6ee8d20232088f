package com.iimsoft.allocation.domain;

import java.util.Locale;

/**
 * 客户优先级档位（封闭枚举）。
 * <p>
 * 声明顺序即瀑布分配的优先顺序：P1 最高，P9 最低。
 * 比较只能通过 {@link #compareTo(Enum)} / {@link #outranks(PriorityTier)}，不允许按字符串排序。
 */
public enum PriorityTier {
    P1, P2, P3, P4, P5, P6, P7, P8, P9;

    /** 1 = highest. */
    public int getRank() {
        return ordinal() + 1;
    }

    public boolean outranks(PriorityTier other) {
        return compareTo(other) < 0;
    }

    /**
     * Parses "P3", "p3" or "3". Anything else is rejected; there is no fallback tier.
     */
    public static PriorityTier fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new InvalidInputException("priority tier is missing");
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        if (!normalized.startsWith("P")) {
            normalized = "P" + normalized;
        }
        for (PriorityTier tier : values()) {
            if (tier.name().equals(normalized)) {
                return tier;
            }
        }
        throw new InvalidInputException("unknown priority tier: " + code);
    }
}
