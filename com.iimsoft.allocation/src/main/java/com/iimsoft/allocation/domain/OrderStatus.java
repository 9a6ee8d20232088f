package com.iimsoft.allocation.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 订单满足状态
 */
public enum OrderStatus {
    /**
     * 尚未分配任何数量
     */
    UNFULFILLED("Unfulfilled"),

    /**
     * 部分满足，剩余数量滚入下一周期的 backlog
     */
    PARTIAL("Partial"),

    /**
     * 全部满足（终态，不再变化）
     */
    FULL("Full");

    private final String label;

    OrderStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() { return label; }

    public static OrderStatus of(int qtyOrdered, int qtyAllocated) {
        if (qtyAllocated <= 0) {
            return UNFULFILLED;
        }
        return qtyAllocated >= qtyOrdered ? FULL : PARTIAL;
    }
}
