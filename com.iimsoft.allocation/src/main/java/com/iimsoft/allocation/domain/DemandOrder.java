package com.iimsoft.allocation.domain;

import java.util.Objects;

/**
 * 客户订单。
 * <p>
 * 身份字段（orderId、periodRequested、qtyOrdered 等）创建后不可变；
 * 只有 qtyAllocated 会被 FIFO 分配器单调递增。
 */
public class DemandOrder {
    private final String orderId;
    private final String customerId;
    private final String segment;
    private final PriorityTier priorityTier;
    // FIFO 排序键：订单产生的周期
    private final int periodRequested;
    private final int qtyOrdered;
    private int qtyAllocated;

    public DemandOrder(String orderId, String customerId, String segment,
                       PriorityTier priorityTier, int periodRequested, int qtyOrdered) {
        if (orderId == null || orderId.isBlank()) {
            throw new InvalidInputException("orderId must not be blank");
        }
        if (customerId == null || customerId.isBlank()) {
            throw new InvalidInputException("customerId must not be blank for order " + orderId);
        }
        if (priorityTier == null) {
            throw new InvalidInputException("priority tier is missing for order " + orderId);
        }
        if (qtyOrdered <= 0) {
            throw new InvalidInputException("qtyOrdered must be positive for order " + orderId + ": " + qtyOrdered);
        }
        this.orderId = orderId;
        this.customerId = customerId;
        this.segment = segment == null ? "" : segment;
        this.priorityTier = priorityTier;
        this.periodRequested = periodRequested;
        this.qtyOrdered = qtyOrdered;
        this.qtyAllocated = 0;
    }

    /**
     * Fresh copy with the same identity and the same allocation progress.
     */
    public DemandOrder copy() {
        DemandOrder copy = new DemandOrder(orderId, customerId, segment, priorityTier, periodRequested, qtyOrdered);
        copy.qtyAllocated = qtyAllocated;
        return copy;
    }

    /**
     * Adds {@code grant} units to this order. Allocation never decreases and never exceeds the order.
     */
    public void allocate(int grant) {
        if (grant < 0) {
            throw new IllegalArgumentException("grant must be non-negative: " + grant);
        }
        if (grant > getQtyRemaining()) {
            throw new IllegalStateException("grant " + grant + " exceeds remaining " + getQtyRemaining()
                    + " of order " + orderId);
        }
        qtyAllocated += grant;
    }

    public String getOrderId() { return orderId; }
    public String getCustomerId() { return customerId; }
    public String getSegment() { return segment; }
    public PriorityTier getPriorityTier() { return priorityTier; }
    public int getPeriodRequested() { return periodRequested; }
    public int getQtyOrdered() { return qtyOrdered; }
    public int getQtyAllocated() { return qtyAllocated; }

    public int getQtyRemaining() {
        return qtyOrdered - qtyAllocated;
    }

    public OrderStatus getStatus() {
        return OrderStatus.of(qtyOrdered, qtyAllocated);
    }

    public boolean isOpen() {
        return getQtyRemaining() > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DemandOrder)) return false;
        DemandOrder that = (DemandOrder) o;
        return Objects.equals(orderId, that.orderId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(orderId);
    }

    @Override
    public String toString() {
        return "Order{" + orderId + " " + priorityTier + " #" + periodRequested + " "
                + qtyAllocated + "/" + qtyOrdered + "}";
    }
}
