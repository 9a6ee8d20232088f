package com.iimsoft.allocation.domain;

/**
 * Immutable per-order, per-period snapshot emitted after the period's FIFO pass.
 */
public class AllocationResult {
    private final int period;
    private final String orderId;
    private final String customerId;
    private final String segment;
    private final PriorityTier priorityTier;
    private final int qtyOrdered;
    private final int qtyAllocated;
    private final int qtyAllocatedThisPeriod;
    private final OrderStatus status;

    public AllocationResult(int period, String orderId, String customerId, String segment,
                            PriorityTier priorityTier, int qtyOrdered, int qtyAllocated,
                            int qtyAllocatedThisPeriod, OrderStatus status) {
        this.period = period;
        this.orderId = orderId;
        this.customerId = customerId;
        this.segment = segment;
        this.priorityTier = priorityTier;
        this.qtyOrdered = qtyOrdered;
        this.qtyAllocated = qtyAllocated;
        this.qtyAllocatedThisPeriod = qtyAllocatedThisPeriod;
        this.status = status;
    }

    public static AllocationResult snapshot(int period, DemandOrder order, int grantedThisPeriod) {
        return new AllocationResult(period, order.getOrderId(), order.getCustomerId(), order.getSegment(),
                order.getPriorityTier(), order.getQtyOrdered(), order.getQtyAllocated(),
                grantedThisPeriod, order.getStatus());
    }

    public int getPeriod() { return period; }
    public String getOrderId() { return orderId; }
    public String getCustomerId() { return customerId; }
    public String getSegment() { return segment; }
    public PriorityTier getPriorityTier() { return priorityTier; }
    public int getQtyOrdered() { return qtyOrdered; }
    public int getQtyAllocated() { return qtyAllocated; }
    public int getQtyAllocatedThisPeriod() { return qtyAllocatedThisPeriod; }
    public OrderStatus getStatus() { return status; }

    public int getQtyRemaining() {
        return qtyOrdered - qtyAllocated;
    }

    @Override
    public String toString() {
        return "#" + period + " " + orderId + " " + priorityTier + " +" + qtyAllocatedThisPeriod
                + " (" + qtyAllocated + "/" + qtyOrdered + ") " + status.getLabel();
    }
}
