package com.iimsoft.allocation.domain;

/**
 * 客户主数据：客户 -> 优先级档位 + 细分市场
 */
public class CustomerTier {
    private final String customerId;
    private final PriorityTier priorityTier;
    private final String segment;

    public CustomerTier(String customerId, PriorityTier priorityTier, String segment) {
        this.customerId = customerId;
        this.priorityTier = priorityTier;
        this.segment = segment;
    }

    public String getCustomerId() { return customerId; }
    public PriorityTier getPriorityTier() { return priorityTier; }
    public String getSegment() { return segment; }

    @Override
    public String toString() {
        return customerId + "(" + priorityTier + ", " + segment + ")";
    }
}
