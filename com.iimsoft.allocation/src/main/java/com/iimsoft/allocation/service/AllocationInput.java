package com.iimsoft.allocation.service;

import com.iimsoft.allocation.domain.CustomerTier;
import com.iimsoft.allocation.domain.DemandOrder;
import com.iimsoft.allocation.domain.SupplyRecord;
import com.iimsoft.allocation.util.PeriodCalendar;

import java.util.List;
import java.util.Map;

/**
 * Validated engine input built from one snapshot.
 */
public class AllocationInput {
    private final PeriodCalendar calendar;
    private final Map<String, CustomerTier> customers;
    private final List<SupplyRecord> supplies;
    private final List<DemandOrder> orders;

    public AllocationInput(PeriodCalendar calendar, Map<String, CustomerTier> customers,
                           List<SupplyRecord> supplies, List<DemandOrder> orders) {
        this.calendar = calendar;
        this.customers = Map.copyOf(customers);
        this.supplies = List.copyOf(supplies);
        this.orders = List.copyOf(orders);
    }

    public PeriodCalendar getCalendar() { return calendar; }
    public Map<String, CustomerTier> getCustomers() { return customers; }
    public List<SupplyRecord> getSupplies() { return supplies; }
    public List<DemandOrder> getOrders() { return orders; }
}
