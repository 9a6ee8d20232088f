package com.iimsoft.allocation.engine;

import com.iimsoft.allocation.domain.DemandOrder;
import com.iimsoft.allocation.domain.PeriodState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * 周期结转：把未满足完的订单原样（身份、下单周期不变）带入下一周期，
 * 并加入下一周期新产生的订单。已满足（FULL）的订单不再进入 backlog。
 */
public class PeriodRollover {

    private static final Logger LOGGER = LoggerFactory.getLogger(PeriodRollover.class);

    /**
     * Backlog of the first period of a run: its new orders, minus any that are already full.
     */
    public PeriodState open(int firstPeriod, Collection<DemandOrder> newOrders) {
        List<DemandOrder> backlog = new ArrayList<>();
        addNewOrders(backlog, firstPeriod, newOrders);
        LOGGER.debug("Open #{}: {} new", firstPeriod, backlog.size());
        return new PeriodState(firstPeriod, backlog);
    }

    public PeriodState rollover(PeriodState closed, int nextPeriod, Collection<DemandOrder> newOrders) {
        if (nextPeriod <= closed.getPeriod()) {
            throw new IllegalArgumentException("next period " + nextPeriod + " must follow period " + closed.getPeriod());
        }
        List<DemandOrder> backlog = new ArrayList<>();
        for (DemandOrder order : closed.getBacklog()) {
            if (order.isOpen()) {
                backlog.add(order);
            }
        }
        int carried = backlog.size();
        addNewOrders(backlog, nextPeriod, newOrders);

        LOGGER.debug("Rollover #{} -> #{}: {} carried, {} new", closed.getPeriod(), nextPeriod,
                carried, backlog.size() - carried);
        return new PeriodState(nextPeriod, backlog);
    }

    private static void addNewOrders(List<DemandOrder> backlog, int period, Collection<DemandOrder> newOrders) {
        for (DemandOrder order : newOrders) {
            if (order.getPeriodRequested() != period) {
                throw new IllegalArgumentException("order " + order.getOrderId() + " was requested in period "
                        + order.getPeriodRequested() + ", not " + period);
            }
            if (order.isOpen()) {
                backlog.add(order);
            }
        }
    }
}
