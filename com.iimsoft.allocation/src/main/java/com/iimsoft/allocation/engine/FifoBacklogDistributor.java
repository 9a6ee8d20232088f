package com.iimsoft.allocation.engine;

import com.iimsoft.allocation.domain.DemandOrder;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pours a tier's allocation into its orders, oldest first.
 * <p>
 * Orders are visited by {@code (periodRequested, orderId)}; each takes
 * {@code min(qtyRemaining, tierRemaining)} and the pass stops once the tier is empty.
 * Later orders keep their prior allocation.
 */
public class FifoBacklogDistributor {

    public static final Comparator<DemandOrder> FIFO_ORDER = Comparator
            .comparingInt(DemandOrder::getPeriodRequested)
            .thenComparing(DemandOrder::getOrderId);

    /**
     * @return units granted in this call, keyed by order id, in grant order; orders that got nothing are absent
     */
    public Map<String, Integer> distribute(long tierAllocation, Collection<DemandOrder> tierOrders) {
        if (tierAllocation < 0) {
            throw new IllegalArgumentException("tier allocation must be non-negative: " + tierAllocation);
        }
        Map<String, Integer> grants = new LinkedHashMap<>();
        if (tierAllocation == 0 || tierOrders.isEmpty()) {
            return grants;
        }

        List<DemandOrder> sorted = new ArrayList<>(tierOrders);
        sorted.sort(FIFO_ORDER);

        long tierRemaining = tierAllocation;
        for (DemandOrder order : sorted) {
            if (tierRemaining == 0) {
                break;
            }
            int grant = (int) Math.min(order.getQtyRemaining(), tierRemaining);
            if (grant == 0) {
                continue;
            }
            order.allocate(grant);
            tierRemaining -= grant;
            grants.put(order.getOrderId(), grant);
        }

        // 瀑布分配已按档位需求封顶，分不完说明调用方给多了
        if (tierRemaining > 0) {
            throw new IllegalStateException("tier allocation " + tierAllocation + " exceeds tier demand, "
                    + tierRemaining + " units left undistributed");
        }
        return grants;
    }
}
