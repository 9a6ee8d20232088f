package com.iimsoft.allocation.engine;

import com.iimsoft.allocation.domain.DemandOrder;
import com.iimsoft.allocation.domain.OrderStatus;
import com.iimsoft.allocation.domain.PriorityTier;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FifoBacklogDistributorTest {

    private final FifoBacklogDistributor distributor = new FifoBacklogDistributor();

    private static DemandOrder order(String id, int period, int qty) {
        return new DemandOrder(id, "Meta", "Data Center", PriorityTier.P1, period, qty);
    }

    @Test
    void oldestOrdersAreServedFirstWithIdTieBreak() {
        DemandOrder newer = order("O-b", 2, 30);
        DemandOrder oldA = order("O-a", 1, 20);
        DemandOrder oldC = order("O-c", 1, 10);

        Map<String, Integer> grants = distributor.distribute(25, List.of(newer, oldC, oldA));

        assertEquals(List.of("O-a", "O-c"), List.copyOf(grants.keySet()));
        assertEquals(20, oldA.getQtyAllocated());
        assertEquals(OrderStatus.FULL, oldA.getStatus());
        assertEquals(5, oldC.getQtyAllocated());
        assertEquals(OrderStatus.PARTIAL, oldC.getStatus());
        assertEquals(0, newer.getQtyAllocated());
        assertEquals(OrderStatus.UNFULFILLED, newer.getStatus());
    }

    @Test
    void partialOrdersKeepTheirPlaceInLine() {
        DemandOrder carried = order("O-9", 1, 50);
        carried.allocate(40);
        DemandOrder fresh = order("O-1", 3, 50);

        Map<String, Integer> grants = distributor.distribute(15, List.of(fresh, carried));

        assertEquals(10, grants.get("O-9"));
        assertEquals(5, grants.get("O-1"));
        assertEquals(OrderStatus.FULL, carried.getStatus());
        assertEquals(5, fresh.getQtyAllocated());
    }

    @Test
    void zeroAllocationChangesNothing() {
        DemandOrder o = order("O-1", 1, 10);
        assertTrue(distributor.distribute(0, List.of(o)).isEmpty());
        assertEquals(0, o.getQtyAllocated());
    }

    @Test
    void fullOrdersAreSkipped() {
        DemandOrder done = order("O-1", 1, 10);
        done.allocate(10);
        DemandOrder open = order("O-2", 2, 10);

        Map<String, Integer> grants = distributor.distribute(4, List.of(done, open));

        assertFalse(grants.containsKey("O-1"));
        assertEquals(4, open.getQtyAllocated());
    }

    @Test
    void allocationAboveTierDemandIsRejected() {
        assertThrows(IllegalStateException.class,
                () -> distributor.distribute(100, List.of(order("O-1", 1, 60))));
        assertThrows(IllegalArgumentException.class,
                () -> distributor.distribute(-1, List.of(order("O-1", 1, 60))));
    }
}
