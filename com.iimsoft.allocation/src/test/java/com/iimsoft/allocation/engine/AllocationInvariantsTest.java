package com.iimsoft.allocation.engine;

import com.iimsoft.allocation.domain.AllocationResult;
import com.iimsoft.allocation.domain.DemandOrder;
import com.iimsoft.allocation.domain.PeriodSummary;
import com.iimsoft.allocation.domain.PriorityTier;
import com.iimsoft.allocation.service.AllocationInput;
import com.iimsoft.allocation.service.DataBuildService;
import com.iimsoft.allocation.util.MockDataGenerator;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDate;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Checks the allocation properties over generated multi-week snapshots.
 */
class AllocationInvariantsTest {

    private static AllocationInput input(long seed) {
        return new DataBuildService().build(
                new MockDataGenerator(seed).generate(LocalDate.of(2026, 1, 1), 20));
    }

    private static AllocationRun run(long seed, boolean lookahead) {
        AllocationInput in = input(seed);
        return new AllocationEngine(lookahead).run(in.getSupplies(), in.getOrders());
    }

    @ParameterizedTest
    @ValueSource(longs = {1L, 42L, 2026L, 777L})
    void periodAllocationNeverExceedsLimit(long seed) {
        AllocationRun run = run(seed, true);
        for (PeriodSummary s : run.getPeriodSummaries()) {
            long allocated = run.resultsFor(s.getPeriod()).stream()
                    .mapToLong(AllocationResult::getQtyAllocatedThisPeriod).sum();
            assertEquals(s.getTotalAllocated(), allocated);
            assertTrue(allocated <= s.getGlobalLimit());
            // 需求不少于上限时恰好用满
            assertEquals(Math.min(s.getTotalDemand(), s.getGlobalLimit()), allocated);
            assertEquals(s.getBaseLimit() - s.getReservedQty(), s.getGlobalLimit());
        }
    }

    @ParameterizedTest
    @ValueSource(longs = {1L, 42L, 2026L, 777L})
    void higherTierIsNeverStarvedForALowerOne(long seed) {
        AllocationRun run = run(seed, true);
        for (PeriodSummary s : run.getPeriodSummaries()) {
            Map<PriorityTier, Long> remainingByTier = new EnumMap<>(PriorityTier.class);
            Map<PriorityTier, Long> grantedByTier = new EnumMap<>(PriorityTier.class);
            for (AllocationResult r : run.resultsFor(s.getPeriod())) {
                remainingByTier.merge(r.getPriorityTier(), (long) r.getQtyRemaining(), Long::sum);
                grantedByTier.merge(r.getPriorityTier(), (long) r.getQtyAllocatedThisPeriod(), Long::sum);
            }
            for (PriorityTier high : PriorityTier.values()) {
                if (remainingByTier.getOrDefault(high, 0L) == 0) {
                    continue;
                }
                for (PriorityTier low : PriorityTier.values()) {
                    if (high.outranks(low)) {
                        assertEquals(0L, grantedByTier.getOrDefault(low, 0L),
                                "period " + s.getPeriod() + ": " + low + " served while " + high + " is short");
                    }
                }
            }
        }
    }

    @ParameterizedTest
    @ValueSource(longs = {1L, 42L, 2026L, 777L})
    void olderOrdersInATierAreServedFirst(long seed) {
        AllocationInput in = input(seed);
        Map<String, Integer> requestedIn = in.getOrders().stream()
                .collect(Collectors.toMap(DemandOrder::getOrderId, DemandOrder::getPeriodRequested));
        AllocationRun run = new AllocationEngine().run(in.getSupplies(), in.getOrders());

        for (PeriodSummary s : run.getPeriodSummaries()) {
            Map<PriorityTier, List<AllocationResult>> byTier = run.resultsFor(s.getPeriod()).stream()
                    .collect(Collectors.groupingBy(AllocationResult::getPriorityTier));
            for (List<AllocationResult> tierRows : byTier.values()) {
                for (AllocationResult older : tierRows) {
                    if (older.getQtyRemaining() == 0) {
                        continue;
                    }
                    for (AllocationResult newer : tierRows) {
                        if (requestedIn.get(newer.getOrderId()) > requestedIn.get(older.getOrderId())) {
                            assertEquals(0, newer.getQtyAllocatedThisPeriod(),
                                    newer.getOrderId() + " served before " + older.getOrderId());
                        }
                    }
                }
            }
        }
    }

    @ParameterizedTest
    @ValueSource(longs = {1L, 42L, 2026L})
    void allocationOnlyGrowsAndBacklogCarriesExactly(long seed) {
        AllocationInput in = input(seed);
        AllocationRun run = new AllocationEngine().run(in.getSupplies(), in.getOrders());

        Map<String, Integer> lastCumulative = new HashMap<>();
        for (AllocationResult r : run.getAllocationResults()) {
            assertTrue(r.getQtyAllocated() >= 0 && r.getQtyAllocated() <= r.getQtyOrdered());
            int before = lastCumulative.getOrDefault(r.getOrderId(), 0);
            assertEquals(before + r.getQtyAllocatedThisPeriod(), r.getQtyAllocated());
            lastCumulative.put(r.getOrderId(), r.getQtyAllocated());
        }

        List<PeriodSummary> summaries = run.getPeriodSummaries();
        for (int i = 1; i < summaries.size(); i++) {
            PeriodSummary prev = summaries.get(i - 1);
            PeriodSummary cur = summaries.get(i);
            assertEquals(prev.getClosingBacklog() + cur.getNewDemand(), cur.getTotalDemand(),
                    "period " + cur.getPeriod());
        }

        long ordered = 0;
        long allocated = 0;
        long remaining = 0;
        for (DemandOrder o : in.getOrders()) {
            ordered += o.getQtyOrdered();
            allocated += o.getQtyAllocated();
            remaining += o.getQtyRemaining();
        }
        assertEquals(ordered, allocated + remaining);
        assertEquals(run.getTotalAllocated(), allocated);
        assertEquals(summaries.get(summaries.size() - 1).getClosingBacklog(), remaining);
        assertEquals(remaining, run.getOpenBacklog().stream().mapToLong(DemandOrder::getQtyRemaining).sum());
    }

    @ParameterizedTest
    @ValueSource(booleans = {true, false})
    void rerunOnSameInputsIsIdentical(boolean lookahead) {
        List<String> first = run(99L, lookahead).getAllocationResults().stream()
                .map(AllocationResult::toString).collect(Collectors.toList());
        List<String> second = run(99L, lookahead).getAllocationResults().stream()
                .map(AllocationResult::toString).collect(Collectors.toList());
        assertFalse(first.isEmpty());
        assertEquals(first, second);
    }

    @ParameterizedTest
    @ValueSource(longs = {5L, 123L})
    void copiedOrdersGiveTheSameOutcome(long seed) {
        AllocationInput in = input(seed);
        List<DemandOrder> copies = in.getOrders().stream().map(DemandOrder::copy).collect(Collectors.toList());

        AllocationRun original = new AllocationEngine().run(in.getSupplies(), in.getOrders());
        AllocationRun replay = new AllocationEngine().run(in.getSupplies(), copies);

        assertEquals(original.getPeriodSummaries().toString(), replay.getPeriodSummaries().toString());
        assertEquals(original.getTierAllocations(), replay.getTierAllocations());
    }

    @ParameterizedTest
    @ValueSource(longs = {3L, 42L, 2026L})
    void runningTotalsFollowThePeriods(long seed) {
        AllocationInput in = input(seed);
        AllocationRun run = new AllocationEngine().run(in.getSupplies(), in.getOrders());

        long supplyA = 0;
        long demand = 0;
        long allocated = 0;
        for (PeriodSummary s : run.getPeriodSummaries()) {
            supplyA += s.getSubcomponentAQty();
            demand += s.getNewDemand();
            allocated += s.getTotalAllocated();
            assertEquals(supplyA, s.getCumulativeSupplyA());
            assertEquals(demand, s.getCumulativeDemand());
            assertEquals(allocated, s.getCumulativeAllocated());
            assertEquals(-s.getClosingBacklog(), s.getCumulativeBacklog());
        }
        long orderedTotal = in.getOrders().stream().mapToLong(DemandOrder::getQtyOrdered).sum();
        assertEquals(orderedTotal, demand);

        List<ComponentCommit> commits = run.getComponentCommits();
        assertEquals(run.getPeriodSummaries().size(), commits.size());
        for (int i = 0; i < commits.size(); i++) {
            ComponentCommit c = commits.get(i);
            assertTrue(c.getTargetCumulative() >= run.getPeriodSummaries().get(i).getCumulativeDemand());
            assertEquals(c.getSupplyACumulative() - c.getTargetCumulative(), c.getSupplyAStanding());
        }
        assertEquals(orderedTotal, commits.get(commits.size() - 1).getTargetCumulative());
    }
}
