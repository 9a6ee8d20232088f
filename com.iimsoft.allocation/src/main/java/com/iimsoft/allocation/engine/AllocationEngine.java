package com.iimsoft.allocation.engine;

import com.iimsoft.allocation.domain.AllocationResult;
import com.iimsoft.allocation.domain.DemandOrder;
import com.iimsoft.allocation.domain.InvalidInputException;
import com.iimsoft.allocation.domain.PeriodState;
import com.iimsoft.allocation.domain.PeriodSummary;
import com.iimsoft.allocation.domain.PriorityTier;
import com.iimsoft.allocation.domain.SupplyRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Runs Resolve -> Waterfall -> FIFO -> Rollover for every period, oldest first.
 * <p>
 * Periods depend on each other through the backlog and the lookahead reservation, so they
 * are processed strictly in sequence on the calling thread. The only side effect is the
 * growth of {@code qtyAllocated} on the orders passed in.
 */
public class AllocationEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(AllocationEngine.class);

    private static final Comparator<DemandOrder> REPORT_ORDER = Comparator
            .comparing(DemandOrder::getPriorityTier)
            .thenComparing(FifoBacklogDistributor.FIFO_ORDER);

    private final ConstraintResolver constraintResolver;
    private final WaterfallTierAllocator waterfallTierAllocator;
    private final FifoBacklogDistributor fifoBacklogDistributor;
    private final PeriodRollover periodRollover;
    private final boolean lookaheadEnabled;

    public AllocationEngine() {
        this(true);
    }

    public AllocationEngine(boolean lookaheadEnabled) {
        this(new ConstraintResolver(), new WaterfallTierAllocator(), new FifoBacklogDistributor(),
                new PeriodRollover(), lookaheadEnabled);
    }

    public AllocationEngine(ConstraintResolver constraintResolver,
                            WaterfallTierAllocator waterfallTierAllocator,
                            FifoBacklogDistributor fifoBacklogDistributor,
                            PeriodRollover periodRollover,
                            boolean lookaheadEnabled) {
        this.constraintResolver = constraintResolver;
        this.waterfallTierAllocator = waterfallTierAllocator;
        this.fifoBacklogDistributor = fifoBacklogDistributor;
        this.periodRollover = periodRollover;
        this.lookaheadEnabled = lookaheadEnabled;
    }

    public boolean isLookaheadEnabled() {
        return lookaheadEnabled;
    }

    /**
     * Allocates over the contiguous period range spanned by the supplies and orders.
     * A period without a supply record has zero supply.
     */
    public AllocationRun run(List<SupplyRecord> supplies, List<DemandOrder> orders) {
        Map<Integer, SupplyRecord> supplyByPeriod = indexSupplies(supplies);
        Map<Integer, List<DemandOrder>> ordersByPeriod = indexOrders(orders);

        AllocationRun run = new AllocationRun();
        if (supplyByPeriod.isEmpty() && ordersByPeriod.isEmpty()) {
            LOGGER.info("Nothing to allocate: no supply and no demand");
            return run;
        }

        Set<Integer> periods = new HashSet<>(supplyByPeriod.keySet());
        periods.addAll(ordersByPeriod.keySet());
        int first = Collections.min(periods);
        int last = Collections.max(periods);

        LOGGER.info("Allocating periods #{}..#{}: {} supply records, {} orders, lookahead={}",
                first, last, supplyByPeriod.size(), orders.size(), lookaheadEnabled);

        PeriodState state = periodRollover.open(first, ordersByPeriod.getOrDefault(first, List.of()));
        PeriodSummary previous = null;
        int period = first;
        while (true) {
            SupplyRecord supply = supplyByPeriod.getOrDefault(period, SupplyRecord.empty(period));
            LookaheadForecast next = null;
            if (period < last) {
                long nextDemand = Quantities.sumRemaining(ordersByPeriod.getOrDefault(period + 1, List.of()));
                long nextSupply = supplyByPeriod.getOrDefault(period + 1, SupplyRecord.empty(period + 1)).getBuildableQty();
                next = new LookaheadForecast(nextDemand, nextSupply);
            }

            PeriodOutcome outcome = runPeriod(state, supply, next, previous);
            run.addOutcome(outcome);
            previous = outcome.getSummary();

            // last 可能是 Integer.MAX_VALUE，不能用 period <= last 作循环条件
            if (period == last) {
                state = outcome.getState();
                break;
            }
            state = periodRollover.rollover(outcome.getState(), period + 1,
                    ordersByPeriod.getOrDefault(period + 1, List.of()));
            period++;
        }
        run.setComponentCommits(componentCommits(run.getPeriodSummaries()));

        List<DemandOrder> open = new ArrayList<>();
        for (DemandOrder order : state.getBacklog()) {
            if (order.isOpen()) {
                open.add(order);
            }
        }
        open.sort(REPORT_ORDER);
        run.setOpenBacklog(open);

        LOGGER.info("Allocation finished: {} units allocated over {} periods, {} orders still open",
                run.getTotalAllocated(), run.getPeriodSummaries().size(), open.size());
        return run;
    }

    /**
     * One period with running totals that start at this period.
     *
     * @see #runPeriod(PeriodState, SupplyRecord, LookaheadForecast, PeriodSummary)
     */
    public PeriodOutcome runPeriod(PeriodState state, SupplyRecord supply, LookaheadForecast next) {
        return runPeriod(state, supply, next, null);
    }

    /**
     * One period: resolve the limit, split it across tiers, pour each tier into its orders.
     *
     * @param state    incoming backlog for this period (mutated: limit and remaining limit)
     * @param next     forecast of the following period, or {@code null} when there is none
     * @param previous summary of the preceding period whose running totals are continued,
     *                 or {@code null} for the first period
     */
    public PeriodOutcome runPeriod(PeriodState state, SupplyRecord supply, LookaheadForecast next,
                                   PeriodSummary previous) {
        int period = state.getPeriod();
        if (supply.getPeriod() != period) {
            throw new IllegalArgumentException("supply of period " + supply.getPeriod()
                    + " passed to period " + period);
        }

        // 1) 全局上限
        BuildLimit limit = lookaheadEnabled
                ? constraintResolver.resolve(supply, next)
                : constraintResolver.resolve(supply);
        state.applyGlobalLimit(limit.getGlobalLimit());

        // 2) 各档位未满足需求
        Map<PriorityTier, List<DemandOrder>> ordersByTier = new EnumMap<>(PriorityTier.class);
        for (DemandOrder order : state.getBacklog()) {
            ordersByTier.computeIfAbsent(order.getPriorityTier(), k -> new ArrayList<>()).add(order);
        }
        Map<PriorityTier, Long> tierDemand = new EnumMap<>(PriorityTier.class);
        long totalDemand = 0;
        long newDemand = 0;
        for (Map.Entry<PriorityTier, List<DemandOrder>> e : ordersByTier.entrySet()) {
            long demand = Quantities.sumRemaining(e.getValue());
            tierDemand.put(e.getKey(), demand);
            totalDemand = Quantities.add(totalDemand, demand);
            for (DemandOrder order : e.getValue()) {
                if (order.getPeriodRequested() == period) {
                    newDemand = Quantities.add(newDemand, order.getQtyOrdered());
                }
            }
        }

        // 3) 瀑布分配到档位
        List<TierAllocation> tierAllocations =
                waterfallTierAllocator.allocate(period, state.getGlobalLimit(), tierDemand);

        // 4) 档位内 FIFO 分配到订单
        Map<String, Integer> grants = new HashMap<>();
        for (TierAllocation tierAllocation : tierAllocations) {
            List<DemandOrder> tierOrders = ordersByTier.getOrDefault(tierAllocation.getTier(), List.of());
            grants.putAll(fifoBacklogDistributor.distribute(tierAllocation.getTierAllocation(), tierOrders));
            state.consume(tierAllocation.getTierAllocation());
        }
        long totalAllocated = state.getGlobalLimit() - state.getRemainingLimit();

        List<DemandOrder> reportOrder = new ArrayList<>(state.getBacklog());
        reportOrder.sort(REPORT_ORDER);
        List<AllocationResult> results = new ArrayList<>(reportOrder.size());
        for (DemandOrder order : reportOrder) {
            results.add(AllocationResult.snapshot(period, order, grants.getOrDefault(order.getOrderId(), 0)));
        }

        long cumulativeSupplyA = Quantities.add(previous == null ? 0 : previous.getCumulativeSupplyA(),
                supply.getSubcomponentAQty());
        long cumulativeSupplyB = Quantities.add(previous == null ? 0 : previous.getCumulativeSupplyB(),
                supply.getSubcomponentBQty());
        long cumulativeDemand = Quantities.add(previous == null ? 0 : previous.getCumulativeDemand(), newDemand);
        long cumulativeAllocated = Quantities.add(previous == null ? 0 : previous.getCumulativeAllocated(),
                totalAllocated);

        PeriodSummary summary = new PeriodSummary(period,
                supply.getSubcomponentAQty(),
                supply.getSubcomponentBQty(),
                limit.getBaseLimit(),
                limit.getReservedQty(),
                limit.getGlobalLimit(),
                newDemand,
                totalDemand,
                totalAllocated,
                totalDemand - totalAllocated,
                limit.getConstrainingInput(),
                cumulativeSupplyA,
                cumulativeSupplyB,
                cumulativeDemand,
                cumulativeAllocated,
                cumulativeAllocated - cumulativeDemand);

        LOGGER.debug("Period #{}: limit={} ({}), demand={}, allocated={}, backlog={}", period,
                summary.getGlobalLimit(), summary.getConstrainingSubcomponent().getLabel(),
                totalDemand, totalAllocated, summary.getClosingBacklog());
        return new PeriodOutcome(state, limit, tierAllocations, results, summary);
    }

    /**
     * Supply A against the cumulative demand target. The target of a period also covers the
     * orders of the period after it, so it runs one period ahead of cumulative demand.
     */
    static List<ComponentCommit> componentCommits(List<PeriodSummary> summaries) {
        List<ComponentCommit> rows = new ArrayList<>(summaries.size());
        for (int i = 0; i < summaries.size(); i++) {
            PeriodSummary current = summaries.get(i);
            long target = i + 1 < summaries.size()
                    ? summaries.get(i + 1).getCumulativeDemand()
                    : current.getCumulativeDemand();
            rows.add(new ComponentCommit(current.getPeriod(), target, current.getCumulativeSupplyA(),
                    current.getCumulativeSupplyA() - target));
        }
        return rows;
    }

    private static Map<Integer, SupplyRecord> indexSupplies(List<SupplyRecord> supplies) {
        Map<Integer, SupplyRecord> byPeriod = new TreeMap<>();
        for (SupplyRecord supply : supplies) {
            if (byPeriod.put(supply.getPeriod(), supply) != null) {
                throw new InvalidInputException("duplicate supply record for period " + supply.getPeriod());
            }
        }
        return byPeriod;
    }

    private static Map<Integer, List<DemandOrder>> indexOrders(List<DemandOrder> orders) {
        Set<String> ids = new HashSet<>();
        Map<Integer, List<DemandOrder>> byPeriod = new TreeMap<>();
        for (DemandOrder order : orders) {
            if (!ids.add(order.getOrderId())) {
                throw new InvalidInputException("duplicate order id: " + order.getOrderId());
            }
            byPeriod.computeIfAbsent(order.getPeriodRequested(), k -> new ArrayList<>()).add(order);
        }
        return byPeriod;
    }
}
