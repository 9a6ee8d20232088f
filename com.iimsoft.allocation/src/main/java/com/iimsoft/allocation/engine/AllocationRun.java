package com.iimsoft.allocation.engine;

import com.iimsoft.allocation.domain.AllocationResult;
import com.iimsoft.allocation.domain.DemandOrder;
import com.iimsoft.allocation.domain.PeriodSummary;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 一次完整运行（全部周期）的输出，交给报表端渲染。
 */
public class AllocationRun {
    private final List<PeriodSummary> periodSummaries = new ArrayList<>();
    private final List<AllocationResult> allocationResults = new ArrayList<>();
    private final List<TierAllocation> tierAllocations = new ArrayList<>();
    private final List<DemandOrder> openBacklog = new ArrayList<>();
    private final List<ComponentCommit> componentCommits = new ArrayList<>();

    void addOutcome(PeriodOutcome outcome) {
        periodSummaries.add(outcome.getSummary());
        allocationResults.addAll(outcome.getResults());
        tierAllocations.addAll(outcome.getTierAllocations());
    }

    void setOpenBacklog(List<DemandOrder> backlog) {
        openBacklog.clear();
        openBacklog.addAll(backlog);
    }

    void setComponentCommits(List<ComponentCommit> rows) {
        componentCommits.clear();
        componentCommits.addAll(rows);
    }

    public List<PeriodSummary> getPeriodSummaries() { return Collections.unmodifiableList(periodSummaries); }
    public List<AllocationResult> getAllocationResults() { return Collections.unmodifiableList(allocationResults); }
    public List<TierAllocation> getTierAllocations() { return Collections.unmodifiableList(tierAllocations); }
    public List<ComponentCommit> getComponentCommits() { return Collections.unmodifiableList(componentCommits); }

    /** Orders still short after the last period, in FIFO order per tier. */
    public List<DemandOrder> getOpenBacklog() { return Collections.unmodifiableList(openBacklog); }

    public Optional<PeriodSummary> summaryFor(int period) {
        return periodSummaries.stream().filter(s -> s.getPeriod() == period).findFirst();
    }

    public List<AllocationResult> resultsFor(int period) {
        return allocationResults.stream()
                .filter(r -> r.getPeriod() == period)
                .collect(Collectors.toList());
    }

    public long getTotalAllocated() {
        long total = 0;
        for (PeriodSummary s : periodSummaries) {
            total = Quantities.add(total, s.getTotalAllocated());
        }
        return total;
    }
}
