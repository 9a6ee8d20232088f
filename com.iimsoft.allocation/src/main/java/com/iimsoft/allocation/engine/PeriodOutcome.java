package com.iimsoft.allocation.engine;

import com.iimsoft.allocation.domain.AllocationResult;
import com.iimsoft.allocation.domain.PeriodState;
import com.iimsoft.allocation.domain.PeriodSummary;

import java.util.List;

/**
 * Everything one period produced; {@link #getState()} is the input of the next rollover.
 */
public class PeriodOutcome {
    private final PeriodState state;
    private final BuildLimit buildLimit;
    private final List<TierAllocation> tierAllocations;
    private final List<AllocationResult> results;
    private final PeriodSummary summary;

    public PeriodOutcome(PeriodState state, BuildLimit buildLimit, List<TierAllocation> tierAllocations,
                         List<AllocationResult> results, PeriodSummary summary) {
        this.state = state;
        this.buildLimit = buildLimit;
        this.tierAllocations = List.copyOf(tierAllocations);
        this.results = List.copyOf(results);
        this.summary = summary;
    }

    public PeriodState getState() { return state; }
    public BuildLimit getBuildLimit() { return buildLimit; }
    public List<TierAllocation> getTierAllocations() { return tierAllocations; }
    public List<AllocationResult> getResults() { return results; }
    public PeriodSummary getSummary() { return summary; }
}
