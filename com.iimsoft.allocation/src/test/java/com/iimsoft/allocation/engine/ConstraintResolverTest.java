package com.iimsoft.allocation.engine;

import com.iimsoft.allocation.domain.ConstrainingInput;
import com.iimsoft.allocation.domain.SupplyRecord;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConstraintResolverTest {

    private final ConstraintResolver resolver = new ConstraintResolver();

    @Test
    void baseLimitIsWeakerSubcomponent() {
        BuildLimit limit = resolver.resolve(new SupplyRecord(1, 120, 80));
        assertEquals(80, limit.getBaseLimit());
        assertEquals(80, limit.getGlobalLimit());
        assertEquals(0, limit.getReservedQty());
        assertEquals(ConstrainingInput.B, limit.getConstrainingInput());

        assertEquals(ConstrainingInput.A, resolver.resolve(new SupplyRecord(1, 30, 90)).getConstrainingInput());
    }

    @Test
    void tieIsAttributedToA() {
        assertEquals(ConstrainingInput.A, resolver.resolve(new SupplyRecord(1, 50, 50)).getConstrainingInput());
    }

    @Test
    void forecastDeficitReservesCapacity() {
        BuildLimit limit = resolver.resolve(new SupplyRecord(1, 100, 100), new LookaheadForecast(150, 120));
        assertEquals(100, limit.getBaseLimit());
        assertEquals(30, limit.getReservedQty());
        assertEquals(70, limit.getGlobalLimit());
        assertEquals(ConstrainingInput.LOOKAHEAD, limit.getConstrainingInput());
    }

    @Test
    void reservationNeverExceedsBaseLimit() {
        BuildLimit limit = resolver.resolve(new SupplyRecord(1, 20, 40), new LookaheadForecast(100, 0));
        assertEquals(20, limit.getReservedQty());
        assertEquals(0, limit.getGlobalLimit());
    }

    @Test
    void noDeficitNoReservation() {
        BuildLimit surplus = resolver.resolve(new SupplyRecord(1, 60, 70), new LookaheadForecast(50, 60));
        assertEquals(60, surplus.getGlobalLimit());
        assertEquals(0, surplus.getReservedQty());
        assertEquals(ConstrainingInput.A, surplus.getConstrainingInput());

        BuildLimit balanced = resolver.resolve(new SupplyRecord(1, 60, 70), new LookaheadForecast(60, 60));
        assertEquals(60, balanced.getGlobalLimit());

        BuildLimit none = resolver.resolve(new SupplyRecord(1, 60, 70), null);
        assertEquals(60, none.getGlobalLimit());
    }

    @Test
    void zeroSupplyGivesZeroLimit() {
        BuildLimit limit = resolver.resolve(new SupplyRecord(1, 0, 25), new LookaheadForecast(10, 0));
        assertEquals(0, limit.getGlobalLimit());
        assertEquals(0, limit.getReservedQty());
        assertEquals(ConstrainingInput.A, limit.getConstrainingInput());
    }
}
