package com.iimsoft.allocation.util;

import com.iimsoft.allocation.domain.InvalidInputException;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PeriodCalendarTest {

    @Test
    void isoWeekOfDate() {
        assertEquals("2026-W01", PeriodCalendar.weekOf(LocalDate.of(2026, 1, 1)));
        assertEquals("2026-W01", PeriodCalendar.weekOf(LocalDate.of(2025, 12, 29)));
        assertEquals("2025-W52", PeriodCalendar.weekOf(LocalDate.of(2025, 12, 28)));
        assertEquals("2026-W53", PeriodCalendar.weekOf(LocalDate.of(2026, 12, 31)));
    }

    @Test
    void periodsAreContiguousAcrossYearEnd() {
        PeriodCalendar calendar = PeriodCalendar.fromWeeks(List.of("2026-W02", "2025-W52"));

        assertEquals(1, calendar.periodOf("2025-W52"));
        assertEquals(2, calendar.periodOf("2026-W01"));
        assertEquals(3, calendar.periodOf("2026-W02"));
        assertEquals("2026-W01", calendar.labelOf(2));
        assertEquals(LocalDate.of(2025, 12, 22), calendar.getAnchorMonday());
    }

    @Test
    void datesMapToTheirWeek() {
        PeriodCalendar calendar = new PeriodCalendar(LocalDate.of(2026, 1, 1));
        assertEquals(LocalDate.of(2025, 12, 29), calendar.getAnchorMonday());
        assertEquals(1, calendar.periodOf(LocalDate.of(2026, 1, 4)));
        assertEquals(2, calendar.periodOf(LocalDate.of(2026, 1, 5)));
        assertThrows(InvalidInputException.class, () -> calendar.periodOf(LocalDate.of(2025, 12, 28)));
    }

    @Test
    void rejectsMalformedLabels() {
        assertThrows(InvalidInputException.class, () -> PeriodCalendar.mondayOf("2026-W00"));
        assertThrows(InvalidInputException.class, () -> PeriodCalendar.mondayOf("2025-W53"));
        assertThrows(InvalidInputException.class, () -> PeriodCalendar.mondayOf("W01-2026"));
        assertThrows(InvalidInputException.class, () -> PeriodCalendar.mondayOf(null));
        assertThrows(InvalidInputException.class, () -> PeriodCalendar.fromWeeks(List.of()));
        assertEquals(LocalDate.of(2026, 12, 28), PeriodCalendar.mondayOf("2026-W53"));
    }
}
