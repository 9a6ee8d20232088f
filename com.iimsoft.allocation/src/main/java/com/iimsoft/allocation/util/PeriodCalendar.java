package com.iimsoft.allocation.util;

import com.iimsoft.allocation.domain.InvalidInputException;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.time.temporal.IsoFields;
import java.time.temporal.TemporalAdjusters;
import java.util.Collection;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * ISO 周标签（如 2026-W03）与连续周期序号之间的映射。
 * <p>
 * 序号从最早的一周开始记为 1，跨年连续递增，中间缺失的周也占一个序号。
 */
public class PeriodCalendar {

    private static final Pattern ISO_WEEK = Pattern.compile("(\\d{4})-W(\\d{2})");

    // 第 1 周期所在周的周一
    private final LocalDate anchorMonday;

    public PeriodCalendar(LocalDate anchorMonday) {
        this.anchorMonday = anchorMonday.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
    }

    /**
     * Calendar whose period 1 is the earliest of the given week labels.
     */
    public static PeriodCalendar fromWeeks(Collection<String> weekLabels) {
        LocalDate earliest = null;
        for (String label : weekLabels) {
            LocalDate monday = mondayOf(label);
            if (earliest == null || monday.isBefore(earliest)) {
                earliest = monday;
            }
        }
        if (earliest == null) {
            throw new InvalidInputException("no week labels to build a calendar from");
        }
        return new PeriodCalendar(earliest);
    }

    public static String weekOf(LocalDate date) {
        int year = date.get(IsoFields.WEEK_BASED_YEAR);
        int week = date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR);
        return String.format("%d-W%02d", year, week);
    }

    public static LocalDate mondayOf(String weekLabel) {
        if (weekLabel == null) {
            throw new InvalidInputException("week label is missing");
        }
        Matcher m = ISO_WEEK.matcher(weekLabel.trim());
        if (!m.matches()) {
            throw new InvalidInputException("malformed ISO week label: " + weekLabel);
        }
        int year = Integer.parseInt(m.group(1));
        int week = Integer.parseInt(m.group(2));
        // 1 月 4 日总在该年的第 1 个 ISO 周内
        LocalDate jan4 = LocalDate.of(year, 1, 4);
        long weeksInYear = jan4.range(IsoFields.WEEK_OF_WEEK_BASED_YEAR).getMaximum();
        if (week < 1 || week > weeksInYear) {
            throw new InvalidInputException("week out of range for " + year + ": " + weekLabel);
        }
        return jan4.with(IsoFields.WEEK_OF_WEEK_BASED_YEAR, week).with(DayOfWeek.MONDAY);
    }

    public LocalDate getAnchorMonday() { return anchorMonday; }

    public int periodOf(String weekLabel) {
        return periodOf(mondayOf(weekLabel));
    }

    public int periodOf(LocalDate date) {
        long weeks = ChronoUnit.WEEKS.between(anchorMonday,
                date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY)));
        if (weeks < 0) {
            throw new InvalidInputException(date + " is before the first period starting " + anchorMonday);
        }
        return Math.toIntExact(weeks + 1);
    }

    public String labelOf(int period) {
        if (period < 1) {
            throw new IllegalArgumentException("period must be >= 1: " + period);
        }
        return weekOf(anchorMonday.plusWeeks(period - 1L));
    }
}
