package com.pharma.signal.model;

import com.pharma.signal.exception.MalformedSeriesException;

import java.time.LocalDate;

/**
 * Calendar-quarter arithmetic. A period is identified by the first day of its
 * quarter (Jan 1, Apr 1, Jul 1 or Oct 1).
 */
public final class Quarters {

    private Quarters() {}

    public static boolean isQuarterStart(LocalDate date) {
        return date != null
                && date.getDayOfMonth() == 1
                && (date.getMonthValue() - 1) % 3 == 0;
    }

    /**
     * Fails fast on a period that is not a quarter boundary. Misaligned periods
     * are never snapped to the nearest quarter.
     */
    public static LocalDate requireQuarterStart(LocalDate date, String context) {
        if (date == null) {
            throw new MalformedSeriesException(context + ": period start is missing");
        }
        if (!isQuarterStart(date)) {
            throw new MalformedSeriesException(String.format(
                    "%s: period start %s is not a calendar quarter boundary", context, date));
        }
        return date;
    }

    public static LocalDate plus(LocalDate quarterStart, long quarters) {
        return quarterStart.plusMonths(3 * quarters);
    }

    // Continuous quarter index, used as the time axis for model fitting
    public static long ordinal(LocalDate quarterStart) {
        return quarterStart.getYear() * 4L + quarterOfYear(quarterStart);
    }

    public static long between(LocalDate from, LocalDate to) {
        return ordinal(to) - ordinal(from);
    }

    /** Zero-based quarter of year: 0 for Q1 through 3 for Q4. */
    public static int quarterOfYear(LocalDate date) {
        return (date.getMonthValue() - 1) / 3;
    }

    public static String label(LocalDate quarterStart) {
        return quarterStart.getYear() + "Q" + (quarterOfYear(quarterStart) + 1);
    }

    /** Parses labels such as {@code 2023Q4} into the quarter's first day. */
    public static LocalDate parseLabel(String label) {
        if (label == null || !label.matches("\\d{4}Q[1-4]")) {
            throw new IllegalArgumentException("Invalid quarter label: " + label);
        }
        int year = Integer.parseInt(label.substring(0, 4));
        int quarter = Integer.parseInt(label.substring(5));
        return LocalDate.of(year, (quarter - 1) * 3 + 1, 1);
    }
}
