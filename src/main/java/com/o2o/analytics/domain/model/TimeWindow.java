package com.o2o.analytics.domain.model;

import lombok.Value;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Inclusive date range.
 */
@Value
public class TimeWindow {

    LocalDate start;
    LocalDate end;

    public static TimeWindow of(LocalDate start, LocalDate end) {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Window bounds are required");
        }
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Window end " + end + " is before start " + start);
        }
        return new TimeWindow(start, end);
    }

    public static TimeWindow day(LocalDate date) {
        return of(date, date);
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(start) && !date.isAfter(end);
    }

    public List<LocalDate> dates() {
        List<LocalDate> dates = new ArrayList<>();
        for (LocalDate d = start; !d.isAfter(end); d = d.plusDays(1)) {
            dates.add(d);
        }
        return dates;
    }

    public TimeWindow span(TimeWindow other) {
        LocalDate s = start.isBefore(other.start) ? start : other.start;
        LocalDate e = end.isAfter(other.end) ? end : other.end;
        return new TimeWindow(s, e);
    }

    @Override
    public String toString() {
        return start + ".." + end;
    }
}
