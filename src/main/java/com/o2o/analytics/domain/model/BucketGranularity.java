package com.o2o.analytics.domain.model;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;

/**
 * Time bucket a segment covers. A bucket is identified by its first day.
 */
public enum BucketGranularity {

    DAY {
        @Override
        public LocalDate bucketOf(LocalDate date) {
            return date;
        }

        @Override
        public LocalDate lastDayOf(LocalDate bucket) {
            return bucket;
        }
    },

    /**
     * ISO week, starting on Monday.
     */
    WEEK {
        @Override
        public LocalDate bucketOf(LocalDate date) {
            return date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
        }

        @Override
        public LocalDate lastDayOf(LocalDate bucket) {
            return bucket.plusDays(6);
        }
    },

    MONTH {
        @Override
        public LocalDate bucketOf(LocalDate date) {
            return date.withDayOfMonth(1);
        }

        @Override
        public LocalDate lastDayOf(LocalDate bucket) {
            return bucket.with(TemporalAdjusters.lastDayOfMonth());
        }
    };

    public abstract LocalDate bucketOf(LocalDate date);

    public abstract LocalDate lastDayOf(LocalDate bucket);

    /**
     * Widens a window so it starts and ends on bucket boundaries.
     */
    public TimeWindow align(TimeWindow window) {
        return TimeWindow.of(bucketOf(window.getStart()), lastDayOf(bucketOf(window.getEnd())));
    }

    /**
     * The full date range of a single bucket.
     */
    public TimeWindow windowOf(LocalDate bucket) {
        LocalDate start = bucketOf(bucket);
        return TimeWindow.of(start, lastDayOf(start));
    }
}
