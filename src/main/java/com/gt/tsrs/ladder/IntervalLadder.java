package com.gt.tsrs.ladder;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Fixed, strictly increasing sequence of review gaps. Position 0 is the least practiced rung and
 * position {@code size() - 1} the most practiced one.
 */
public class IntervalLadder {

    public static final List<Integer> DEFAULT_INTERVAL_DAYS = List.of(1, 3, 5, 11, 25, 44, 88);

    private final List<Duration> intervals;

    public IntervalLadder(List<Duration> intervals) {
        if (intervals == null || intervals.isEmpty()) {
            throw new IllegalArgumentException("Interval ladder must contain at least one interval");
        }

        Duration previous = Duration.ZERO;
        for (Duration interval : intervals) {
            if (interval == null || interval.compareTo(previous) <= 0) {
                throw new IllegalArgumentException("Interval ladder must be positive and strictly increasing: " + intervals);
            }
            previous = interval;
        }

        this.intervals = List.copyOf(intervals);
    }

    public static IntervalLadder ofDays(List<Integer> days) {
        if (days == null) {
            throw new IllegalArgumentException("Interval ladder must contain at least one interval");
        }

        return new IntervalLadder(days.stream().map(Duration::ofDays).collect(Collectors.toUnmodifiableList()));
    }

    public static IntervalLadder defaultLadder() {
        return ofDays(DEFAULT_INTERVAL_DAYS);
    }

    public int size() {
        return intervals.size();
    }

    public int maxIndex() {
        return intervals.size() - 1;
    }

    public Duration getInterval(int index) {
        if (index < 0 || index > maxIndex()) {
            throw new IndexOutOfBoundsException("Ladder index " + index + " is outside [0, " + maxIndex() + "]");
        }

        return intervals.get(index);
    }

    public int clampIndex(int index) {
        return Math.max(0, Math.min(index, maxIndex()));
    }

    public Instant nextReviewTime(Instant lastReviewTime, int index) {
        return lastReviewTime.plus(getInterval(index));
    }

    public List<Duration> getIntervals() {
        return intervals;
    }

    @Override
    public String toString() {
        return intervals.stream().map(interval -> String.valueOf(interval.toDays())).collect(Collectors.joining(",", "[", "]"));
    }
}
