package io.github.riemr.staffing.domain.model;

import io.github.riemr.staffing.application.util.SlotTimeUtils;
import io.github.riemr.staffing.exception.SchedulerConfigException;

/**
 * 1 日の中の半開区間 [start, end)。分単位で保持し、終端は 24:00 (1440) まで許容する。
 */
public record TimeRange(int startMinute, int endMinute) {

    public static final TimeRange FULL_DAY = new TimeRange(0, SlotTimeUtils.MINUTES_PER_DAY);

    public TimeRange {
        if (startMinute < 0 || endMinute > SlotTimeUtils.MINUTES_PER_DAY || startMinute >= endMinute) {
            throw new SchedulerConfigException("Invalid time range: " + startMinute + "-" + endMinute);
        }
    }

    public static TimeRange of(String from, String to) {
        return new TimeRange(SlotTimeUtils.parseMinuteOfDay(from), SlotTimeUtils.parseMinuteOfDay(to));
    }

    public static TimeRange ofHours(int fromHour, int toHour) {
        return new TimeRange(fromHour * 60, toHour * 60);
    }

    public int durationMinutes() {
        return endMinute - startMinute;
    }

    public boolean contains(int from, int to) {
        return startMinute <= from && to <= endMinute;
    }

    public boolean contains(TimeRange other) {
        return contains(other.startMinute, other.endMinute);
    }

    public int overlapMinutes(int from, int to) {
        return Math.max(0, Math.min(endMinute, to) - Math.max(startMinute, from));
    }

    @Override
    public String toString() {
        return SlotTimeUtils.formatMinuteOfDay(startMinute) + "-" + SlotTimeUtils.formatMinuteOfDay(endMinute);
    }
}
