package io.github.riemr.staffing.domain.model;

import java.time.DayOfWeek;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;

import io.github.riemr.staffing.exception.SchedulerConfigException;

/**
 * 曜日×時間ごとの需要予測。予測モデル側で生成された値をそのまま受け取る。
 */
public final class DemandForecast {

    private static final DemandForecast EMPTY = new DemandForecast(new EnumMap<>(DayOfWeek.class));

    private final Map<DayOfWeek, NavigableMap<Integer, HourlyDemand>> byDay;

    private DemandForecast(Map<DayOfWeek, NavigableMap<Integer, HourlyDemand>> byDay) {
        this.byDay = byDay;
    }

    public static DemandForecast empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public HourlyDemand at(DayOfWeek day, int hour) {
        NavigableMap<Integer, HourlyDemand> hours = byDay.get(day);
        if (hours == null) {
            return HourlyDemand.NONE;
        }
        return hours.getOrDefault(hour, HourlyDemand.NONE);
    }

    public int itemsAt(DayOfWeek day, int hour) {
        return at(day, hour).itemCount();
    }

    /** item_count が 1 以上の時間を持つ曜日。 */
    public Set<DayOfWeek> demandDays() {
        Set<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
        byDay.forEach((day, hours) -> {
            if (hours.values().stream().anyMatch(d -> d.itemCount() > 0)) {
                days.add(day);
            }
        });
        return days;
    }

    public Map<Integer, HourlyDemand> hoursOf(DayOfWeek day) {
        NavigableMap<Integer, HourlyDemand> hours = byDay.get(day);
        return hours == null ? Map.of() : Collections.unmodifiableMap(hours);
    }

    public long totalItems() {
        return byDay.values().stream()
                .flatMap(h -> h.values().stream())
                .mapToLong(HourlyDemand::itemCount)
                .sum();
    }

    public boolean isEmpty() {
        return totalItems() == 0;
    }

    public static final class Builder {
        private final Map<DayOfWeek, NavigableMap<Integer, HourlyDemand>> byDay = new EnumMap<>(DayOfWeek.class);

        public Builder hour(DayOfWeek day, int hour, int orderCount, int itemCount) {
            if (day == null) {
                throw new SchedulerConfigException("Demand day is required");
            }
            if (hour < 0 || hour > 23) {
                throw new SchedulerConfigException("Demand hour must be 0..23 but was " + hour);
            }
            byDay.computeIfAbsent(day, d -> new TreeMap<>()).put(hour, new HourlyDemand(orderCount, itemCount));
            return this;
        }

        public Builder items(DayOfWeek day, int hour, int itemCount) {
            return hour(day, hour, 0, itemCount);
        }

        public DemandForecast build() {
            Map<DayOfWeek, NavigableMap<Integer, HourlyDemand>> copy = new EnumMap<>(DayOfWeek.class);
            byDay.forEach((day, hours) -> copy.put(day, Collections.unmodifiableNavigableMap(new TreeMap<>(hours))));
            return new DemandForecast(copy);
        }
    }
}
