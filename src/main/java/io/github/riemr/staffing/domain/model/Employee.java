package io.github.riemr.staffing.domain.model;

import java.time.DayOfWeek;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import io.github.riemr.staffing.exception.SchedulerConfigException;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * 従業員。勤務可能日・時間帯、希望日・時間帯、時給、週上限時間などを保持する。
 * <p>勤務可能日に時間帯の指定がない場合は終日勤務可能とみなす。
 * 希望日・希望時間帯が一切ない従業員には希望乖離ペナルティを課さない。</p>
 */
@Value
public class Employee {

    private static final double DEFAULT_MAX_HOURS_PER_WEEK = 40.0;
    private static final int DEFAULT_MAX_CONSEC_SLOTS = 8;

    String id;
    Set<String> roleIds;
    Set<DayOfWeek> availableDays;
    Set<DayOfWeek> preferredDays;
    Map<DayOfWeek, TimeRange> availableHours;
    Map<DayOfWeek, TimeRange> preferredHours;
    double hourlyWage;
    double maxHoursPerWeek;
    int maxConsecSlots;
    double prefHours;

    @Builder
    public Employee(String id,
                    @Singular("roleId") Set<String> roleIds,
                    @Singular("availableDay") Set<DayOfWeek> availableDays,
                    @Singular("preferredDay") Set<DayOfWeek> preferredDays,
                    @Singular("availableHour") Map<DayOfWeek, TimeRange> availableHours,
                    @Singular("preferredHour") Map<DayOfWeek, TimeRange> preferredHours,
                    Double hourlyWage,
                    Double maxHoursPerWeek,
                    Integer maxConsecSlots,
                    Double prefHours) {
        if (id == null || id.isBlank()) {
            throw new SchedulerConfigException("Employee id is required");
        }
        if (roleIds == null || roleIds.isEmpty()) {
            throw SchedulerConfigException.of("Employee", id, "at least one eligible role is required");
        }
        if (hourlyWage == null || !(hourlyWage > 0)) {
            throw SchedulerConfigException.of("Employee", id, "hourlyWage must be > 0");
        }
        double maxHours = maxHoursPerWeek == null ? DEFAULT_MAX_HOURS_PER_WEEK : maxHoursPerWeek;
        if (maxHours < 0) {
            throw SchedulerConfigException.of("Employee", id, "maxHoursPerWeek must be >= 0");
        }
        int maxConsec = maxConsecSlots == null ? DEFAULT_MAX_CONSEC_SLOTS : maxConsecSlots;
        if (maxConsec < 1) {
            throw SchedulerConfigException.of("Employee", id, "maxConsecSlots must be >= 1");
        }
        double pref = prefHours == null ? 0.0 : prefHours;
        if (pref < 0) {
            throw SchedulerConfigException.of("Employee", id, "prefHours must be >= 0");
        }

        Set<DayOfWeek> available = copyDays(availableDays);
        Set<DayOfWeek> preferred = copyDays(preferredDays);
        Map<DayOfWeek, TimeRange> availHours = copyHours(availableHours);
        Map<DayOfWeek, TimeRange> prefHoursByDay = copyHours(preferredHours);

        if (!available.containsAll(preferred)) {
            throw SchedulerConfigException.of("Employee", id, "preferredDays must be a subset of availableDays");
        }
        for (DayOfWeek day : availHours.keySet()) {
            if (!available.contains(day)) {
                throw SchedulerConfigException.of("Employee", id, "availableHours given for unavailable day " + day);
            }
        }
        for (Map.Entry<DayOfWeek, TimeRange> e : prefHoursByDay.entrySet()) {
            if (!available.contains(e.getKey())) {
                throw SchedulerConfigException.of("Employee", id, "preferredHours given for unavailable day " + e.getKey());
            }
            TimeRange avail = availHours.getOrDefault(e.getKey(), TimeRange.FULL_DAY);
            if (!avail.contains(e.getValue())) {
                throw SchedulerConfigException.of("Employee", id,
                        "preferredHours " + e.getValue() + " not within availableHours " + avail + " on " + e.getKey());
            }
        }

        this.id = id;
        this.roleIds = Collections.unmodifiableSet(new LinkedHashSet<>(roleIds));
        this.availableDays = Collections.unmodifiableSet(available);
        this.preferredDays = Collections.unmodifiableSet(preferred);
        this.availableHours = Collections.unmodifiableMap(availHours);
        this.preferredHours = Collections.unmodifiableMap(prefHoursByDay);
        this.hourlyWage = hourlyWage;
        this.maxHoursPerWeek = maxHours;
        this.maxConsecSlots = maxConsec;
        this.prefHours = pref;
    }

    public boolean canPerform(String roleId) {
        return roleIds.contains(roleId);
    }

    /** 指定日の勤務可能時間帯。勤務不可日は null。 */
    public TimeRange availabilityOn(DayOfWeek day) {
        if (!availableDays.contains(day)) {
            return null;
        }
        return availableHours.getOrDefault(day, TimeRange.FULL_DAY);
    }

    public boolean isAvailableFor(DayOfWeek day, int fromMinute, int toMinute) {
        TimeRange range = availabilityOn(day);
        return range != null && range.contains(fromMinute, toMinute);
    }

    public boolean hasPreferences() {
        return !preferredDays.isEmpty() || !preferredHours.isEmpty();
    }

    /**
     * 希望日・希望時間帯に収まる勤務かどうか。希望を持たない従業員は常に true。
     */
    public boolean isPreferred(DayOfWeek day, int fromMinute, int toMinute) {
        if (!hasPreferences()) {
            return true;
        }
        if (!preferredDays.contains(day) && !preferredHours.containsKey(day)) {
            return false;
        }
        TimeRange range = preferredHours.get(day);
        return range == null || range.contains(fromMinute, toMinute);
    }

    /** 週あたりの勤務可能時間（分）。週上限時間は考慮しない。 */
    public int weeklyAvailableMinutes() {
        int total = 0;
        for (DayOfWeek day : availableDays) {
            total += availabilityOn(day).durationMinutes();
        }
        return total;
    }

    private static Set<DayOfWeek> copyDays(Set<DayOfWeek> days) {
        return days == null || days.isEmpty() ? EnumSet.noneOf(DayOfWeek.class) : EnumSet.copyOf(days);
    }

    private static Map<DayOfWeek, TimeRange> copyHours(Map<DayOfWeek, TimeRange> hours) {
        Map<DayOfWeek, TimeRange> copy = new EnumMap<>(DayOfWeek.class);
        if (hours != null) {
            copy.putAll(hours);
        }
        return copy;
    }
}
