package io.github.riemr.staffing.optimization.solution;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import io.github.riemr.staffing.optimization.grid.TimeWindow;

/**
 * 曜日 → (枠, 勤務者) の一覧。勤務者のいる枠だけを保持する。
 */
public final class Schedule {

    private final Map<DayOfWeek, List<ScheduledWindow>> byDay;

    public Schedule(Map<DayOfWeek, List<ScheduledWindow>> byDay) {
        Map<DayOfWeek, List<ScheduledWindow>> copy = new EnumMap<>(DayOfWeek.class);
        byDay.forEach((day, windows) -> {
            if (!windows.isEmpty()) {
                copy.put(day, List.copyOf(windows));
            }
        });
        this.byDay = Collections.unmodifiableMap(copy);
    }

    public static Schedule empty() {
        return new Schedule(Map.of());
    }

    public Map<DayOfWeek, List<ScheduledWindow>> getDays() {
        return byDay;
    }

    public List<ScheduledWindow> windowsOn(DayOfWeek day) {
        return byDay.getOrDefault(day, List.of());
    }

    public boolean isEmpty() {
        return byDay.isEmpty();
    }

    public List<ScheduledWindow> allWindows() {
        List<ScheduledWindow> all = new ArrayList<>();
        byDay.values().forEach(all::addAll);
        return all;
    }

    public List<TimeWindow> windowsOf(String employeeId) {
        List<TimeWindow> result = new ArrayList<>();
        for (ScheduledWindow sw : allWindows()) {
            if (sw.employeeIds().contains(employeeId)) {
                result.add(sw.window());
            }
        }
        return result;
    }

    public double hoursOf(String employeeId) {
        return windowsOf(employeeId).stream().mapToInt(TimeWindow::durationMinutes).sum() / 60.0;
    }

    public double hoursOf(String employeeId, String roleId) {
        int minutes = 0;
        for (ScheduledWindow sw : allWindows()) {
            for (StaffAssignment a : sw.staff()) {
                if (a.employeeId().equals(employeeId) && a.roleId().equals(roleId)) {
                    minutes += sw.window().durationMinutes();
                }
            }
        }
        return minutes / 60.0;
    }

    public boolean isAssigned(String employeeId, DayOfWeek day, int startMinute) {
        return windowsOn(day).stream()
                .anyMatch(sw -> sw.window().startMinute() == startMinute && sw.employeeIds().contains(employeeId));
    }

    public int totalAssignments() {
        return allWindows().stream().mapToInt(sw -> sw.staff().size()).sum();
    }
}
