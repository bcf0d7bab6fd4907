package io.github.riemr.staffing.optimization.grid;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import io.github.riemr.staffing.application.util.SlotTimeUtils;
import io.github.riemr.staffing.domain.model.DemandForecast;
import io.github.riemr.staffing.domain.model.Employee;
import io.github.riemr.staffing.domain.model.HourlyDemand;
import io.github.riemr.staffing.domain.model.SchedulerConfig;
import io.github.riemr.staffing.domain.model.SchedulerInput;
import io.github.riemr.staffing.domain.model.ShiftDefinition;
import io.github.riemr.staffing.domain.model.TimeRange;
import io.github.riemr.staffing.exception.SchedulerConfigException;
import lombok.extern.slf4j.Slf4j;

/**
 * 設定と需要予測から時間軸を組み立てる。
 * <ul>
 *   <li>対象曜日: いずれかの従業員が勤務可能、または需要がある曜日</li>
 *   <li>均等枠モード: 1 日を slotLenHour 刻みで分割（最終枠は 24:00 で打ち切り）</li>
 *   <li>固定シフトモード: 設定されたシフト枠をそのまま使用</li>
 * </ul>
 * 時間単位の需要は枠との重なり分に比例して配分する。
 */
@Slf4j
public class TimeGridBuilder {

    public TimeGrid build(SchedulerInput input, DemandForecast demand) {
        SchedulerConfig config = input.getConfig();
        int slotMinutes = config.getSlotMinutes();
        int slotsPerDay = SlotTimeUtils.slotsPerDay(slotMinutes);
        if (config.getMinShiftLengthSlots() > slotsPerDay) {
            throw new SchedulerConfigException("minShiftLengthSlots " + config.getMinShiftLengthSlots()
                    + " exceeds the " + slotsPerDay + " slots of a day");
        }
        List<ShiftDefinition> shifts = config.isFixedShifts() ? validateShifts(config, slotMinutes) : List.of();

        Map<DayOfWeek, List<TimeWindow>> windowsByDay = new EnumMap<>(DayOfWeek.class);
        for (DayOfWeek day : activeDays(input, demand)) {
            windowsByDay.put(day, config.isFixedShifts()
                    ? shiftWindows(day, shifts)
                    : uniformWindows(day, slotMinutes));
        }

        Map<TimeWindow, Long> demandCenti = new HashMap<>();
        Set<TimeWindow> open = new HashSet<>();
        for (Map.Entry<DayOfWeek, List<TimeWindow>> e : windowsByDay.entrySet()) {
            allocateDemand(e.getKey(), e.getValue(), demand, demandCenti);
            markOpen(config, e.getKey(), e.getValue(), demandCenti, open);
        }
        log.debug("Time grid built: days={}, windows/day={}, open windows={}",
                windowsByDay.keySet(), config.isFixedShifts() ? shifts.size() : slotsPerDay, open.size());
        return new TimeGrid(slotMinutes, config.isFixedShifts(), windowsByDay, demandCenti, open);
    }

    private Set<DayOfWeek> activeDays(SchedulerInput input, DemandForecast demand) {
        Set<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
        for (Employee e : input.getEmployees()) {
            days.addAll(e.getAvailableDays());
        }
        days.addAll(demand.demandDays());
        return days;
    }

    private List<ShiftDefinition> validateShifts(SchedulerConfig config, int slotMinutes) {
        if (config.getShiftWindows().isEmpty()) {
            throw new SchedulerConfigException("fixedShifts requires at least one shift window");
        }
        List<ShiftDefinition> sorted = new ArrayList<>(config.getShiftWindows());
        sorted.sort(Comparator.comparingInt(s -> s.range().startMinute()));
        Set<String> names = new HashSet<>();
        ShiftDefinition prev = null;
        for (ShiftDefinition s : sorted) {
            TimeRange r = s.range();
            if (!names.add(s.name())) {
                throw SchedulerConfigException.of("Shift", s.name(), "declared twice");
            }
            if (!SlotTimeUtils.isAligned(r.startMinute(), slotMinutes) || !SlotTimeUtils.isAligned(r.endMinute(), slotMinutes)) {
                throw SchedulerConfigException.of("Shift", s.name(), r + " is not aligned to " + slotMinutes + "-minute slots");
            }
            if (SlotTimeUtils.slotsSpanned(r.durationMinutes(), slotMinutes) < config.getMinShiftLengthSlots()) {
                throw SchedulerConfigException.of("Shift", s.name(), "shorter than minShiftLengthSlots " + config.getMinShiftLengthSlots());
            }
            if (prev != null && prev.range().endMinute() > r.startMinute()) {
                throw SchedulerConfigException.of("Shift", s.name(), "overlaps shift " + prev.name());
            }
            prev = s;
        }
        return Collections.unmodifiableList(sorted);
    }

    private List<TimeWindow> uniformWindows(DayOfWeek day, int slotMinutes) {
        List<TimeWindow> windows = new ArrayList<>();
        int index = 0;
        for (int start = 0; start < SlotTimeUtils.MINUTES_PER_DAY; start += slotMinutes) {
            int end = Math.min(SlotTimeUtils.MINUTES_PER_DAY, start + slotMinutes);
            String label = SlotTimeUtils.formatMinuteOfDay(start) + "-" + SlotTimeUtils.formatMinuteOfDay(end);
            windows.add(new TimeWindow(day, index++, label, start, end));
        }
        return Collections.unmodifiableList(windows);
    }

    private List<TimeWindow> shiftWindows(DayOfWeek day, List<ShiftDefinition> shifts) {
        List<TimeWindow> windows = new ArrayList<>();
        int index = 0;
        for (ShiftDefinition s : shifts) {
            windows.add(new TimeWindow(day, index++, s.name(), s.range().startMinute(), s.range().endMinute()));
        }
        return Collections.unmodifiableList(windows);
    }

    private void allocateDemand(DayOfWeek day, List<TimeWindow> windows, DemandForecast demand, Map<TimeWindow, Long> out) {
        Map<TimeWindow, Double> items = new HashMap<>();
        double total = 0;
        for (Map.Entry<Integer, HourlyDemand> h : demand.hoursOf(day).entrySet()) {
            int count = h.getValue().itemCount();
            if (count == 0) continue;
            total += count;
            int from = h.getKey() * 60;
            for (TimeWindow w : windows) {
                int overlap = w.overlapMinutes(from, from + 60);
                if (overlap > 0) {
                    items.merge(w, count * overlap / 60.0, Double::sum);
                }
            }
        }
        double allocated = 0;
        for (Map.Entry<TimeWindow, Double> e : items.entrySet()) {
            long centi = Math.round(e.getValue() * 100.0);
            if (centi > 0) {
                out.put(e.getKey(), centi);
                allocated += e.getValue();
            }
        }
        if (total - allocated > 1e-6) {
            log.warn("{} items of demand on {} fall outside every shift window and are ignored", total - allocated, day);
        }
    }

    private void markOpen(SchedulerConfig config, DayOfWeek day, List<TimeWindow> windows,
                          Map<TimeWindow, Long> demandCenti, Set<TimeWindow> open) {
        if (!config.hasOperatingHours()) {
            for (TimeWindow w : windows) {
                if (demandCenti.getOrDefault(w, 0L) > 0) {
                    open.add(w);
                }
            }
            return;
        }
        TimeRange hours = config.getOperatingHours().get(day);
        long dropped = 0;
        for (TimeWindow w : windows) {
            if (hours != null && hours.overlapMinutes(w.startMinute(), w.endMinute()) > 0) {
                open.add(w);
            } else {
                Long removed = demandCenti.remove(w);
                if (removed != null) {
                    dropped += removed;
                }
            }
        }
        if (dropped > 0) {
            log.warn("Demand of {} items on {} falls outside operating hours and is dropped", dropped / 100.0, day);
        }
    }
}
