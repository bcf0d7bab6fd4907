package io.github.riemr.staffing.optimization.grid;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

import io.github.riemr.staffing.application.util.SlotTimeUtils;

/**
 * 求解対象の時間軸。曜日ごとの枠、枠ごとの需要（1/100 アイテム単位）と営業枠フラグを持つ。
 */
public final class TimeGrid {

    private final int slotMinutes;
    private final boolean fixedShifts;
    private final Map<DayOfWeek, List<TimeWindow>> windowsByDay;
    private final Map<TimeWindow, Long> demandCenti;
    private final Set<TimeWindow> openWindows;

    TimeGrid(int slotMinutes,
             boolean fixedShifts,
             Map<DayOfWeek, List<TimeWindow>> windowsByDay,
             Map<TimeWindow, Long> demandCenti,
             Set<TimeWindow> openWindows) {
        this.slotMinutes = slotMinutes;
        this.fixedShifts = fixedShifts;
        this.windowsByDay = windowsByDay;
        this.demandCenti = demandCenti;
        this.openWindows = openWindows;
    }

    public int getSlotMinutes() {
        return slotMinutes;
    }

    public boolean isFixedShifts() {
        return fixedShifts;
    }

    public List<DayOfWeek> getDays() {
        return List.copyOf(windowsByDay.keySet());
    }

    public List<TimeWindow> windowsOn(DayOfWeek day) {
        return windowsByDay.getOrDefault(day, List.of());
    }

    public List<TimeWindow> getWindows() {
        List<TimeWindow> all = new ArrayList<>();
        windowsByDay.values().forEach(all::addAll);
        return Collections.unmodifiableList(all);
    }

    public boolean isEmpty() {
        return windowsByDay.isEmpty();
    }

    public long demandCenti(TimeWindow window) {
        return demandCenti.getOrDefault(window, 0L);
    }

    public double demandItems(TimeWindow window) {
        return demandCenti(window) / 100.0;
    }

    public long totalDemandCenti() {
        return demandCenti.values().stream().mapToLong(Long::longValue).sum();
    }

    public boolean isOpen(TimeWindow window) {
        return openWindows.contains(window);
    }

    public List<TimeWindow> getOpenWindows() {
        return getWindows().stream().filter(openWindows::contains).toList();
    }

    /** 枠が占めるスロット数（端数切り上げ）。均等枠では常に 1。 */
    public int slotsOf(TimeWindow window) {
        return SlotTimeUtils.slotsSpanned(window.durationMinutes(), slotMinutes);
    }

    /**
     * 連続する曜日の枠を時刻順につないだ列。間に時間軸外の曜日があれば別の列になる。
     * 日付をまたぐ連続勤務の判定に使う。
     */
    public List<List<TimeWindow>> continuousSpans() {
        List<List<TimeWindow>> spans = new ArrayList<>();
        List<TimeWindow> current = new ArrayList<>();
        for (DayOfWeek day : windowsByDay.keySet()) {
            current.addAll(windowsOn(day));
            if (nextDay(day) == null) {
                spans.add(Collections.unmodifiableList(current));
                current = new ArrayList<>();
            }
        }
        return spans;
    }

    /** 翌曜日が同じ週の中で時間軸に含まれていればそれを返す。 */
    public DayOfWeek nextDay(DayOfWeek day) {
        if (day == DayOfWeek.SUNDAY) {
            return null;
        }
        DayOfWeek next = day.plus(1);
        return windowsByDay.containsKey(next) ? next : null;
    }
}
