package io.github.riemr.staffing.domain.model;

import java.time.DayOfWeek;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import io.github.riemr.staffing.application.util.SlotTimeUtils;
import io.github.riemr.staffing.exception.SchedulerConfigException;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * 組織全体のシフトルール。
 * <ul>
 *   <li>slotLenHour: 時間軸の刻み（分単位で割り切れる必要がある）</li>
 *   <li>minRestSlots: 勤務間に必要な空き枠数（日をまたぐ場合も含む）</li>
 *   <li>minShiftLengthSlots: 連続勤務の最短枠数</li>
 *   <li>meetAllDemand: 需要を必須制約として扱うか</li>
 *   <li>fixedShifts / shiftWindows: 固定シフトモードとその枠</li>
 *   <li>operatingHours: 営業時間（未設定なら需要のある枠が営業枠）</li>
 * </ul>
 */
@Value
public class SchedulerConfig {

    double slotLenHour;
    int minRestSlots;
    int minShiftLengthSlots;
    boolean meetAllDemand;
    boolean fixedShifts;
    List<ShiftDefinition> shiftWindows;
    Map<DayOfWeek, TimeRange> operatingHours;

    @Builder
    public SchedulerConfig(Double slotLenHour,
                           Integer minRestSlots,
                           Integer minShiftLengthSlots,
                           boolean meetAllDemand,
                           boolean fixedShifts,
                           @Singular("shiftWindow") List<ShiftDefinition> shiftWindows,
                           @Singular("operatingHour") Map<DayOfWeek, TimeRange> operatingHours) {
        double len = slotLenHour == null ? 1.0 : slotLenHour;
        if (!(len > 0) || len > 24.0) {
            throw new SchedulerConfigException("slotLenHour must be in (0, 24] but was " + len);
        }
        double minutes = len * 60.0;
        if (Math.abs(minutes - Math.rint(minutes)) > 1e-9) {
            throw new SchedulerConfigException("slotLenHour must be a whole number of minutes but was " + len);
        }
        int rest = minRestSlots == null ? 0 : minRestSlots;
        if (rest < 0) {
            throw new SchedulerConfigException("minRestSlots must be >= 0");
        }
        int minLength = minShiftLengthSlots == null ? 1 : minShiftLengthSlots;
        if (minLength < 1) {
            throw new SchedulerConfigException("minShiftLengthSlots must be >= 1");
        }
        this.slotLenHour = len;
        this.minRestSlots = rest;
        this.minShiftLengthSlots = minLength;
        this.meetAllDemand = meetAllDemand;
        this.fixedShifts = fixedShifts;
        this.shiftWindows = shiftWindows == null ? List.of() : List.copyOf(shiftWindows);
        Map<DayOfWeek, TimeRange> hours = new EnumMap<>(DayOfWeek.class);
        if (operatingHours != null) {
            hours.putAll(operatingHours);
        }
        this.operatingHours = Collections.unmodifiableMap(hours);
    }

    public int getSlotMinutes() {
        return (int) Math.round(slotLenHour * 60.0);
    }

    public int getSlotsPerDay() {
        return SlotTimeUtils.slotsPerDay(getSlotMinutes());
    }

    public boolean hasOperatingHours() {
        return !operatingHours.isEmpty();
    }
}
