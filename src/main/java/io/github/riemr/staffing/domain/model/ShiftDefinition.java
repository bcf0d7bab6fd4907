package io.github.riemr.staffing.domain.model;

import io.github.riemr.staffing.exception.SchedulerConfigException;

/** 固定シフトモードで使用する名前付きシフト枠。 */
public record ShiftDefinition(String name, TimeRange range) {

    public ShiftDefinition {
        if (name == null || name.isBlank()) {
            throw new SchedulerConfigException("Shift name is required");
        }
        if (range == null) {
            throw SchedulerConfigException.of("Shift", name, "time range is required");
        }
    }

    public static ShiftDefinition of(String name, String from, String to) {
        return new ShiftDefinition(name, TimeRange.of(from, to));
    }
}
