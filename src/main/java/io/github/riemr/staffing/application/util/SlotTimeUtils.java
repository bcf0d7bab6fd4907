package io.github.riemr.staffing.application.util;

import java.time.DayOfWeek;
import java.time.format.TextStyle;
import java.util.Locale;

import io.github.riemr.staffing.exception.SchedulerConfigException;

public final class SlotTimeUtils {
    private SlotTimeUtils() {}

    public static final int MINUTES_PER_DAY = 24 * 60;

    public static int slotsPerDay(int minutesPerSlot) {
        if (minutesPerSlot <= 0) throw new IllegalArgumentException("minutesPerSlot must be > 0: " + minutesPerSlot);
        return (MINUTES_PER_DAY + minutesPerSlot - 1) / minutesPerSlot;
    }

    public static boolean isAligned(int minuteOfDay, int minutesPerSlot) {
        return minuteOfDay % minutesPerSlot == 0 || minuteOfDay == MINUTES_PER_DAY;
    }

    public static int toSlotIndex(int minuteOfDay, int minutesPerSlot) {
        if (!isAligned(minuteOfDay, minutesPerSlot)) throw new IllegalArgumentException("Time not aligned to " + minutesPerSlot + ": " + formatMinuteOfDay(minuteOfDay));
        return (minuteOfDay + minutesPerSlot - 1) / minutesPerSlot;
    }

    /** 枠数換算（端数切り上げ）。 */
    public static int slotsSpanned(int durationMinutes, int minutesPerSlot) {
        return (durationMinutes + minutesPerSlot - 1) / minutesPerSlot;
    }

    /** "HH:mm" を 0..1440 の分に変換する。"24:00" は 1440。 */
    public static int parseMinuteOfDay(String hhmm) {
        if (hhmm == null) throw new SchedulerConfigException("time is required");
        String s = hhmm.trim();
        int colon = s.indexOf(':');
        try {
            int hour = Integer.parseInt(colon < 0 ? s : s.substring(0, colon));
            int minute = colon < 0 ? 0 : Integer.parseInt(s.substring(colon + 1));
            int total = hour * 60 + minute;
            if (hour < 0 || minute < 0 || minute > 59 || total > MINUTES_PER_DAY) {
                throw new SchedulerConfigException("Time out of range: " + hhmm);
            }
            return total;
        } catch (NumberFormatException e) {
            throw new SchedulerConfigException("Invalid time: " + hhmm);
        }
    }

    public static String formatMinuteOfDay(int minuteOfDay) {
        return String.format("%02d:%02d", minuteOfDay / 60, minuteOfDay % 60);
    }

    public static String dayLabel(DayOfWeek day) {
        return day.getDisplayName(TextStyle.SHORT, Locale.ENGLISH);
    }

    public static double minutesToHours(long minutes) {
        return minutes / 60.0;
    }
}
