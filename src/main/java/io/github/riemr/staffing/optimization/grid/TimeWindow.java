package io.github.riemr.staffing.optimization.grid;

import java.time.DayOfWeek;

import io.github.riemr.staffing.application.util.SlotTimeUtils;

/**
 * 時間軸上の 1 枠。必ずいずれか 1 つの曜日に属する。
 *
 * @param day         曜日
 * @param index       曜日内の並び順（0 始まり）
 * @param name        固定シフト名、均等枠では時刻ラベル
 * @param startMinute 開始（分）
 * @param endMinute   終了（分、排他）
 */
public record TimeWindow(DayOfWeek day, int index, String name, int startMinute, int endMinute) {

    public int durationMinutes() {
        return endMinute - startMinute;
    }

    public double hours() {
        return durationMinutes() / 60.0;
    }

    public String timeLabel() {
        return SlotTimeUtils.formatMinuteOfDay(startMinute) + "-" + SlotTimeUtils.formatMinuteOfDay(endMinute);
    }

    public String label() {
        return SlotTimeUtils.dayLabel(day) + " " + timeLabel();
    }

    public int overlapMinutes(int from, int to) {
        return Math.max(0, Math.min(endMinute, to) - Math.max(startMinute, from));
    }

    @Override
    public String toString() {
        return label();
    }
}
