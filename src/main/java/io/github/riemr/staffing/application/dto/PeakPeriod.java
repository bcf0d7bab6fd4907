package io.github.riemr.staffing.application.dto;

import java.time.DayOfWeek;

/**
 * 需要のピーク枠。
 *
 * @param averageAtTime    同じ時刻帯の全曜日平均需要
 * @param maxAtTime        同じ時刻帯の最大需要
 * @param recommendedStaff 需要を処理するのに必要な人数の目安（生産職種がなければ null）
 */
public record PeakPeriod(
    DayOfWeek day,
    String window,
    double demandItems,
    double averageAtTime,
    double maxAtTime,
    Integer recommendedStaff
) {}
