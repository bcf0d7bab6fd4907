package io.github.riemr.staffing.application.dto;

public enum UtilizationStatus {
    /** 週の勤務が 0 時間 */
    UNUSED,
    UNDERUTILIZED,
    WELL_UTILIZED,
    OVERUTILIZED
}
