package io.github.riemr.staffing.application.dto;

/**
 * @param balanceScore 1 - (max - min) / max。全員 0 時間なら 1
 */
public record WorkloadDistribution(
    double meanHours,
    double maxHours,
    double minHours,
    double rangeHours,
    int unusedCount,
    int underutilizedCount,
    int wellUtilizedCount,
    int overutilizedCount,
    double balanceScore
) {}
