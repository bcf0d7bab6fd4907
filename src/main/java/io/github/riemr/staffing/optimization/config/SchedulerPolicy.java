package io.github.riemr.staffing.optimization.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.Setter;

/**
 * 目的関数の重みと分析レポートのしきい値。すべて application.yml で上書き可能。
 * <p>金額はセント、需要は 1/100 アイテム単位で目的関数に入るため、
 * unmetDemandWeight=10 は未充足 1 アイテムあたり 1000（時給 10 の 1 時間分）に相当する。</p>
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "scheduler.policy")
public class SchedulerPolicy {

    /** 希望外勤務・希望時間乖離 1 分あたりのペナルティ (λ1) */
    @Min(value = 0, message = "preferenceWeight must be >= 0")
    private long preferenceWeight = 1;

    /** 未充足需要 1/100 アイテムあたりのペナルティ (λ2) */
    @Min(value = 0, message = "unmetDemandWeight must be >= 0")
    private long unmetDemandWeight = 10;

    /** 従業員間の勤務時間の差（最大 - 最小）1 分あたりのペナルティ */
    @Min(value = 0, message = "fairnessWeight must be >= 0")
    private long fairnessWeight = 1;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double underutilizedBelow = 0.5;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double overutilizedAbove = 0.9;

    /** ピーク判定に使うパーセンタイル */
    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax("100.0")
    private double peakPercentile = 90.0;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double bottleneckUtilization = 0.85;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double coverageGapThreshold = 0.8;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double criticalCoverageBelow = 0.5;

    /** 未充足 1 アイテムあたりの機会損失 */
    @DecimalMin("0.0")
    private double itemMargin = 10.0;

    /** 採用人数換算に使う 1 人あたりの週労働時間 */
    @DecimalMin(value = "0.0", inclusive = false)
    private double standardWeeklyHours = 40.0;
}
