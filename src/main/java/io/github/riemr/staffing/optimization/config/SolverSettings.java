package io.github.riemr.staffing.optimization.config;

import java.time.Duration;

/**
 * CP-SAT の実行設定。
 *
 * @param defaultBudget      予算未指定時の探索時間上限
 * @param workers            探索ワーカー数
 * @param logSearchProgress  CP-SAT 自身の探索ログを出力するか
 */
public record SolverSettings(Duration defaultBudget, int workers, boolean logSearchProgress) {

    public static final Duration DEFAULT_BUDGET = Duration.ofSeconds(30);
    public static final int DEFAULT_WORKERS = 8;

    public SolverSettings {
        if (defaultBudget == null || defaultBudget.isZero() || defaultBudget.isNegative()) {
            defaultBudget = DEFAULT_BUDGET;
        }
        if (workers < 1) {
            workers = DEFAULT_WORKERS;
        }
    }

    public static SolverSettings defaults() {
        return new SolverSettings(DEFAULT_BUDGET, DEFAULT_WORKERS, false);
    }

    /** 呼び出し側の予算を優先し、未指定・0 以下なら既定値を使う。 */
    public Duration effectiveBudget(Duration requested) {
        if (requested == null || requested.isZero() || requested.isNegative()) {
            return defaultBudget;
        }
        return requested;
    }
}
