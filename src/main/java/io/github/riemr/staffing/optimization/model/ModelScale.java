package io.github.riemr.staffing.optimization.model;

import io.github.riemr.staffing.exception.SchedulerConfigException;

/**
 * CP-SAT は整数係数しか扱えないため、モデル内の数量はすべて整数に換算する。
 * <ul>
 *   <li>アイテム数: 1/100 単位 (centi-item)</li>
 *   <li>金額: セント</li>
 *   <li>貢献率: 分母 100 以下の既約分数</li>
 * </ul>
 */
public final class ModelScale {

    public static final long ITEM_SCALE = 100;
    public static final long MONEY_SCALE = 100;
    public static final long CONTRIB_RESOLUTION = 100;

    private ModelScale() {}

    public record Fraction(long numerator, long denominator) {
        public boolean isOne() {
            return numerator == denominator;
        }

        public double value() {
            return (double) numerator / denominator;
        }
    }

    /**
     * 貢献率を既約分数にする。1/100 の倍数でない値は丸めずに拒否する。
     */
    public static Fraction contribution(double factor) {
        double scaled = factor * CONTRIB_RESOLUTION;
        long num = Math.round(scaled);
        if (num <= 0 || Math.abs(scaled - num) > 1e-6) {
            throw new SchedulerConfigException("contribFactor " + factor + " must be a positive multiple of 1/" + CONTRIB_RESOLUTION);
        }
        long den = CONTRIB_RESOLUTION;
        long g = gcd(num, den);
        return new Fraction(num / g, den / g);
    }

    /** 1 人が枠内で処理できるアイテム数 (1/100 単位)。 */
    public static long itemsCenti(double ratePerHour, int minutes) {
        return Math.round(ratePerHour * ITEM_SCALE * minutes / 60.0);
    }

    public static long wageCents(double hourlyWage, int minutes) {
        return Math.round(hourlyWage * MONEY_SCALE * minutes / 60.0);
    }

    public static double toItems(long centi) {
        return centi / (double) ITEM_SCALE;
    }

    public static double toMoney(long cents) {
        return cents / (double) MONEY_SCALE;
    }

    private static long gcd(long a, long b) {
        while (b != 0) {
            long t = a % b;
            a = b;
            b = t;
        }
        return a;
    }
}
