package io.github.riemr.staffing.optimization.config;

import java.time.Duration;
import java.util.Locale;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import lombok.extern.slf4j.Slf4j;

@Configuration
@Slf4j
public class CpSatConfig {

    // 予算未指定時の探索時間上限（既定: 30秒）
    @Value("${scheduler.solver.default-budget:PT30S}")
    private String defaultBudget;
    @Value("${scheduler.solver.workers:8}")
    private int workers;
    // CP-SAT 内部の探索ログ
    @Value("${scheduler.solver.log-search-progress:false}")
    private boolean logSearchProgress;

    @Bean
    public SolverSettings solverSettings() {
        SolverSettings settings = new SolverSettings(
                parseDurationTolerant(defaultBudget, SolverSettings.DEFAULT_BUDGET), workers, logSearchProgress);
        log.info("CP-SAT settings: budget={}, workers={}, logSearchProgress={}",
                settings.defaultBudget(), settings.workers(), settings.logSearchProgress());
        return settings;
    }

    static Duration parseDurationTolerant(String raw, Duration def) {
        if (raw == null || raw.isBlank()) return def;
        Duration parsed;
        try {
            parsed = parseDuration(raw.trim());
        } catch (RuntimeException e) {
            log.debug("Duration '{}' rejected: {}", raw, e.getMessage());
            parsed = null;
        }
        if (parsed == null) {
            log.warn("Unparsable duration '{}', falling back to {}", raw, def);
            return def;
        }
        return parsed;
    }

    // ISO-8601 または数値 + 単位 (ms / s / m / h)、単位なしは秒。対応外の形式は null
    private static Duration parseDuration(String s) {
        if (s.startsWith("P")) {
            if (s.matches("^PT\\d+$")) s = s + "S"; // PT30 -> PT30S
            return Duration.parse(s);
        }
        String ls = s.toLowerCase(Locale.ROOT);
        if (ls.endsWith("ms")) return Duration.ofMillis(Long.parseLong(ls.substring(0, ls.length() - 2)));
        if (ls.endsWith("s")) return Duration.ofSeconds(Long.parseLong(ls.substring(0, ls.length() - 1)));
        if (ls.endsWith("m")) return Duration.ofMinutes(Long.parseLong(ls.substring(0, ls.length() - 1)));
        if (ls.endsWith("h")) return Duration.ofHours(Long.parseLong(ls.substring(0, ls.length() - 1)));
        if (ls.matches("^\\d+$")) return Duration.ofSeconds(Long.parseLong(ls));
        return null;
    }
}
