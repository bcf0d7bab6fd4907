package io.github.riemr.staffing.optimization.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;

import org.junit.jupiter.api.Test;

class CpSatConfigTest {

    private static final Duration DEF = Duration.ofSeconds(30);

    @Test
    void parseDurationTolerant_acceptsIsoAndShorthand() {
        assertThat(CpSatConfig.parseDurationTolerant("PT2M", DEF)).isEqualTo(Duration.ofMinutes(2));
        assertThat(CpSatConfig.parseDurationTolerant("PT45", DEF)).isEqualTo(Duration.ofSeconds(45));
        assertThat(CpSatConfig.parseDurationTolerant("500ms", DEF)).isEqualTo(Duration.ofMillis(500));
        assertThat(CpSatConfig.parseDurationTolerant("10s", DEF)).isEqualTo(Duration.ofSeconds(10));
        assertThat(CpSatConfig.parseDurationTolerant("5m", DEF)).isEqualTo(Duration.ofMinutes(5));
        assertThat(CpSatConfig.parseDurationTolerant("1h", DEF)).isEqualTo(Duration.ofHours(1));
        assertThat(CpSatConfig.parseDurationTolerant("12", DEF)).isEqualTo(Duration.ofSeconds(12));
    }

    @Test
    void parseDurationTolerant_fallsBackOnGarbage() {
        assertThat(CpSatConfig.parseDurationTolerant(null, DEF)).isEqualTo(DEF);
        assertThat(CpSatConfig.parseDurationTolerant(" ", DEF)).isEqualTo(DEF);
        assertThat(CpSatConfig.parseDurationTolerant("soon", DEF)).isEqualTo(DEF);
        assertThat(CpSatConfig.parseDurationTolerant("PTxyz", DEF)).isEqualTo(DEF);
        assertThat(CpSatConfig.parseDurationTolerant("fast s", DEF)).isEqualTo(DEF);
        assertThat(CpSatConfig.parseDurationTolerant("3 weeks", DEF)).isEqualTo(DEF);
    }

    @Test
    void solverSettings_replaceNonPositiveBudget() {
        SolverSettings settings = new SolverSettings(Duration.ZERO, 0, false);

        assertThat(settings.defaultBudget()).isEqualTo(SolverSettings.DEFAULT_BUDGET);
        assertThat(settings.workers()).isEqualTo(SolverSettings.DEFAULT_WORKERS);
        assertThat(settings.effectiveBudget(Duration.ofSeconds(-1))).isEqualTo(SolverSettings.DEFAULT_BUDGET);
        assertThat(settings.effectiveBudget(Duration.ofSeconds(3))).isEqualTo(Duration.ofSeconds(3));
    }
}
