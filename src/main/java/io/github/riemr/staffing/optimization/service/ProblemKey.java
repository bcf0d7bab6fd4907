package io.github.riemr.staffing.optimization.service;

import java.time.LocalDate;
import java.util.Objects;

/**
 * 実行中の求解の識別子。組織コードと週の開始日で一意。
 */
public final class ProblemKey {
    private final String organizationCode;
    private final LocalDate weekStart;

    public ProblemKey(String organizationCode, LocalDate weekStart) {
        this.organizationCode = Objects.requireNonNull(organizationCode, "organizationCode");
        this.weekStart = Objects.requireNonNull(weekStart, "weekStart");
    }

    public String getOrganizationCode() { return organizationCode; }
    public LocalDate getWeekStart() { return weekStart; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProblemKey that = (ProblemKey) o;
        return Objects.equals(organizationCode, that.organizationCode) &&
               Objects.equals(weekStart, that.weekStart);
    }

    @Override
    public int hashCode() {
        return Objects.hash(organizationCode, weekStart);
    }

    @Override
    public String toString() {
        return organizationCode + ":" + weekStart;
    }
}
