package io.github.riemr.staffing.application.dto;

public record FeasibilityIssue(
    Category category,
    Severity severity,
    String message,
    String roleId,
    String window
) {
    public enum Category {
        MIN_PRESENT,
        AVAILABILITY,
        DEMAND_CAPACITY,
        HOURS_CAPACITY,
        WORK_RULES,
        SOLVER_BUDGET
    }

    public enum Severity {
        CRITICAL,
        HIGH,
        MEDIUM
    }
}
