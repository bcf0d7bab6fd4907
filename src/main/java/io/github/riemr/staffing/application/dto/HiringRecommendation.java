package io.github.riemr.staffing.application.dto;

public record HiringRecommendation(
    String roleId,
    int additionalEmployees,
    Priority priority,
    String reason
) {
    public enum Priority {
        CRITICAL,
        HIGH,
        MEDIUM
    }
}
