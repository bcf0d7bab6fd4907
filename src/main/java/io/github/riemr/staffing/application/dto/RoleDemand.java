package io.github.riemr.staffing.application.dto;

public record RoleDemand(
    String roleId,
    int eligibleEmployees,
    int workingEmployees,
    double hoursWorked,
    double capacityUtilization,
    boolean bottleneck
) {}
