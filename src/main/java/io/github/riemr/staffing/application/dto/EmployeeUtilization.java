package io.github.riemr.staffing.application.dto;

public record EmployeeUtilization(
    String employeeId,
    double assignedHours,
    double maxHoursPerWeek,
    double utilizationRate,
    double preferenceDeviationHours,
    UtilizationStatus status
) {}
