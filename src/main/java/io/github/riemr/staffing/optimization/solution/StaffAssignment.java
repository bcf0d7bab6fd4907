package io.github.riemr.staffing.optimization.solution;

public record StaffAssignment(String employeeId, String roleId) {}
