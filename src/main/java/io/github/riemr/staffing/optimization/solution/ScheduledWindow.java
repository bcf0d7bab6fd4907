package io.github.riemr.staffing.optimization.solution;

import java.util.List;

import io.github.riemr.staffing.optimization.grid.TimeWindow;

public record ScheduledWindow(TimeWindow window, List<StaffAssignment> staff) {

    public List<String> employeeIds() {
        return staff.stream().map(StaffAssignment::employeeId).toList();
    }

    public long countRole(String roleId) {
        return staff.stream().filter(s -> s.roleId().equals(roleId)).count();
    }
}
