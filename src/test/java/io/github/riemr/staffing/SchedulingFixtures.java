package io.github.riemr.staffing;

import java.time.DayOfWeek;

import io.github.riemr.staffing.domain.model.Employee;
import io.github.riemr.staffing.domain.model.Role;
import io.github.riemr.staffing.domain.model.TimeRange;

public final class SchedulingFixtures {
    private SchedulingFixtures() {}

    public static Role producing(String id, double itemsPerHour) {
        return Role.builder().id(id).producing(true).itemsPerEmployeePerHour(itemsPerHour).build();
    }

    public static Role support(String id, int minPresent) {
        return Role.builder().id(id).producing(false).minPresent(minPresent).build();
    }

    /** 月曜の指定時間帯に勤務可能、週上限 40 時間、希望時間 0 の従業員。 */
    public static Employee.EmployeeBuilder mondayEmployee(String id, double wage, int fromHour, int toHour, String... roles) {
        Employee.EmployeeBuilder b = Employee.builder()
                .id(id)
                .hourlyWage(wage)
                .maxHoursPerWeek(40.0)
                .maxConsecSlots(8)
                .prefHours(0.0)
                .availableDay(DayOfWeek.MONDAY)
                .availableHour(DayOfWeek.MONDAY, TimeRange.ofHours(fromHour, toHour));
        for (String r : roles) {
            b.roleId(r);
        }
        return b;
    }
}
