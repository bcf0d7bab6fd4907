package io.github.riemr.staffing.optimization.solution;

import static io.github.riemr.staffing.SchedulingFixtures.mondayEmployee;
import static io.github.riemr.staffing.SchedulingFixtures.producing;
import static org.assertj.core.api.Assertions.assertThat;

import java.time.DayOfWeek;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import io.github.riemr.staffing.domain.model.SchedulerInput;
import io.github.riemr.staffing.optimization.grid.TimeWindow;

class SolutionDescriberTest {

    private static final DayOfWeek MON = DayOfWeek.MONDAY;

    private final SchedulerInput input = SchedulerInput.builder()
            .role(producing("cook", 10))
            .employee(mondayEmployee("e1", 10, 8, 18, "cook").prefHours(2.0).build())
            .employee(mondayEmployee("e2", 20, 8, 18, "cook").build())
            .build();

    private static TimeWindow hour(int h) {
        return new TimeWindow(MON, h, String.format("%02d:00-%02d:00", h, h + 1), h * 60, (h + 1) * 60);
    }

    @Test
    void describe_listsHoursAssignmentsAndUnmetDemand() {
        Schedule schedule = new Schedule(Map.of(MON, List.of(
                new ScheduledWindow(hour(9), List.of(new StaffAssignment("e1", "cook"))))));
        SolveResult result = new SolveResult(SolveStatus.FEASIBLE, schedule, 13620.0, 13000.0,
                List.of(new WindowOutput(hour(9), 10, 10, 0, true),
                        new WindowOutput(hour(10), 12.5, 0, 12.5, true)),
                0.5);

        String text = SolutionDescriber.describe(input, result);

        assertThat(text).contains("SOLUTION FOUND")
                .contains("Status: FEASIBLE")
                .contains("Objective: 13620.00")
                .contains("e1: 1.0h worked (pref: 2.0h, dev: 1.0h)")
                .contains("e2: 0.0h worked (pref: 0.0h, dev: 0.0h)")
                .contains("  Mon 09:00-10:00: e1 -> cook")
                .contains("--- Unmet Demand ---")
                .contains("  Mon 10:00-11:00: 12.5 items")
                .doesNotContain("All demand satisfied");
    }

    @Test
    void describe_reportsSatisfiedDemand() {
        Schedule schedule = new Schedule(Map.of(MON, List.of(
                new ScheduledWindow(hour(9), List.of(new StaffAssignment("e2", "cook"))))));
        SolveResult result = new SolveResult(SolveStatus.OPTIMAL, schedule, 2060.0, 2060.0,
                List.of(new WindowOutput(hour(9), 10, 10, 0, true)), 0.1);

        assertThat(SolutionDescriber.describe(input, result))
                .contains("--- All demand satisfied ---")
                .doesNotContain("Unmet Demand");
    }

    @Test
    void describe_withoutSolution_showsOnlyTheStatus() {
        String text = SolutionDescriber.describe(input, SolveResult.withoutSolution(SolveStatus.INFEASIBLE, 0.2));

        assertThat(text).contains("NO SOLUTION FOUND").contains("Status: INFEASIBLE").doesNotContain("Employee Stats");
        assertThat(SolutionDescriber.describe(input, null)).contains("NO SOLUTION FOUND").doesNotContain("Status");
    }
}
