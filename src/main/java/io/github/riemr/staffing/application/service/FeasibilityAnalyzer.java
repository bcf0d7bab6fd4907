package io.github.riemr.staffing.application.service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.springframework.stereotype.Component;

import io.github.riemr.staffing.application.dto.FeasibilityAnalysis;
import io.github.riemr.staffing.application.dto.FeasibilityIssue;
import io.github.riemr.staffing.application.dto.FeasibilityIssue.Category;
import io.github.riemr.staffing.application.dto.FeasibilityIssue.Severity;
import io.github.riemr.staffing.application.dto.RoleCapacity;
import io.github.riemr.staffing.domain.model.Employee;
import io.github.riemr.staffing.domain.model.ProductionChain;
import io.github.riemr.staffing.domain.model.Role;
import io.github.riemr.staffing.domain.model.SchedulerInput;
import io.github.riemr.staffing.optimization.grid.TimeGrid;
import io.github.riemr.staffing.optimization.grid.TimeWindow;
import io.github.riemr.staffing.optimization.model.ModelScale;
import io.github.riemr.staffing.optimization.solution.SolveStatus;

/**
 * 解が得られなかったときに、どのハード制約が原因と考えられるかを推定する。
 * 制約の種類ごとに入力だけから判定できる矛盾を探し、重大度順に並べる。
 */
@Component
public class FeasibilityAnalyzer {

    public FeasibilityAnalysis analyze(SchedulerInput input, TimeGrid grid, List<RoleCapacity> capacities, SolveStatus status) {
        List<FeasibilityIssue> issues = new ArrayList<>();
        List<String> reported = new ArrayList<>();

        checkEligibleForMinPresent(grid, capacities, issues, reported);
        checkAvailabilityForMinPresent(input, grid, issues, reported);
        if (input.getConfig().isMeetAllDemand()) {
            checkWindowSupply(input, grid, issues);
            checkTotalCapacity(grid, capacities, issues);
        }
        checkCoverageHours(input, grid, issues);

        if (issues.isEmpty() && status == SolveStatus.UNKNOWN) {
            issues.add(new FeasibilityIssue(Category.SOLVER_BUDGET, Severity.MEDIUM,
                    "The search budget ran out before any feasible schedule was found; retry with a larger budget",
                    null, null));
        } else if (issues.isEmpty() && status == SolveStatus.INFEASIBLE) {
            issues.add(new FeasibilityIssue(Category.WORK_RULES, Severity.MEDIUM,
                    "No single capacity shortfall explains the result; the combination of rest, consecutive-slot, "
                            + "minimum shift length and weekly hour limits leaves no valid assignment",
                    null, null));
        }
        issues.sort(Comparator.comparingInt(i -> i.severity().ordinal()));
        String primary = issues.isEmpty() ? null : issues.get(0).message();
        return new FeasibilityAnalysis(primary, List.copyOf(issues));
    }

    private void checkEligibleForMinPresent(TimeGrid grid, List<RoleCapacity> capacities,
                                            List<FeasibilityIssue> issues, List<String> reported) {
        if (grid.getOpenWindows().isEmpty()) return;
        for (RoleCapacity c : capacities) {
            if (c.minPresent() > c.eligibleEmployees()) {
                issues.add(new FeasibilityIssue(Category.MIN_PRESENT, Severity.CRITICAL,
                        "Role " + c.roleId() + " has min_present=" + c.minPresent() + " but only "
                                + c.eligibleEmployees() + " eligible employee(s)",
                        c.roleId(), null));
                reported.add(c.roleId());
            }
        }
    }

    private void checkAvailabilityForMinPresent(SchedulerInput input, TimeGrid grid,
                                                List<FeasibilityIssue> issues, List<String> reported) {
        for (Role r : input.getRoles()) {
            if (r.getMinPresent() <= 0 || reported.contains(r.getId())) continue;
            int shortWindows = 0;
            TimeWindow first = null;
            int firstAvailable = 0;
            for (TimeWindow w : grid.getOpenWindows()) {
                int available = availableEligible(input, r.getId(), w);
                if (available < r.getMinPresent()) {
                    if (first == null) {
                        first = w;
                        firstAvailable = available;
                    }
                    shortWindows++;
                }
            }
            if (first != null) {
                issues.add(new FeasibilityIssue(Category.AVAILABILITY, Severity.HIGH,
                        "Role " + r.getId() + " has min_present=" + r.getMinPresent() + " but only " + firstAvailable
                                + " eligible employee(s) available in " + first.label()
                                + " (" + shortWindows + " open window(s) affected)",
                        r.getId(), first.label()));
            }
        }
    }

    private void checkWindowSupply(SchedulerInput input, TimeGrid grid, List<FeasibilityIssue> issues) {
        int shortWindows = 0;
        TimeWindow first = null;
        double firstMax = 0;
        for (TimeWindow w : grid.getWindows()) {
            double demand = grid.demandItems(w);
            if (demand <= 0) continue;
            double max = maxSupplyItems(input, w);
            if (max + 1e-9 < demand) {
                if (first == null) {
                    first = w;
                    firstMax = max;
                }
                shortWindows++;
            }
        }
        if (first != null) {
            issues.add(new FeasibilityIssue(Category.DEMAND_CAPACITY, Severity.CRITICAL,
                    String.format("Demand of %.2f items in %s exceeds the %.2f items all available staff can produce "
                            + "(%d window(s) affected)", grid.demandItems(first), first.label(), firstMax, shortWindows),
                    null, first.label()));
        }
    }

    private void checkTotalCapacity(TimeGrid grid, List<RoleCapacity> capacities, List<FeasibilityIssue> issues) {
        double demand = ModelScale.toItems(grid.totalDemandCenti());
        double potential = capacities.stream()
                .filter(c -> c.potentialOutput() != null)
                .mapToDouble(RoleCapacity::potentialOutput)
                .sum();
        if (demand > 0 && potential < demand) {
            issues.add(new FeasibilityIssue(Category.DEMAND_CAPACITY, Severity.HIGH,
                    String.format("Total demand of %.2f items exceeds the weekly potential output of %.2f items", demand, potential),
                    null, null));
        }
    }

    private void checkCoverageHours(SchedulerInput input, TimeGrid grid, List<FeasibilityIssue> issues) {
        double required = 0;
        for (TimeWindow w : grid.getOpenWindows()) {
            for (Role r : input.getRoles()) {
                required += r.getMinPresent() * w.hours();
            }
        }
        double available = input.getEmployees().stream().mapToDouble(Employee::getMaxHoursPerWeek).sum();
        if (required > available + 1e-9) {
            issues.add(new FeasibilityIssue(Category.HOURS_CAPACITY, Severity.HIGH,
                    String.format("Minimum staffing needs %.1f hours but employees can work at most %.1f hours per week",
                            required, available),
                    null, null));
        }
    }

    private int availableEligible(SchedulerInput input, String roleId, TimeWindow w) {
        int count = 0;
        for (Employee e : input.eligibleEmployees(roleId)) {
            if (e.isAvailableFor(w.day(), w.startMinute(), w.endMinute()) && e.getMaxHoursPerWeek() * 60 >= w.durationMinutes()) {
                count++;
            }
        }
        return count;
    }

    /** 勤務可能な全員が入った場合の枠の処理量。 */
    private double maxSupplyItems(SchedulerInput input, TimeWindow w) {
        double total = 0;
        for (ProductionChain chain : input.getChains()) {
            double raw = 0;
            for (String roleId : chain.getRoleIds()) {
                raw += roleOutput(input, input.role(roleId), w);
            }
            total += raw * chain.getContribFactor();
        }
        for (Role r : input.getRoles()) {
            if (r.isProducing() && input.chainsOf(r.getId()).isEmpty()) {
                total += roleOutput(input, r, w);
            }
        }
        return total;
    }

    private double roleOutput(SchedulerInput input, Role r, TimeWindow w) {
        if (!r.isProducing()) return 0;
        return availableEligible(input, r.getId(), w) * r.getItemsPerEmployeePerHour() * w.hours();
    }
}
