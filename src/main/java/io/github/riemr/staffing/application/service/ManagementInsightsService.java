package io.github.riemr.staffing.application.service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.springframework.stereotype.Service;

import io.github.riemr.staffing.application.dto.CostAnalysis;
import io.github.riemr.staffing.application.dto.CoverageGap;
import io.github.riemr.staffing.application.dto.EmployeeUtilization;
import io.github.riemr.staffing.application.dto.FeasibilityAnalysis;
import io.github.riemr.staffing.application.dto.HiringRecommendation;
import io.github.riemr.staffing.application.dto.HiringRecommendation.Priority;
import io.github.riemr.staffing.application.dto.ManagementInsights;
import io.github.riemr.staffing.application.dto.PeakPeriod;
import io.github.riemr.staffing.application.dto.RoleCapacity;
import io.github.riemr.staffing.application.dto.RoleDemand;
import io.github.riemr.staffing.application.dto.UtilizationStatus;
import io.github.riemr.staffing.application.dto.WorkloadDistribution;
import io.github.riemr.staffing.domain.model.DemandForecast;
import io.github.riemr.staffing.domain.model.Employee;
import io.github.riemr.staffing.domain.model.Role;
import io.github.riemr.staffing.domain.model.SchedulerInput;
import io.github.riemr.staffing.optimization.config.SchedulerPolicy;
import io.github.riemr.staffing.optimization.grid.TimeGrid;
import io.github.riemr.staffing.optimization.grid.TimeGridBuilder;
import io.github.riemr.staffing.optimization.grid.TimeWindow;
import io.github.riemr.staffing.optimization.model.ModelScale;
import io.github.riemr.staffing.optimization.solution.Schedule;
import io.github.riemr.staffing.optimization.solution.ScheduledWindow;
import io.github.riemr.staffing.optimization.solution.SolveResult;
import io.github.riemr.staffing.optimization.solution.StaffAssignment;
import io.github.riemr.staffing.optimization.solution.WindowOutput;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 求解結果から管理者向けの分析レポートを生成するサービス。
 * <ul>
 *   <li>能力分析・採用提案: 常に生成</li>
 *   <li>実行可能性分析: 解がない場合のみ</li>
 *   <li>ピーク・稼働率・職種需要・カバレッジ不足・コスト・負荷分散: 解がある場合のみ</li>
 * </ul>
 * しきい値はすべて {@link SchedulerPolicy} から取得する。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ManagementInsightsService {

    private final SchedulerPolicy policy;
    private final FeasibilityAnalyzer feasibilityAnalyzer;

    public ManagementInsights generate(SchedulerInput input, DemandForecast demand, SolveResult result) {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(demand, "demand");
        TimeGrid grid = new TimeGridBuilder().build(input, demand);

        List<RoleCapacity> capacities = analyzeCapacity(input, grid);
        boolean solved = result != null && result.hasSolution();
        ManagementInsights.ManagementInsightsBuilder builder = ManagementInsights.builder()
                .status(result == null ? null : result.status())
                .capacityAnalysis(capacities)
                .hiringRecommendations(recommendHiring(input, capacities, ModelScale.toItems(grid.totalDemandCenti()),
                        solved ? result : null));

        if (!solved) {
            FeasibilityAnalysis feasibility = feasibilityAnalyzer.analyze(input, grid, capacities,
                    result == null ? null : result.status());
            log.info("Insights without schedule: status={}, primaryCause={}",
                    result == null ? "NOT_SOLVED" : result.status(), feasibility.primaryCause());
            return builder.feasibilityAnalysis(feasibility).build();
        }

        Schedule schedule = result.schedule();
        List<EmployeeUtilization> utilization = analyzeUtilization(input, schedule);
        List<CoverageGap> gaps = findCoverageGaps(input, schedule, result.windowOutputs());
        ManagementInsights insights = builder
                .peakPeriods(findPeakPeriods(input, grid))
                .employeeUtilization(utilization)
                .coverageGaps(gaps)
                .roleDemand(analyzeRoleDemand(input, schedule, capacities, gaps))
                .costAnalysis(analyzeCost(input, schedule, result))
                .workloadDistribution(analyzeWorkload(utilization))
                .build();
        log.info("Insights generated: status={}, coverageGaps={}, hiringRecommendations={}",
                result.status(), gaps.size(), insights.getHiringRecommendations().size());
        return insights;
    }

    /* ===================================================================== */
    /* Capacity / hiring                                                     */
    /* ===================================================================== */

    List<RoleCapacity> analyzeCapacity(SchedulerInput input, TimeGrid grid) {
        double totalDemand = ModelScale.toItems(grid.totalDemandCenti());
        List<RoleCapacity> result = new ArrayList<>();
        for (Role r : input.getRoles()) {
            List<Employee> eligible = input.eligibleEmployees(r.getId());
            double hours = eligible.stream().mapToDouble(this::availableHours).sum();
            Double potential = r.isProducing() ? r.getItemsPerEmployeePerHour() * hours : null;
            Double ratio = potential != null && totalDemand > 0 ? potential / totalDemand : null;
            boolean enoughPeople = eligible.size() >= r.getMinPresent();
            boolean enoughOutput = potential == null || totalDemand <= 0 || potential >= totalDemand;
            result.add(new RoleCapacity(r.getId(), r.isProducing(), r.getMinPresent(), eligible.size(),
                    hours, potential, ratio, enoughPeople && enoughOutput));
        }
        return result;
    }

    private double availableHours(Employee e) {
        return Math.min(e.getMaxHoursPerWeek(), e.weeklyAvailableMinutes() / 60.0);
    }

    List<HiringRecommendation> recommendHiring(SchedulerInput input, List<RoleCapacity> capacities,
                                               double totalDemand, SolveResult result) {
        double unmet = result == null ? 0 : result.totalUnmetItems();
        List<HiringRecommendation> recs = new ArrayList<>();
        for (RoleCapacity c : capacities) {
            Role role = input.role(c.roleId());
            if (c.minPresent() > c.eligibleEmployees()) {
                recs.add(new HiringRecommendation(c.roleId(), c.minPresent() - c.eligibleEmployees(), Priority.CRITICAL,
                        "min_present=" + c.minPresent() + " but only " + c.eligibleEmployees() + " eligible employee(s)"));
            } else if (!c.sufficient() && c.producing()) {
                double shortfall = totalDemand - c.potentialOutput();
                recs.add(new HiringRecommendation(c.roleId(), hiresFor(shortfall, role), Priority.HIGH,
                        String.format("potential output %.1f items is below demand %.1f items", c.potentialOutput(), totalDemand)));
            } else if (unmet > 0 && c.producing()) {
                recs.add(new HiringRecommendation(c.roleId(), hiresFor(unmet, role), Priority.MEDIUM,
                        String.format("schedule leaves %.1f items of demand unserved", unmet)));
            }
        }
        return recs;
    }

    private int hiresFor(double items, Role role) {
        double perEmployee = role.getItemsPerEmployeePerHour() * policy.getStandardWeeklyHours();
        return Math.max(1, (int) Math.ceil(items / perEmployee - 1e-9));
    }

    /* ===================================================================== */
    /* Solution-dependent sections                                           */
    /* ===================================================================== */

    List<PeakPeriod> findPeakPeriods(SchedulerInput input, TimeGrid grid) {
        List<Double> values = new ArrayList<>();
        for (TimeWindow w : grid.getWindows()) {
            if (grid.demandCenti(w) > 0) {
                values.add(grid.demandItems(w));
            }
        }
        if (values.isEmpty()) {
            return List.of();
        }
        double threshold = percentile(values, policy.getPeakPercentile());
        Map<Integer, List<Double>> byTime = new HashMap<>();
        for (TimeWindow w : grid.getWindows()) {
            byTime.computeIfAbsent(w.startMinute(), k -> new ArrayList<>()).add(grid.demandItems(w));
        }
        List<PeakPeriod> peaks = new ArrayList<>();
        for (TimeWindow w : grid.getWindows()) {
            double d = grid.demandItems(w);
            if (d <= threshold) continue;
            List<Double> same = byTime.get(w.startMinute());
            double avg = same.stream().mapToDouble(Double::doubleValue).average().orElse(0);
            double max = same.stream().mapToDouble(Double::doubleValue).max().orElse(0);
            double perHead = bestItemsPerHead(input, w);
            Integer staff = perHead > 0 ? (int) Math.ceil(d / perHead - 1e-9) : null;
            peaks.add(new PeakPeriod(w.day(), w.timeLabel(), d, avg, max, staff));
        }
        peaks.sort(Comparator.comparingDouble(PeakPeriod::demandItems).reversed());
        return peaks;
    }

    /** 線形補間によるパーセンタイル。 */
    static double percentile(List<Double> values, double p) {
        List<Double> sorted = new ArrayList<>(values);
        sorted.sort(Double::compare);
        double rank = p / 100.0 * (sorted.size() - 1);
        int lo = (int) Math.floor(rank);
        int hi = (int) Math.ceil(rank);
        return sorted.get(lo) + (sorted.get(hi) - sorted.get(lo)) * (rank - lo);
    }

    private double bestItemsPerHead(SchedulerInput input, TimeWindow w) {
        return input.getRoles().stream()
                .filter(Role::isProducing)
                .mapToDouble(r -> r.getItemsPerEmployeePerHour() * w.hours())
                .max()
                .orElse(0);
    }

    List<EmployeeUtilization> analyzeUtilization(SchedulerInput input, Schedule schedule) {
        List<EmployeeUtilization> result = new ArrayList<>();
        for (Employee e : input.getEmployees()) {
            double hours = schedule.hoursOf(e.getId());
            double rate = e.getMaxHoursPerWeek() > 0 ? hours / e.getMaxHoursPerWeek() : 0.0;
            result.add(new EmployeeUtilization(e.getId(), hours, e.getMaxHoursPerWeek(), rate,
                    hours - e.getPrefHours(), statusOf(hours, rate)));
        }
        return result;
    }

    private UtilizationStatus statusOf(double hours, double rate) {
        if (hours <= 0) return UtilizationStatus.UNUSED;
        if (rate < policy.getUnderutilizedBelow()) return UtilizationStatus.UNDERUTILIZED;
        if (rate > policy.getOverutilizedAbove()) return UtilizationStatus.OVERUTILIZED;
        return UtilizationStatus.WELL_UTILIZED;
    }

    List<CoverageGap> findCoverageGaps(SchedulerInput input, Schedule schedule, List<WindowOutput> outputs) {
        List<CoverageGap> gaps = new ArrayList<>();
        for (WindowOutput out : outputs) {
            if (out.demandItems() <= 0) continue;
            double rate = out.suppliedItems() / out.demandItems();
            if (rate >= policy.getCoverageGapThreshold()) continue;
            TimeWindow w = out.window();
            ScheduledWindow staffed = schedule.windowsOn(w.day()).stream()
                    .filter(sw -> sw.window().equals(w))
                    .findFirst()
                    .orElse(null);
            List<String> shortRoles = new ArrayList<>();
            for (Role r : input.getRoles()) {
                if (!r.isProducing()) continue;
                int required = (int) Math.ceil(out.demandItems() / (r.getItemsPerEmployeePerHour() * w.hours()) - 1e-9);
                long assigned = staffed == null ? 0 : staffed.countRole(r.getId());
                if (assigned < required) {
                    shortRoles.add(r.getId());
                }
            }
            double perHead = bestItemsPerHead(input, w);
            gaps.add(CoverageGap.builder()
                    .day(w.day())
                    .window(w.timeLabel())
                    .demandItems(out.demandItems())
                    .suppliedItems(out.suppliedItems())
                    .requiredStaff(perHead > 0 ? (int) Math.ceil(out.demandItems() / perHead - 1e-9) : null)
                    .assignedStaff(staffed == null ? 0 : staffed.staff().size())
                    .shortRoles(shortRoles)
                    .critical(rate < policy.getCriticalCoverageBelow())
                    .build());
        }
        return gaps;
    }

    List<RoleDemand> analyzeRoleDemand(SchedulerInput input, Schedule schedule,
                                       List<RoleCapacity> capacities, List<CoverageGap> gaps) {
        List<RoleDemand> result = new ArrayList<>();
        for (RoleCapacity c : capacities) {
            double hours = 0;
            int working = 0;
            for (Employee e : input.eligibleEmployees(c.roleId())) {
                double h = schedule.hoursOf(e.getId(), c.roleId());
                if (h > 0) {
                    working++;
                    hours += h;
                }
            }
            double utilization = c.availableHours() > 0 ? hours / c.availableHours() : 0.0;
            boolean inGap = gaps.stream().anyMatch(g -> g.getShortRoles().contains(c.roleId()));
            result.add(new RoleDemand(c.roleId(), c.eligibleEmployees(), working, hours, utilization,
                    utilization > policy.getBottleneckUtilization() && inGap));
        }
        return result;
    }

    CostAnalysis analyzeCost(SchedulerInput input, Schedule schedule, SolveResult result) {
        Map<String, Double> wages = new HashMap<>();
        input.getEmployees().forEach(e -> wages.put(e.getId(), e.getHourlyWage()));
        Map<String, Double> byRole = new LinkedHashMap<>();
        input.getRoles().forEach(r -> byRole.put(r.getId(), 0.0));
        double total = 0;
        for (ScheduledWindow sw : schedule.allWindows()) {
            for (StaffAssignment a : sw.staff()) {
                double cost = wages.get(a.employeeId()) * sw.window().hours();
                total += cost;
                byRole.merge(a.roleId(), cost, Double::sum);
            }
        }
        double unmet = result.totalUnmetItems();
        double served = result.windowOutputs().stream().mapToDouble(WindowOutput::servedItems).sum();
        return new CostAnalysis(total, byRole, unmet, unmet * policy.getItemMargin(), served,
                served > 0 ? total / served : null);
    }

    WorkloadDistribution analyzeWorkload(List<EmployeeUtilization> utilization) {
        if (utilization.isEmpty()) {
            return new WorkloadDistribution(0, 0, 0, 0, 0, 0, 0, 0, 1.0);
        }
        double mean = utilization.stream().mapToDouble(EmployeeUtilization::assignedHours).average().orElse(0);
        double max = utilization.stream().mapToDouble(EmployeeUtilization::assignedHours).max().orElse(0);
        double min = utilization.stream().mapToDouble(EmployeeUtilization::assignedHours).min().orElse(0);
        int unused = 0;
        int under = 0;
        int well = 0;
        int over = 0;
        for (EmployeeUtilization u : utilization) {
            switch (u.status()) {
                case UNUSED:
                    unused++;
                    break;
                case UNDERUTILIZED:
                    under++;
                    break;
                case OVERUTILIZED:
                    over++;
                    break;
                default:
                    well++;
            }
        }
        double balance = max > 0 ? 1.0 - (max - min) / max : 1.0;
        return new WorkloadDistribution(mean, max, min, max - min, unused, under, well, over, balance);
    }
}
