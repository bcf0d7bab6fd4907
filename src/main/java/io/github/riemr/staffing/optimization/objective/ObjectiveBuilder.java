package io.github.riemr.staffing.optimization.objective;

import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.google.ortools.sat.BoolVar;
import com.google.ortools.sat.CpModel;
import com.google.ortools.sat.IntVar;
import com.google.ortools.sat.LinearExpr;
import com.google.ortools.sat.LinearExprBuilder;

import io.github.riemr.staffing.domain.model.Employee;
import io.github.riemr.staffing.optimization.config.SchedulerPolicy;
import io.github.riemr.staffing.optimization.grid.TimeWindow;
import io.github.riemr.staffing.optimization.model.ModelScale;
import io.github.riemr.staffing.optimization.model.ScheduleModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 目的関数: 人件費(セント) + λ1 × 希望乖離(分) + λ2 × 未充足需要(1/100 アイテム)
 * + 公平性重み × 勤務時間の幅(分) を最小化する。
 * <p>希望乖離は、希望日・希望時間帯の外で働いた分数と、週の勤務時間と希望時間の差の絶対値の和。
 * 勤務時間の幅は全従業員の週勤務分数の最大と最小の差。</p>
 */
@Slf4j
@RequiredArgsConstructor
public class ObjectiveBuilder {

    private final ScheduleModel model;
    private final SchedulerPolicy policy;

    public void build() {
        CpModel cp = model.getCpModel();
        LinearExprBuilder objective = LinearExpr.newBuilder();
        long lambdaPref = policy.getPreferenceWeight();
        long lambdaUnmet = policy.getUnmetDemandWeight();
        long fairness = policy.getFairnessWeight();
        Map<String, Employee> employees = model.getInput().getEmployees().stream()
                .collect(Collectors.toMap(Employee::getId, Function.identity()));

        for (Map.Entry<ScheduleModel.EmployeeWindow, BoolVar> entry : model.getAssignments().entrySet()) {
            Employee e = employees.get(entry.getKey().employeeId());
            TimeWindow w = entry.getKey().window();
            long coef = ModelScale.wageCents(e.getHourlyWage(), w.durationMinutes());
            if (lambdaPref > 0 && !e.isPreferred(w.day(), w.startMinute(), w.endMinute())) {
                coef += lambdaPref * w.durationMinutes();
            }
            objective.addTerm(entry.getValue(), coef);
        }

        if (lambdaPref > 0) {
            for (Employee e : model.getInput().getEmployees()) {
                IntVar worked = model.getWorkedMinutes().get(e.getId());
                long target = Math.round(e.getPrefHours() * 60.0);
                long possible = model.getAssignments().keySet().stream()
                        .filter(k -> k.employeeId().equals(e.getId()))
                        .mapToLong(k -> k.window().durationMinutes())
                        .sum();
                IntVar deviation = cp.newIntVar(0, Math.max(target, possible), "dev_" + e.getId());
                // deviation >= |worked - target|
                cp.addGreaterOrEqual(deviation, LinearExpr.newBuilder().add(worked).add(-target));
                cp.addGreaterOrEqual(deviation, LinearExpr.newBuilder().addTerm(worked, -1).add(target));
                objective.addTerm(deviation, lambdaPref);
            }
        }

        if (lambdaUnmet > 0) {
            for (IntVar slack : model.getUnmet().values()) {
                objective.addTerm(slack, lambdaUnmet);
            }
        }
        if (fairness > 0 && model.getWorkedMinutes().size() > 1) {
            addWorkloadRange(cp, objective, fairness);
        }
        cp.minimize(objective);
        log.debug("Objective built: preferenceWeight={}, unmetDemandWeight={}, fairnessWeight={}",
                lambdaPref, lambdaUnmet, fairness);
    }

    /** maxWorked >= worked_e >= minWorked として、幅 (max - min) に重みを掛ける。 */
    private void addWorkloadRange(CpModel cp, LinearExprBuilder objective, long weight) {
        long upper = model.getWorkedMinutes().values().stream()
                .mapToLong(v -> v.getDomain().max())
                .max()
                .orElse(0);
        IntVar maxWorked = cp.newIntVar(0, upper, "max_worked");
        IntVar minWorked = cp.newIntVar(0, upper, "min_worked");
        for (IntVar worked : model.getWorkedMinutes().values()) {
            cp.addGreaterOrEqual(maxWorked, worked);
            cp.addLessOrEqual(minWorked, worked);
        }
        objective.addTerm(maxWorked, weight);
        objective.addTerm(minWorked, -weight);
    }
}
