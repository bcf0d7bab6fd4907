package io.github.riemr.staffing.optimization.model;

import java.util.ArrayList;
import java.util.List;

import com.google.ortools.sat.BoolVar;
import com.google.ortools.sat.CpModel;
import com.google.ortools.sat.IntVar;
import com.google.ortools.sat.LinearExpr;
import com.google.ortools.sat.LinearExprBuilder;

import io.github.riemr.staffing.domain.model.Employee;
import io.github.riemr.staffing.domain.model.ProductionChain;
import io.github.riemr.staffing.domain.model.Role;
import io.github.riemr.staffing.domain.model.SchedulerInput;
import io.github.riemr.staffing.optimization.grid.TimeGrid;
import io.github.riemr.staffing.optimization.grid.TimeWindow;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 時間軸上に決定変数を生成する。
 * <ul>
 *   <li>x[e,w]: 従業員 e が枠 w 全体に勤務可能な場合のみ生成する割当変数</li>
 *   <li>y[e,r,w]: 職種 r としての割当</li>
 *   <li>h[r,w]: 職種の人数（上限は候補者数）</li>
 *   <li>raw[l,w] / scaled[l,w]: ラインの理論処理量と貢献率適用後の処理量 (1/100 アイテム)</li>
 *   <li>supply[w], unmet[w], worked[e]</li>
 * </ul>
 * 処理量の定義式（raw, scaled, supply, worked）もここで張る。
 */
@Slf4j
@RequiredArgsConstructor
public class DecisionVariableBuilder {

    private final SchedulerInput input;
    private final TimeGrid grid;

    public ScheduleModel build() {
        ScheduleModel model = new ScheduleModel(input, grid);
        createAssignments(model);
        createHeadcounts(model);
        createProductionLines(model);
        createSupplies(model);
        createWorkedMinutes(model);
        log.debug("Decision variables: assignments={}, roleAssignments={}, headcounts={}, lines={}",
                model.getAssignments().size(), model.getRoleAssignments().size(),
                model.getHeadcounts().size(), model.getLines().size());
        return model;
    }

    private void createAssignments(ScheduleModel model) {
        CpModel cp = model.getCpModel();
        for (Employee e : input.getEmployees()) {
            for (TimeWindow w : grid.getWindows()) {
                if (!e.isAvailableFor(w.day(), w.startMinute(), w.endMinute())) {
                    continue;
                }
                String suffix = e.getId() + "_" + w.day() + "_" + w.index();
                model.getAssignments().put(new ScheduleModel.EmployeeWindow(e.getId(), w), cp.newBoolVar("x_" + suffix));
                for (String roleId : e.getRoleIds()) {
                    model.getRoleAssignments().put(new ScheduleModel.EmployeeRoleWindow(e.getId(), roleId, w),
                            cp.newBoolVar("y_" + roleId + "_" + suffix));
                }
            }
        }
    }

    private void createHeadcounts(ScheduleModel model) {
        CpModel cp = model.getCpModel();
        for (Role r : input.getRoles()) {
            for (TimeWindow w : grid.getWindows()) {
                int candidates = 0;
                for (Employee e : input.getEmployees()) {
                    if (model.roleAssignment(e.getId(), r.getId(), w) != null) {
                        candidates++;
                    }
                }
                ScheduleModel.RoleWindow key = new ScheduleModel.RoleWindow(r.getId(), w);
                model.getHeadcounts().put(key, cp.newIntVar(0, candidates, "h_" + r.getId() + "_" + w.day() + "_" + w.index()));
                model.getHeadcountBounds().put(key, candidates);
            }
        }
    }

    private void createProductionLines(ScheduleModel model) {
        List<ProductionLine> lines = new ArrayList<>();
        for (ProductionChain chain : input.getChains()) {
            List<Role> roles = chain.getRoleIds().stream().map(input::role).toList();
            ProductionLine line = ProductionLine.ofChain(chain, roles);
            if (line.producingRoles().isEmpty()) {
                log.debug("Chain {} has no producing role and supplies nothing", chain.getId());
                continue;
            }
            lines.add(line);
        }
        for (Role r : input.getRoles()) {
            if (r.isProducing() && input.chainsOf(r.getId()).isEmpty()) {
                lines.add(ProductionLine.implicitFor(r));
            }
        }
        model.getLines().addAll(lines);

        CpModel cp = model.getCpModel();
        for (ProductionLine line : lines) {
            for (TimeWindow w : grid.getWindows()) {
                LinearExprBuilder rawExpr = LinearExpr.newBuilder();
                long rawUpper = 0;
                for (Role r : line.producingRoles()) {
                    long perHead = ModelScale.itemsCenti(r.getItemsPerEmployeePerHour(), w.durationMinutes());
                    rawExpr.addTerm(model.headcount(r.getId(), w), perHead);
                    rawUpper += perHead * model.headcountBound(r.getId(), w);
                }
                String suffix = line.id().replace(':', '_') + "_" + w.day() + "_" + w.index();
                IntVar raw = cp.newIntVar(0, rawUpper, "raw_" + suffix);
                cp.addEquality(raw, rawExpr);

                ModelScale.Fraction f = line.contribution();
                long scaledUpper = rawUpper * f.numerator() / f.denominator();
                IntVar scaled = cp.newIntVar(0, scaledUpper, "scaled_" + suffix);
                if (f.isOne()) {
                    cp.addEquality(scaled, raw);
                } else {
                    // scaled = raw * num / den を除算等式で表す
                    cp.addDivisionEquality(scaled, LinearExpr.term(raw, f.numerator()), LinearExpr.constant(f.denominator()));
                }
                ScheduleModel.LineWindow key = new ScheduleModel.LineWindow(line.id(), w);
                model.getRawOutputs().put(key, raw);
                model.getScaledOutputs().put(key, scaled);
                model.getScaledBounds().put(key, scaledUpper);
            }
        }
    }

    private void createSupplies(ScheduleModel model) {
        CpModel cp = model.getCpModel();
        boolean soft = !input.getConfig().isMeetAllDemand();
        for (TimeWindow w : grid.getWindows()) {
            List<IntVar> scaled = new ArrayList<>();
            long upper = 0;
            for (ProductionLine line : model.getLines()) {
                ScheduleModel.LineWindow key = new ScheduleModel.LineWindow(line.id(), w);
                scaled.add(model.getScaledOutputs().get(key));
                upper += model.getScaledBounds().get(key);
            }
            IntVar supply = cp.newIntVar(0, upper, "supply_" + w.day() + "_" + w.index());
            cp.addEquality(supply, LinearExpr.sum(scaled.toArray(new IntVar[0])));
            model.getSupplies().put(w, supply);

            long demand = grid.demandCenti(w);
            if (soft && demand > 0) {
                model.getUnmet().put(w, cp.newIntVar(0, demand, "unmet_" + w.day() + "_" + w.index()));
            }
        }
    }

    private void createWorkedMinutes(ScheduleModel model) {
        CpModel cp = model.getCpModel();
        for (Employee e : input.getEmployees()) {
            LinearExprBuilder minutes = LinearExpr.newBuilder();
            long upper = 0;
            for (TimeWindow w : grid.getWindows()) {
                BoolVar x = model.assignment(e.getId(), w);
                if (x != null) {
                    minutes.addTerm(x, w.durationMinutes());
                    upper += w.durationMinutes();
                }
            }
            IntVar worked = cp.newIntVar(0, upper, "worked_" + e.getId());
            cp.addEquality(worked, minutes);
            model.getWorkedMinutes().put(e.getId(), worked);
        }
    }
}
