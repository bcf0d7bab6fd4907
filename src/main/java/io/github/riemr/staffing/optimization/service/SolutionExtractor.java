package io.github.riemr.staffing.optimization.service;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import com.google.ortools.sat.BoolVar;
import com.google.ortools.sat.CpSolver;
import com.google.ortools.sat.IntVar;

import io.github.riemr.staffing.domain.model.Employee;
import io.github.riemr.staffing.optimization.grid.TimeGrid;
import io.github.riemr.staffing.optimization.grid.TimeWindow;
import io.github.riemr.staffing.optimization.model.ModelScale;
import io.github.riemr.staffing.optimization.model.ScheduleModel;
import io.github.riemr.staffing.optimization.solution.ScheduledWindow;
import io.github.riemr.staffing.optimization.solution.Schedule;
import io.github.riemr.staffing.optimization.solution.StaffAssignment;
import io.github.riemr.staffing.optimization.solution.WindowOutput;

/**
 * ソルバーの変数値から勤務表と枠ごとの処理量を取り出す。
 */
class SolutionExtractor {

    Schedule extractSchedule(ScheduleModel model, CpSolver solver) {
        TimeGrid grid = model.getGrid();
        Map<DayOfWeek, List<ScheduledWindow>> byDay = new EnumMap<>(DayOfWeek.class);
        for (DayOfWeek day : grid.getDays()) {
            List<ScheduledWindow> windows = new ArrayList<>();
            for (TimeWindow w : grid.windowsOn(day)) {
                List<StaffAssignment> staff = new ArrayList<>();
                for (Employee e : model.getInput().getEmployees()) {
                    BoolVar x = model.assignment(e.getId(), w);
                    if (x == null || !solver.booleanValue(x)) continue;
                    for (String roleId : e.getRoleIds()) {
                        if (solver.booleanValue(model.roleAssignment(e.getId(), roleId, w))) {
                            staff.add(new StaffAssignment(e.getId(), roleId));
                        }
                    }
                }
                if (!staff.isEmpty()) {
                    windows.add(new ScheduledWindow(w, staff));
                }
            }
            byDay.put(day, windows);
        }
        return new Schedule(byDay);
    }

    List<WindowOutput> extractOutputs(ScheduleModel model, CpSolver solver) {
        TimeGrid grid = model.getGrid();
        List<WindowOutput> outputs = new ArrayList<>();
        for (TimeWindow w : grid.getWindows()) {
            long demand = grid.demandCenti(w);
            IntVar supplyVar = model.getSupplies().get(w);
            long supply = supplyVar == null ? 0 : solver.value(supplyVar);
            if (demand == 0 && supply == 0) continue;
            long unmet = Math.max(0, demand - supply);
            outputs.add(new WindowOutput(w, ModelScale.toItems(demand), ModelScale.toItems(supply),
                    ModelScale.toItems(unmet), grid.isOpen(w)));
        }
        return outputs;
    }
}
