package io.github.riemr.staffing.optimization.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.ortools.sat.BoolVar;
import com.google.ortools.sat.CpModel;
import com.google.ortools.sat.IntVar;

import io.github.riemr.staffing.domain.model.SchedulerInput;
import io.github.riemr.staffing.optimization.grid.TimeGrid;
import io.github.riemr.staffing.optimization.grid.TimeWindow;
import lombok.Getter;

/**
 * 決定変数の集合。キーは record で表し、変数が存在しない組合せは割当不可を意味する。
 */
@Getter
public class ScheduleModel {

    public record EmployeeWindow(String employeeId, TimeWindow window) {}

    public record EmployeeRoleWindow(String employeeId, String roleId, TimeWindow window) {}

    public record RoleWindow(String roleId, TimeWindow window) {}

    public record LineWindow(String lineId, TimeWindow window) {}

    private final CpModel cpModel = new CpModel();
    private final SchedulerInput input;
    private final TimeGrid grid;

    private final Map<EmployeeWindow, BoolVar> assignments = new LinkedHashMap<>();
    private final Map<EmployeeRoleWindow, BoolVar> roleAssignments = new LinkedHashMap<>();
    private final Map<RoleWindow, IntVar> headcounts = new LinkedHashMap<>();
    private final Map<RoleWindow, Integer> headcountBounds = new LinkedHashMap<>();
    private final List<ProductionLine> lines = new ArrayList<>();
    private final Map<LineWindow, IntVar> rawOutputs = new LinkedHashMap<>();
    private final Map<LineWindow, IntVar> scaledOutputs = new LinkedHashMap<>();
    private final Map<LineWindow, Long> scaledBounds = new LinkedHashMap<>();
    private final Map<TimeWindow, IntVar> supplies = new LinkedHashMap<>();
    private final Map<TimeWindow, IntVar> unmet = new LinkedHashMap<>();
    private final Map<String, IntVar> workedMinutes = new LinkedHashMap<>();

    public ScheduleModel(SchedulerInput input, TimeGrid grid) {
        this.input = input;
        this.grid = grid;
    }

    public BoolVar assignment(String employeeId, TimeWindow window) {
        return assignments.get(new EmployeeWindow(employeeId, window));
    }

    public BoolVar roleAssignment(String employeeId, String roleId, TimeWindow window) {
        return roleAssignments.get(new EmployeeRoleWindow(employeeId, roleId, window));
    }

    public IntVar headcount(String roleId, TimeWindow window) {
        return headcounts.get(new RoleWindow(roleId, window));
    }

    public int headcountBound(String roleId, TimeWindow window) {
        return headcountBounds.getOrDefault(new RoleWindow(roleId, window), 0);
    }
}
