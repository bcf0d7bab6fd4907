package io.github.riemr.staffing.optimization.constraint;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.List;

import com.google.ortools.sat.BoolVar;
import com.google.ortools.sat.CpModel;
import com.google.ortools.sat.IntVar;
import com.google.ortools.sat.LinearExpr;
import com.google.ortools.sat.LinearExprBuilder;
import com.google.ortools.sat.Literal;

import io.github.riemr.staffing.application.util.SlotTimeUtils;
import io.github.riemr.staffing.domain.model.Employee;
import io.github.riemr.staffing.domain.model.Role;
import io.github.riemr.staffing.domain.model.SchedulerConfig;
import io.github.riemr.staffing.domain.model.SchedulerInput;
import io.github.riemr.staffing.optimization.grid.TimeGrid;
import io.github.riemr.staffing.optimization.grid.TimeWindow;
import io.github.riemr.staffing.optimization.model.ScheduleModel;
import lombok.extern.slf4j.Slf4j;

/**
 * シフト最適化のハード制約定義クラス
 * 決定変数に対して、勤務可否・職種・休憩・連続勤務・週上限・最少人数・需要充足の制約を張る。
 *
 * 需要充足は meetAllDemand の場合のみハード制約、それ以外は不足分をスラック変数で受けて
 * 目的関数側でペナルティを課す。
 */
@Slf4j
public class StaffingConstraintProvider {

    private final ScheduleModel model;
    private final SchedulerInput input;
    private final SchedulerConfig config;
    private final TimeGrid grid;
    private final CpModel cp;

    public StaffingConstraintProvider(ScheduleModel model) {
        this.model = model;
        this.input = model.getInput();
        this.config = input.getConfig();
        this.grid = model.getGrid();
        this.cp = model.getCpModel();
    }

    /**
     * 全制約の定義メソッド
     */
    public void defineConstraints() {
        linkAssignmentToRoles();
        linkHeadcounts();
        minimumPresence();
        dependentRoles();
        if (grid.isFixedShifts()) {
            oneShiftPerDay();
            fixedShiftConsecutiveLimit();
            overnightRestForFixedShifts();
        } else {
            restBetweenShifts();
            maxConsecutiveSlots();
            minimumShiftLength();
        }
        weeklyHours();
        demandSupply();
        log.debug("Constraints defined: {}", cp.getBuilder().getConstraintsCount());
    }

    /**
     * 割当と職種割当の整合（ハード制約）
     * 勤務している枠ではちょうど 1 つの職種に就く。
     */
    private void linkAssignmentToRoles() {
        for (Employee e : input.getEmployees()) {
            for (TimeWindow w : grid.getWindows()) {
                BoolVar x = model.assignment(e.getId(), w);
                if (x == null) continue;
                List<BoolVar> roles = new ArrayList<>();
                for (String roleId : e.getRoleIds()) {
                    roles.add(model.roleAssignment(e.getId(), roleId, w));
                }
                cp.addEquality(x, LinearExpr.sum(roles.toArray(new BoolVar[0])));
            }
        }
    }

    /**
     * 職種人数の定義（ハード制約）
     */
    private void linkHeadcounts() {
        for (Role r : input.getRoles()) {
            for (TimeWindow w : grid.getWindows()) {
                LinearExprBuilder sum = LinearExpr.newBuilder();
                for (Employee e : input.getEmployees()) {
                    BoolVar y = model.roleAssignment(e.getId(), r.getId(), w);
                    if (y != null) {
                        sum.add(y);
                    }
                }
                cp.addEquality(model.headcount(r.getId(), w), sum);
            }
        }
    }

    /**
     * 最少人数制約（ハード制約）
     * 営業枠では必ず minPresent 人以上、営業外の枠では 0 人か minPresent 人以上。
     */
    private void minimumPresence() {
        for (Role r : input.getRoles()) {
            int k = r.getMinPresent();
            if (k <= 0) continue;
            for (TimeWindow w : grid.getWindows()) {
                IntVar h = model.headcount(r.getId(), w);
                if (grid.isOpen(w)) {
                    cp.addGreaterOrEqual(h, k);
                } else if (model.headcountBound(r.getId(), w) < k) {
                    cp.addEquality(h, 0);
                } else if (k > 1) {
                    BoolVar staffed = cp.newBoolVar("staffed_" + r.getId() + "_" + w.day() + "_" + w.index());
                    cp.addGreaterOrEqual(h, k).onlyEnforceIf(staffed);
                    cp.addEquality(h, 0).onlyEnforceIf(staffed.not());
                }
            }
        }
    }

    /**
     * 非独立職種の単独配置禁止（ハード制約）
     * 同じ枠に相手職種が 1 人もいなければ配置できない。
     */
    private void dependentRoles() {
        for (Role r : input.getRoles()) {
            if (r.isIndependent()) continue;
            List<String> partners = input.partnerRoleIds(r.getId());
            for (TimeWindow w : grid.getWindows()) {
                int ub = model.headcountBound(r.getId(), w);
                if (ub == 0) continue;
                IntVar h = model.headcount(r.getId(), w);
                if (partners.isEmpty()) {
                    cp.addEquality(h, 0);
                    continue;
                }
                // h_r <= ub * Σ h_partner
                LinearExprBuilder expr = LinearExpr.newBuilder().addTerm(h, 1);
                for (String p : partners) {
                    expr.addTerm(model.headcount(p, w), -ub);
                }
                cp.addLessOrEqual(expr, 0);
            }
        }
    }

    /**
     * 勤務間休憩（ハード制約）
     * 勤務と勤務の間に 1 枠以上 minRestSlots 枠未満の空きを作らない。日付をまたぐ場合も同様。
     */
    private void restBetweenShifts() {
        int minRest = config.getMinRestSlots();
        if (minRest <= 1) return;
        for (Employee e : input.getEmployees()) {
            for (DayOfWeek day : grid.getDays()) {
                List<TimeWindow> today = grid.windowsOn(day);
                forbidShortGaps(e, today, 0, minRest);
                DayOfWeek next = grid.nextDay(day);
                if (next != null) {
                    List<TimeWindow> span = new ArrayList<>(today);
                    span.addAll(grid.windowsOn(next));
                    forbidShortGaps(e, span, today.size(), minRest);
                }
            }
        }
    }

    /**
     * windows[t] と windows[t+g+1] に勤務し、その間 g 枠がすべて空きとなるパターンを禁止する。
     * secondFrom 以上の位置で 2 つ目の勤務が始まるパターンだけを対象にする。
     */
    private void forbidShortGaps(Employee e, List<TimeWindow> windows, int secondFrom, int minRest) {
        int n = windows.size();
        int firstLimit = secondFrom == 0 ? n : secondFrom;
        for (int t = 0; t < firstLimit; t++) {
            BoolVar first = model.assignment(e.getId(), windows.get(t));
            if (first == null) continue;
            for (int gap = 1; gap < minRest; gap++) {
                int s = t + gap + 1;
                if (s >= n) break;
                if (s < secondFrom) continue;
                BoolVar second = model.assignment(e.getId(), windows.get(s));
                if (second == null) continue;
                LinearExprBuilder expr = LinearExpr.newBuilder().add(first).add(second);
                for (int i = t + 1; i < s; i++) {
                    BoolVar mid = model.assignment(e.getId(), windows.get(i));
                    if (mid != null) {
                        expr.addTerm(mid, -1);
                    }
                }
                cp.addLessOrEqual(expr, 1);
            }
        }
    }

    /**
     * 連続勤務上限（ハード制約）
     * 任意の連続 maxConsecSlots+1 枠のうち勤務できるのは maxConsecSlots 枠まで。
     * 翌日も時間軸に含まれる場合は日付をまたいで数える。
     */
    private void maxConsecutiveSlots() {
        for (Employee e : input.getEmployees()) {
            int limit = e.getMaxConsecSlots();
            for (List<TimeWindow> span : grid.continuousSpans()) {
                for (int t = 0; t + limit < span.size(); t++) {
                    List<BoolVar> run = new ArrayList<>();
                    for (int i = t; i <= t + limit; i++) {
                        BoolVar x = model.assignment(e.getId(), span.get(i));
                        if (x != null) run.add(x);
                    }
                    if (run.size() > limit) {
                        cp.addLessOrEqual(LinearExpr.sum(run.toArray(new BoolVar[0])), limit);
                    }
                }
            }
        }
    }

    /**
     * 最短勤務長（ハード制約）
     * 枠 t で勤務が始まる (x[t]=1, x[t-1]=0) なら続く minShiftLengthSlots-1 枠も勤務する。
     * 日の終わりや勤務不可枠で打ち切られる位置からは勤務を始められない。
     */
    private void minimumShiftLength() {
        int length = config.getMinShiftLengthSlots();
        if (length <= 1) return;
        for (Employee e : input.getEmployees()) {
            for (DayOfWeek day : grid.getDays()) {
                List<TimeWindow> windows = grid.windowsOn(day);
                for (int t = 0; t < windows.size(); t++) {
                    BoolVar x = model.assignment(e.getId(), windows.get(t));
                    if (x == null) continue;
                    BoolVar prev = t == 0 ? null : model.assignment(e.getId(), windows.get(t - 1));
                    for (int k = 1; k < length; k++) {
                        int i = t + k;
                        BoolVar follow = i < windows.size() ? model.assignment(e.getId(), windows.get(i)) : null;
                        LinearExprBuilder start = LinearExpr.newBuilder().add(x);
                        if (prev != null) {
                            start.addTerm(prev, -1);
                        }
                        if (follow == null) {
                            cp.addLessOrEqual(start, 0);
                            break;
                        }
                        start.addTerm(follow, -1);
                        cp.addLessOrEqual(start, 0);
                    }
                }
            }
        }
    }

    /**
     * 固定シフト: 1 日 1 シフトまで（ハード制約）
     */
    private void oneShiftPerDay() {
        for (Employee e : input.getEmployees()) {
            for (DayOfWeek day : grid.getDays()) {
                List<Literal> shifts = new ArrayList<>();
                for (TimeWindow w : grid.windowsOn(day)) {
                    BoolVar x = model.assignment(e.getId(), w);
                    if (x != null) shifts.add(x);
                }
                if (shifts.size() > 1) {
                    cp.addAtMostOne(shifts);
                }
            }
        }
    }

    /**
     * 固定シフト: 連続勤務上限（ハード制約）
     * 24:00 終了のシフトと翌日 0:00 開始のシフトは続けて 1 つの勤務とみなす。
     * 続けた合計スロット数が maxConsecSlots を超える組合せは、どれか 1 つを外す。
     * 単独で上限を超えるシフトには入れない。
     */
    private void fixedShiftConsecutiveLimit() {
        for (Employee e : input.getEmployees()) {
            for (DayOfWeek day : grid.getDays()) {
                for (TimeWindow w : grid.windowsOn(day)) {
                    BoolVar x = model.assignment(e.getId(), w);
                    if (x == null) continue;
                    List<BoolVar> run = new ArrayList<>();
                    run.add(x);
                    limitContinuousRun(e, w, run, grid.slotsOf(w));
                }
            }
        }
    }

    private void limitContinuousRun(Employee e, TimeWindow last, List<BoolVar> run, int slots) {
        if (slots > e.getMaxConsecSlots()) {
            cp.addLessOrEqual(LinearExpr.sum(run.toArray(new BoolVar[0])), run.size() - 1);
            return;
        }
        if (last.endMinute() != SlotTimeUtils.MINUTES_PER_DAY) return;
        DayOfWeek next = grid.nextDay(last.day());
        if (next == null) return;
        for (TimeWindow w : grid.windowsOn(next)) {
            if (w.startMinute() != 0) continue;
            BoolVar x = model.assignment(e.getId(), w);
            if (x == null) continue;
            run.add(x);
            limitContinuousRun(e, w, run, slots + grid.slotsOf(w));
            run.remove(run.size() - 1);
        }
    }

    /**
     * 固定シフト: 日をまたぐ勤務間休憩（ハード制約）
     */
    private void overnightRestForFixedShifts() {
        int minRest = config.getMinRestSlots();
        if (minRest <= 0) return;
        for (Employee e : input.getEmployees()) {
            for (DayOfWeek day : grid.getDays()) {
                DayOfWeek next = grid.nextDay(day);
                if (next == null) continue;
                for (TimeWindow late : grid.windowsOn(day)) {
                    BoolVar a = model.assignment(e.getId(), late);
                    if (a == null) continue;
                    for (TimeWindow early : grid.windowsOn(next)) {
                        BoolVar b = model.assignment(e.getId(), early);
                        if (b == null) continue;
                        int idle = SlotTimeUtils.MINUTES_PER_DAY - late.endMinute() + early.startMinute();
                        if (idle > 0 && idle / grid.getSlotMinutes() < minRest) {
                            cp.addLessOrEqual(LinearExpr.sum(new BoolVar[] {a, b}), 1);
                        }
                    }
                }
            }
        }
    }

    /**
     * 週労働時間上限（ハード制約）
     */
    private void weeklyHours() {
        for (Employee e : input.getEmployees()) {
            long capMinutes = (long) Math.floor(e.getMaxHoursPerWeek() * 60.0 + 1e-9);
            cp.addLessOrEqual(model.getWorkedMinutes().get(e.getId()), capMinutes);
        }
    }

    /**
     * 需要充足
     * meetAllDemand ならハード制約、そうでなければ supply + unmet >= demand。
     */
    private void demandSupply() {
        for (TimeWindow w : grid.getWindows()) {
            long demand = grid.demandCenti(w);
            if (demand <= 0) continue;
            IntVar supply = model.getSupplies().get(w);
            IntVar slack = model.getUnmet().get(w);
            if (slack == null) {
                cp.addGreaterOrEqual(supply, demand);
            } else {
                cp.addGreaterOrEqual(LinearExpr.sum(new IntVar[] {supply, slack}), demand);
            }
        }
    }
}
