package io.github.riemr.staffing.optimization.solution;

import java.util.Locale;
import java.util.StringJoiner;

import io.github.riemr.staffing.domain.model.Employee;
import io.github.riemr.staffing.domain.model.SchedulerInput;

/**
 * 求解結果をログや画面にそのまま出せるテキストにまとめる。
 */
public final class SolutionDescriber {
    private SolutionDescriber() {}

    private static final String RULE = "=".repeat(60);

    public static String describe(SchedulerInput input, SolveResult result) {
        StringJoiner out = new StringJoiner("\n");
        out.add(RULE);
        if (result == null || !result.hasSolution()) {
            out.add("NO SOLUTION FOUND");
            out.add(RULE);
            if (result != null) {
                out.add("Status: " + result.status());
            }
            return out.toString();
        }
        out.add("SOLUTION FOUND");
        out.add(RULE);
        out.add("Status: " + result.status());
        out.add(String.format(Locale.ROOT, "Objective: %.2f", result.objectiveValue()));

        out.add("");
        out.add("--- Employee Stats ---");
        Schedule schedule = result.schedule();
        for (Employee e : input.getEmployees()) {
            double hours = schedule.hoursOf(e.getId());
            out.add(String.format(Locale.ROOT, "%s: %.1fh worked (pref: %.1fh, dev: %.1fh)",
                    e.getId(), hours, e.getPrefHours(), Math.abs(hours - e.getPrefHours())));
        }

        out.add("");
        out.add("--- Schedule ---");
        for (ScheduledWindow sw : schedule.allWindows()) {
            for (StaffAssignment a : sw.staff()) {
                out.add("  " + sw.window().label() + ": " + a.employeeId() + " -> " + a.roleId());
            }
        }

        out.add("");
        if (result.totalUnmetItems() > 0) {
            out.add("--- Unmet Demand ---");
            for (WindowOutput o : result.windowOutputs()) {
                if (o.unmetItems() > 0) {
                    out.add(String.format(Locale.ROOT, "  %s: %.1f items", o.window().label(), o.unmetItems()));
                }
            }
        } else {
            out.add("--- All demand satisfied ---");
        }
        return out.toString();
    }
}
