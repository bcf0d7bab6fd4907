package io.github.riemr.staffing.optimization.solution;

import com.google.ortools.sat.CpSolverStatus;

public enum SolveStatus {
    OPTIMAL,
    FEASIBLE,
    INFEASIBLE,
    UNKNOWN;

    public boolean hasSolution() {
        return this == OPTIMAL || this == FEASIBLE;
    }

    /** MODEL_INVALID はモデル構築側の不具合なので例外にする。 */
    public static SolveStatus from(CpSolverStatus status) {
        switch (status) {
            case OPTIMAL:
                return OPTIMAL;
            case FEASIBLE:
                return FEASIBLE;
            case INFEASIBLE:
                return INFEASIBLE;
            case UNKNOWN:
                return UNKNOWN;
            default:
                throw new IllegalStateException("CP-SAT returned " + status);
        }
    }
}
