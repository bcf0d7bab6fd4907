package io.github.riemr.staffing.optimization.solution;

import java.util.List;

/**
 * 求解結果。解が得られなかった場合 schedule / objectiveValue は null。
 *
 * @param objectiveValue     目的関数値（人件費セント + ペナルティ）
 * @param bestObjectiveBound 探索終了時点の下界
 * @param windowOutputs      需要または処理量のある枠ごとの内訳
 */
public record SolveResult(
    SolveStatus status,
    Schedule schedule,
    Double objectiveValue,
    Double bestObjectiveBound,
    List<WindowOutput> windowOutputs,
    double wallTimeSeconds
) {
    public static SolveResult withoutSolution(SolveStatus status, double wallTimeSeconds) {
        return new SolveResult(status, null, null, null, List.of(), wallTimeSeconds);
    }

    public boolean hasSolution() {
        return schedule != null;
    }

    public double totalUnmetItems() {
        return windowOutputs.stream().mapToDouble(WindowOutput::unmetItems).sum();
    }
}
