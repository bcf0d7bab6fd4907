package io.github.riemr.staffing.optimization.solution;

import io.github.riemr.staffing.optimization.grid.TimeWindow;

/**
 * 枠ごとの需要と処理量（アイテム数）。
 */
public record WindowOutput(TimeWindow window, double demandItems, double suppliedItems, double unmetItems, boolean open) {

    public double servedItems() {
        return Math.min(demandItems, suppliedItems);
    }

    public double coverageRate() {
        return demandItems <= 0 ? 1.0 : Math.min(1.0, suppliedItems / demandItems);
    }
}
