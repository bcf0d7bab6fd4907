package io.github.riemr.staffing.application.dto;

import java.util.List;

import io.github.riemr.staffing.optimization.solution.SolveStatus;
import lombok.Builder;
import lombok.Value;

/**
 * 管理者向け分析レポート。解に依存する項目は解がない場合 null。
 * feasibilityAnalysis は逆に解がない場合のみ設定される。
 */
@Value
@Builder
public class ManagementInsights {
    SolveStatus status;
    List<RoleCapacity> capacityAnalysis;
    List<HiringRecommendation> hiringRecommendations;
    FeasibilityAnalysis feasibilityAnalysis;

    List<PeakPeriod> peakPeriods;
    List<EmployeeUtilization> employeeUtilization;
    List<RoleDemand> roleDemand;
    List<CoverageGap> coverageGaps;
    CostAnalysis costAnalysis;
    WorkloadDistribution workloadDistribution;

    public boolean hasSolutionSections() {
        return employeeUtilization != null;
    }
}
