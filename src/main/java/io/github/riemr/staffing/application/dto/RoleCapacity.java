package io.github.riemr.staffing.application.dto;

/**
 * 職種ごとの理論能力。求解結果に依存しない。
 *
 * @param potentialOutput 生産職種のみ。勤務可能時間 × 時間あたり処理数
 * @param capacityRatio   potentialOutput / 総需要（需要 0 または非生産職種は null）
 */
public record RoleCapacity(
    String roleId,
    boolean producing,
    int minPresent,
    int eligibleEmployees,
    double availableHours,
    Double potentialOutput,
    Double capacityRatio,
    boolean sufficient
) {}
