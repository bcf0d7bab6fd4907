package io.github.riemr.staffing.application.dto;

import java.util.List;

/**
 * 解が得られなかった場合の原因分析。primaryCause は最も重大な問題のメッセージ。
 */
public record FeasibilityAnalysis(String primaryCause, List<FeasibilityIssue> issues) {

    public boolean hasIssues() {
        return !issues.isEmpty();
    }
}
