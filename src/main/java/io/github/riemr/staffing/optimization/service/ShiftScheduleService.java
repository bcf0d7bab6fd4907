package io.github.riemr.staffing.optimization.service;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.springframework.stereotype.Service;

import io.github.riemr.staffing.application.dto.ManagementInsights;
import io.github.riemr.staffing.application.dto.ScorePoint;
import io.github.riemr.staffing.application.service.ManagementInsightsService;
import io.github.riemr.staffing.domain.model.DemandForecast;
import io.github.riemr.staffing.domain.model.SchedulerInput;
import io.github.riemr.staffing.optimization.config.SchedulerPolicy;
import io.github.riemr.staffing.optimization.config.SolverSettings;
import io.github.riemr.staffing.optimization.solution.SolutionDescriber;
import io.github.riemr.staffing.optimization.solution.SolveResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * CP-SAT による週次シフト計算を制御するサービス。
 * <ul>
 *   <li>入力と需要予測からセッションを生成して同期的に求解</li>
 *   <li>ProblemKey 付きの求解は別スレッドからキャンセル可能</li>
 *   <li>結果（または解なし）から管理者向け分析レポートを生成</li>
 * </ul>
 * 求解ごとに独立したセッションを使うため、異なる組織の求解は並行に実行できる。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ShiftScheduleService {

    /* === Collaborators === */
    private final SolverSettings solverSettings;
    private final SchedulerPolicy policy;
    private final ManagementInsightsService insightsService;

    /* === Runtime State === */
    private final Map<ProblemKey, SchedulerSession> activeSessions = new ConcurrentHashMap<>();
    // 直近の求解のスコア推移
    private final Map<ProblemKey, List<ScorePoint>> scoreSeriesMap = new ConcurrentHashMap<>();

    /**
     * シフトを求解する。
     *
     * @param input  組織設定・従業員・職種
     * @param demand 需要予測
     * @param budget 探索時間の上限（null なら既定値）
     * @return 求解結果。実行不能・時間切れも結果として返す
     * @throws io.github.riemr.staffing.exception.SchedulerConfigException 入力が構造的に不正な場合
     */
    public SolveResult solve(SchedulerInput input, DemandForecast demand, Duration budget) {
        return newSession(input, demand).solve(budget);
    }

    /**
     * キャンセル可能な求解。同じキーで実行中の求解がある場合は IllegalStateException。
     */
    public SolveResult solve(ProblemKey key, SchedulerInput input, DemandForecast demand, Duration budget) {
        SchedulerSession session = newSession(input, demand);
        if (activeSessions.putIfAbsent(key, session) != null) {
            throw new IllegalStateException("A solve is already running for " + key);
        }
        try {
            log.info("Solve requested for {}", key);
            SolveResult result = session.solve(budget);
            scoreSeriesMap.put(key, session.getScoreSeries());
            return result;
        } finally {
            activeSessions.remove(key, session);
        }
    }

    /**
     * 実行中の求解に中断を要求する。
     *
     * @return 該当する求解が実行中だった場合 true
     */
    public boolean cancel(ProblemKey key) {
        SchedulerSession session = activeSessions.get(key);
        if (session == null) {
            return false;
        }
        log.warn("Cancel requested for {}", key);
        session.cancel();
        return true;
    }

    public boolean isSolving(ProblemKey key) {
        return activeSessions.containsKey(key);
    }

    public List<ScorePoint> getScoreSeries(ProblemKey key) {
        return scoreSeriesMap.getOrDefault(key, List.of());
    }

    /**
     * 分析レポートを生成する。result が null（未求解・解なし）の場合は
     * 能力分析・採用提案・実行可能性分析のみを含む。
     */
    public ManagementInsights generateInsights(SchedulerInput input, DemandForecast demand, SolveResult result) {
        return insightsService.generate(input, demand, result);
    }

    /**
     * 求解結果の要約テキスト（勤務時間・割当一覧・未充足需要）。解なしの場合はその旨のみ。
     */
    public String describe(SchedulerInput input, SolveResult result) {
        return SolutionDescriber.describe(input, result);
    }

    private SchedulerSession newSession(SchedulerInput input, DemandForecast demand) {
        return new SchedulerSession(input, demand, solverSettings, policy);
    }
}
