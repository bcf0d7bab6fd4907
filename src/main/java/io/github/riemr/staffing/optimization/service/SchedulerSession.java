package io.github.riemr.staffing.optimization.service;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

import com.google.ortools.sat.CpSolver;
import com.google.ortools.sat.CpSolverSolutionCallback;
import com.google.ortools.sat.CpSolverStatus;

import io.github.riemr.staffing.application.dto.ScorePoint;
import io.github.riemr.staffing.domain.model.DemandForecast;
import io.github.riemr.staffing.domain.model.SchedulerInput;
import io.github.riemr.staffing.optimization.config.NativeLibraries;
import io.github.riemr.staffing.optimization.config.SchedulerPolicy;
import io.github.riemr.staffing.optimization.config.SolverSettings;
import io.github.riemr.staffing.optimization.constraint.StaffingConstraintProvider;
import io.github.riemr.staffing.optimization.grid.TimeGrid;
import io.github.riemr.staffing.optimization.grid.TimeGridBuilder;
import io.github.riemr.staffing.optimization.model.DecisionVariableBuilder;
import io.github.riemr.staffing.optimization.model.ScheduleModel;
import io.github.riemr.staffing.optimization.objective.ObjectiveBuilder;
import io.github.riemr.staffing.optimization.solution.SolveResult;
import io.github.riemr.staffing.optimization.solution.SolveStatus;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 1 回の求解を表すセッション。生成時にモデルを組み立て (BUILT)、
 * {@link #solve(Duration)} で探索し (SOLVING)、結果の状態で終了する。
 * <p>セッションは使い捨てで、他のセッションと状態を共有しない。
 * {@link #cancel()} は別スレッドから呼び出してよく、その時点の最善解を返させる。</p>
 */
@Slf4j
public class SchedulerSession {

    public enum State {
        BUILT, SOLVING, OPTIMAL, FEASIBLE, INFEASIBLE, UNKNOWN;

        static State of(SolveStatus status) {
            return State.valueOf(status.name());
        }
    }

    private static final long STOP_RETRY_MILLIS = 20;

    @Getter
    private final TimeGrid grid;
    @Getter
    private final ScheduleModel model;
    private final SolverSettings settings;
    private final List<ScorePoint> scoreSeries = new CopyOnWriteArrayList<>();
    private final SolutionExtractor extractor = new SolutionExtractor();

    private volatile State state = State.BUILT;
    private volatile boolean cancelRequested = false;
    private volatile CpSolver solver;

    public SchedulerSession(SchedulerInput input, DemandForecast demand, SolverSettings settings, SchedulerPolicy policy) {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(demand, "demand");
        this.settings = Objects.requireNonNull(settings, "settings");
        Objects.requireNonNull(policy, "policy");
        NativeLibraries.ensureLoaded();

        this.grid = new TimeGridBuilder().build(input, demand);
        this.model = new DecisionVariableBuilder(input, grid).build();
        new StaffingConstraintProvider(model).defineConstraints();
        new ObjectiveBuilder(model, policy).build();
    }

    public State getState() {
        return state;
    }

    public List<ScorePoint> getScoreSeries() {
        return List.copyOf(scoreSeries);
    }

    /**
     * 探索を実行する。予算を使い切っても解がなければ UNKNOWN、
     * 解が 1 つ以上あれば FEASIBLE（最適性が証明されれば OPTIMAL）。
     *
     * @param budget 探索時間の上限（null / 0 以下なら既定値）
     * @return 求解結果
     * @throws IllegalStateException 2 回目の呼び出し、またはモデルが不正な場合
     */
    public SolveResult solve(Duration budget) {
        synchronized (this) {
            if (state != State.BUILT) {
                throw new IllegalStateException("Session already " + state);
            }
            state = State.SOLVING;
        }
        String invalid = model.getCpModel().validate();
        if (!invalid.isEmpty()) {
            state = State.UNKNOWN;
            throw new IllegalStateException("Invalid CP model: " + invalid);
        }

        Duration effective = settings.effectiveBudget(budget);
        CpSolver cpSolver = new CpSolver();
        cpSolver.getParameters().setMaxTimeInSeconds(effective.toMillis() / 1000.0);
        cpSolver.getParameters().setNumWorkers(settings.workers());
        cpSolver.getParameters().setLogSearchProgress(settings.logSearchProgress());
        // solver の公開と中断フラグの確認は cancel() と同じロックの中で行う
        synchronized (this) {
            if (cancelRequested) {
                log.warn("Solve cancelled before search started");
                return finish(SolveResult.withoutSolution(SolveStatus.UNKNOWN, 0.0));
            }
            this.solver = cpSolver;
        }

        log.info("Solve start: employees={}, windows={}, variables={}, budget={}",
                model.getInput().getEmployees().size(), grid.getWindows().size(),
                model.getCpModel().getBuilder().getVariablesCount(), effective);
        CpSolverStatus status;
        try {
            status = cpSolver.solve(model.getCpModel(), new ProgressCallback());
        } catch (RuntimeException e) {
            state = State.UNKNOWN;
            throw e;
        }
        SolveStatus outcome = SolveStatus.from(status);

        SolveResult result;
        if (outcome.hasSolution()) {
            result = new SolveResult(outcome,
                    extractor.extractSchedule(model, cpSolver),
                    cpSolver.objectiveValue(),
                    cpSolver.bestObjectiveBound(),
                    extractor.extractOutputs(model, cpSolver),
                    cpSolver.wallTime());
            log.info("Solve end: status={}, objective={}, wallTime={}s", outcome, result.objectiveValue(), cpSolver.wallTime());
        } else {
            result = SolveResult.withoutSolution(outcome, cpSolver.wallTime());
            log.warn("Solve end without schedule: status={}, wallTime={}s", outcome, cpSolver.wallTime());
        }
        return finish(result);
    }

    /**
     * 探索の中断を要求する。探索開始前なら solve は UNKNOWN を返す。
     * 探索中なら solve が戻るまで停止要求を繰り返す（探索の立ち上がり前の停止要求は CP-SAT に届かないため）。
     */
    public void cancel() {
        CpSolver s;
        synchronized (this) {
            cancelRequested = true;
            s = solver;
        }
        if (s == null) {
            return;
        }
        log.warn("Cancel requested during search");
        while (state == State.SOLVING) {
            s.stopSearch();
            try {
                Thread.sleep(STOP_RETRY_MILLIS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for search to stop");
                return;
            }
        }
    }

    private SolveResult finish(SolveResult result) {
        state = State.of(result.status());
        return result;
    }

    /** 改善解ごとにスコア推移を記録する。 */
    private class ProgressCallback extends CpSolverSolutionCallback {
        @Override
        public void onSolutionCallback() {
            ScorePoint point = new ScorePoint((long) (wallTime() * 1000), objectiveValue(), bestObjectiveBound());
            scoreSeries.add(point);
            log.debug("Improved solution: objective={}, bound={}, elapsed={}ms",
                    point.getObjective(), point.getBestBound(), point.getTimeMillis());
            if (cancelRequested) {
                stopSearch();
            }
        }
    }
}
