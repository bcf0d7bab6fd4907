package io.github.riemr.staffing.exception;

/**
 * スケジューラ入力の構造的な不備を表す例外。
 * 値の補正は行わず、検出した時点で即座に送出する。
 */
public class SchedulerConfigException extends IllegalArgumentException {

    public SchedulerConfigException(String message) {
        super(message);
    }

    public static SchedulerConfigException of(String entity, String id, String detail) {
        return new SchedulerConfigException(entity + " '" + id + "': " + detail);
    }
}
