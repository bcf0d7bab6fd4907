package io.github.riemr.staffing.domain.model;

import io.github.riemr.staffing.exception.SchedulerConfigException;
import lombok.Builder;
import lombok.Value;

/**
 * 職種。producing の場合のみ 1 人 1 時間あたりの処理アイテム数を持つ。
 */
@Value
public class Role {

    String id;
    boolean producing;
    Double itemsPerEmployeePerHour;
    int minPresent;
    boolean independent;

    @Builder
    public Role(String id, boolean producing, Double itemsPerEmployeePerHour, Integer minPresent, Boolean independent) {
        if (id == null || id.isBlank()) {
            throw new SchedulerConfigException("Role id is required");
        }
        if (producing && (itemsPerEmployeePerHour == null || !(itemsPerEmployeePerHour > 0))) {
            throw SchedulerConfigException.of("Role", id, "producing role requires positive itemsPerEmployeePerHour");
        }
        if (!producing && itemsPerEmployeePerHour != null) {
            throw SchedulerConfigException.of("Role", id, "itemsPerEmployeePerHour is only allowed on producing roles");
        }
        if (minPresent != null && minPresent < 0) {
            throw SchedulerConfigException.of("Role", id, "minPresent must be >= 0");
        }
        this.id = id;
        this.producing = producing;
        this.itemsPerEmployeePerHour = itemsPerEmployeePerHour;
        this.minPresent = minPresent == null ? 0 : minPresent;
        this.independent = independent == null || independent;
    }

    public double getRateOrZero() {
        return producing ? itemsPerEmployeePerHour : 0.0;
    }
}
