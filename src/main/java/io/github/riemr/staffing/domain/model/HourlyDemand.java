package io.github.riemr.staffing.domain.model;

import io.github.riemr.staffing.exception.SchedulerConfigException;

/** 1 時間あたりの予測注文数・アイテム数。 */
public record HourlyDemand(int orderCount, int itemCount) {

    public static final HourlyDemand NONE = new HourlyDemand(0, 0);

    public HourlyDemand {
        if (orderCount < 0 || itemCount < 0) {
            throw new SchedulerConfigException("Demand counts must be >= 0 but were " + orderCount + "/" + itemCount);
        }
    }
}
