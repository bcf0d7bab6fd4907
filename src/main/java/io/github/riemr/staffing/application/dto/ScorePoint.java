package io.github.riemr.staffing.application.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class ScorePoint {
    private long timeMillis;
    private double objective;
    private double bestBound;
}
