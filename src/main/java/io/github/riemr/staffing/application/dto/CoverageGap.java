package io.github.riemr.staffing.application.dto;

import java.time.DayOfWeek;
import java.util.List;
import java.util.Objects;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CoverageGap {

    private DayOfWeek day;

    private String window;

    private double demandItems;

    private double suppliedItems;

    private Integer requiredStaff;

    private Integer assignedStaff;

    private List<String> shortRoles;

    private boolean critical;

    public double getCoverageRate() {
        if (demandItems <= 0) {
            return 1.0;
        }
        return suppliedItems / demandItems;
    }

    public Integer getBalance() {
        if (requiredStaff == null || assignedStaff == null) {
            return null;
        }
        return assignedStaff - requiredStaff;
    }

    public boolean isShortage() {
        Integer balance = getBalance();
        return balance != null && balance < 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CoverageGap)) return false;
        CoverageGap that = (CoverageGap) o;
        return day == that.day && Objects.equals(window, that.window);
    }

    @Override
    public int hashCode() {
        return Objects.hash(day, window);
    }

    @Override
    public String toString() {
        return "CoverageGap{" +
                "day=" + day +
                ", window='" + window + '\'' +
                ", demandItems=" + demandItems +
                ", suppliedItems=" + suppliedItems +
                ", requiredStaff=" + requiredStaff +
                ", assignedStaff=" + assignedStaff +
                ", shortRoles=" + shortRoles +
                ", critical=" + critical +
                '}';
    }
}
