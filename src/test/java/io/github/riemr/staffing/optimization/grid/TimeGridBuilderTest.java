package io.github.riemr.staffing.optimization.grid;

import static io.github.riemr.staffing.SchedulingFixtures.mondayEmployee;
import static io.github.riemr.staffing.SchedulingFixtures.producing;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.DayOfWeek;
import java.util.List;

import org.junit.jupiter.api.Test;

import io.github.riemr.staffing.domain.model.DemandForecast;
import io.github.riemr.staffing.domain.model.SchedulerConfig;
import io.github.riemr.staffing.domain.model.SchedulerInput;
import io.github.riemr.staffing.domain.model.ShiftDefinition;
import io.github.riemr.staffing.domain.model.TimeRange;
import io.github.riemr.staffing.exception.SchedulerConfigException;

class TimeGridBuilderTest {

    private final TimeGridBuilder builder = new TimeGridBuilder();

    private SchedulerInput input(SchedulerConfig config) {
        return SchedulerInput.builder()
                .role(producing("cook", 10))
                .employee(mondayEmployee("e1", 10, 8, 18, "cook").build())
                .config(config)
                .build();
    }

    @Test
    void uniformGrid_coversWholeDay_andTruncatesLastWindow() {
        TimeGrid grid = builder.build(input(SchedulerConfig.builder().slotLenHour(0.7).build()), DemandForecast.empty());

        List<TimeWindow> monday = grid.windowsOn(DayOfWeek.MONDAY);
        assertThat(monday).hasSize(35);
        assertThat(monday.get(0).startMinute()).isZero();
        assertThat(monday.get(34).startMinute()).isEqualTo(34 * 42);
        assertThat(monday.get(34).endMinute()).isEqualTo(1440);
        assertThat(grid.getDays()).containsExactly(DayOfWeek.MONDAY);
    }

    @Test
    void activeDays_includeDemandDaysWithoutAvailability() {
        DemandForecast demand = DemandForecast.builder().items(DayOfWeek.SATURDAY, 12, 5).build();

        TimeGrid grid = builder.build(input(SchedulerConfig.builder().build()), demand);

        assertThat(grid.getDays()).containsExactly(DayOfWeek.MONDAY, DayOfWeek.SATURDAY);
        assertThat(grid.nextDay(DayOfWeek.MONDAY)).isNull();
        assertThat(grid.nextDay(DayOfWeek.SATURDAY)).isNull();
    }

    @Test
    void demand_isSplitProRataAcrossHalfHourWindows() {
        DemandForecast demand = DemandForecast.builder().items(DayOfWeek.MONDAY, 9, 30).build();

        TimeGrid grid = builder.build(input(SchedulerConfig.builder().slotLenHour(0.5).build()), demand);

        List<TimeWindow> monday = grid.windowsOn(DayOfWeek.MONDAY);
        assertThat(grid.demandItems(monday.get(18))).isEqualTo(15.0);
        assertThat(grid.demandItems(monday.get(19))).isEqualTo(15.0);
        assertThat(grid.demandItems(monday.get(20))).isZero();
        assertThat(grid.isOpen(monday.get(18))).isTrue();
        assertThat(grid.isOpen(monday.get(20))).isFalse();
    }

    @Test
    void operatingHours_defineOpenWindows_andDropClosedDemand() {
        SchedulerConfig config = SchedulerConfig.builder()
                .operatingHour(DayOfWeek.MONDAY, TimeRange.ofHours(9, 12))
                .build();
        DemandForecast demand = DemandForecast.builder()
                .items(DayOfWeek.MONDAY, 10, 8)
                .items(DayOfWeek.MONDAY, 20, 4)
                .build();

        TimeGrid grid = builder.build(input(config), demand);

        assertThat(grid.getOpenWindows()).extracting(TimeWindow::startMinute).containsExactly(540, 600, 660);
        assertThat(grid.totalDemandCenti()).isEqualTo(800);
    }

    @Test
    void build_fails_whenMinShiftLengthExceedsSlotsPerDay() {
        SchedulerConfig config = SchedulerConfig.builder().slotLenHour(4.0).minShiftLengthSlots(7).build();

        assertThatThrownBy(() -> builder.build(input(config), DemandForecast.empty()))
                .isInstanceOf(SchedulerConfigException.class)
                .hasMessageContaining("minShiftLengthSlots");
    }

    @Test
    void build_fails_whenFixedShiftsHaveNoWindows() {
        SchedulerConfig config = SchedulerConfig.builder().fixedShifts(true).build();

        assertThatThrownBy(() -> builder.build(input(config), DemandForecast.empty()))
                .isInstanceOf(SchedulerConfigException.class)
                .hasMessageContaining("fixedShifts");
    }

    @Test
    void build_fails_whenFixedShiftsOverlap() {
        SchedulerConfig config = SchedulerConfig.builder()
                .fixedShifts(true)
                .shiftWindow(ShiftDefinition.of("morning", "06:00", "14:00"))
                .shiftWindow(ShiftDefinition.of("mid", "12:00", "20:00"))
                .build();

        assertThatThrownBy(() -> builder.build(input(config), DemandForecast.empty()))
                .isInstanceOf(SchedulerConfigException.class)
                .hasMessageContaining("overlaps");
    }

    @Test
    void build_fails_whenFixedShiftIsShorterThanMinimumLength() {
        SchedulerConfig config = SchedulerConfig.builder()
                .minShiftLengthSlots(4)
                .fixedShifts(true)
                .shiftWindow(ShiftDefinition.of("peak", "11:00", "13:00"))
                .build();

        assertThatThrownBy(() -> builder.build(input(config), DemandForecast.empty()))
                .isInstanceOf(SchedulerConfigException.class)
                .hasMessageContaining("peak");
    }

    @Test
    void fixedShifts_becomeWindows_andCollectDemandInsideThem() {
        SchedulerConfig config = SchedulerConfig.builder()
                .fixedShifts(true)
                .shiftWindow(ShiftDefinition.of("evening", "14:00", "22:00"))
                .shiftWindow(ShiftDefinition.of("morning", "06:00", "14:00"))
                .build();
        DemandForecast demand = DemandForecast.builder()
                .items(DayOfWeek.MONDAY, 8, 10)
                .items(DayOfWeek.MONDAY, 9, 5)
                .items(DayOfWeek.MONDAY, 23, 7)
                .build();

        TimeGrid grid = builder.build(input(config), demand);

        List<TimeWindow> monday = grid.windowsOn(DayOfWeek.MONDAY);
        assertThat(monday).extracting(TimeWindow::name).containsExactly("morning", "evening");
        assertThat(grid.demandItems(monday.get(0))).isEqualTo(15.0);
        assertThat(grid.demandItems(monday.get(1))).isZero();
        assertThat(grid.slotsOf(monday.get(0))).isEqualTo(8);
    }
}
