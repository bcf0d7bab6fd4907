package io.github.riemr.staffing.domain.model;

import static io.github.riemr.staffing.SchedulingFixtures.mondayEmployee;
import static io.github.riemr.staffing.SchedulingFixtures.producing;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.DayOfWeek;
import java.util.List;

import org.junit.jupiter.api.Test;

import io.github.riemr.staffing.exception.SchedulerConfigException;

class SchedulerInputTest {

    @Test
    void build_fails_whenEmployeeReferencesUndeclaredRole() {
        assertThatThrownBy(() -> SchedulerInput.builder()
                .role(producing("cook", 10))
                .employee(mondayEmployee("e1", 10, 8, 18, "cashier").build())
                .build())
                .isInstanceOf(SchedulerConfigException.class)
                .hasMessageContaining("e1")
                .hasMessageContaining("cashier");
    }

    @Test
    void build_fails_whenChainReferencesUndeclaredRole() {
        assertThatThrownBy(() -> SchedulerInput.builder()
                .role(producing("cook", 10))
                .chain(ProductionChain.builder().id("kitchen").roleId("cook").roleId("prep").contribFactor(0.8).build())
                .build())
                .isInstanceOf(SchedulerConfigException.class)
                .hasMessageContaining("kitchen");
    }

    @Test
    void build_fails_whenRoleDeclaredTwice() {
        assertThatThrownBy(() -> SchedulerInput.builder()
                .role(producing("cook", 10))
                .role(producing("cook", 12))
                .build())
                .isInstanceOf(SchedulerConfigException.class)
                .hasMessageContaining("declared twice");
    }

    @Test
    void partnerRoles_areChainMates_orEveryOtherRole() {
        SchedulerInput input = SchedulerInput.builder()
                .role(producing("prep", 20))
                .role(producing("cook", 15))
                .role(Role.builder().id("runner").producing(false).independent(false).build())
                .role(Role.builder().id("trainee").producing(false).independent(false).build())
                .chain(ProductionChain.builder().id("kitchen").roleId("prep").roleId("cook").roleId("trainee").build())
                .build();

        assertThat(input.partnerRoleIds("trainee")).containsExactly("prep", "cook");
        assertThat(input.partnerRoleIds("runner")).containsExactly("prep", "cook", "trainee");
    }

    @Test
    void employee_rejectsPreferredHoursOutsideAvailability() {
        assertThatThrownBy(() -> mondayEmployee("e1", 10, 8, 12, "cook")
                .preferredHour(DayOfWeek.MONDAY, TimeRange.ofHours(11, 14))
                .build())
                .isInstanceOf(SchedulerConfigException.class)
                .hasMessageContaining("preferredHours");
    }

    @Test
    void employee_rejectsPreferredDayThatIsNotAvailable() {
        assertThatThrownBy(() -> mondayEmployee("e1", 10, 8, 12, "cook")
                .preferredDay(DayOfWeek.FRIDAY)
                .build())
                .isInstanceOf(SchedulerConfigException.class);
    }

    @Test
    void employee_rejectsNonPositiveWage() {
        assertThatThrownBy(() -> mondayEmployee("e1", 0, 8, 12, "cook").build())
                .isInstanceOf(SchedulerConfigException.class)
                .hasMessageContaining("hourlyWage");
    }

    @Test
    void employee_availabilityDefaultsToFullDay_andPreferenceChecks() {
        Employee e = Employee.builder().id("e1").roleId("cook").hourlyWage(10.0)
                .availableDay(DayOfWeek.TUESDAY)
                .availableDay(DayOfWeek.WEDNESDAY)
                .availableHour(DayOfWeek.WEDNESDAY, TimeRange.of("09:00", "17:00"))
                .preferredHour(DayOfWeek.WEDNESDAY, TimeRange.of("10:00", "12:00"))
                .build();

        assertThat(e.availabilityOn(DayOfWeek.TUESDAY)).isEqualTo(TimeRange.FULL_DAY);
        assertThat(e.availabilityOn(DayOfWeek.MONDAY)).isNull();
        assertThat(e.isAvailableFor(DayOfWeek.WEDNESDAY, 8 * 60, 9 * 60)).isFalse();
        assertThat(e.isPreferred(DayOfWeek.WEDNESDAY, 10 * 60, 11 * 60)).isTrue();
        assertThat(e.isPreferred(DayOfWeek.WEDNESDAY, 12 * 60, 13 * 60)).isFalse();
        assertThat(e.isPreferred(DayOfWeek.TUESDAY, 10 * 60, 11 * 60)).isFalse();
        assertThat(e.weeklyAvailableMinutes()).isEqualTo(24 * 60 + 8 * 60);
        assertThat(e.getMaxHoursPerWeek()).isEqualTo(40.0);
        assertThat(e.getMaxConsecSlots()).isEqualTo(8);
    }

    @Test
    void role_requiresRateOnlyWhenProducing() {
        assertThatThrownBy(() -> Role.builder().id("cook").producing(true).build())
                .isInstanceOf(SchedulerConfigException.class);
        assertThatThrownBy(() -> Role.builder().id("host").producing(false).itemsPerEmployeePerHour(3.0).build())
                .isInstanceOf(SchedulerConfigException.class);
        Role host = Role.builder().id("host").minPresent(1).build();
        assertThat(host.isIndependent()).isTrue();
        assertThat(host.getMinPresent()).isEqualTo(1);
    }

    @Test
    void chain_rejectsContribFactorAboveOne() {
        assertThatThrownBy(() -> ProductionChain.builder().id("c").roleIds(List.of("a")).contribFactor(1.2).build())
                .isInstanceOf(SchedulerConfigException.class)
                .hasMessageContaining("contribFactor");
    }

    @Test
    void chain_rejectsContribFactorFinerThanHundredths() {
        assertThatThrownBy(() -> ProductionChain.builder().id("c").roleIds(List.of("a")).contribFactor(0.333).build())
                .isInstanceOf(SchedulerConfigException.class)
                .hasMessageContaining("multiple of 0.01");
        assertThat(ProductionChain.builder().id("c").roleIds(List.of("a")).contribFactor(0.07).build().getContribFactor())
                .isEqualTo(0.07);
    }

    @Test
    void config_rejectsSlotLengthThatIsNotWholeMinutes() {
        assertThatThrownBy(() -> SchedulerConfig.builder().slotLenHour(0.3333).build())
                .isInstanceOf(SchedulerConfigException.class);
        assertThat(SchedulerConfig.builder().slotLenHour(0.25).build().getSlotMinutes()).isEqualTo(15);
    }

    @Test
    void demandForecast_rejectsNegativeCountsAndBadHours() {
        assertThatThrownBy(() -> DemandForecast.builder().items(DayOfWeek.MONDAY, 9, -1))
                .isInstanceOf(SchedulerConfigException.class);
        assertThatThrownBy(() -> DemandForecast.builder().items(DayOfWeek.MONDAY, 24, 1))
                .isInstanceOf(SchedulerConfigException.class);
        DemandForecast f = DemandForecast.builder().hour(DayOfWeek.MONDAY, 9, 3, 12).items(DayOfWeek.MONDAY, 10, 0).build();
        assertThat(f.itemsAt(DayOfWeek.MONDAY, 9)).isEqualTo(12);
        assertThat(f.demandDays()).containsExactly(DayOfWeek.MONDAY);
        assertThat(f.totalItems()).isEqualTo(12);
    }
}
