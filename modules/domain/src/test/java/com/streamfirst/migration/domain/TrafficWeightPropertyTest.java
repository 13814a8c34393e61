package com.streamfirst.migration.domain;

import net.jqwik.api.ForAll;
import net.jqwik.api.Label;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class TrafficWeightPropertyTest {

    @Property
    @Label("Shifting keeps the split summing to 100")
    void shiftKeepsSum(@ForAll @IntRange(min = 0, max = 100) int newWeight,
                       @ForAll @IntRange(min = 1, max = 100) int step) {
        var shifted = TrafficWeight.ofNewWeight(newWeight).shiftBy(step);

        assertThat(shifted.oldWeight() + shifted.newWeight()).isEqualTo(100);
        assertThat(shifted.newWeight()).isGreaterThanOrEqualTo(newWeight);
    }

    @Property
    @Label("Repeated steps reach 0/100 and complete exactly once")
    void repeatedStepsComplete(@ForAll @IntRange(min = 1, max = 100) int step) {
        var now = Instant.parse("2024-06-01T00:00:00Z");
        var state = MigrationState.initial(new MigrationId("prop"), step, now)
                .transitionTo(MigrationPhase.VALIDATING, now)
                .transitionTo(MigrationPhase.SHIFTING, now);

        int steps = 0;
        while (!state.getPhase().isTerminal()) {
            var before = state.getCurrentWeight();
            state = state.shiftStep(now);
            steps++;
            assertThat(state.getLastGoodWeight()).isEqualTo(before);
            assertThat(state.getCurrentWeight().oldWeight() + state.getCurrentWeight().newWeight()).isEqualTo(100);
        }

        assertThat(state.getPhase()).isEqualTo(MigrationPhase.COMPLETED);
        assertThat(state.getCurrentWeight()).isEqualTo(TrafficWeight.ALL_NEW);
        assertThat(steps).isEqualTo((100 + step - 1) / step);
    }
}
