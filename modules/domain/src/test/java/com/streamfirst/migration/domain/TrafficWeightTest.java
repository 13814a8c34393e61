package com.streamfirst.migration.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TrafficWeightTest {

  @Test
  void rejects_weights_not_summing_to_hundred() {
    assertThatThrownBy(() -> new TrafficWeight(60, 30))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("sum to 100");
  }

  @Test
  void rejects_negative_weight() {
    assertThatThrownBy(() -> new TrafficWeight(110, -10))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void shift_moves_step_to_new_environment() {
    var weight = new TrafficWeight(80, 20).shiftBy(20);

    assertThat(weight).isEqualTo(new TrafficWeight(60, 40));
  }

  @Test
  void shift_is_capped_at_all_new() {
    var weight = new TrafficWeight(30, 70).shiftBy(50);

    assertThat(weight).isEqualTo(TrafficWeight.ALL_NEW);
    assertThat(weight.isAllNew()).isTrue();
  }

  @Test
  void shift_rejects_step_outside_range() {
    assertThatThrownBy(() -> TrafficWeight.ALL_OLD.shiftBy(0))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> TrafficWeight.ALL_OLD.shiftBy(101))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void renders_as_old_slash_new() {
    assertThat(new TrafficWeight(60, 40)).hasToString("60/40");
  }
}
