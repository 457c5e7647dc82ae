package com.mk.fx.qa.load.generator.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class RequestOutcomeTest {

  @Test
  void exceptionOutcome_hasNoLatency() {
    var outcome = RequestOutcome.exception("ConnectException");

    assertThat(outcome.isSuccess()).isFalse();
    assertThat(outcome.latency()).isNull();
    assertThatThrownBy(outcome::latencySeconds).isInstanceOf(IllegalStateException.class);
  }

  @Test
  void errorStatus_withoutBody_keepsEmptyDetail() {
    var outcome = RequestOutcome.errorStatus(Duration.ofMillis(3), 404, null);

    assertThat(outcome.detail()).isEmpty();
    assertThat(outcome.latencySeconds()).isEqualTo(0.003);
  }

  @Test
  void responseOutcomes_requireLatency() {
    assertThatThrownBy(() -> RequestOutcome.success(null, 200))
        .isInstanceOf(NullPointerException.class);
    assertThatThrownBy(() -> RequestOutcome.success(Duration.ofMillis(-1), 200))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void runResult_neverHoldsMoreOutcomesThanExpected() {
    var outcome = RequestOutcome.success(Duration.ofMillis(1), 200);

    assertThatThrownBy(() -> new RunResult(List.of(outcome, outcome), 1, false))
        .isInstanceOf(IllegalArgumentException.class);
    assertThat(new RunResult(List.of(outcome), 3, true).size()).isEqualTo(1);
  }
}
