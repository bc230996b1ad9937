package com.aireciudadano.acquisition.prometheus;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.aireciudadano.acquisition.config.AcquisitionProperties;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class RetryPolicyTest {

  @Test
  void backoffGrowsExponentiallyAndIsCapped() {
    RetryPolicy policy = new RetryPolicy(5, Duration.ofMillis(500), 2.0, Duration.ofSeconds(3));

    assertThat(policy.maxAttempts()).isEqualTo(6);
    assertThat(policy.backoffBefore(1)).isEqualTo(Duration.ofMillis(500));
    assertThat(policy.backoffBefore(2)).isEqualTo(Duration.ofMillis(1000));
    assertThat(policy.backoffBefore(3)).isEqualTo(Duration.ofMillis(2000));
    assertThat(policy.backoffBefore(4)).isEqualTo(Duration.ofSeconds(3));
  }

  @Test
  void classifiesRetryableStatuses() {
    RetryPolicy policy = new RetryPolicy(3, Duration.ZERO, 1.0, Duration.ZERO);

    assertThat(policy.isRetryableStatus(500)).isTrue();
    assertThat(policy.isRetryableStatus(503)).isTrue();
    assertThat(policy.isRetryableStatus(408)).isTrue();
    assertThat(policy.isRetryableStatus(429)).isTrue();
    assertThat(policy.isRetryableStatus(400)).isFalse();
    assertThat(policy.isRetryableStatus(422)).isFalse();
  }

  @Test
  void buildsFromPropertiesDefaults() {
    RetryPolicy policy = RetryPolicy.from(new AcquisitionProperties().getRetry());

    assertThat(policy.maxRetries()).isEqualTo(3);
    assertThat(policy.initialBackoff()).isEqualTo(Duration.ofMillis(500));
  }

  @Test
  void rejectsInvalidSettings() {
    assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(-1, Duration.ZERO, 2.0, Duration.ZERO));
    assertThrows(IllegalArgumentException.class, () -> new RetryPolicy(1, Duration.ZERO, 0.5, Duration.ZERO));
  }
}
