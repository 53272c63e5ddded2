/*
 * どこで: Dispatch アプリの設定バインド
 * 何を: キューの lease/backoff/最大試行回数の設定を保持する
 * なぜ: 再試行間隔と dead 判定の閾値を環境ごとに調整するため
 */
package com.example.dispatch.config;

import com.example.dispatch.model.Priority;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "dispatch.queue")
@Validated
public record DispatchQueueProperties(
    @NotNull Duration lease,
    @NotNull Duration backoffBase,
    @NotNull Duration backoffMax,
    double backoffExponentBase,
    double backoffJitterMin,
    double backoffJitterMax,
    @NotNull Duration backoffMin,
    @Positive int defaultMaxAttempts,
    Map<Priority, Integer> maxAttemptsByPriority,
    @Positive int errorMessageMaxLength) {

  public DispatchQueueProperties {
    maxAttemptsByPriority =
        maxAttemptsByPriority == null || maxAttemptsByPriority.isEmpty()
            ? Map.of()
            : new EnumMap<>(maxAttemptsByPriority);
  }

  public int maxAttemptsFor(Priority priority) {
    final Integer configured = maxAttemptsByPriority.get(priority);
    return configured == null ? defaultMaxAttempts : configured;
  }

  @AssertTrue(message = "dispatch.queue.lease must be positive")
  public boolean isLeasePositive() {
    return isPositiveDuration(lease);
  }

  @AssertTrue(message = "dispatch.queue.backoff-max must not be shorter than backoff-base")
  public boolean isBackoffRangeValid() {
    return backoffBase != null && backoffMax != null && backoffMax.compareTo(backoffBase) >= 0;
  }

  @AssertTrue(message = "dispatch.queue.backoff-jitter-min must be positive and <= backoff-jitter-max")
  public boolean isJitterRangeValid() {
    return backoffJitterMin > 0 && backoffJitterMin <= backoffJitterMax;
  }

  @AssertTrue(message = "dispatch.queue.max-attempts-by-priority values must be positive")
  public boolean isMaxAttemptsByPriorityValid() {
    return maxAttemptsByPriority.values().stream().allMatch(value -> value != null && value > 0);
  }

  private boolean isPositiveDuration(Duration duration) {
    return duration != null && !duration.isZero() && !duration.isNegative();
  }
}
