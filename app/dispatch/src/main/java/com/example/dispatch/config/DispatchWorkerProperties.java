/*
 * どこで: Dispatch アプリの設定バインド
 * 何を: 配信ワーカー数/バッチ/タイムアウト/アイドル待機の設定を保持する
 * なぜ: 並列度と外部チャネルへの待ち時間を運用で調整するため
 */
package com.example.dispatch.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "dispatch.worker")
@Validated
public record DispatchWorkerProperties(
    boolean enabled,
    @Positive int workerCount,
    @Positive int batchSize,
    @NotNull Duration deliveryTimeout,
    @NotNull Duration throttleDelay,
    @NotNull Duration idleBackoffMin,
    @NotNull Duration idleBackoffMax,
    @NotBlank String workerIdPrefix) {

  @AssertTrue(message = "dispatch.worker.delivery-timeout must be positive")
  public boolean isDeliveryTimeoutPositive() {
    return deliveryTimeout != null && !deliveryTimeout.isZero() && !deliveryTimeout.isNegative();
  }

  @AssertTrue(message = "dispatch.worker.idle-backoff-max must not be shorter than idle-backoff-min")
  public boolean isIdleBackoffRangeValid() {
    // null は @NotNull で検出する前提。
    return idleBackoffMin == null
        || idleBackoffMax == null
        || (!idleBackoffMin.isNegative() && idleBackoffMax.compareTo(idleBackoffMin) >= 0);
  }
}
