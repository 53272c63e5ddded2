/*
 * どこで: Dispatch アプリの設定バインド
 * 何を: token bucket の容量/補充速度をチャネル別・ユーザ別に保持する
 * なぜ: 外部プロバイダの送信上限に合わせて流量を絞るため
 */
package com.example.dispatch.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Positive;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "dispatch.rate-limit")
@Validated
public record RateLimitProperties(
    boolean enabled,
    @Positive int defaultCapacity,
    double defaultRefillPerSecond,
    Map<String, BucketLimit> channels,
    BucketLimit perUser) {

  public RateLimitProperties {
    channels = channels == null ? Map.of() : Map.copyOf(channels);
  }

  public record BucketLimit(int capacity, double refillPerSecond) {}

  public BucketLimit channelLimit(String channel) {
    final BucketLimit configured = channels.get(channel);
    return configured == null ? new BucketLimit(defaultCapacity, defaultRefillPerSecond) : configured;
  }

  @AssertTrue(message = "dispatch.rate-limit bucket capacity and refill must be positive")
  public boolean isBucketLimitsValid() {
    final boolean channelsValid = channels.values().stream().allMatch(this::isValid);
    return defaultRefillPerSecond > 0 && channelsValid && (perUser == null || isValid(perUser));
  }

  private boolean isValid(BucketLimit limit) {
    return limit != null && limit.capacity() > 0 && limit.refillPerSecond() > 0;
  }
}
