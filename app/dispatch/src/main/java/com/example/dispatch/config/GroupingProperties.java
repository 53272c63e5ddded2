/*
 * どこで: Dispatch アプリの設定バインド
 * 何を: 通知種別ごとの grouping 規則と flush 間隔を保持する
 * なぜ: まとめ配信の対象と窓幅をコード変更なしに切り替えるため
 */
package com.example.dispatch.config;

import com.example.dispatch.model.AggregationStrategy;
import jakarta.validation.constraints.AssertTrue;
import java.time.Duration;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "dispatch.grouping")
@Validated
public record GroupingProperties(boolean enabled, Duration flushInterval, Map<String, Rule> rules) {

  public GroupingProperties {
    rules = rules == null ? Map.of() : Map.copyOf(rules);
  }

  public record Rule(Duration window, String dimension, AggregationStrategy strategy, Integer maxItems) {}

  @AssertTrue(message = "dispatch.grouping.rules window must be positive and max-items >= 1")
  public boolean isRulesValid() {
    return rules.values().stream()
        .allMatch(
            rule ->
                rule.window() != null
                    && !rule.window().isZero()
                    && !rule.window().isNegative()
                    && (rule.maxItems() == null || rule.maxItems() >= 1));
  }
}
