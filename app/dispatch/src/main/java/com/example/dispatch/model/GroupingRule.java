/*
 * どこで: Dispatch ドメインモデル
 * 何を: 通知種別ごとの grouping 規則(窓幅/次元/戦略/上限件数)を保持する
 * なぜ: group key の導出と早期 flush の判定を規則単位で行うため
 */
package com.example.dispatch.model;

import java.time.Duration;

public record GroupingRule(
    String type, Duration window, String dimension, AggregationStrategy strategy, Integer maxItems) {

  /** userId と type、dimension があれば data 上のその値から group key を作る。 */
  public String groupKeyFor(NotificationJob candidate) {
    final StringBuilder key = new StringBuilder();
    key.append(candidate.userId()).append(':').append(type);
    if (dimension != null && !dimension.isBlank()) {
      final Object value = candidate.payload().data().get(dimension);
      key.append(':').append(value == null ? "-" : value.toString());
    }
    return key.toString();
  }

  public boolean reachesLimit(int memberCount) {
    return maxItems != null && memberCount >= maxItems;
  }
}
