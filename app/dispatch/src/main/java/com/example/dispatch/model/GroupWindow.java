/*
 * どこで: Dispatch ドメインモデル
 * 何を: group_windows の 1 行を表現する
 * なぜ: 窓の開閉と digest ジョブの対応をプロセス間で共有するため
 */
package com.example.dispatch.model;

import java.time.Instant;
import java.util.UUID;

public record GroupWindow(
    UUID windowId,
    String groupKey,
    String userId,
    String type,
    AggregationStrategy strategy,
    Instant windowStart,
    Instant windowEnd,
    WindowState state,
    int memberCount,
    UUID digestJobId,
    Instant createdAt,
    Instant updatedAt,
    Instant closedAt) {

  public boolean acceptsAt(Instant now) {
    return state == WindowState.OPEN && now.isBefore(windowEnd);
  }
}
