/*
 * どこで: Dispatch ドメインモデル
 * 何を: grouping への offer 結果を表現する
 * なぜ: 呼び出し側が合流/新規窓/バイパスを区別して応答を組み立てるため
 */
package com.example.dispatch.model;

import java.time.Instant;
import java.util.UUID;

public record OfferResult(
    Disposition disposition, UUID jobId, String groupKey, UUID windowId, Instant windowEnd) {

  public enum Disposition {
    MERGED,
    WINDOW_OPENED,
    BYPASSED
  }

  public static OfferResult bypassed(UUID jobId) {
    return new OfferResult(Disposition.BYPASSED, jobId, null, null, null);
  }

  public boolean isBypassed() {
    return disposition == Disposition.BYPASSED;
  }
}
