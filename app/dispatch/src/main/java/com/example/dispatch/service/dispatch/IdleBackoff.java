/*
 * どこで: Dispatch 配信層
 * 何を: キューが空のときのポーリング待機時間を指数的に伸ばし jitter を掛ける
 * なぜ: アイドル時に全ワーカーが同じ周期で DB を叩かないようにするため
 */
package com.example.dispatch.service.dispatch;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

final class IdleBackoff {

  private final long minMillis;
  private final long maxMillis;
  private long currentMillis;

  IdleBackoff(Duration min, Duration max) {
    this.minMillis = Math.max(1, min.toMillis());
    this.maxMillis = Math.max(minMillis, max.toMillis());
    this.currentMillis = minMillis;
  }

  /** [current/2, current] の範囲で待機時間を返し、次回の上限を倍にする。min を下回らない。 */
  Duration next() {
    final long ceiling = currentMillis;
    currentMillis = Math.min(currentMillis * 2, maxMillis);
    final long floor = Math.max(minMillis, ceiling / 2);
    if (floor >= ceiling) {
      return Duration.ofMillis(ceiling);
    }
    return Duration.ofMillis(ThreadLocalRandom.current().nextLong(floor, ceiling + 1));
  }

  void reset() {
    currentMillis = minMillis;
  }
}
