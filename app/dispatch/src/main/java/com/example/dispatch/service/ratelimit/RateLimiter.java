/*
 * どこで: Dispatch rate limit
 * 何を: キー単位の送信許可判定を抽象化する
 * なぜ: 共有ストアの実装を差し替えても配信ワーカー側を変えないため
 */
package com.example.dispatch.service.ratelimit;

public interface RateLimiter {

  /** token を 1 つ消費できた場合に true。残量が無ければ消費せず false。 */
  boolean tryAcquire(String key);
}
