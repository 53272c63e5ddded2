/*
 * どこで: Dispatch キュー
 * 何を: 再試行までの待ち時間を指数バックオフ + jitter で求める
 * なぜ: 一時障害中のチャネルへ再試行が同時に集中しないようにするため
 */
package com.example.dispatch.service.queue;

import com.example.dispatch.config.DispatchQueueProperties;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class BackoffPolicy {

  private final DispatchQueueProperties properties;

  /**
   * 再試行回数 {@code attempt} (1 始まり) に対する待ち時間を返す。
   *
   * <p>base * exponentBase^(attempt-1) を backoff-max で頭打ちにし、jitter 倍率を掛ける。
   */
  public Duration computeBackoff(int attempt) {
    double baseMillis = properties.backoffBase().toMillis();
    double exp = baseMillis * Math.pow(properties.backoffExponentBase(), Math.max(0, attempt - 1));
    double capped = Math.min(exp, properties.backoffMax().toMillis());
    double jitterMin = properties.backoffJitterMin();
    double jitterMax = properties.backoffJitterMax();
    double jitter = jitterMin + ThreadLocalRandom.current().nextDouble() * (jitterMax - jitterMin);
    long backoffMillis = (long) Math.ceil(capped * jitter);
    long minMillis = properties.backoffMin().toMillis();
    return Duration.ofMillis(Math.max(minMillis, backoffMillis));
  }
}
