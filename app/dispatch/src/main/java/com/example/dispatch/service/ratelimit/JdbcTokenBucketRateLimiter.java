/*
 * どこで: Dispatch rate limit
 * 何を: Postgres 上の token bucket でキーごとの送信枠を判定する
 * なぜ: 複数プロセスのワーカーが同じ送信上限を共有するため
 */
package com.example.dispatch.service.ratelimit;

import com.example.dispatch.config.RateLimitProperties;
import com.example.dispatch.config.RateLimitProperties.BucketLimit;
import com.example.dispatch.repository.RateLimitBucketRepository;
import java.time.Clock;
import java.time.Instant;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class JdbcTokenBucketRateLimiter implements RateLimiter {

  private static final Logger logger = LoggerFactory.getLogger(JdbcTokenBucketRateLimiter.class);

  private final RateLimitBucketRepository bucketRepository;
  private final RateLimitProperties properties;
  private final Clock clock;

  @Override
  public boolean tryAcquire(String key) {
    if (!properties.enabled()) {
      return true;
    }
    final BucketLimit limit = resolveLimit(key);
    if (limit == null) {
      return true;
    }
    try {
      final boolean acquired =
          bucketRepository.tryConsume(key, limit.capacity(), limit.refillPerSecond(), Instant.now(clock));
      if (!acquired) {
        logger.debug("rate limit denied key={} capacity={}", key, limit.capacity());
      }
      return acquired;
    } catch (DataAccessException ex) {
      // 共有ストアに到達できない間は送信しない
      logger.warn("rate limit store unavailable; denying key={}", key, ex);
      return false;
    }
  }

  /** per-user 設定が無い場合、ユーザキーは無制限として扱う。 */
  BucketLimit resolveLimit(String key) {
    if (key.startsWith(RateLimitKeys.CHANNEL_PREFIX)) {
      return properties.channelLimit(key.substring(RateLimitKeys.CHANNEL_PREFIX.length()));
    }
    if (key.startsWith(RateLimitKeys.USER_PREFIX)) {
      return properties.perUser();
    }
    return new BucketLimit(properties.defaultCapacity(), properties.defaultRefillPerSecond());
  }
}
