/*
 * どこで: Dispatch データアクセス
 * 何を: rate_limit_buckets の token 補充と消費を 1 文で行う
 * なぜ: 全プロセスで共有する送信枠を、読み取りと更新の間の競合なしに消費するため
 */
package com.example.dispatch.repository;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class RateLimitBucketRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /**
   * 経過時間分を補充したうえで token を 1 つ消費する。
   *
   * @return 消費できた場合は true。残量不足の場合は行を更新せず false
   */
  public boolean tryConsume(String bucketKey, int capacity, double refillPerSecond, Instant now) {
    // 初回は満タンから 1 消費した状態で作成する。
    // 既存行は ON CONFLICT 側で補充後の残量が 1 以上のときだけ更新し、RETURNING の有無で判定する。
    final String sql =
        """
        INSERT INTO rate_limit_buckets AS b (bucket_key, tokens, refreshed_at)
        VALUES (:bucketKey, :capacity - 1, :now)
        ON CONFLICT (bucket_key) DO UPDATE
        SET tokens = LEAST(
                       CAST(:capacity AS double precision),
                       b.tokens + GREATEST(0, EXTRACT(EPOCH FROM (CAST(:now AS timestamptz) - b.refreshed_at)))
                         * :refillPerSecond) - 1,
            refreshed_at = GREATEST(b.refreshed_at, CAST(:now AS timestamptz))
        WHERE LEAST(
                CAST(:capacity AS double precision),
                b.tokens + GREATEST(0, EXTRACT(EPOCH FROM (CAST(:now AS timestamptz) - b.refreshed_at)))
                  * :refillPerSecond) >= 1
        RETURNING b.tokens
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("bucketKey", bucketKey)
            .addValue("capacity", capacity)
            .addValue("refillPerSecond", refillPerSecond)
            .addValue("now", toTimestamp(now));
    final List<Double> remaining = jdbcTemplate.queryForList(sql, params, Double.class);
    return !remaining.isEmpty();
  }
}
