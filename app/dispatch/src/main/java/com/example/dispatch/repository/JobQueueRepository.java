/*
 * どこで: Dispatch データアクセス
 * 何を: notification_jobs の登録/lease/ack 遷移/回収を担う
 * なぜ: 複数プロセスのワーカーが同じキューを排他的に消費するため
 */
package com.example.dispatch.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.dispatch.model.JobState;
import com.example.dispatch.model.NotificationJob;
import com.example.dispatch.model.Priority;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JobQueueRepository {

  static final Comparator<NotificationJob> LEASE_ORDER =
      Comparator.comparingInt((NotificationJob job) -> job.priority().rank())
          .reversed()
          .thenComparing(NotificationJob::notBefore)
          .thenComparing(NotificationJob::createdAt);

  private static final String COLUMNS =
      """
      job_id, user_id, type, priority, payload_json::text AS payload_json_text, state,
      attempt, max_attempts, not_before, lease_owner, lease_expires_at, group_key,
      schedule_id, trace_id, delivered_channels::text AS delivered_channels_text,
      last_error, expires_at, created_at, updated_at, completed_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final PayloadJsonCodec codec;

  /** 既存 job_id と衝突した場合、または group 窓が保留中の jobId の場合は 0 を返す。 */
  public int insertIfAbsent(NotificationJob job) {
    return insertIfAbsent(job, null);
  }

  /**
   * releasingWindowId の窓に属するメンバーだけは重複扱いしない。1 件だけの窓を flush して
   * メンバーを元の jobId のまま投入するときに使う。
   */
  public int insertIfAbsent(NotificationJob job, UUID releasingWindowId) {
    final String sql =
        """
        INSERT INTO notification_jobs (
          job_id, user_id, type, priority, payload_json, state, attempt, max_attempts,
          not_before, group_key, schedule_id, trace_id, delivered_channels, expires_at,
          created_at, updated_at
        )
        SELECT
          :jobId::uuid, :userId::text, :type::text, :priority::text, :payloadJson::jsonb,
          :state::text, :attempt::int, :maxAttempts::int, :notBefore::timestamptz,
          :groupKey::text, :scheduleId::uuid, :traceId::text, :deliveredChannels::jsonb,
          :expiresAt::timestamptz, :createdAt::timestamptz, :updatedAt::timestamptz
        WHERE NOT EXISTS (
          SELECT 1 FROM group_window_members m
          WHERE m.job_id = :jobId::uuid
            AND m.window_id IS DISTINCT FROM :releasingWindowId::uuid
        )
        ON CONFLICT (job_id) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("jobId", job.jobId())
            .addValue("userId", job.userId())
            .addValue("type", job.type())
            .addValue("priority", job.priority().name())
            .addValue("payloadJson", codec.writePayload(job.payload()))
            .addValue("state", job.state().name())
            .addValue("attempt", job.attempt())
            .addValue("maxAttempts", job.maxAttempts())
            .addValue("notBefore", toTimestamp(job.notBefore()))
            .addValue("groupKey", job.groupKey())
            .addValue("scheduleId", job.scheduleId())
            .addValue("traceId", job.traceId())
            .addValue("deliveredChannels", codec.writeChannels(job.deliveredChannels()))
            .addValue("expiresAt", toTimestamp(job.expiresAt()))
            .addValue("createdAt", toTimestamp(job.createdAt()))
            .addValue("updatedAt", toTimestamp(job.updatedAt()))
            .addValue("releasingWindowId", releasingWindowId);
    return jdbcTemplate.update(sql, params);
  }

  public Optional<NotificationJob> findById(UUID jobId) {
    final String sql = "SELECT " + COLUMNS + " FROM notification_jobs WHERE job_id = :jobId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("jobId", jobId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<NotificationJob> claimDue(int limit, Instant now, Instant leaseUntil, String owner) {
    // SKIP LOCKED で他ワーカーが選択中の行を飛ばし、同一ジョブの二重 lease を防ぐ
    final String sql =
        """
        WITH cte AS (
          SELECT job_id
          FROM notification_jobs
          WHERE state IN ('QUEUED', 'SCHEDULED')
            AND not_before <= :now
          ORDER BY priority_rank DESC, not_before, created_at
          LIMIT :limit
          FOR UPDATE SKIP LOCKED
        )
        UPDATE notification_jobs j
        SET state = 'LEASED',
            lease_owner = :owner,
            lease_expires_at = :leaseUntil,
            updated_at = :now
        FROM cte
        WHERE j.job_id = cte.job_id
        RETURNING j.job_id, j.user_id, j.type, j.priority, j.payload_json::text AS payload_json_text,
                  j.state, j.attempt, j.max_attempts, j.not_before, j.lease_owner,
                  j.lease_expires_at, j.group_key, j.schedule_id, j.trace_id,
                  j.delivered_channels::text AS delivered_channels_text, j.last_error,
                  j.expires_at, j.created_at, j.updated_at, j.completed_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("leaseUntil", toTimestamp(leaseUntil))
            .addValue("owner", owner)
            .addValue("limit", limit);
    // RETURNING の順序は保証されないため、選択時と同じ順序に並べ直す
    final List<NotificationJob> claimed = new ArrayList<>(jdbcTemplate.query(sql, params, this::mapRow));
    claimed.sort(LEASE_ORDER);
    return claimed;
  }

  public int markDelivering(UUID jobId, String owner, Instant now) {
    final String sql =
        """
        UPDATE notification_jobs
        SET state = 'DELIVERING',
            updated_at = :now
        WHERE job_id = :jobId
          AND state = 'LEASED'
          AND lease_owner = :owner
        """;
    return jdbcTemplate.update(sql, ownedParams(jobId, owner, now));
  }

  public int markSucceeded(UUID jobId, String owner, List<String> deliveredChannels, Instant now) {
    final String sql =
        """
        UPDATE notification_jobs
        SET state = 'SUCCEEDED',
            delivered_channels = :deliveredChannels::jsonb,
            last_error = NULL,
            lease_owner = NULL,
            lease_expires_at = NULL,
            completed_at = :now,
            updated_at = :now
        WHERE job_id = :jobId
          AND state IN ('LEASED', 'DELIVERING')
          AND lease_owner = :owner
        """;
    final MapSqlParameterSource params =
        ownedParams(jobId, owner, now)
            .addValue("deliveredChannels", codec.writeChannels(deliveredChannels));
    return jdbcTemplate.update(sql, params);
  }

  public int markRequeued(
      UUID jobId,
      String owner,
      int attempt,
      Instant notBefore,
      List<String> deliveredChannels,
      String lastError,
      Instant now) {
    final String sql =
        """
        UPDATE notification_jobs
        SET state = 'QUEUED',
            attempt = :attempt,
            not_before = :notBefore,
            delivered_channels = :deliveredChannels::jsonb,
            last_error = :lastError,
            lease_owner = NULL,
            lease_expires_at = NULL,
            updated_at = :now
        WHERE job_id = :jobId
          AND state IN ('LEASED', 'DELIVERING')
          AND lease_owner = :owner
        """;
    final MapSqlParameterSource params =
        ownedParams(jobId, owner, now)
            .addValue("attempt", attempt)
            .addValue("notBefore", toTimestamp(notBefore))
            .addValue("deliveredChannels", codec.writeChannels(deliveredChannels))
            .addValue("lastError", lastError);
    return jdbcTemplate.update(sql, params);
  }

  public int markDead(
      UUID jobId,
      String owner,
      int attempt,
      List<String> deliveredChannels,
      String lastError,
      Instant now) {
    final String sql =
        """
        UPDATE notification_jobs
        SET state = 'DEAD',
            attempt = :attempt,
            delivered_channels = :deliveredChannels::jsonb,
            last_error = :lastError,
            lease_owner = NULL,
            lease_expires_at = NULL,
            completed_at = :now,
            updated_at = :now
        WHERE job_id = :jobId
          AND state IN ('LEASED', 'DELIVERING')
          AND lease_owner = :owner
        """;
    final MapSqlParameterSource params =
        ownedParams(jobId, owner, now)
            .addValue("attempt", attempt)
            .addValue("deliveredChannels", codec.writeChannels(deliveredChannels))
            .addValue("lastError", lastError);
    return jdbcTemplate.update(sql, params);
  }

  /** lease 期限切れの行を QUEUED へ戻す。attempt は変更しない。 */
  public List<UUID> reapExpiredLeases(Instant now) {
    final String sql =
        """
        UPDATE notification_jobs
        SET state = 'QUEUED',
            lease_owner = NULL,
            lease_expires_at = NULL,
            updated_at = :now
        WHERE state IN ('LEASED', 'DELIVERING')
          AND lease_expires_at < :now
        RETURNING job_id
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, (rs, rowNum) -> UUID.fromString(rs.getString("job_id")));
  }

  public int resetDeadForReplay(UUID jobId, Instant now) {
    final String sql =
        """
        UPDATE notification_jobs
        SET state = 'QUEUED',
            attempt = 0,
            not_before = :now,
            last_error = NULL,
            completed_at = NULL,
            updated_at = :now
        WHERE job_id = :jobId
          AND state = 'DEAD'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("jobId", jobId).addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  /** priority が null の場合は全優先度の待機数を返す。 */
  public long countWaiting(Priority priority) {
    final StringBuilder sql =
        new StringBuilder(
            "SELECT COUNT(*) FROM notification_jobs WHERE state IN ('QUEUED', 'SCHEDULED')");
    final MapSqlParameterSource params = new MapSqlParameterSource();
    if (priority != null) {
      sql.append(" AND priority = :priority");
      params.addValue("priority", priority.name());
    }
    final Long count = jdbcTemplate.queryForObject(sql.toString(), params, Long.class);
    return count == null ? 0 : count;
  }

  public int deleteSucceededOlderThan(Instant threshold) {
    final String sql =
        """
        DELETE FROM notification_jobs
        WHERE completed_at < :threshold
          AND state = 'SUCCEEDED'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    return jdbcTemplate.update(sql, params);
  }

  public int countStaleActive(Instant threshold) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM notification_jobs
        WHERE not_before < :threshold
          AND state IN ('QUEUED', 'LEASED', 'DELIVERING')
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  private MapSqlParameterSource ownedParams(UUID jobId, String owner, Instant now) {
    return new MapSqlParameterSource()
        .addValue("jobId", jobId)
        .addValue("owner", owner)
        .addValue("now", toTimestamp(now));
  }

  private NotificationJob mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String scheduleId = rs.getString("schedule_id");
    return NotificationJob.builder()
        .jobId(UUID.fromString(rs.getString("job_id")))
        .userId(rs.getString("user_id"))
        .type(rs.getString("type"))
        .priority(Priority.valueOf(rs.getString("priority")))
        .payload(codec.readPayload(rs.getString("payload_json_text")))
        .state(JobState.valueOf(rs.getString("state")))
        .attempt(rs.getInt("attempt"))
        .maxAttempts(rs.getInt("max_attempts"))
        .notBefore(toInstant(rs.getTimestamp("not_before")))
        .leaseOwner(rs.getString("lease_owner"))
        .leaseExpiresAt(toInstant(rs.getTimestamp("lease_expires_at")))
        .groupKey(rs.getString("group_key"))
        .scheduleId(scheduleId == null ? null : UUID.fromString(scheduleId))
        .traceId(rs.getString("trace_id"))
        .deliveredChannels(codec.readChannels(rs.getString("delivered_channels_text")))
        .lastError(rs.getString("last_error"))
        .expiresAt(toInstant(rs.getTimestamp("expires_at")))
        .createdAt(toInstant(rs.getTimestamp("created_at")))
        .updatedAt(toInstant(rs.getTimestamp("updated_at")))
        .completedAt(toInstant(rs.getTimestamp("completed_at")))
        .build();
  }
}
