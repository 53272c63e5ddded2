/*
 * どこで: Dispatch データアクセス
 * 何を: notification_dead_letters の追記/参照/replay 記録を担う
 * なぜ: 完全失敗したジョブを隔離し、運用者の再投入を可能にするため
 */
package com.example.dispatch.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.dispatch.model.DeadLetterRecord;
import com.example.dispatch.model.Priority;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class DeadLetterRepository {

  private static final String COLUMNS =
      """
      dead_letter_id, job_id, user_id, type, priority, payload_json::text AS payload_json_text,
      attempt, reason, created_at, replayed_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final PayloadJsonCodec codec;

  public void insert(DeadLetterRecord record) {
    final String sql =
        """
        INSERT INTO notification_dead_letters (
          dead_letter_id,
          job_id,
          user_id,
          type,
          priority,
          payload_json,
          attempt,
          reason,
          created_at
        ) VALUES (
          :deadLetterId,
          :jobId,
          :userId,
          :type,
          :priority,
          :payloadJson::jsonb,
          :attempt,
          :reason,
          :createdAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("deadLetterId", record.deadLetterId())
            .addValue("jobId", record.jobId())
            .addValue("userId", record.userId())
            .addValue("type", record.type())
            .addValue("priority", record.priority().name())
            .addValue("payloadJson", codec.writePayload(record.payload()))
            .addValue("attempt", record.attempt())
            .addValue("reason", record.reason())
            .addValue("createdAt", toTimestamp(record.createdAt()));
    jdbcTemplate.update(sql, params);
  }

  /** replay 前の最新レコードを行ロック付きで取得する。 */
  public Optional<DeadLetterRecord> findLatestOpenByJobIdForUpdate(UUID jobId) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM notification_dead_letters
            WHERE job_id = :jobId
              AND replayed_at IS NULL
            ORDER BY created_at DESC
            LIMIT 1
            FOR UPDATE
            """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("jobId", jobId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public int markReplayed(UUID deadLetterId, Instant replayedAt) {
    final String sql =
        """
        UPDATE notification_dead_letters
        SET replayed_at = :replayedAt
        WHERE dead_letter_id = :deadLetterId
          AND replayed_at IS NULL
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("deadLetterId", deadLetterId)
            .addValue("replayedAt", toTimestamp(replayedAt));
    return jdbcTemplate.update(sql, params);
  }

  public long countOpen() {
    final String sql = "SELECT COUNT(*) FROM notification_dead_letters WHERE replayed_at IS NULL";
    final Long count = jdbcTemplate.queryForObject(sql, new MapSqlParameterSource(), Long.class);
    return count == null ? 0 : count;
  }

  public List<DeadLetterRecord> findRecentOpen(int limit) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM notification_dead_letters
            WHERE replayed_at IS NULL
            ORDER BY created_at DESC
            LIMIT :limit
            """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public List<DeadLetterRecord> findByJobId(UUID jobId) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM notification_dead_letters
            WHERE job_id = :jobId
            ORDER BY created_at
            """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("jobId", jobId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private DeadLetterRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new DeadLetterRecord(
        UUID.fromString(rs.getString("dead_letter_id")),
        UUID.fromString(rs.getString("job_id")),
        rs.getString("user_id"),
        rs.getString("type"),
        Priority.valueOf(rs.getString("priority")),
        codec.readPayload(rs.getString("payload_json_text")),
        rs.getInt("attempt"),
        rs.getString("reason"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("replayed_at")));
  }
}
