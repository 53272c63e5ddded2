/*
 * どこで: Dispatch データアクセス
 * 何を: group_windows/group_window_members の開設/追加/flush 遷移を担う
 * なぜ: 窓の状態を DB に置き、複数プロセスからの offer と flush を直列化するため
 */
package com.example.dispatch.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.dispatch.model.AggregationStrategy;
import com.example.dispatch.model.GroupMember;
import com.example.dispatch.model.GroupWindow;
import com.example.dispatch.model.Priority;
import com.example.dispatch.model.WindowState;
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
public class GroupWindowRepository {

  private static final String WINDOW_COLUMNS =
      """
      window_id, group_key, user_id, type, strategy, window_start, window_end, state,
      member_count, digest_job_id, created_at, updated_at, closed_at
      """;

  private static final String MEMBER_COLUMNS =
      """
      window_id, position, job_id, user_id, type, priority, payload_json::text AS payload_json_text,
      max_attempts, trace_id, created_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final PayloadJsonCodec codec;

  public Optional<GroupWindow> findOpenForUpdate(String groupKey) {
    final String sql =
        "SELECT "
            + WINDOW_COLUMNS
            + """
            FROM group_windows
            WHERE group_key = :groupKey
              AND state = 'OPEN'
            FOR UPDATE
            """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("groupKey", groupKey);
    return jdbcTemplate.query(sql, params, this::mapWindow).stream().findFirst();
  }

  public Optional<GroupWindow> findById(UUID windowId) {
    final String sql = "SELECT " + WINDOW_COLUMNS + " FROM group_windows WHERE window_id = :windowId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("windowId", windowId);
    return jdbcTemplate.query(sql, params, this::mapWindow).stream().findFirst();
  }

  /**
   * OPEN 窓を新設する。
   *
   * @return 同じ group_key の OPEN 窓が既にある場合は 0
   */
  public int insertOpenIfAbsent(GroupWindow window) {
    // 部分ユニークインデックス (group_key WHERE state = 'OPEN') を衝突判定に使う
    final String sql =
        """
        INSERT INTO group_windows (
          window_id, group_key, user_id, type, strategy, window_start, window_end, state,
          member_count, created_at, updated_at
        ) VALUES (
          :windowId, :groupKey, :userId, :type, :strategy, :windowStart, :windowEnd, 'OPEN',
          0, :createdAt, :updatedAt
        )
        ON CONFLICT (group_key) WHERE state = 'OPEN' DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("windowId", window.windowId())
            .addValue("groupKey", window.groupKey())
            .addValue("userId", window.userId())
            .addValue("type", window.type())
            .addValue("strategy", window.strategy().name())
            .addValue("windowStart", toTimestamp(window.windowStart()))
            .addValue("windowEnd", toTimestamp(window.windowEnd()))
            .addValue("createdAt", toTimestamp(window.createdAt()))
            .addValue("updatedAt", toTimestamp(window.updatedAt()));
    return jdbcTemplate.update(sql, params);
  }

  /** 同じ job_id が既にどこかの窓かキューに居る場合は 0 を返す。 */
  public int insertMemberIfAbsent(GroupMember member) {
    final String sql =
        """
        INSERT INTO group_window_members (
          window_id, position, job_id, user_id, type, priority, payload_json, max_attempts,
          trace_id, created_at
        )
        SELECT
          :windowId::uuid, :position::int, :jobId::uuid, :userId::text, :type::text,
          :priority::text, :payloadJson::jsonb, :maxAttempts::int, :traceId::text,
          :createdAt::timestamptz
        WHERE NOT EXISTS (SELECT 1 FROM notification_jobs j WHERE j.job_id = :jobId::uuid)
        ON CONFLICT (job_id) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("windowId", member.windowId())
            .addValue("position", member.position())
            .addValue("jobId", member.jobId())
            .addValue("userId", member.userId())
            .addValue("type", member.type())
            .addValue("priority", member.priority().name())
            .addValue("payloadJson", codec.writePayload(member.payload()))
            .addValue("maxAttempts", member.maxAttempts())
            .addValue("traceId", member.traceId())
            .addValue("createdAt", toTimestamp(member.createdAt()));
    return jdbcTemplate.update(sql, params);
  }

  public int incrementMemberCount(UUID windowId, Instant now) {
    final String sql =
        """
        UPDATE group_windows
        SET member_count = member_count + 1,
            updated_at = :now
        WHERE window_id = :windowId
          AND state = 'OPEN'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("windowId", windowId).addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  /**
   * OPEN の窓を FLUSHING へ進める。
   *
   * <p>同時に呼ばれた場合、後続は行ロック解放後に state を再評価して空を得る。
   */
  public Optional<GroupWindow> beginFlush(UUID windowId, Instant now) {
    final String sql =
        """
        UPDATE group_windows
        SET state = 'FLUSHING',
            updated_at = :now
        WHERE window_id = :windowId
          AND state = 'OPEN'
        RETURNING
        """
            + WINDOW_COLUMNS;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("windowId", windowId).addValue("now", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapWindow).stream().findFirst();
  }

  public int markFlushed(UUID windowId, UUID digestJobId, Instant now) {
    final String sql =
        """
        UPDATE group_windows
        SET state = 'FLUSHED',
            digest_job_id = :digestJobId,
            closed_at = :now,
            updated_at = :now
        WHERE window_id = :windowId
          AND state = 'FLUSHING'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("windowId", windowId)
            .addValue("digestJobId", digestJobId)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public int cancelOpen(String groupKey, Instant now) {
    final String sql =
        """
        UPDATE group_windows
        SET state = 'CANCELLED',
            closed_at = :now,
            updated_at = :now
        WHERE group_key = :groupKey
          AND state = 'OPEN'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("groupKey", groupKey).addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public List<UUID> findDueOpenWindowIds(Instant now, int limit) {
    final String sql =
        """
        SELECT window_id
        FROM group_windows
        WHERE state = 'OPEN'
          AND window_end <= :now
        ORDER BY window_end
        LIMIT :limit
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("now", toTimestamp(now)).addValue("limit", limit);
    return jdbcTemplate.query(sql, params, (rs, rowNum) -> UUID.fromString(rs.getString("window_id")));
  }

  public List<GroupMember> findMembers(UUID windowId) {
    final String sql =
        "SELECT "
            + MEMBER_COLUMNS
            + """
            FROM group_window_members
            WHERE window_id = :windowId
            ORDER BY position
            """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("windowId", windowId);
    return jdbcTemplate.query(sql, params, this::mapMember);
  }

  public Optional<GroupMember> findMemberByJobId(UUID jobId) {
    final String sql = "SELECT " + MEMBER_COLUMNS + " FROM group_window_members WHERE job_id = :jobId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("jobId", jobId);
    return jdbcTemplate.query(sql, params, this::mapMember).stream().findFirst();
  }

  public int deleteClosedOlderThan(Instant threshold) {
    final String sql =
        """
        DELETE FROM group_windows
        WHERE closed_at < :threshold
          AND state IN ('FLUSHED', 'CANCELLED')
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    return jdbcTemplate.update(sql, params);
  }

  private GroupWindow mapWindow(ResultSet rs, int rowNum) throws SQLException {
    final String digestJobId = rs.getString("digest_job_id");
    return new GroupWindow(
        UUID.fromString(rs.getString("window_id")),
        rs.getString("group_key"),
        rs.getString("user_id"),
        rs.getString("type"),
        AggregationStrategy.valueOf(rs.getString("strategy")),
        toInstant(rs.getTimestamp("window_start")),
        toInstant(rs.getTimestamp("window_end")),
        WindowState.valueOf(rs.getString("state")),
        rs.getInt("member_count"),
        digestJobId == null ? null : UUID.fromString(digestJobId),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")),
        toInstant(rs.getTimestamp("closed_at")));
  }

  private GroupMember mapMember(ResultSet rs, int rowNum) throws SQLException {
    return new GroupMember(
        UUID.fromString(rs.getString("window_id")),
        rs.getInt("position"),
        UUID.fromString(rs.getString("job_id")),
        rs.getString("user_id"),
        rs.getString("type"),
        Priority.valueOf(rs.getString("priority")),
        codec.readPayload(rs.getString("payload_json_text")),
        rs.getInt("max_attempts"),
        rs.getString("trace_id"),
        toInstant(rs.getTimestamp("created_at")));
  }
}
