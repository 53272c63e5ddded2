/*
 * どこで: Dispatch データアクセス
 * 何を: schedule_specs の登録/期限到来の取得/次回発火と発火条件の CAS 更新を担う
 * なぜ: 複数の scheduler インスタンスが同じ発火を二重に進めないようにするため
 */
package com.example.dispatch.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.dispatch.model.Priority;
import com.example.dispatch.model.ScheduleSpec;
import com.example.dispatch.model.ScheduleStatus;
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
public class ScheduleSpecRepository {

  private static final String COLUMNS =
      """
      spec_id, user_id, type, priority, payload_json::text AS payload_json_text, cron_expression,
      fire_at, timezone, skip_weekends, skip_holidays, holiday_region, max_occurrences,
      occurrences_so_far, max_attempts, next_fire_at, end_at, status, trace_id, created_at, updated_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final PayloadJsonCodec codec;

  public void insert(ScheduleSpec spec) {
    final String sql =
        """
        INSERT INTO schedule_specs (
          spec_id, user_id, type, priority, payload_json, cron_expression, fire_at, timezone,
          skip_weekends, skip_holidays, holiday_region, max_occurrences, occurrences_so_far,
          max_attempts, next_fire_at, end_at, status, trace_id, created_at, updated_at
        ) VALUES (
          :specId, :userId, :type, :priority, :payloadJson::jsonb, :cronExpression, :fireAt, :timezone,
          :skipWeekends, :skipHolidays, :holidayRegion, :maxOccurrences, :occurrencesSoFar,
          :maxAttempts, :nextFireAt, :endAt, :status, :traceId, :createdAt, :updatedAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("specId", spec.specId())
            .addValue("userId", spec.userId())
            .addValue("type", spec.type())
            .addValue("priority", spec.priority().name())
            .addValue("payloadJson", codec.writePayload(spec.payload()))
            .addValue("cronExpression", spec.cronExpression())
            .addValue("fireAt", toTimestamp(spec.fireAt()))
            .addValue("timezone", spec.timezone())
            .addValue("skipWeekends", spec.skipWeekends())
            .addValue("skipHolidays", spec.skipHolidays())
            .addValue("holidayRegion", spec.holidayRegion())
            .addValue("maxOccurrences", spec.maxOccurrences())
            .addValue("occurrencesSoFar", spec.occurrencesSoFar())
            .addValue("maxAttempts", spec.maxAttempts())
            .addValue("nextFireAt", toTimestamp(spec.nextFireAt()))
            .addValue("endAt", toTimestamp(spec.endAt()))
            .addValue("status", spec.status().name())
            .addValue("traceId", spec.traceId())
            .addValue("createdAt", toTimestamp(spec.createdAt()))
            .addValue("updatedAt", toTimestamp(spec.updatedAt()));
    jdbcTemplate.update(sql, params);
  }

  public Optional<ScheduleSpec> findById(UUID specId) {
    final String sql = "SELECT " + COLUMNS + " FROM schedule_specs WHERE spec_id = :specId";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("specId", specId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public List<ScheduleSpec> findDue(Instant now, int limit) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM schedule_specs
            WHERE status = 'ACTIVE'
              AND next_fire_at <= :now
            ORDER BY next_fire_at
            LIMIT :limit
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("now", toTimestamp(now)).addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public List<ScheduleSpec> findActiveByUserId(String userId) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM schedule_specs
            WHERE user_id = :userId
              AND status = 'ACTIVE'
            ORDER BY next_fire_at
            """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userId", userId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int countActiveByUserId(String userId) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM schedule_specs
        WHERE user_id = :userId
          AND status = 'ACTIVE'
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userId", userId);
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  /**
   * 発火条件と次回発火時刻を置き換える。next_fire_at が期待値のままの場合だけ更新する。
   *
   * @return 予定が ACTIVE でない、または materialize が先に進めていた場合は 0
   */
  public int updateTrigger(ScheduleSpec spec, Instant expectedNextFireAt) {
    final String sql =
        """
        UPDATE schedule_specs
        SET cron_expression = :cronExpression,
            fire_at = :fireAt,
            timezone = :timezone,
            skip_weekends = :skipWeekends,
            skip_holidays = :skipHolidays,
            holiday_region = :holidayRegion,
            max_occurrences = :maxOccurrences,
            end_at = :endAt,
            next_fire_at = :nextFireAt,
            updated_at = :updatedAt
        WHERE spec_id = :specId
          AND status = 'ACTIVE'
          AND next_fire_at = :expectedNextFireAt
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("specId", spec.specId())
            .addValue("cronExpression", spec.cronExpression())
            .addValue("fireAt", toTimestamp(spec.fireAt()))
            .addValue("timezone", spec.timezone())
            .addValue("skipWeekends", spec.skipWeekends())
            .addValue("skipHolidays", spec.skipHolidays())
            .addValue("holidayRegion", spec.holidayRegion())
            .addValue("maxOccurrences", spec.maxOccurrences())
            .addValue("endAt", toTimestamp(spec.endAt()))
            .addValue("nextFireAt", toTimestamp(spec.nextFireAt()))
            .addValue("updatedAt", toTimestamp(spec.updatedAt()))
            .addValue("expectedNextFireAt", toTimestamp(expectedNextFireAt));
    return jdbcTemplate.update(sql, params);
  }

  /**
   * next_fire_at が期待値のままの場合だけ次回発火へ進める。
   *
   * @return 他インスタンスが先に進めていた場合は 0
   */
  public int advance(
      UUID specId,
      Instant expectedNextFireAt,
      Instant nextFireAt,
      int occurrencesSoFar,
      ScheduleStatus status,
      Instant now) {
    final String sql =
        """
        UPDATE schedule_specs
        SET next_fire_at = :nextFireAt,
            occurrences_so_far = :occurrencesSoFar,
            status = :status,
            updated_at = :now
        WHERE spec_id = :specId
          AND status = 'ACTIVE'
          AND next_fire_at = :expectedNextFireAt
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("specId", specId)
            .addValue("expectedNextFireAt", toTimestamp(expectedNextFireAt))
            .addValue("nextFireAt", toTimestamp(nextFireAt))
            .addValue("occurrencesSoFar", occurrencesSoFar)
            .addValue("status", status.name())
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public int close(UUID specId, ScheduleStatus status, Instant now) {
    final String sql =
        """
        UPDATE schedule_specs
        SET status = :status,
            next_fire_at = NULL,
            updated_at = :now
        WHERE spec_id = :specId
          AND status = 'ACTIVE'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("specId", specId)
            .addValue("status", status.name())
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  public int deleteClosedOlderThan(Instant threshold) {
    final String sql =
        """
        DELETE FROM schedule_specs
        WHERE updated_at < :threshold
          AND status IN ('RETIRED', 'CANCELLED')
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    return jdbcTemplate.update(sql, params);
  }

  private ScheduleSpec mapRow(ResultSet rs, int rowNum) throws SQLException {
    final int maxOccurrences = rs.getInt("max_occurrences");
    final Integer nullableMaxOccurrences = rs.wasNull() ? null : maxOccurrences;
    return ScheduleSpec.builder()
        .specId(UUID.fromString(rs.getString("spec_id")))
        .userId(rs.getString("user_id"))
        .type(rs.getString("type"))
        .priority(Priority.valueOf(rs.getString("priority")))
        .payload(codec.readPayload(rs.getString("payload_json_text")))
        .cronExpression(rs.getString("cron_expression"))
        .fireAt(toInstant(rs.getTimestamp("fire_at")))
        .timezone(rs.getString("timezone"))
        .skipWeekends(rs.getBoolean("skip_weekends"))
        .skipHolidays(rs.getBoolean("skip_holidays"))
        .holidayRegion(rs.getString("holiday_region"))
        .maxOccurrences(nullableMaxOccurrences)
        .occurrencesSoFar(rs.getInt("occurrences_so_far"))
        .maxAttempts(rs.getInt("max_attempts"))
        .nextFireAt(toInstant(rs.getTimestamp("next_fire_at")))
        .endAt(toInstant(rs.getTimestamp("end_at")))
        .status(ScheduleStatus.valueOf(rs.getString("status")))
        .traceId(rs.getString("trace_id"))
        .createdAt(toInstant(rs.getTimestamp("created_at")))
        .updatedAt(toInstant(rs.getTimestamp("updated_at")))
        .build();
  }
}
