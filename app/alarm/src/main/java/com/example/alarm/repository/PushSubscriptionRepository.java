/*
 * Where: Alarm data access
 * What: push_subscriptions table behind SubscriptionRegistry
 * Why: Endpoint uniqueness is enforced by the table so concurrent re-subscribes cannot duplicate
 */
package com.example.alarm.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.alarm.model.PushSubscription;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class PushSubscriptionRepository implements SubscriptionRegistry {

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final Clock clock;

  @Override
  public List<PushSubscription> listByUser(String userId) {
    final String sql =
        """
        SELECT endpoint, user_id, p256dh, auth, created_at, updated_at
        FROM push_subscriptions
        WHERE user_id = :userId
        ORDER BY created_at, endpoint
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userId", userId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  @Override
  public void upsert(String endpoint, String userId, String p256dh, String auth) {
    // single statement so a concurrent insert of the same endpoint turns into an update
    final String sql =
        """
        INSERT INTO push_subscriptions (endpoint, user_id, p256dh, auth, created_at, updated_at)
        VALUES (:endpoint, :userId, :p256dh, :auth, :now, :now)
        ON CONFLICT (endpoint) DO UPDATE
        SET user_id = EXCLUDED.user_id,
            p256dh = EXCLUDED.p256dh,
            auth = EXCLUDED.auth,
            updated_at = EXCLUDED.updated_at
        """;
    final Instant now = Instant.now(clock);
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("endpoint", endpoint)
            .addValue("userId", userId)
            .addValue("p256dh", p256dh)
            .addValue("auth", auth)
            .addValue("now", toTimestamp(now));
    jdbcTemplate.update(sql, params);
  }

  @Override
  public int removeByEndpoint(String endpoint) {
    final String sql =
        """
        DELETE FROM push_subscriptions
        WHERE endpoint = :endpoint
        """;
    return jdbcTemplate.update(sql, new MapSqlParameterSource().addValue("endpoint", endpoint));
  }

  @Override
  public int removeByUserAndEndpoint(String userId, String endpoint) {
    final String sql =
        """
        DELETE FROM push_subscriptions
        WHERE endpoint = :endpoint
          AND user_id = :userId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("endpoint", endpoint).addValue("userId", userId);
    return jdbcTemplate.update(sql, params);
  }

  private PushSubscription mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new PushSubscription(
        rs.getString("endpoint"),
        rs.getString("user_id"),
        rs.getString("p256dh"),
        rs.getString("auth"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("updated_at")));
  }
}
