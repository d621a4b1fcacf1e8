/*
 * どこで: Message データアクセス
 * 何を: messages/applications テーブルの登録/取得/削除を担う
 * なぜ: MessageRepository を Postgres 上で実現するため
 */
package com.example.push.message.repository;

import static com.example.push.common.JdbcTimestampUtils.toInstant;
import static com.example.push.common.JdbcTimestampUtils.toTimestamp;

import com.example.push.message.model.ApplicationRecord;
import com.example.push.message.model.MessageRecord;
import com.example.push.message.model.NewMessage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "JdbcTemplate/ObjectMapper は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class JdbcMessageRepository implements MessageRepository {

  private static final TypeReference<Map<String, Object>> EXTRAS_TYPE = new TypeReference<>() {};

  private static final String MESSAGE_COLUMNS =
      """
      m.id, m.application_id, m.title, m.message, m.priority,
      m.extras::text AS extras_text, m.created_at
      """;

  private static final String APPLICATION_COLUMNS = "id, user_id, token, name, description";

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  @Override
  public List<MessageRecord> findByApplication(long applicationId) {
    final String sql =
        "SELECT "
            + MESSAGE_COLUMNS
            + """
            FROM messages m
            WHERE m.application_id = :applicationId
            ORDER BY m.id DESC
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("applicationId", applicationId);
    return jdbcTemplate.query(sql, params, this::mapMessage);
  }

  @Override
  public List<MessageRecord> findByUser(long userId) {
    final String sql =
        "SELECT "
            + MESSAGE_COLUMNS
            + """
            FROM messages m
            JOIN applications a ON a.id = m.application_id
            WHERE a.user_id = :userId
            ORDER BY m.id DESC
            """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userId", userId);
    return jdbcTemplate.query(sql, params, this::mapMessage);
  }

  @Override
  public List<MessageRecord> findByApplicationSince(long applicationId, int limit, long since) {
    final String sql =
        "SELECT "
            + MESSAGE_COLUMNS
            + """
            FROM messages m
            WHERE m.application_id = :applicationId
            """
            + sinceCondition(since)
            + """
            ORDER BY m.id DESC
            LIMIT :limit
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("applicationId", applicationId)
            .addValue("since", since)
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapMessage);
  }

  @Override
  public List<MessageRecord> findByUserSince(long userId, int limit, long since) {
    final String sql =
        "SELECT "
            + MESSAGE_COLUMNS
            + """
            FROM messages m
            JOIN applications a ON a.id = m.application_id
            WHERE a.user_id = :userId
            """
            + sinceCondition(since)
            + """
            ORDER BY m.id DESC
            LIMIT :limit
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userId", userId)
            .addValue("since", since)
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapMessage);
  }

  @Override
  public Optional<MessageRecord> findMessageById(long messageId) {
    final String sql =
        "SELECT "
            + MESSAGE_COLUMNS
            + """
            FROM messages m
            WHERE m.id = :messageId
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("messageId", messageId);
    return jdbcTemplate.query(sql, params, this::mapMessage).stream().findFirst();
  }

  @Override
  public Optional<ApplicationRecord> findApplicationById(long applicationId) {
    final String sql = "SELECT " + APPLICATION_COLUMNS + " FROM applications WHERE id = :id";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", applicationId);
    return jdbcTemplate.query(sql, params, this::mapApplication).stream().findFirst();
  }

  @Override
  public Optional<ApplicationRecord> findApplicationByToken(String token) {
    final String sql =
        "SELECT " + APPLICATION_COLUMNS + " FROM applications WHERE token = :token";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("token", token);
    return jdbcTemplate.query(sql, params, this::mapApplication).stream().findFirst();
  }

  @Override
  public void deleteMessageById(long messageId) {
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("messageId", messageId);
    jdbcTemplate.update("DELETE FROM messages WHERE id = :messageId", params);
  }

  @Override
  public void deleteByApplication(long applicationId) {
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("applicationId", applicationId);
    jdbcTemplate.update("DELETE FROM messages WHERE application_id = :applicationId", params);
  }

  @Override
  public void deleteByUser(long userId) {
    final String sql =
        """
        DELETE FROM messages
        WHERE application_id IN (
          SELECT id FROM applications WHERE user_id = :userId
        )
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("userId", userId);
    jdbcTemplate.update(sql, params);
  }

  @Override
  public MessageRecord create(NewMessage message) {
    // ID は BIGSERIAL に採番させ、RETURNING で受け取る
    final String sql =
        """
        INSERT INTO messages (
          application_id,
          title,
          message,
          priority,
          extras,
          created_at
        ) VALUES (
          :applicationId,
          :title,
          :message,
          :priority,
          :extras::jsonb,
          :createdAt
        )
        RETURNING id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("applicationId", message.applicationId())
            .addValue("title", message.title())
            .addValue("message", message.message())
            .addValue("priority", message.priority(), Types.INTEGER)
            .addValue("extras", serializeExtras(message.extras()), Types.VARCHAR)
            .addValue("createdAt", toTimestamp(message.date()));
    final Long id = jdbcTemplate.queryForObject(sql, params, Long.class);
    if (id == null) {
      throw new DataRetrievalFailureException("message insert returned no id");
    }
    return message.toRecord(id);
  }

  private String sinceCondition(long since) {
    // since=0 は「最新から」を意味するため上限条件を付けない
    return since > 0 ? "  AND m.id < :since\n" : "";
  }

  private String serializeExtras(Map<String, Object> extras) {
    if (extras == null) {
      return null;
    }
    try {
      return objectMapper.writeValueAsString(extras);
    } catch (JsonProcessingException ex) {
      throw new IllegalArgumentException("message extras serialization failure", ex);
    }
  }

  private Map<String, Object> parseExtras(String extrasJson) {
    if (extrasJson == null) {
      return null;
    }
    try {
      return objectMapper.readValue(extrasJson, EXTRAS_TYPE);
    } catch (JsonProcessingException ex) {
      throw new DataRetrievalFailureException("message extras parse failure", ex);
    }
  }

  private MessageRecord mapMessage(ResultSet rs, int rowNum) throws SQLException {
    final int rawPriority = rs.getInt("priority");
    final Integer priority = rs.wasNull() ? null : rawPriority;
    return new MessageRecord(
        rs.getLong("id"),
        rs.getLong("application_id"),
        rs.getString("title"),
        rs.getString("message"),
        priority,
        parseExtras(rs.getString("extras_text")),
        toInstant(rs.getTimestamp("created_at")));
  }

  private ApplicationRecord mapApplication(ResultSet rs, int rowNum) throws SQLException {
    return new ApplicationRecord(
        rs.getLong("id"),
        rs.getLong("user_id"),
        rs.getString("token"),
        rs.getString("name"),
        rs.getString("description"));
  }
}
