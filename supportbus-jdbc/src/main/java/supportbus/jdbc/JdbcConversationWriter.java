package supportbus.jdbc;

import com.github.f4b6a3.ulid.UlidCreator;
import supportbus.session.Message;
import supportbus.spi.ConversationWriter;
import supportbus.transcript.CompletedConversation;
import supportbus.util.JsonCodec;

import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * {@link ConversationWriter} that stores a finished conversation as one header row in
 * {@code completed_conversations} and one row per message in {@code completed_messages}.
 *
 * <p>Header and messages are written in a single transaction on a connection obtained
 * from the {@link ConnectionProvider}. Any failure rolls the transaction back and
 * surfaces as {@link ConversationStoreException}.
 *
 * <p>The {@code conversation_id} column holds {@link #conversationId(String)} of the
 * session id, so the same session always maps to the same row key.
 *
 * <pre>{@code
 * JdbcConversationWriter writer = JdbcConversationWriter.builder()
 *     .connectionProvider(new DataSourceConnectionProvider(dataSource))
 *     .build();
 * }</pre>
 */
public final class JdbcConversationWriter implements ConversationWriter {
  private static final Logger logger = Logger.getLogger(JdbcConversationWriter.class.getName());

  private static final Pattern UUID_PATTERN = Pattern.compile(
      "[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");

  private final ConnectionProvider connectionProvider;
  private final String conversationsTable;
  private final String messagesTable;
  private final JsonCodec jsonCodec;

  private JdbcConversationWriter(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.conversationsTable = TableNames.validate(builder.conversationsTable);
    this.messagesTable = TableNames.validate(builder.messagesTable);
    this.jsonCodec = builder.jsonCodec != null ? builder.jsonCodec : JsonCodec.getDefault();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Maps a session id to the stored conversation id. A session id that already is a
   * UUID is kept; anything else gets a name-based UUID derived from its UTF-8 bytes.
   */
  public static UUID conversationId(String sessionId) {
    Objects.requireNonNull(sessionId, "sessionId");
    if (UUID_PATTERN.matcher(sessionId).matches()) {
      return UUID.fromString(sessionId);
    }
    return UUID.nameUUIDFromBytes(sessionId.getBytes(StandardCharsets.UTF_8));
  }

  @Override
  public void writeConversation(CompletedConversation conversation) {
    String conversationId = conversationId(conversation.sessionId()).toString();
    try (Connection conn = connectionProvider.getConnection()) {
      boolean autoCommit = conn.getAutoCommit();
      conn.setAutoCommit(false);
      try {
        insertHeader(conn, conversationId, conversation);
        for (Message message : conversation.messages()) {
          insertMessage(conn, conversationId, message);
        }
        conn.commit();
      } catch (RuntimeException | SQLException e) {
        rollback(conn, e);
        throw e instanceof ConversationStoreException cse ? cse
            : new ConversationStoreException(
                "Failed to write conversation " + conversation.sessionId(), e);
      } finally {
        conn.setAutoCommit(autoCommit);
      }
    } catch (SQLException e) {
      throw new ConversationStoreException(
          "Failed to obtain connection for conversation " + conversation.sessionId(), e);
    }
    logger.info("Wrote conversation " + conversation.sessionId() + " as " + conversationId
        + " (" + conversation.messages().size() + " messages)");
  }

  private void insertHeader(Connection conn, String conversationId,
      CompletedConversation conversation) {
    String sql = "INSERT INTO " + conversationsTable + " (" +
        "conversation_id, session_id, start_time, end_time, final_status, review_score, " +
        "operator_id, customer_id) VALUES (?,?,?,?,?,NULL,?,?)";
    String customerId = conversation.customerId() != null
        ? conversation.customerId()
        : conversation.customerEmail();
    JdbcTemplate.update(conn, sql,
        conversationId, conversation.sessionId(),
        Timestamp.from(conversation.startTime()), Timestamp.from(conversation.endTime()),
        conversation.finalStatus().name(), conversation.operatorId(), customerId);
  }

  private void insertMessage(Connection conn, String conversationId, Message message) {
    String sql = "INSERT INTO " + messagesTable + " (" +
        "message_id, conversation_id, message_timestamp, sender, text_content, " +
        "intent_label, sentiment_label, entities, agent_action) VALUES (?,?,?,?,?,?,?,?,?)";
    JdbcTemplate.update(conn, sql,
        UlidCreator.getMonotonicUlid().toString(), conversationId,
        Timestamp.from(message.timestamp()), message.sender().name(), message.text(),
        message.intentLabel(), message.sentimentLabel(),
        jsonOrNull(message.entities()), jsonOrNull(message.agentAction()));
  }

  private String jsonOrNull(Map<String, Object> value) {
    return value == null || value.isEmpty() ? null : jsonCodec.toJson(value);
  }

  private static void rollback(Connection conn, Exception cause) {
    try {
      conn.rollback();
    } catch (SQLException e) {
      cause.addSuppressed(e);
    }
  }

  /** Builder for {@link JdbcConversationWriter}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private String conversationsTable = TableNames.DEFAULT_CONVERSATIONS_TABLE;
    private String messagesTable = TableNames.DEFAULT_MESSAGES_TABLE;
    private JsonCodec jsonCodec;

    private Builder() {}

    /**
     * <b>Required.</b>
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /**
     * Optional. Defaults to {@code completed_conversations}.
     */
    public Builder conversationsTable(String conversationsTable) {
      this.conversationsTable = conversationsTable;
      return this;
    }

    /**
     * Optional. Defaults to {@code completed_messages}.
     */
    public Builder messagesTable(String messagesTable) {
      this.messagesTable = messagesTable;
      return this;
    }

    /**
     * Sets the codec for the {@code entities} and {@code agent_action} columns.
     *
     * <p>Optional. Defaults to {@link JsonCodec#getDefault()}.
     */
    public Builder jsonCodec(JsonCodec jsonCodec) {
      this.jsonCodec = jsonCodec;
      return this;
    }

    /**
     * @throws IllegalArgumentException if a table name is not a plain identifier
     */
    public JdbcConversationWriter build() {
      return new JdbcConversationWriter(this);
    }
  }
}
