package supportbus.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import supportbus.SupportBus;
import supportbus.WorkflowEvent;
import supportbus.classify.Classification;
import supportbus.classify.ClassifierAgent;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class HikariCPIntegrationTest {
  private HikariDataSource hikariDs;
  private JdbcConversationWriter writer;

  @BeforeEach
  void setup() throws SQLException {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl("jdbc:h2:mem:hikari_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
    config.setMaximumPoolSize(4);
    config.setMinimumIdle(1);
    config.setPoolName("supportbus-test-pool");
    hikariDs = new HikariDataSource(config);

    try (Connection conn = hikariDs.getConnection()) {
      Schema.create(conn);
    }
    writer = JdbcConversationWriter.builder()
        .connectionProvider(new DataSourceConnectionProvider(hikariDs))
        .build();
  }

  @AfterEach
  void tearDown() {
    if (hikariDs != null && !hikariDs.isClosed()) {
      hikariDs.close();
    }
  }

  @Test
  void escalatedConversationIsArchivedThroughPool() throws Exception {
    try (SupportBus bus = SupportBus.builder().conversationWriter(writer).build()) {
      ClassifierAgent.sentiment(bus.broker(), (text, history) -> Classification.of("NEGATIVE", 0.8));

      bus.broker().publish(WorkflowEvent.NEW_USER_MESSAGE,
          Map.of("session_id", "pool-1", "text", "Nothing works", "customer_email", "p@q.r"));

      assertEquals(1, bus.transcriptRecorder().stats().writes());
    }

    try (Connection conn = hikariDs.getConnection();
         PreparedStatement ps = conn.prepareStatement(
             "SELECT final_status, customer_id FROM completed_conversations WHERE session_id=?")) {
      ps.setString(1, "pool-1");
      try (ResultSet rs = ps.executeQuery()) {
        assertTrue(rs.next());
        assertEquals("ESCALATED_TO_HUMAN", rs.getString(1));
        assertEquals("p@q.r", rs.getString(2));
      }
    }
    assertEquals(1, countRows("completed_messages"));
    assertEquals(0, hikariDs.getHikariPoolMXBean().getActiveConnections());
  }

  @Test
  void concurrentSessionsDoNotLeakConnections() throws Exception {
    int threads = 4;
    int sessionsPerThread = 10;
    try (SupportBus bus = SupportBus.builder().conversationWriter(writer).build()) {
      ExecutorService executor = Executors.newFixedThreadPool(threads);
      for (int t = 0; t < threads; t++) {
        final int threadIdx = t;
        executor.submit(() -> {
          for (int i = 0; i < sessionsPerThread; i++) {
            String sessionId = "t" + threadIdx + "-" + i;
            bus.broker().publish(WorkflowEvent.NEW_USER_MESSAGE,
                Map.of("session_id", sessionId, "text", "hello"));
            bus.broker().publish(WorkflowEvent.CONVERSATION_END,
                Map.of("session_id", sessionId, "reason", "RESOLVED"));
          }
        });
      }
      executor.shutdown();
      assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));

      assertEquals(threads * sessionsPerThread, bus.transcriptRecorder().stats().writes());
      assertEquals(0, bus.registry().count());
    }

    assertEquals(threads * sessionsPerThread, countRows("completed_conversations"));
    assertEquals(threads * sessionsPerThread, countRows("completed_messages"));
    assertEquals(0, hikariDs.getHikariPoolMXBean().getActiveConnections());
  }

  @Test
  void failedWriteReturnsConnectionToPool() {
    JdbcConversationWriter broken = JdbcConversationWriter.builder()
        .connectionProvider(new DataSourceConnectionProvider(hikariDs))
        .conversationsTable("missing_conversations")
        .build();

    try (SupportBus bus = SupportBus.builder().conversationWriter(broken).build()) {
      bus.registry().createSession("f1", null);
      bus.broker().publish(WorkflowEvent.CONVERSATION_END, Map.of("session_id", "f1"));

      assertEquals(1, bus.transcriptRecorder().stats().errors());
      assertFalse(bus.registry().contains("f1"));
    }
    assertEquals(0, hikariDs.getHikariPoolMXBean().getActiveConnections());
  }

  private int countRows(String table) throws SQLException {
    try (Connection conn = hikariDs.getConnection();
         PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM " + table);
         ResultSet rs = ps.executeQuery()) {
      rs.next();
      return rs.getInt(1);
    }
  }
}
