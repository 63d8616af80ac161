package supportbus.escalation;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import supportbus.Event;
import supportbus.EventCapture;
import supportbus.MutableClock;
import supportbus.WorkflowEvent;
import supportbus.broker.EventBroker;
import supportbus.spi.MetricsExporter;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EscalationManagerTest {
  private final MutableClock clock = MutableClock.startingAt("2024-05-01T12:00:00Z");
  private EventBroker broker;
  private EscalationQueue queue;
  private EscalationManager manager;
  private EventCapture capture;

  @BeforeEach
  void setUp() {
    broker = EventBroker.builder().build();
    queue = new EscalationQueue(clock, MetricsExporter.NOOP, 300);
    manager = EscalationManager.attach(broker, queue);
    capture = EventCapture.on(broker);
  }

  private void escalate(String sessionId, String priority) {
    broker.publish(WorkflowEvent.TASK_ESCALATE, Map.of("session_id", sessionId,
        "reason", "LOW_INTENT_CONFIDENCE", "priority", priority,
        "context", Map.of("session_id", sessionId)));
  }

  @Test
  void escalationIsQueuedAndOperatorsNotified() {
    escalate("s1", "NORMAL");
    escalate("s2", "NORMAL");

    Event complete = capture.ofType(WorkflowEvent.RESULT_ESCALATION_COMPLETE).get(1);
    assertEquals("s2", complete.payload().get("session_id"));
    assertEquals("QUEUED", complete.payload().get("status"));
    assertEquals(2, complete.payload().get("queue_position"));
    assertEquals(600L, complete.payload().get("estimated_wait_time"));

    Event notification = capture.ofType(WorkflowEvent.NOTIFICATION_OPERATOR).get(1);
    assertEquals("NEW_ESCALATION", notification.payload().get("type"));
    assertEquals(2, notification.payload().get("queue_size"));
    assertEquals("NORMAL", notification.payload().get("priority"));
  }

  @Test
  void operatorGetsNextSessionWithContext() {
    escalate("s1", "NORMAL");
    clock.advance(Duration.ofSeconds(45));

    broker.publish(WorkflowEvent.OPERATOR_AVAILABLE,
        Map.of("operator_id", "op-1", "operator_name", "Dana"));

    Event assigned = capture.single(WorkflowEvent.RESULT_OPERATOR_ASSIGNED);
    assertEquals(Boolean.TRUE, assigned.payload().get("assigned"));
    assertEquals("s1", assigned.payload().get("session_id"));
    assertEquals("Dana", assigned.payload().get("operator_name"));
    assertEquals(Map.of("session_id", "s1"), assigned.payload().get("context"));
    assertEquals("2024-05-01T12:00:00Z", assigned.payload().get("escalated_at"));
    assertEquals(45.0, assigned.payload().get("wait_time_seconds"));
  }

  @Test
  void operatorOnEmptyQueueGetsQueueEmpty() {
    broker.publish(WorkflowEvent.OPERATOR_AVAILABLE, Map.of("operator_id", "op-1"));

    Event assigned = capture.single(WorkflowEvent.RESULT_OPERATOR_ASSIGNED);
    assertEquals(Boolean.FALSE, assigned.payload().get("assigned"));
    assertEquals("QUEUE_EMPTY", assigned.payload().get("reason"));
  }

  @Test
  void resolutionReportsTimesOnce() {
    escalate("s1", "HIGH");
    clock.advance(Duration.ofSeconds(60));
    broker.publish(WorkflowEvent.OPERATOR_AVAILABLE, Map.of("operator_id", "op-1"));
    clock.advance(Duration.ofSeconds(240));

    Map<String, Object> resolved = Map.of("session_id", "s1", "operator_id", "op-1",
        "resolution_notes", "Replacement shipped");
    broker.publish(WorkflowEvent.ESCALATION_RESOLVED, resolved);
    broker.publish(WorkflowEvent.ESCALATION_RESOLVED, resolved);

    Event result = capture.single(WorkflowEvent.RESULT_ESCALATION_RESOLVED);
    assertEquals(300.0, result.payload().get("total_time_seconds"));
    assertEquals(240.0, result.payload().get("handling_time_seconds"));
    assertEquals("Replacement shipped", result.payload().get("resolution_notes"));
  }

  @Test
  void malformedTaskIsReportedAsAgentError() {
    broker.publish(WorkflowEvent.TASK_ESCALATE, Map.of("session_id", "s1"));

    Event error = capture.single(WorkflowEvent.AGENT_ERROR);
    assertEquals("escalation_manager", error.payload().get("agent_name"));
    assertEquals("TASK_ESCALATE", error.payload().get("task"));
    assertEquals(0, queue.size());
  }

  @Test
  void malformedOperatorEventIsOnlyLogged() {
    broker.publish(WorkflowEvent.OPERATOR_AVAILABLE, Map.of("operator_name", "Nobody"));

    assertTrue(capture.ofType(WorkflowEvent.AGENT_ERROR).isEmpty());
    assertTrue(capture.ofType(WorkflowEvent.RESULT_OPERATOR_ASSIGNED).isEmpty());
  }

  @Test
  void subscriberCannotRewriteQueuedContext() {
    broker.subscribe(WorkflowEvent.TASK_ESCALATE, event -> {
      Map<?, ?> context = (Map<?, ?>) event.payload().get("context");
      ((List<?>) context.get("messages")).clear();
    });

    broker.publish(WorkflowEvent.TASK_ESCALATE, Map.of("session_id", "s1",
        "reason", "UNKNOWN_INTENT",
        "context", Map.of("session_id", "s1",
            "messages", List.of(Map.of("sender", "USER", "text", "help")))));
    broker.publish(WorkflowEvent.OPERATOR_AVAILABLE, Map.of("operator_id", "op-1"));

    assertEquals(1, broker.stats().errors());
    Map<?, ?> stored = queue.get("s1").orElseThrow().context();
    assertEquals(1, ((List<?>) stored.get("messages")).size());
    Event assigned = capture.single(WorkflowEvent.RESULT_OPERATOR_ASSIGNED);
    Map<?, ?> handedOver = (Map<?, ?>) assigned.payload().get("context");
    assertEquals(1, ((List<?>) handedOver.get("messages")).size());
  }

  @Test
  void closeStopsHandlingEvents() {
    manager.close();

    escalate("s1", "NORMAL");

    assertEquals(0, queue.size());
    assertTrue(capture.ofType(WorkflowEvent.RESULT_ESCALATION_COMPLETE).isEmpty());
  }
}
