package supportbus.coordinator;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import supportbus.Event;
import supportbus.EventCapture;
import supportbus.WorkflowEvent;
import supportbus.broker.EventBroker;
import supportbus.session.ConversationContext;
import supportbus.session.ConversationStatus;
import supportbus.session.SessionRegistry;
import supportbus.spi.MetricsExporter;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CoordinatorTest {
  private EventBroker broker;
  private SessionRegistry registry;
  private Coordinator coordinator;
  private EventCapture capture;

  @BeforeEach
  void setUp() {
    broker = EventBroker.builder().build();
    registry = new SessionRegistry();
    coordinator = Coordinator.builder().broker(broker).registry(registry).build();
    capture = EventCapture.on(broker);
  }

  private void newMessage(String sessionId, String text) {
    broker.publish(WorkflowEvent.NEW_USER_MESSAGE, Map.of("session_id", sessionId, "text", text));
  }

  private void sentiment(String sessionId, String label) {
    broker.publish(WorkflowEvent.RESULT_SENTIMENT_RECOGNIZED,
        Map.of("session_id", sessionId, "sentiment", label, "confidence", 0.9));
  }

  private void intent(String sessionId, String label, double confidence) {
    broker.publish(WorkflowEvent.RESULT_INTENT_RECOGNIZED,
        Map.of("session_id", sessionId, "intent", label, "confidence", confidence));
  }

  @Test
  void gateZeroRecordsMessageAndRequestsSentiment() {
    broker.publish(WorkflowEvent.NEW_USER_MESSAGE,
        Map.of("session_id", "s1", "text", "Hello", "customer_email", "a@b.c"));

    ConversationContext context = registry.get("s1").orElseThrow();
    assertEquals("a@b.c", context.customerEmail());
    assertEquals(1, context.messageCount());
    Event task = capture.single(WorkflowEvent.TASK_RECOGNIZE_SENTIMENT);
    assertEquals(Map.of("session_id", "s1", "text", "Hello"), task.payload());
    assertEquals(1, coordinator.stats().messagesProcessed());
  }

  @Test
  void messagesAccumulateInOrder() {
    for (int i = 0; i < 5; i++) {
      newMessage("s1", "message " + i);
    }

    List<String> texts = registry.get("s1").orElseThrow().userTextHistory();
    assertEquals(List.of("message 0", "message 1", "message 2", "message 3", "message 4"), texts);
    assertEquals(5, capture.ofType(WorkflowEvent.TASK_RECOGNIZE_SENTIMENT).size());
  }

  @Test
  void angrySentimentEscalatesOnceWithoutIntentTask() {
    newMessage("s1", "This is ridiculous");

    sentiment("s1", "ANGRY");

    Event escalation = capture.single(WorkflowEvent.TASK_ESCALATE);
    assertEquals("NEGATIVE_SENTIMENT_ANGRY", escalation.payload().get("reason"));
    assertTrue(capture.ofType(WorkflowEvent.TASK_RECOGNIZE_INTENT).isEmpty());
    assertEquals(ConversationStatus.ESCALATED, registry.get("s1").orElseThrow().status());
    Map<?, ?> context = (Map<?, ?>) escalation.payload().get("context");
    assertEquals("s1", context.get("session_id"));
    assertEquals("ESCALATED", context.get("status"));
  }

  @Test
  void sentimentLabelsCompareCaseInsensitively() {
    newMessage("s1", "meh");

    sentiment("s1", "negative");

    assertEquals("NEGATIVE_SENTIMENT_NEGATIVE",
        capture.single(WorkflowEvent.TASK_ESCALATE).payload().get("reason"));
  }

  @Test
  void neutralSentimentRequestsIntentWithHistory() {
    newMessage("s1", "Hi");
    newMessage("s1", "Where is my order?");

    sentiment("s1", "NEUTRAL");

    Event task = capture.single(WorkflowEvent.TASK_RECOGNIZE_INTENT);
    assertEquals("Where is my order?", task.payload().get("text"));
    assertEquals(List.of("Hi", "Where is my order?"), task.payload().get("history"));
    assertTrue(capture.ofType(WorkflowEvent.TASK_ESCALATE).isEmpty());
  }

  @Test
  void confidenceAtThresholdRoutes() {
    newMessage("s1", "Where is my order?");

    intent("s1", "track_order", 0.7);

    assertTrue(capture.ofType(WorkflowEvent.TASK_ESCALATE).isEmpty());
    Event routed = capture.ofType("TASK_HANDLE_ORDER_TRACKING").get(0);
    assertEquals("s1", routed.payload().get("session_id"));
    assertEquals("track_order", routed.payload().get("current_intent"));
    assertEquals(1, coordinator.stats().routes());
  }

  @Test
  void confidenceBelowThresholdEscalates() {
    newMessage("s1", "Where is my order?");

    intent("s1", "track_order", Math.nextDown(0.7));

    assertEquals("LOW_INTENT_CONFIDENCE",
        capture.single(WorkflowEvent.TASK_ESCALATE).payload().get("reason"));
    assertTrue(capture.ofType("TASK_HANDLE_ORDER_TRACKING").isEmpty());
  }

  @Test
  void unknownIntentEscalates() {
    newMessage("s1", "Sing me a song");

    intent("s1", "sing_song", 0.99);

    Event escalation = capture.single(WorkflowEvent.TASK_ESCALATE);
    assertEquals("UNKNOWN_INTENT", escalation.payload().get("reason"));
    assertEquals(Map.of("intent", "sing_song"), escalation.payload().get("details"));
  }

  @Test
  void routesAndThresholdAreConfigurable() {
    coordinator.close();
    CoordinatorConfig config = new CoordinatorConfig()
        .setIntentConfidenceThreshold(0.5)
        .setSentimentEscalationLabels(Set.of("SAD"))
        .addRoute("billing", "TASK_HANDLE_BILLING");
    Coordinator.builder().broker(broker).registry(registry).config(config).build();

    newMessage("s1", "Invoice question");
    sentiment("s1", "ANGRY");
    intent("s1", "billing", 0.55);

    assertTrue(capture.ofType(WorkflowEvent.TASK_ESCALATE).isEmpty());
    assertEquals(1, capture.ofType("TASK_HANDLE_BILLING").size());
  }

  @Test
  void lateResultForMissingSessionIsIgnored() {
    sentiment("ghost", "NEUTRAL");
    intent("ghost", "track_order", 0.9);

    assertTrue(capture.ofType(WorkflowEvent.TASK_RECOGNIZE_INTENT).isEmpty());
    assertTrue(capture.ofType(WorkflowEvent.TASK_ESCALATE).isEmpty());
    assertTrue(capture.ofType(WorkflowEvent.AGENT_ERROR).isEmpty());
    assertEquals(0, broker.stats().errors());
  }

  @Test
  void malformedGatePayloadReportsOneAgentError() {
    newMessage("s1", "Hello");

    broker.publish(WorkflowEvent.RESULT_INTENT_RECOGNIZED, Map.of("session_id", "s1", "intent", "x"));

    Event error = capture.single(WorkflowEvent.AGENT_ERROR);
    assertEquals("coordinator", error.payload().get("agent_name"));
    assertEquals("RESULT_INTENT_RECOGNIZED", error.payload().get("task"));
    assertEquals("AGENT_ERROR_coordinator",
        capture.single(WorkflowEvent.TASK_ESCALATE).payload().get("reason"));
    assertEquals(0, broker.stats().errors());
  }

  @Test
  void malformedPayloadWithoutSessionDoesNotEscalate() {
    broker.publish(WorkflowEvent.NEW_USER_MESSAGE, Map.of("text", "orphan"));

    assertEquals(1, capture.ofType(WorkflowEvent.AGENT_ERROR).size());
    assertTrue(capture.ofType(WorkflowEvent.TASK_ESCALATE).isEmpty());
    assertEquals(0, registry.count());
  }

  @Test
  void agentErrorEscalatesWithAgentName() {
    newMessage("s1", "Hello");

    broker.publish(WorkflowEvent.AGENT_ERROR,
        Map.of("session_id", "s1", "agent_name", "intent_agent", "error", "model offline"));

    Event escalation = capture.single(WorkflowEvent.TASK_ESCALATE);
    assertEquals("AGENT_ERROR_intent_agent", escalation.payload().get("reason"));
    Map<?, ?> details = (Map<?, ?>) escalation.payload().get("details");
    assertEquals("model offline", details.get("error"));
    assertEquals(1, coordinator.stats().errors());
  }

  @Test
  void escalationRequestBecomesCanonicalTask() {
    newMessage("s1", "Let me talk to a human");

    broker.publish(WorkflowEvent.REQUEST_ESCALATION, Map.of("session_id", "s1",
        "reason", "CUSTOMER_REQUEST", "priority", "HIGH", "details", Map.of("channel", "chat")));

    Event escalation = capture.single(WorkflowEvent.TASK_ESCALATE);
    assertEquals("CUSTOMER_REQUEST", escalation.payload().get("reason"));
    assertEquals("HIGH", escalation.payload().get("priority"));
    assertEquals(Map.of("channel", "chat"), escalation.payload().get("details"));
    assertEquals("CUSTOMER_REQUEST", registry.get("s1").orElseThrow().escalationReason());
  }

  @Test
  void escalationForUnknownSessionCarriesNullContext() {
    broker.publish(WorkflowEvent.REQUEST_ESCALATION, Map.of("session_id", "gone", "reason", "X"));

    Event escalation = capture.single(WorkflowEvent.TASK_ESCALATE);
    assertTrue(escalation.payload().containsKey("context"));
    assertNull(escalation.payload().get("context"));
  }

  @Test
  void malformedEscalationRequestIsDropped() {
    broker.publish(WorkflowEvent.REQUEST_ESCALATION, Map.of("session_id", "s1"));
    broker.publish(WorkflowEvent.AGENT_ERROR, Map.of("error", "no session"));

    assertTrue(capture.ofType(WorkflowEvent.TASK_ESCALATE).isEmpty());
    assertEquals(1, capture.ofType(WorkflowEvent.AGENT_ERROR).size());
  }

  @Test
  void timeoutAbandonsSessionAndEndsConversation() {
    newMessage("s1", "Hello?");

    broker.publish(WorkflowEvent.CONVERSATION_TIMEOUT, Map.of("session_id", "s1"));

    assertEquals(ConversationStatus.ABANDONED, registry.get("s1").orElseThrow().status());
    Event end = capture.single(WorkflowEvent.CONVERSATION_END);
    assertEquals("TIMEOUT", end.payload().get("reason"));
  }

  @Test
  void timeoutForUnknownSessionIsNoOp() {
    broker.publish(WorkflowEvent.CONVERSATION_TIMEOUT, Map.of("session_id", "ghost"));

    assertTrue(capture.ofType(WorkflowEvent.CONVERSATION_END).isEmpty());
  }

  @Test
  void unexpectedGateFailureEscalatesAsSystemError() {
    coordinator.close();
    SessionRegistry brokenGauges = new SessionRegistry(Clock.systemUTC(), new FailingGaugeMetrics());
    Coordinator.builder().broker(broker).registry(brokenGauges).build();

    newMessage("s1", "hello");

    Event escalation = capture.single(WorkflowEvent.TASK_ESCALATE);
    assertEquals("SYSTEM_ERROR", escalation.payload().get("reason"));
    Map<?, ?> details = (Map<?, ?>) escalation.payload().get("details");
    assertEquals("gauge backend down", details.get("error"));
    assertEquals("NEW_USER_MESSAGE", details.get("task"));
    assertNotNull(escalation.payload().get("context"));
    assertTrue(capture.ofType(WorkflowEvent.TASK_RECOGNIZE_SENTIMENT).isEmpty());
    assertEquals(0, broker.stats().errors());
  }

  @Test
  void closeUnsubscribesHandlers() {
    coordinator.close();

    newMessage("s1", "Anyone?");

    assertEquals(0, registry.count());
    assertTrue(capture.ofType(WorkflowEvent.TASK_RECOGNIZE_SENTIMENT).isEmpty());
  }

  private static final class FailingGaugeMetrics implements MetricsExporter {
    @Override
    public void incrementPublished() {
    }

    @Override
    public void incrementDelivered() {
    }

    @Override
    public void incrementHandlerErrors() {
    }

    @Override
    public void incrementUndelivered() {
    }

    @Override
    public void recordActiveSessions(int activeSessions) {
      throw new IllegalStateException("gauge backend down");
    }

    @Override
    public void recordEscalationQueueDepth(int depth) {
    }
  }
}
