package supportbus.payload;

import org.junit.jupiter.api.Test;
import supportbus.Event;
import supportbus.WorkflowEvent;
import supportbus.escalation.EscalationPriority;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowPayloadTest {

  @Test
  void newMessageRequiresSessionAndText() {
    NewMessage message = NewMessage.from(Event.of(WorkflowEvent.NEW_USER_MESSAGE,
        Map.of("session_id", "s1", "text", "hi", "customer_email", "a@b.c")));

    assertEquals("s1", message.sessionId());
    assertEquals("a@b.c", message.customerEmail());
    assertNull(message.customerId());

    MalformedPayloadException e = assertThrows(MalformedPayloadException.class,
        () -> NewMessage.from(Event.of(WorkflowEvent.NEW_USER_MESSAGE, Map.of("session_id", "s1"))));
    assertEquals("text", e.field());
    assertEquals("NEW_USER_MESSAGE", e.eventType());
  }

  @Test
  void emptyStringCountsAsMissing() {
    MalformedPayloadException e = assertThrows(MalformedPayloadException.class,
        () -> SentimentResult.from(Event.of(WorkflowEvent.RESULT_SENTIMENT_RECOGNIZED,
            Map.of("session_id", "", "sentiment", "ANGRY"))));
    assertEquals("session_id", e.field());
  }

  @Test
  void numbersAcceptNumericStrings() {
    IntentResult result = IntentResult.from(Event.of(WorkflowEvent.RESULT_INTENT_RECOGNIZED,
        Map.of("session_id", "s1", "intent", "track_order", "confidence", "0.75")));

    assertEquals(0.75, result.confidence());
    assertNull(result.entities());
  }

  @Test
  void intentConfidenceIsRequiredAndNumeric() {
    assertThrows(MalformedPayloadException.class,
        () -> IntentResult.from(Event.of(WorkflowEvent.RESULT_INTENT_RECOGNIZED,
            Map.of("session_id", "s1", "intent", "track_order"))));
    MalformedPayloadException e = assertThrows(MalformedPayloadException.class,
        () -> IntentResult.from(Event.of(WorkflowEvent.RESULT_INTENT_RECOGNIZED,
            Map.of("session_id", "s1", "intent", "track_order", "confidence", "high"))));
    assertEquals("confidence", e.field());
  }

  @Test
  void entitiesMustBeAnObject() {
    assertThrows(MalformedPayloadException.class,
        () -> IntentResult.from(Event.of(WorkflowEvent.RESULT_INTENT_RECOGNIZED,
            Map.of("session_id", "s1", "intent", "x", "confidence", 0.9, "entities", "order=1"))));
  }

  @Test
  void sentimentConfidenceIsOptional() {
    SentimentResult result = SentimentResult.from(Event.of(WorkflowEvent.RESULT_SENTIMENT_RECOGNIZED,
        Map.of("session_id", "s1", "sentiment", "NEUTRAL")));

    assertNull(result.confidence());
  }

  @Test
  void escalationRequestDefaultsAndParsesPriority() {
    EscalationRequest defaults = EscalationRequest.from(Event.of(WorkflowEvent.REQUEST_ESCALATION,
        Map.of("session_id", "s1", "reason", "CUSTOMER_ASKED")));
    EscalationRequest high = EscalationRequest.from(Event.of(WorkflowEvent.REQUEST_ESCALATION,
        Map.of("session_id", "s1", "reason", "VIP", "priority", "high", "details", Map.of("k", "v"))));

    assertEquals(EscalationPriority.NORMAL, defaults.priority());
    assertEquals(Map.of(), defaults.details());
    assertEquals(EscalationPriority.HIGH, high.priority());
    assertEquals(Map.of("k", "v"), high.details());
    assertThrows(MalformedPayloadException.class,
        () -> EscalationRequest.from(Event.of(WorkflowEvent.REQUEST_ESCALATION,
            Map.of("session_id", "s1", "reason", "VIP", "priority", "URGENT"))));
  }

  @Test
  void classificationTaskHistoryIsOptional() {
    ClassificationTask sentimentTask = ClassificationTask.from(Event.of(
        WorkflowEvent.TASK_RECOGNIZE_SENTIMENT, ClassificationTask.sentiment("s1", "hi").toPayload()));
    ClassificationTask intentTask = ClassificationTask.from(Event.of(WorkflowEvent.TASK_RECOGNIZE_INTENT,
        Map.of("session_id", "s1", "text", "b", "history", List.of("a", "b"))));

    assertNull(sentimentTask.history());
    assertFalse(ClassificationTask.sentiment("s1", "hi").toPayload().containsKey("history"));
    assertEquals(List.of("a", "b"), intentTask.history());
  }

  @Test
  void agentResponseFinalFlag() {
    AgentResponse response = AgentResponse.from(Event.of(WorkflowEvent.RESULT_SEND_RESPONSE_TO_USER,
        Map.of("session_id", "s1", "text", "Label sent", "final", true)));
    AgentResponse partial = AgentResponse.from(Event.of(WorkflowEvent.RESULT_SEND_RESPONSE_TO_USER,
        Map.of("session_id", "s1", "text", "Looking...")));

    assertTrue(response.finalResponse());
    assertFalse(partial.finalResponse());
    assertEquals("unknown", partial.agent());
  }

  @Test
  void escalationTaskCarriesNullContext() {
    EscalationTask task = new EscalationTask("s1", "SYSTEM_ERROR", Map.of("error", "x"),
        EscalationPriority.HIGH, null);

    Map<String, Object> payload = task.toPayload();

    assertTrue(payload.containsKey("context"));
    assertNull(payload.get("context"));
    assertEquals("HIGH", payload.get("priority"));
    assertEquals(task, EscalationTask.from(Event.of(WorkflowEvent.TASK_ESCALATE, payload)));
  }

  @Test
  void escalationTaskContextIsDetachedFromCaller() {
    List<Object> messages = new ArrayList<>();
    messages.add(Map.of("sender", "USER", "text", "help"));
    Map<String, Object> context = new LinkedHashMap<>();
    context.put("messages", messages);
    EscalationTask task = new EscalationTask("s1", "UNKNOWN_INTENT", null, null, context);

    messages.clear();
    Map<String, Object> payload = task.toPayload();

    Map<?, ?> copied = (Map<?, ?>) payload.get("context");
    List<?> copiedMessages = (List<?>) copied.get("messages");
    assertEquals(1, copiedMessages.size());
    assertThrows(UnsupportedOperationException.class, copiedMessages::clear);
    assertThrows(UnsupportedOperationException.class, () -> ((Map<?, ?>) payload.get("details")).clear());
  }

  @Test
  void optionalFieldsMayBeExplicitNull() {
    Map<String, Object> raw = new LinkedHashMap<>();
    raw.put("session_id", "s1");
    raw.put("reason", null);

    ConversationEnd end = ConversationEnd.from(Event.of(WorkflowEvent.CONVERSATION_END, raw));
    ConversationTimeout timeout = ConversationTimeout.from(Event.of(WorkflowEvent.CONVERSATION_TIMEOUT, raw));

    assertNull(end.reason());
    assertEquals("TIMEOUT", timeout.reason());
  }

  @Test
  void operatorPayloads() {
    OperatorAvailable operator = OperatorAvailable.from(Event.of(WorkflowEvent.OPERATOR_AVAILABLE,
        Map.of("operator_id", "op-1")));
    EscalationResolved resolved = EscalationResolved.from(Event.of(WorkflowEvent.ESCALATION_RESOLVED,
        Map.of("session_id", "s1", "operator_id", "op-1")));

    assertEquals("Unknown", operator.operatorName());
    assertEquals("", resolved.resolutionNotes());
    assertThrows(MalformedPayloadException.class,
        () -> OperatorAvailable.from(Event.of(WorkflowEvent.OPERATOR_AVAILABLE, Map.of())));
  }
}
