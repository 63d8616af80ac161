package supportbus.transcript;

import supportbus.Event;
import supportbus.EventHandler;
import supportbus.WorkflowEvent;
import supportbus.broker.EventBroker;
import supportbus.payload.AgentResponse;
import supportbus.payload.ConversationEnd;
import supportbus.payload.MalformedPayloadException;
import supportbus.session.ConversationContext;
import supportbus.session.ConversationStatus;
import supportbus.session.Sender;
import supportbus.session.SessionRegistry;
import supportbus.spi.ConversationWriter;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Passive observer that records agent replies and archives conversations when they end.
 *
 * <p>A conversation ends on {@code RESULT_ESCALATION_COMPLETE}, on {@code CONVERSATION_END},
 * or on a {@code RESULT_SEND_RESPONSE_TO_USER} flagged {@code final}. Operators named by
 * {@code RESULT_OPERATOR_ASSIGNED} or {@code CONVERSATION_END} are recorded on the session
 * while it is still live. Ending hands the
 * conversation to the {@link ConversationWriter}, removes the session from the registry
 * and publishes {@code TRANSCRIPT_SAVED}. A writer failure is logged and the session is
 * removed anyway.
 */
public final class TranscriptRecorder implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(TranscriptRecorder.class.getName());

  private final EventBroker broker;
  private final SessionRegistry registry;
  private final ConversationWriter writer;
  private final Clock clock;

  private final AtomicLong completed = new AtomicLong();
  private final AtomicLong writes = new AtomicLong();
  private final AtomicLong errors = new AtomicLong();

  private final EventHandler onResponse = this::onResponse;
  private final EventHandler onEscalated = this::onEscalated;
  private final EventHandler onEnd = this::onEnd;
  private final EventHandler onAssigned = this::onAssigned;

  private TranscriptRecorder(EventBroker broker, SessionRegistry registry,
      ConversationWriter writer, Clock clock) {
    this.broker = Objects.requireNonNull(broker, "broker");
    this.registry = Objects.requireNonNull(registry, "registry");
    this.writer = writer != null ? writer : ConversationWriter.NOOP;
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public static TranscriptRecorder attach(EventBroker broker, SessionRegistry registry,
      ConversationWriter writer) {
    return attach(broker, registry, writer, Clock.systemUTC());
  }

  /**
   * Creates a recorder and subscribes it to the broker.
   *
   * @param writer where finished conversations go; {@code null} for
   *     {@link ConversationWriter#NOOP}
   * @param clock source of conversation end times
   * @return the subscribed recorder; {@link #close()} unsubscribes it
   */
  public static TranscriptRecorder attach(EventBroker broker, SessionRegistry registry,
      ConversationWriter writer, Clock clock) {
    TranscriptRecorder recorder = new TranscriptRecorder(broker, registry, writer, clock);
    broker.subscribe(WorkflowEvent.RESULT_SEND_RESPONSE_TO_USER, recorder.onResponse);
    broker.subscribe(WorkflowEvent.RESULT_ESCALATION_COMPLETE, recorder.onEscalated);
    broker.subscribe(WorkflowEvent.CONVERSATION_END, recorder.onEnd);
    broker.subscribe(WorkflowEvent.RESULT_OPERATOR_ASSIGNED, recorder.onAssigned);
    return recorder;
  }

  private void onResponse(Event event) {
    AgentResponse response;
    try {
      response = AgentResponse.from(event);
    } catch (MalformedPayloadException e) {
      logger.warning("Ignoring agent response: " + e.getMessage());
      return;
    }
    Map<String, Object> action = new LinkedHashMap<>();
    action.put("agent", response.agent());
    action.put("action", "respond");
    action.put("status", "success");
    Map<String, Object> extras = new LinkedHashMap<>();
    extras.put("agent_action", action);
    if (registry.addMessage(response.sessionId(), Sender.AGENT, response.text(), extras).isEmpty()) {
      logger.warning("Agent response for unknown session " + response.sessionId());
      return;
    }
    if (response.finalResponse()) {
      registry.markStatus(response.sessionId(), ConversationStatus.RESOLVED);
      end(response.sessionId(), FinalStatus.RESOLVED_BY_AGENT);
    }
  }

  private void onEscalated(Event event) {
    String sessionId = event.sessionIdOrNull();
    if (sessionId == null) {
      logger.warning("Ignoring " + event.eventType() + " without session id");
      return;
    }
    end(sessionId, FinalStatus.ESCALATED_TO_HUMAN);
  }

  private void onEnd(Event event) {
    ConversationEnd end;
    try {
      end = ConversationEnd.from(event);
    } catch (MalformedPayloadException e) {
      logger.warning("Ignoring conversation end: " + e.getMessage());
      return;
    }
    if (end.operatorId() != null) {
      registry.assignOperator(end.sessionId(), end.operatorId());
    }
    end(end.sessionId(), FinalStatus.fromEndReason(end.reason()));
  }

  private void onAssigned(Event event) {
    Map<String, Object> payload = event.payload();
    String sessionId = event.sessionIdOrNull();
    if (!Boolean.TRUE.equals(payload.get("assigned")) || sessionId == null
        || !(payload.get("operator_id") instanceof String operatorId)) {
      return;
    }
    // No-op once the session is archived.
    registry.assignOperator(sessionId, operatorId);
  }

  private void end(String sessionId, FinalStatus finalStatus) {
    Optional<ConversationContext> context = registry.get(sessionId);
    if (context.isEmpty()) {
      logger.warning("Cannot archive unknown session " + sessionId);
      return;
    }
    CompletedConversation conversation =
        CompletedConversation.of(context.get(), finalStatus, clock.instant());
    boolean persisted = false;
    try {
      writer.writeConversation(conversation);
      writes.incrementAndGet();
      persisted = true;
    } catch (Exception e) {
      errors.incrementAndGet();
      logger.log(Level.SEVERE, "Failed to persist conversation " + sessionId, e);
    }
    registry.delete(sessionId);
    completed.incrementAndGet();
    logger.info("Conversation " + sessionId + " ended: " + finalStatus
        + " (" + conversation.messages().size() + " messages, persisted=" + persisted + ")");

    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put(Event.SESSION_ID, sessionId);
    payload.put("message_count", conversation.messages().size());
    payload.put("final_status", finalStatus.name());
    payload.put("persisted", persisted);
    broker.publish(WorkflowEvent.TRANSCRIPT_SAVED, payload);
  }

  public RecorderStats stats() {
    return new RecorderStats(completed.get(), writes.get(), errors.get());
  }

  @Override
  public void close() {
    broker.unsubscribe(WorkflowEvent.RESULT_SEND_RESPONSE_TO_USER, onResponse);
    broker.unsubscribe(WorkflowEvent.RESULT_ESCALATION_COMPLETE, onEscalated);
    broker.unsubscribe(WorkflowEvent.CONVERSATION_END, onEnd);
    broker.unsubscribe(WorkflowEvent.RESULT_OPERATOR_ASSIGNED, onAssigned);
  }
}
