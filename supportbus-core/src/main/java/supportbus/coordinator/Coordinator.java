package supportbus.coordinator;

import supportbus.Event;
import supportbus.EventHandler;
import supportbus.WorkflowEvent;
import supportbus.broker.EventBroker;
import supportbus.escalation.EscalationPriority;
import supportbus.payload.AgentError;
import supportbus.payload.ClassificationTask;
import supportbus.payload.ConversationEnd;
import supportbus.payload.ConversationTimeout;
import supportbus.payload.EscalationRequest;
import supportbus.payload.EscalationTask;
import supportbus.payload.IntentResult;
import supportbus.payload.MalformedPayloadException;
import supportbus.payload.NewMessage;
import supportbus.payload.SentimentResult;
import supportbus.session.ConversationContext;
import supportbus.session.ConversationStatus;
import supportbus.session.Sender;
import supportbus.session.SessionAttributes;
import supportbus.session.SessionRegistry;
import supportbus.spi.MetricsExporter;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Gate state machine driving each conversation from the first user message to a
 * downstream handler or a human operator.
 *
 * <pre>
 *   NEW_USER_MESSAGE ──(gate 0)──→ TASK_RECOGNIZE_SENTIMENT
 *   RESULT_SENTIMENT_RECOGNIZED ──(gate 1)──→ TASK_RECOGNIZE_INTENT | TASK_ESCALATE
 *   RESULT_INTENT_RECOGNIZED ──(gate 2)──→ routed task | TASK_ESCALATE
 *   REQUEST_ESCALATION, AGENT_ERROR ──→ TASK_ESCALATE
 *   CONVERSATION_TIMEOUT ──→ CONVERSATION_END
 * </pre>
 *
 * <p>No per-session state is stored here; the stage of a conversation is implied by the
 * last handler that ran for it. Results for a session that is no longer registered are
 * logged and ignored. A malformed payload on a gate is reported as {@code AGENT_ERROR};
 * any other failure inside a gate escalates with {@link EscalationReasons#SYSTEM_ERROR}
 * so a human remains the fallback. Nothing is thrown back to the broker.
 *
 * <p>Create instances via {@link #builder()}; {@link Builder#build()} subscribes the
 * handlers and {@link #close()} removes them.
 */
public final class Coordinator implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(Coordinator.class.getName());

  public static final String AGENT_NAME = "coordinator";

  private final EventBroker broker;
  private final SessionRegistry registry;
  private final CoordinatorConfig config;
  private final MetricsExporter metrics;

  private final AtomicLong messagesProcessed = new AtomicLong();
  private final AtomicLong escalations = new AtomicLong();
  private final AtomicLong routes = new AtomicLong();
  private final AtomicLong errors = new AtomicLong();

  private final Map<WorkflowEvent, EventHandler> handlers = new LinkedHashMap<>();

  private Coordinator(Builder builder) {
    this.broker = Objects.requireNonNull(builder.broker, "broker");
    this.registry = Objects.requireNonNull(builder.registry, "registry");
    this.config = builder.config != null ? builder.config : new CoordinatorConfig();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;

    handlers.put(WorkflowEvent.NEW_USER_MESSAGE, gate(this::onNewMessage));
    handlers.put(WorkflowEvent.RESULT_SENTIMENT_RECOGNIZED, gate(this::onSentimentResult));
    handlers.put(WorkflowEvent.RESULT_INTENT_RECOGNIZED, gate(this::onIntentResult));
    handlers.put(WorkflowEvent.CONVERSATION_TIMEOUT, gate(this::onTimeout));
    handlers.put(WorkflowEvent.REQUEST_ESCALATION, this::onEscalationRequest);
    handlers.put(WorkflowEvent.AGENT_ERROR, this::onAgentError);
  }

  public static Builder builder() {
    return new Builder();
  }

  private void subscribe() {
    handlers.forEach(broker::subscribe);
    logger.info("Coordinator subscribed to " + handlers.keySet());
  }

  // Gate 0
  private void onNewMessage(Event event) {
    NewMessage message = NewMessage.from(event);
    registry.getOrCreate(message.sessionId(),
        SessionAttributes.of(message.customerEmail(), message.customerId()));
    registry.addMessage(message.sessionId(), Sender.USER, message.text());
    messagesProcessed.incrementAndGet();
    logger.fine(() -> "Gate 0: message recorded for session " + message.sessionId());
    broker.publish(WorkflowEvent.TASK_RECOGNIZE_SENTIMENT,
        ClassificationTask.sentiment(message.sessionId(), message.text()).toPayload());
  }

  // Gate 1
  private void onSentimentResult(Event event) {
    SentimentResult result = SentimentResult.from(event);
    Optional<ConversationContext> context =
        registry.updateSentiment(result.sessionId(), result.sentiment(), result.confidence());
    if (context.isEmpty()) {
      logger.warning("Gate 1: session " + result.sessionId() + " not found; ignoring sentiment");
      return;
    }
    if (config.escalatesOn(result.sentiment())) {
      Map<String, Object> details = new LinkedHashMap<>();
      details.put("sentiment", result.sentiment());
      details.put("confidence", result.confidence());
      escalate(result.sessionId(), EscalationReasons.negativeSentiment(result.sentiment()),
          details, EscalationPriority.NORMAL);
      return;
    }
    ConversationContext ctx = context.get();
    Optional<String> text = ctx.lastUserText();
    if (text.isEmpty()) {
      logger.warning("Gate 1: session " + result.sessionId() + " has no user message");
      return;
    }
    logger.fine(() -> "Gate 1 passed for session " + result.sessionId());
    broker.publish(WorkflowEvent.TASK_RECOGNIZE_INTENT,
        new ClassificationTask(result.sessionId(), text.get(), ctx.userTextHistory()).toPayload());
  }

  // Gate 2
  private void onIntentResult(Event event) {
    IntentResult result = IntentResult.from(event);
    Optional<ConversationContext> context = registry.updateIntent(
        result.sessionId(), result.intent(), result.confidence(), result.entities());
    if (context.isEmpty()) {
      logger.warning("Gate 2: session " + result.sessionId() + " not found; ignoring intent");
      return;
    }
    if (result.confidence() < config.getIntentConfidenceThreshold()) {
      Map<String, Object> details = new LinkedHashMap<>();
      details.put("intent", result.intent());
      details.put("confidence", result.confidence());
      details.put("threshold", config.getIntentConfidenceThreshold());
      escalate(result.sessionId(), EscalationReasons.LOW_INTENT_CONFIDENCE, details,
          EscalationPriority.NORMAL);
      return;
    }
    String task = config.routeFor(result.intent());
    if (task == null) {
      Map<String, Object> details = new LinkedHashMap<>();
      details.put("intent", result.intent());
      escalate(result.sessionId(), EscalationReasons.UNKNOWN_INTENT, details,
          EscalationPriority.NORMAL);
      return;
    }
    routes.incrementAndGet();
    metrics.incrementRouted(task);
    logger.info("Routing session " + result.sessionId() + " (" + result.intent() + ") to " + task);
    broker.publish(task, context.get().snapshot());
  }

  private void onTimeout(Event event) {
    ConversationTimeout timeout = ConversationTimeout.from(event);
    if (registry.markStatus(timeout.sessionId(), ConversationStatus.ABANDONED).isEmpty()) {
      logger.warning("Timeout for unknown session " + timeout.sessionId() + "; ignoring");
      return;
    }
    logger.info("Session " + timeout.sessionId() + " timed out");
    broker.publish(WorkflowEvent.CONVERSATION_END,
        new ConversationEnd(timeout.sessionId(), "TIMEOUT", null).toPayload());
  }

  private void onEscalationRequest(Event event) {
    EscalationRequest request;
    try {
      request = EscalationRequest.from(event);
    } catch (MalformedPayloadException e) {
      logger.warning("Dropping escalation request: " + e.getMessage());
      return;
    }
    escalate(request.sessionId(), request.reason(), request.details(), request.priority());
  }

  private void onAgentError(Event event) {
    AgentError error;
    try {
      error = AgentError.from(event);
    } catch (MalformedPayloadException e) {
      logger.warning("Dropping agent error report: " + e.getMessage());
      return;
    }
    errors.incrementAndGet();
    logger.warning("Agent " + error.agentName() + " failed on session " + error.sessionId()
        + ": " + error.error());
    Map<String, Object> details = new LinkedHashMap<>();
    details.put("error", error.error());
    details.put("task", error.task());
    escalate(error.sessionId(), EscalationReasons.agentError(error.agentName()), details,
        EscalationPriority.NORMAL);
  }

  private void escalate(String sessionId, String reason, Map<String, Object> details,
      EscalationPriority priority) {
    Map<String, Object> context = registry.escalate(sessionId, reason)
        .map(ConversationContext::snapshot)
        .orElse(null);
    if (context == null) {
      logger.warning("Escalating unknown session " + sessionId + " without context");
    }
    escalations.incrementAndGet();
    metrics.incrementEscalated(reason);
    logger.info("Escalating session " + sessionId + ": " + reason);
    broker.publish(WorkflowEvent.TASK_ESCALATE,
        new EscalationTask(sessionId, reason, details, priority, context).toPayload());
  }

  private EventHandler gate(EventHandler body) {
    return event -> {
      try {
        body.onEvent(event);
      } catch (MalformedPayloadException e) {
        reportMalformed(event, e);
      } catch (Exception e) {
        onGateFailure(event, e);
      }
    };
  }

  private void reportMalformed(Event event, MalformedPayloadException e) {
    errors.incrementAndGet();
    logger.warning("Coordinator rejected payload: " + e.getMessage());
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put(Event.SESSION_ID, event.sessionIdOrNull());
    payload.put("agent_name", AGENT_NAME);
    payload.put("error", e.getMessage());
    payload.put("task", event.eventType());
    broker.publish(WorkflowEvent.AGENT_ERROR, payload);
  }

  private void onGateFailure(Event event, Exception failure) {
    errors.incrementAndGet();
    String sessionId = event.sessionIdOrNull();
    if (sessionId == null) {
      logger.log(Level.SEVERE, "Gate failure on " + event.eventType() + " without session id", failure);
      return;
    }
    logger.log(Level.SEVERE, "Gate failure on " + event.eventType() + " for session " + sessionId
        + "; escalating", failure);
    Map<String, Object> details = new LinkedHashMap<>();
    details.put("error", String.valueOf(failure.getMessage()));
    details.put("task", event.eventType());
    try {
      escalate(sessionId, EscalationReasons.SYSTEM_ERROR, details, EscalationPriority.NORMAL);
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Emergency escalation failed for session " + sessionId, e);
    }
  }

  public CoordinatorConfig config() {
    return config;
  }

  public CoordinatorStats stats() {
    return new CoordinatorStats(messagesProcessed.get(), escalations.get(), routes.get(),
        errors.get(), registry.count());
  }

  /**
   * Removes the coordinator's subscriptions. Sessions stay in the registry.
   */
  @Override
  public void close() {
    handlers.forEach(broker::unsubscribe);
    logger.info("Coordinator unsubscribed");
  }

  /** Builder for {@link Coordinator}. */
  public static final class Builder {
    private EventBroker broker;
    private SessionRegistry registry;
    private CoordinatorConfig config;
    private MetricsExporter metrics;

    private Builder() {}

    /**
     * Sets the broker the coordinator subscribes to and publishes on.
     *
     * <p><b>Required.</b>
     *
     * @param broker the broker
     * @return this builder
     */
    public Builder broker(EventBroker broker) {
      this.broker = broker;
      return this;
    }

    /**
     * Sets the registry holding conversation state.
     *
     * <p><b>Required.</b>
     *
     * @param registry the session registry
     * @return this builder
     */
    public Builder registry(SessionRegistry registry) {
      this.registry = registry;
      return this;
    }

    /**
     * Sets gate thresholds and routes.
     *
     * <p>Optional. Defaults to {@code new CoordinatorConfig()}.
     *
     * @param config the configuration
     * @return this builder
     */
    public Builder config(CoordinatorConfig config) {
      this.config = config;
      return this;
    }

    /**
     * Sets the metrics exporter for routing and escalation counters.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the metrics exporter
     * @return this builder
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Builds the coordinator and subscribes its handlers.
     *
     * @return a subscribed coordinator
     */
    public Coordinator build() {
      Coordinator coordinator = new Coordinator(this);
      coordinator.subscribe();
      return coordinator;
    }
  }
}
