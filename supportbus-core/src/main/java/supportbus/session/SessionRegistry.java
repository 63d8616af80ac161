package supportbus.session;

import supportbus.spi.MetricsExporter;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * Keyed store of {@link ConversationContext}s, one per session id.
 *
 * <p>Insert, delete and lookup of keys run under one table-wide lock that is never held
 * while caller code runs. Field updates on a context are applied under that context's
 * own monitor. The workflow assumes one in-flight gate transition per session; there is
 * no sequence fencing, so a late classification result overwrites a newer one.
 *
 * <p>Operations on an unknown session return {@link Optional#empty()} instead of failing:
 * a session may already have been cleaned up when a late event arrives.
 */
public final class SessionRegistry {
  private static final Logger logger = Logger.getLogger(SessionRegistry.class.getName());

  private final ReentrantLock lock = new ReentrantLock();
  private final Map<String, ConversationContext> sessions = new HashMap<>();
  private final Clock clock;
  private final MetricsExporter metrics;

  private final AtomicLong created = new AtomicLong();
  private final AtomicLong ended = new AtomicLong();
  private final AtomicLong totalMessages = new AtomicLong();

  public SessionRegistry() {
    this(Clock.systemUTC(), MetricsExporter.NOOP);
  }

  public SessionRegistry(Clock clock, MetricsExporter metrics) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
  }

  /**
   * Creates a new session.
   *
   * @param sessionId the session id
   * @param attributes customer attributes, may be {@code null}
   * @return the new context
   * @throws SessionAlreadyExistsException if the id is already registered
   */
  public ConversationContext createSession(String sessionId, SessionAttributes attributes) {
    Objects.requireNonNull(sessionId, "sessionId");
    int size;
    ConversationContext context;
    lock.lock();
    try {
      if (sessions.containsKey(sessionId)) {
        throw new SessionAlreadyExistsException(sessionId);
      }
      context = new ConversationContext(sessionId, clock.instant(), attributes);
      sessions.put(sessionId, context);
      size = sessions.size();
    } finally {
      lock.unlock();
    }
    onCreated(sessionId, size);
    return context;
  }

  /**
   * Returns the session, creating it when absent. Two racing callers always get the
   * same context.
   *
   * @param sessionId the session id
   * @param attributes customer attributes used only when the session is created
   * @return the existing or new context
   */
  public ConversationContext getOrCreate(String sessionId, SessionAttributes attributes) {
    Objects.requireNonNull(sessionId, "sessionId");
    int size;
    ConversationContext context;
    lock.lock();
    try {
      context = sessions.get(sessionId);
      if (context != null) {
        return context;
      }
      context = new ConversationContext(sessionId, clock.instant(), attributes);
      sessions.put(sessionId, context);
      size = sessions.size();
    } finally {
      lock.unlock();
    }
    onCreated(sessionId, size);
    return context;
  }

  public Optional<ConversationContext> get(String sessionId) {
    if (sessionId == null) {
      return Optional.empty();
    }
    lock.lock();
    try {
      return Optional.ofNullable(sessions.get(sessionId));
    } finally {
      lock.unlock();
    }
  }

  public boolean contains(String sessionId) {
    return get(sessionId).isPresent();
  }

  /**
   * Appends a message to the session.
   *
   * @param sessionId the session id
   * @param sender who wrote the message
   * @param text the message text
   * @return the appended message, or empty for an unknown session
   */
  public Optional<Message> addMessage(String sessionId, Sender sender, String text) {
    return addMessage(sessionId, sender, text, null);
  }

  /**
   * Appends a message with optional extras. Recognised keys are
   * {@value Message#INTENT_LABEL}, {@value Message#SENTIMENT_LABEL},
   * {@value Message#ENTITIES} and {@value Message#AGENT_ACTION}; others are ignored.
   *
   * @param sessionId the session id
   * @param sender who wrote the message
   * @param text the message text
   * @param extras optional message fields, may be {@code null}
   * @return the appended message, or empty for an unknown session
   */
  public Optional<Message> addMessage(String sessionId, Sender sender, String text,
      Map<String, ?> extras) {
    Optional<ConversationContext> context = lookup(sessionId, "addMessage");
    if (context.isEmpty()) {
      return Optional.empty();
    }
    Map<String, ?> fields = extras == null ? Map.of() : extras;
    Message message = new Message(sender, text, clock.instant(),
        stringOrNull(fields.get(Message.INTENT_LABEL)),
        stringOrNull(fields.get(Message.SENTIMENT_LABEL)),
        mapOrNull(fields.get(Message.ENTITIES)),
        mapOrNull(fields.get(Message.AGENT_ACTION)));
    context.get().append(message);
    totalMessages.incrementAndGet();
    return Optional.of(message);
  }

  /**
   * Records the current sentiment and labels the most recent USER message with it.
   */
  public Optional<ConversationContext> updateSentiment(String sessionId, String label,
      Double confidence) {
    return mutate(sessionId, "updateSentiment", ctx -> ctx.applySentiment(label, confidence));
  }

  /**
   * Records the current intent, merges the entities into the session, and labels the
   * most recent USER message with both.
   */
  public Optional<ConversationContext> updateIntent(String sessionId, String label,
      Double confidence, Map<String, Object> entities) {
    return mutate(sessionId, "updateIntent", ctx -> ctx.applyIntent(label, confidence, entities));
  }

  /**
   * Merges entities into the session; later values win.
   */
  public Optional<ConversationContext> mergeEntities(String sessionId, Map<String, Object> entities) {
    Objects.requireNonNull(entities, "entities");
    return mutate(sessionId, "mergeEntities", ctx -> ctx.mergeEntities(entities));
  }

  /**
   * Marks the session {@link ConversationStatus#ESCALATED} and records the reason.
   */
  public Optional<ConversationContext> escalate(String sessionId, String reason) {
    return mutate(sessionId, "escalate", ctx -> ctx.escalate(reason));
  }

  public Optional<ConversationContext> markStatus(String sessionId, ConversationStatus status) {
    Objects.requireNonNull(status, "status");
    return mutate(sessionId, "markStatus", ctx -> ctx.status(status));
  }

  public Optional<ConversationContext> assignOperator(String sessionId, String operatorId) {
    return mutate(sessionId, "assignOperator", ctx -> ctx.operatorId(operatorId));
  }

  /**
   * Returns a payload copy of the session, see {@link ConversationContext#snapshot()}.
   */
  public Optional<Map<String, Object>> snapshot(String sessionId) {
    return get(sessionId).map(ConversationContext::snapshot);
  }

  /**
   * Removes the session. This is the only way a context leaves the registry.
   *
   * @param sessionId the session id
   * @return the removed context, or empty if it was not registered
   */
  public Optional<ConversationContext> delete(String sessionId) {
    if (sessionId == null) {
      return Optional.empty();
    }
    ConversationContext removed;
    int size;
    lock.lock();
    try {
      removed = sessions.remove(sessionId);
      size = sessions.size();
    } finally {
      lock.unlock();
    }
    if (removed == null) {
      logger.fine(() -> "delete: no session " + sessionId);
      return Optional.empty();
    }
    ended.incrementAndGet();
    metrics.recordActiveSessions(size);
    logger.fine(() -> "Deleted session " + sessionId);
    return Optional.of(removed);
  }

  public int count() {
    lock.lock();
    try {
      return sessions.size();
    } finally {
      lock.unlock();
    }
  }

  public List<String> sessionIds() {
    lock.lock();
    try {
      return new ArrayList<>(sessions.keySet());
    } finally {
      lock.unlock();
    }
  }

  public RegistryStats stats() {
    return new RegistryStats(created.get(), count(), ended.get(), totalMessages.get());
  }

  private void onCreated(String sessionId, int size) {
    created.incrementAndGet();
    metrics.recordActiveSessions(size);
    logger.fine(() -> "Created session " + sessionId);
  }

  private Optional<ConversationContext> lookup(String sessionId, String operation) {
    Optional<ConversationContext> context = get(sessionId);
    if (context.isEmpty()) {
      logger.fine(() -> operation + ": no session " + sessionId);
    }
    return context;
  }

  private Optional<ConversationContext> mutate(String sessionId, String operation,
      Consumer<ConversationContext> update) {
    Optional<ConversationContext> context = lookup(sessionId, operation);
    context.ifPresent(update);
    return context;
  }

  private static String stringOrNull(Object value) {
    return value == null ? null : value.toString();
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> mapOrNull(Object value) {
    if (value instanceof Map<?, ?> map) {
      return new LinkedHashMap<>((Map<String, Object>) map);
    }
    return null;
  }
}
