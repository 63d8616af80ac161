package supportbus.session;

import supportbus.util.ImmutableValues;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Mutable state of one conversation, owned by the {@link SessionRegistry}.
 *
 * <p>Reads are public; every mutation goes through the registry. All access is
 * synchronized on the context itself, so a {@link #snapshot()} never observes a
 * half-applied update. Accessors return copies.
 */
public final class ConversationContext {
  private final String sessionId;
  private final Instant startTime;
  private final String customerEmail;
  private final String customerId;
  private final Map<String, Object> metadata;

  private ConversationStatus status = ConversationStatus.ACTIVE;
  private String currentSentiment;
  private Double sentimentConfidence;
  private String currentIntent;
  private Double intentConfidence;
  private final List<Message> messages = new ArrayList<>();
  private final Map<String, Object> entities = new LinkedHashMap<>();
  private String escalationReason;
  private String operatorId;

  ConversationContext(String sessionId, Instant startTime, SessionAttributes attributes) {
    this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
    this.startTime = Objects.requireNonNull(startTime, "startTime");
    SessionAttributes attrs = attributes == null ? SessionAttributes.empty() : attributes;
    this.customerEmail = attrs.customerEmail();
    this.customerId = attrs.customerId();
    this.metadata = new LinkedHashMap<>(attrs.metadata());
  }

  public String sessionId() {
    return sessionId;
  }

  public Instant startTime() {
    return startTime;
  }

  public String customerEmail() {
    return customerEmail;
  }

  public String customerId() {
    return customerId;
  }

  public synchronized Map<String, Object> metadata() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  public synchronized ConversationStatus status() {
    return status;
  }

  public synchronized String currentSentiment() {
    return currentSentiment;
  }

  public synchronized Double sentimentConfidence() {
    return sentimentConfidence;
  }

  public synchronized String currentIntent() {
    return currentIntent;
  }

  public synchronized Double intentConfidence() {
    return intentConfidence;
  }

  public synchronized List<Message> messages() {
    return List.copyOf(messages);
  }

  public synchronized int messageCount() {
    return messages.size();
  }

  public synchronized Map<String, Object> entities() {
    return Collections.unmodifiableMap(new LinkedHashMap<>(entities));
  }

  public synchronized String escalationReason() {
    return escalationReason;
  }

  public synchronized String operatorId() {
    return operatorId;
  }

  /**
   * Returns the text of the most recent USER message.
   *
   * @return the text, or empty if the user has not written yet
   */
  public synchronized Optional<String> lastUserText() {
    int index = lastIndexOf(Sender.USER);
    return index < 0 ? Optional.empty() : Optional.of(messages.get(index).text());
  }

  /**
   * Returns the texts of all USER messages in the order they were recorded.
   *
   * @return a fresh list
   */
  public synchronized List<String> userTextHistory() {
    List<String> history = new ArrayList<>();
    for (Message message : messages) {
      if (message.sender() == Sender.USER) {
        history.add(message.text());
      }
    }
    return history;
  }

  /**
   * Returns the payload form of this context with snake_case keys and ISO-8601
   * timestamps. The map and everything nested in it are fresh read-only copies.
   *
   * @return a snapshot map
   */
  public synchronized Map<String, Object> snapshot() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("session_id", sessionId);
    map.put("start_time", startTime.toString());
    map.put("customer_email", customerEmail);
    map.put("customer_id", customerId);
    map.put("status", status.name());
    map.put("current_sentiment", currentSentiment);
    map.put("sentiment_confidence", sentimentConfidence);
    map.put("current_intent", currentIntent);
    map.put("intent_confidence", intentConfidence);
    List<Map<String, Object>> messageMaps = new ArrayList<>(messages.size());
    for (Message message : messages) {
      messageMaps.add(message.toPayload());
    }
    map.put("messages", messageMaps);
    map.put("entities", new LinkedHashMap<>(entities));
    map.put("metadata", new LinkedHashMap<>(metadata));
    map.put("escalation_reason", escalationReason);
    map.put("operator_id", operatorId);
    return ImmutableValues.copyOf(map);
  }

  synchronized void append(Message message) {
    messages.add(message);
  }

  synchronized void applySentiment(String label, Double confidence) {
    this.currentSentiment = label;
    this.sentimentConfidence = confidence;
    int index = lastIndexOf(Sender.USER);
    if (index >= 0) {
      messages.set(index, messages.get(index).withSentimentLabel(label));
    }
  }

  synchronized void applyIntent(String label, Double confidence, Map<String, Object> newEntities) {
    this.currentIntent = label;
    this.intentConfidence = confidence;
    if (newEntities != null) {
      entities.putAll(newEntities);
    }
    int index = lastIndexOf(Sender.USER);
    if (index >= 0) {
      messages.set(index, messages.get(index).withIntent(label, newEntities));
    }
  }

  synchronized void mergeEntities(Map<String, Object> newEntities) {
    entities.putAll(newEntities);
  }

  synchronized void escalate(String reason) {
    this.status = ConversationStatus.ESCALATED;
    this.escalationReason = reason;
  }

  synchronized void status(ConversationStatus status) {
    this.status = status;
  }

  synchronized void operatorId(String operatorId) {
    this.operatorId = operatorId;
  }

  private int lastIndexOf(Sender sender) {
    for (int i = messages.size() - 1; i >= 0; i--) {
      if (messages.get(i).sender() == sender) {
        return i;
      }
    }
    return -1;
  }

  @Override
  public String toString() {
    return "ConversationContext{sessionId=" + sessionId + ", status=" + status() + '}';
  }
}
