package supportbus;

import com.github.f4b6a3.ulid.UlidCreator;

import supportbus.util.ImmutableValues;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable event passed through the {@link supportbus.broker.EventBroker}.
 *
 * <p>Each event is assigned a ULID-based {@code eventId} unless one is supplied. The
 * payload is deep-copied at build time into unmodifiable maps and lists that keep insertion
 * order, so no subscriber can change what the next one sees;
 * {@code null} values are allowed (optional snapshot fields), {@code null} keys are not.
 * Payload schema is per event type and validated by the receiving handler, see
 * {@link supportbus.payload}.
 *
 * @see EventType
 * @see WorkflowEvent
 */
public final class Event {
  public static final String SESSION_ID = "session_id";

  private final String eventId;
  private final String eventType;
  private final Instant occurredAt;
  private final Map<String, Object> payload;

  private Event(Builder builder) {
    this.eventId = builder.eventId == null ? newEventId() : builder.eventId;
    this.eventType = Objects.requireNonNull(builder.eventType, "eventType");
    if (this.eventType.isEmpty()) {
      throw new IllegalArgumentException("eventType cannot be empty");
    }
    this.occurredAt = builder.occurredAt == null ? Instant.now() : builder.occurredAt;

    Map<String, Object> copy = builder.payload == null
        ? new LinkedHashMap<>()
        : new LinkedHashMap<>(builder.payload);
    if (copy.containsKey(null)) {
      throw new IllegalArgumentException("payload cannot contain null keys");
    }
    this.payload = ImmutableValues.copyOf(copy);
  }

  /**
   * Creates a builder with a type-safe event type.
   *
   * @param eventType the event type (enum or other EventType implementation)
   * @return a new builder
   */
  public static Builder builder(EventType eventType) {
    Objects.requireNonNull(eventType, "eventType");
    return new Builder(eventType.name());
  }

  /**
   * Creates a builder with a string event type.
   *
   * @param eventType the event type name
   * @return a new builder
   */
  public static Builder builder(String eventType) {
    return new Builder(eventType);
  }

  /**
   * Creates an event with a string event type and payload.
   *
   * @param eventType the event type name
   * @param payload   the payload, copied
   * @return a new event
   */
  public static Event of(String eventType, Map<String, ?> payload) {
    return builder(eventType).payload(payload).build();
  }

  /**
   * Creates an event with a type-safe event type and payload.
   *
   * @param eventType the event type
   * @param payload   the payload, copied
   * @return a new event
   */
  public static Event of(EventType eventType, Map<String, ?> payload) {
    return builder(eventType).payload(payload).build();
  }

  public String eventId() {
    return eventId;
  }

  public String eventType() {
    return eventType;
  }

  public Instant occurredAt() {
    return occurredAt;
  }

  public Map<String, Object> payload() {
    return payload;
  }

  /**
   * Returns the {@code session_id} payload field when it is a non-empty string, else {@code null}.
   * Error paths use this to report against the right session before the payload is validated.
   *
   * @return the session id, or {@code null}
   */
  public String sessionIdOrNull() {
    Object value = payload.get(SESSION_ID);
    if (value instanceof String s && !s.isEmpty()) {
      return s;
    }
    return null;
  }

  @Override
  public String toString() {
    return "Event{eventId=" + eventId + ", eventType=" + eventType
        + ", occurredAt=" + occurredAt + ", fields=" + payload.keySet() + '}';
  }

  /**
   * Builder for {@link Event}.
   */
  public static final class Builder {
    private final String eventType;
    private String eventId;
    private Instant occurredAt;
    private Map<String, ?> payload;

    private Builder(String eventType) {
      this.eventType = eventType;
    }

    /**
     * Sets a custom event identifier.
     *
     * <p>Optional. Defaults to a monotonic ULID.
     *
     * @param eventId the event identifier
     * @return this builder
     */
    public Builder eventId(String eventId) {
      this.eventId = eventId;
      return this;
    }

    /**
     * Sets the event timestamp.
     *
     * <p>Optional. Defaults to {@link Instant#now()}.
     *
     * @param occurredAt the event timestamp
     * @return this builder
     */
    public Builder occurredAt(Instant occurredAt) {
      this.occurredAt = occurredAt;
      return this;
    }

    /**
     * Sets the payload. The map is copied at build time.
     *
     * <p>Optional. Defaults to an empty map.
     *
     * @param payload the payload fields
     * @return this builder
     */
    public Builder payload(Map<String, ?> payload) {
      this.payload = payload;
      return this;
    }

    /**
     * Builds an immutable {@link Event}.
     *
     * @return a new event
     * @throws IllegalArgumentException if {@code eventType} is empty or the payload has a null key
     */
    public Event build() {
      return new Event(this);
    }
  }

  private static String newEventId() {
    return UlidCreator.getMonotonicUlid().toString();
  }
}
