package supportbus.broker;

import supportbus.Event;
import supportbus.EventHandler;
import supportbus.EventType;
import supportbus.spi.MetricsExporter;
import supportbus.util.JsonCodec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-process publish/subscribe broker. Delivers each published event synchronously,
 * on the publisher's thread, to a snapshot of the subscribers taken when the publish
 * starts: exact-type subscribers first, then wildcard subscribers, each in
 * subscription order.
 *
 * <p>Every handler invocation is isolated: a handler that throws is logged and counted
 * and the remaining subscribers still receive the event. An event nobody subscribed to
 * is counted as undelivered and logged at WARNING; that is not an error.
 *
 * <p>Handlers may publish from inside a handler. Nesting is tracked per thread and
 * bounded by {@link Builder#maxPublishDepth(int)}; a publish past the bound throws
 * {@link PublishDepthExceededException}, which the enclosing delivery counts as a
 * handler error.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe.
 *
 * @see EventInterceptor
 * @see DefaultSubscriberRegistry
 */
public final class EventBroker {
  private static final Logger logger = Logger.getLogger(EventBroker.class.getName());

  private final DefaultSubscriberRegistry subscribers = new DefaultSubscriberRegistry();
  private final MetricsExporter metrics;
  private final List<EventInterceptor> interceptors;
  private final int maxPublishDepth;
  private final JsonCodec jsonCodec;
  private final ThreadLocal<int[]> depth = ThreadLocal.withInitial(() -> new int[1]);

  private final AtomicLong published = new AtomicLong();
  private final AtomicLong delivered = new AtomicLong();
  private final AtomicLong errors = new AtomicLong();
  private final AtomicLong undelivered = new AtomicLong();

  private EventBroker(Builder builder) {
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.interceptors = Collections.unmodifiableList(new ArrayList<>(builder.interceptors));
    this.jsonCodec = builder.jsonCodec != null ? builder.jsonCodec : JsonCodec.getDefault();
    if (builder.maxPublishDepth < 1) {
      throw new IllegalArgumentException("maxPublishDepth must be >= 1");
    }
    this.maxPublishDepth = builder.maxPublishDepth;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Subscribes a handler to a string event type. Subscribing the same handler twice
   * delivers each event to it twice.
   *
   * @param eventType the event type name
   * @param handler the handler
   */
  public void subscribe(String eventType, EventHandler handler) {
    subscribers.subscribe(eventType, handler);
    logger.fine(() -> "Subscribed handler to " + eventType);
  }

  /**
   * Subscribes a handler to a type-safe event type.
   *
   * @param eventType the event type
   * @param handler the handler
   */
  public void subscribe(EventType eventType, EventHandler handler) {
    subscribe(Objects.requireNonNull(eventType, "eventType").name(), handler);
  }

  /**
   * Subscribes a handler to every event. Wildcard handlers receive each event after
   * the exact-type subscribers.
   *
   * @param handler the handler
   */
  public void subscribeAll(EventHandler handler) {
    subscribers.subscribeAll(handler);
  }

  /**
   * Removes one subscription of {@code handler} for {@code eventType}.
   *
   * @param eventType the event type name, or {@code "*"} for a wildcard subscription
   * @param handler the exact handler instance that was subscribed
   * @return {@code true} if a subscription was removed, {@code false} if none existed
   */
  public boolean unsubscribe(String eventType, EventHandler handler) {
    boolean removed = subscribers.unsubscribe(eventType, handler);
    if (!removed) {
      logger.fine(() -> "No subscription to remove for " + eventType);
    }
    return removed;
  }

  public boolean unsubscribe(EventType eventType, EventHandler handler) {
    return unsubscribe(Objects.requireNonNull(eventType, "eventType").name(), handler);
  }

  /**
   * Builds an event from the type and payload and delivers it.
   *
   * @param eventType the event type name
   * @param payload the payload, copied into the event
   * @return the published event
   * @throws PublishDepthExceededException if nested publishing on this thread is too deep
   */
  public Event publish(String eventType, Map<String, ?> payload) {
    return publish(Event.of(eventType, payload));
  }

  public Event publish(EventType eventType, Map<String, ?> payload) {
    return publish(Event.of(eventType, payload));
  }

  /**
   * Delivers a pre-built event to every current subscriber of its type.
   *
   * @param event the event
   * @return the same event
   * @throws PublishDepthExceededException if nested publishing on this thread is too deep
   */
  public Event publish(Event event) {
    Objects.requireNonNull(event, "event");
    int[] current = depth.get();
    if (current[0] >= maxPublishDepth) {
      throw new PublishDepthExceededException(event.eventType(), maxPublishDepth);
    }
    current[0]++;
    try {
      deliver(event);
    } finally {
      current[0]--;
      if (current[0] == 0) {
        depth.remove();
      }
    }
    return event;
  }

  private void deliver(Event event) {
    published.incrementAndGet();
    metrics.incrementPublished();
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("Publishing " + event.eventType() + " " + event.eventId()
          + " payload=" + jsonCodec.toJson(event.payload()));
    }

    List<EventHandler> snapshot = subscribers.subscribersFor(event.eventType());
    if (snapshot.isEmpty()) {
      undelivered.incrementAndGet();
      metrics.incrementUndelivered();
      logger.warning("No subscribers for event type " + event.eventType()
          + " (eventId=" + event.eventId() + ")");
      return;
    }

    for (EventHandler handler : snapshot) {
      long start = System.nanoTime();
      try {
        invoke(handler, event);
        delivered.incrementAndGet();
        metrics.incrementDelivered();
      } catch (Exception e) {
        errors.incrementAndGet();
        metrics.incrementHandlerErrors();
        logger.log(Level.SEVERE, "Handler failed for " + event.eventType()
            + " (eventId=" + event.eventId() + ")", e);
      } finally {
        metrics.recordHandlerDurationMs((System.nanoTime() - start) / 1_000_000);
      }
    }
  }

  private void invoke(EventHandler handler, Event event) throws Exception {
    int completedBefore = 0;
    try {
      for (int i = 0; i < interceptors.size(); i++) {
        interceptors.get(i).beforeDispatch(event);
        completedBefore = i + 1;
      }
      handler.onEvent(event);
      runAfterDispatch(event, null, completedBefore);
    } catch (Exception e) {
      runAfterDispatch(event, e, completedBefore);
      throw e;
    }
  }

  private void runAfterDispatch(Event event, Exception error, int count) {
    for (int i = count - 1; i >= 0; i--) {
      try {
        interceptors.get(i).afterDispatch(event, error);
      } catch (Exception ex) {
        logger.log(Level.WARNING, "Interceptor afterDispatch failed", ex);
      }
    }
  }

  /**
   * Returns a copy of the broker counters.
   *
   * @return current counters
   */
  public BrokerStats stats() {
    return new BrokerStats(published.get(), delivered.get(), errors.get(), undelivered.get());
  }

  /**
   * Returns the number of subscriptions per event type.
   *
   * @return event type to subscription count, wildcard as {@code "*"}
   */
  public Map<String, Integer> subscriberCounts() {
    return subscribers.counts();
  }

  /**
   * Removes every subscription. Used on shutdown and between tests.
   */
  public void clearAllSubscribers() {
    int removed = subscribers.clear();
    logger.info("Cleared " + removed + " subscriptions");
  }

  /** Builder for {@link EventBroker}. */
  public static final class Builder {
    private MetricsExporter metrics;
    private final List<EventInterceptor> interceptors = new ArrayList<>();
    private int maxPublishDepth = 32;
    private JsonCodec jsonCodec;

    private Builder() {}

    /**
     * Sets the metrics exporter for broker counters.
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
     * Adds an interceptor run around every handler invocation.
     *
     * @param interceptor the interceptor
     * @return this builder
     */
    public Builder interceptor(EventInterceptor interceptor) {
      this.interceptors.add(Objects.requireNonNull(interceptor, "interceptor"));
      return this;
    }

    /**
     * Adds several interceptors in order.
     *
     * @param interceptors the interceptors
     * @return this builder
     */
    public Builder interceptors(List<EventInterceptor> interceptors) {
      for (EventInterceptor interceptor : interceptors) {
        interceptor(interceptor);
      }
      return this;
    }

    /**
     * Sets how deeply handlers may nest {@code publish} calls on one thread.
     *
     * <p>Optional. Defaults to {@code 32}. Must be &ge; 1.
     *
     * @param maxPublishDepth maximum nesting, counting the outermost publish
     * @return this builder
     */
    public Builder maxPublishDepth(int maxPublishDepth) {
      this.maxPublishDepth = maxPublishDepth;
      return this;
    }

    /**
     * Sets the codec used to render payloads in FINE-level log lines.
     *
     * <p>Optional. Defaults to {@link JsonCodec#getDefault()}.
     *
     * @param jsonCodec the codec
     * @return this builder
     */
    public Builder jsonCodec(JsonCodec jsonCodec) {
      this.jsonCodec = jsonCodec;
      return this;
    }

    public EventBroker build() {
      return new EventBroker(this);
    }
  }
}
