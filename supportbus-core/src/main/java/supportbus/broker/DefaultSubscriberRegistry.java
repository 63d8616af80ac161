package supportbus.broker;

import supportbus.EventHandler;
import supportbus.EventType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Thread-safe subscriber table for the {@link EventBroker}.
 *
 * <p>Supports subscription by specific event type or wildcard ("*") for all events.
 * The same handler may be subscribed more than once; each subscription is delivered
 * separately and {@link #unsubscribe} removes one subscription at a time.
 *
 * <h2>Thread Safety</h2>
 * <p>Each per-type list is copy-on-write: a lookup copies the current arrays, so a
 * subscribe or unsubscribe issued from inside a handler never changes an in-flight
 * delivery, and no lock is held while handlers run.
 */
public final class DefaultSubscriberRegistry {
  public static final String ALL_EVENTS = "*";

  private final Map<String, CopyOnWriteArrayList<EventHandler>> subscribers = new ConcurrentHashMap<>();

  /**
   * Subscribes a handler for a type-safe event type.
   *
   * @param eventType the event type (enum or other EventType implementation)
   * @param handler the handler
   * @return this registry for chaining
   */
  public DefaultSubscriberRegistry subscribe(EventType eventType, EventHandler handler) {
    return subscribe(eventType.name(), handler);
  }

  /**
   * Subscribes a handler for a string event type.
   *
   * @param eventType the event type name
   * @param handler the handler
   * @return this registry for chaining
   */
  public DefaultSubscriberRegistry subscribe(String eventType, EventHandler handler) {
    Objects.requireNonNull(eventType, "eventType");
    Objects.requireNonNull(handler, "handler");
    subscribers.computeIfAbsent(eventType, ignored -> new CopyOnWriteArrayList<>()).add(handler);
    return this;
  }

  /**
   * Subscribes a handler to every event type (wildcard).
   *
   * @param handler the handler
   * @return this registry for chaining
   */
  public DefaultSubscriberRegistry subscribeAll(EventHandler handler) {
    return subscribe(ALL_EVENTS, handler);
  }

  /**
   * Removes the earliest subscription of {@code handler} for {@code eventType}.
   *
   * @param eventType the event type name, or {@link #ALL_EVENTS}
   * @param handler the exact handler instance that was subscribed
   * @return {@code true} if a subscription was removed
   */
  public boolean unsubscribe(String eventType, EventHandler handler) {
    CopyOnWriteArrayList<EventHandler> list = subscribers.get(eventType);
    return list != null && list.remove(handler);
  }

  /**
   * Returns a snapshot of the handlers for {@code eventType}: exact-type subscribers in
   * subscription order, then wildcard subscribers in subscription order. Later subscribe or
   * unsubscribe calls do not affect a snapshot already returned.
   *
   * @param eventType the event type to look up
   * @return immutable list of matching handlers, may be empty
   */
  public List<EventHandler> subscribersFor(String eventType) {
    List<EventHandler> result = new ArrayList<>();
    CopyOnWriteArrayList<EventHandler> specific = subscribers.get(eventType);
    if (specific != null) {
      result.addAll(specific);
    }
    if (!ALL_EVENTS.equals(eventType)) {
      CopyOnWriteArrayList<EventHandler> all = subscribers.get(ALL_EVENTS);
      if (all != null) {
        result.addAll(all);
      }
    }
    return Collections.unmodifiableList(result);
  }

  /**
   * Returns the number of subscriptions per event type, omitting types with none.
   *
   * @return event type to subscription count
   */
  public Map<String, Integer> counts() {
    Map<String, Integer> counts = new LinkedHashMap<>();
    subscribers.forEach((type, list) -> {
      if (!list.isEmpty()) {
        counts.put(type, list.size());
      }
    });
    return Collections.unmodifiableMap(counts);
  }

  /**
   * Removes every subscription.
   *
   * @return the number of subscriptions removed
   */
  public int clear() {
    int removed = 0;
    for (CopyOnWriteArrayList<EventHandler> list : subscribers.values()) {
      removed += list.size();
    }
    subscribers.clear();
    return removed;
  }
}
