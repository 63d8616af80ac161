package supportbus.payload;

import supportbus.Event;
import supportbus.escalation.EscalationPriority;
import supportbus.util.ImmutableValues;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Typed field access over an event payload. Every failure is reported as a
 * {@link MalformedPayloadException} naming the event type and field.
 */
final class PayloadReader {
  private final String eventType;
  private final Map<String, Object> payload;

  private PayloadReader(Event event) {
    this.eventType = event.eventType();
    this.payload = event.payload();
  }

  static PayloadReader of(Event event) {
    return new PayloadReader(event);
  }

  String requireString(String field) {
    String value = optionalString(field);
    if (value == null || value.isEmpty()) {
      throw new MalformedPayloadException(eventType, field, "is required");
    }
    return value;
  }

  String optionalString(String field) {
    Object value = payload.get(field);
    if (value == null) {
      return null;
    }
    if (value instanceof String s) {
      return s;
    }
    if (value instanceof Number || value instanceof Boolean || value instanceof Enum<?>) {
      return value.toString();
    }
    throw new MalformedPayloadException(eventType, field, "must be a string");
  }

  double requireNumber(String field) {
    Double value = optionalNumber(field);
    if (value == null) {
      throw new MalformedPayloadException(eventType, field, "is required");
    }
    return value;
  }

  Double optionalNumber(String field) {
    Object value = payload.get(field);
    if (value == null) {
      return null;
    }
    if (value instanceof Number n) {
      return n.doubleValue();
    }
    if (value instanceof String s) {
      try {
        return Double.valueOf(s.trim());
      } catch (NumberFormatException e) {
        throw new MalformedPayloadException(eventType, field, "must be numeric");
      }
    }
    throw new MalformedPayloadException(eventType, field, "must be numeric");
  }

  boolean optionalBoolean(String field) {
    Object value = payload.get(field);
    if (value == null) {
      return false;
    }
    if (value instanceof Boolean b) {
      return b;
    }
    if (value instanceof String s) {
      return Boolean.parseBoolean(s.trim());
    }
    throw new MalformedPayloadException(eventType, field, "must be a boolean");
  }

  @SuppressWarnings("unchecked")
  Map<String, Object> optionalMap(String field) {
    Object value = payload.get(field);
    if (value == null) {
      return null;
    }
    if (value instanceof Map<?, ?> map) {
      for (Object key : map.keySet()) {
        if (!(key instanceof String)) {
          throw new MalformedPayloadException(eventType, field, "must have string keys");
        }
      }
      return ImmutableValues.copyOf((Map<String, Object>) map);
    }
    throw new MalformedPayloadException(eventType, field, "must be an object");
  }

  List<String> optionalStringList(String field) {
    Object value = payload.get(field);
    if (value == null) {
      return null;
    }
    if (value instanceof List<?> list) {
      List<String> result = new ArrayList<>(list.size());
      for (Object item : list) {
        if (item == null) {
          throw new MalformedPayloadException(eventType, field, "must not contain nulls");
        }
        result.add(item.toString());
      }
      return Collections.unmodifiableList(result);
    }
    throw new MalformedPayloadException(eventType, field, "must be a list");
  }

  EscalationPriority optionalPriority(String field) {
    String value = optionalString(field);
    try {
      return EscalationPriority.parse(value);
    } catch (IllegalArgumentException e) {
      throw new MalformedPayloadException(eventType, field,
          "must be one of HIGH, NORMAL, LOW but was " + value);
    }
  }
}
