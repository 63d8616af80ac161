package supportbus.payload;

import supportbus.Event;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@code CONVERSATION_TIMEOUT}: published by an external watchdog for a stalled session.
 */
public record ConversationTimeout(String sessionId, String reason) implements WorkflowPayload {

  public ConversationTimeout {
    Objects.requireNonNull(sessionId, "sessionId");
    reason = reason == null ? "TIMEOUT" : reason;
  }

  public static ConversationTimeout from(Event event) {
    PayloadReader reader = PayloadReader.of(event);
    return new ConversationTimeout(
        reader.requireString(SESSION_ID),
        reader.optionalString("reason"));
  }

  @Override
  public Map<String, Object> toPayload() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put(SESSION_ID, sessionId);
    map.put("reason", reason);
    return map;
  }
}
