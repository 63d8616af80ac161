package supportbus.payload;

import supportbus.Event;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@code CONVERSATION_END}: the conversation is over and can be archived.
 *
 * @param reason     why it ended, may be {@code null}
 * @param operatorId operator who handled the conversation, may be {@code null}
 */
public record ConversationEnd(String sessionId, String reason, String operatorId)
    implements WorkflowPayload {

  public ConversationEnd {
    Objects.requireNonNull(sessionId, "sessionId");
  }

  public static ConversationEnd from(Event event) {
    PayloadReader reader = PayloadReader.of(event);
    return new ConversationEnd(
        reader.requireString(SESSION_ID),
        reader.optionalString("reason"),
        reader.optionalString("operator_id"));
  }

  @Override
  public Map<String, Object> toPayload() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put(SESSION_ID, sessionId);
    if (reason != null) {
      map.put("reason", reason);
    }
    if (operatorId != null) {
      map.put("operator_id", operatorId);
    }
    return map;
  }
}
