package supportbus.payload;

import supportbus.Event;
import supportbus.escalation.EscalationPriority;
import supportbus.util.ImmutableValues;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@code REQUEST_ESCALATION}: any component asking for a human to take over.
 */
public record EscalationRequest(String sessionId, String reason, Map<String, Object> details,
    EscalationPriority priority) implements WorkflowPayload {

  public EscalationRequest {
    Objects.requireNonNull(sessionId, "sessionId");
    Objects.requireNonNull(reason, "reason");
    details = details == null ? Map.of() : ImmutableValues.copyOf(details);
    priority = priority == null ? EscalationPriority.NORMAL : priority;
  }

  public static EscalationRequest from(Event event) {
    PayloadReader reader = PayloadReader.of(event);
    return new EscalationRequest(
        reader.requireString(SESSION_ID),
        reader.requireString("reason"),
        reader.optionalMap("details"),
        reader.optionalPriority("priority"));
  }

  @Override
  public Map<String, Object> toPayload() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put(SESSION_ID, sessionId);
    map.put("reason", reason);
    map.put("details", details);
    map.put("priority", priority.name());
    return map;
  }
}
