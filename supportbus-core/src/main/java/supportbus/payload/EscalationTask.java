package supportbus.payload;

import supportbus.Event;
import supportbus.escalation.EscalationPriority;
import supportbus.util.ImmutableValues;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@code TASK_ESCALATE}: the single canonical escalation the coordinator publishes,
 * whatever triggered it.
 *
 * @param context session snapshot, {@code null} when the session was not registered
 */
public record EscalationTask(String sessionId, String reason, Map<String, Object> details,
    EscalationPriority priority, Map<String, Object> context) implements WorkflowPayload {

  public EscalationTask {
    Objects.requireNonNull(sessionId, "sessionId");
    Objects.requireNonNull(reason, "reason");
    details = details == null ? Map.of() : ImmutableValues.copyOf(details);
    context = ImmutableValues.copyOf(context);
    priority = priority == null ? EscalationPriority.NORMAL : priority;
  }

  public static EscalationTask from(Event event) {
    PayloadReader reader = PayloadReader.of(event);
    return new EscalationTask(
        reader.requireString(SESSION_ID),
        reader.requireString("reason"),
        reader.optionalMap("details"),
        reader.optionalPriority("priority"),
        reader.optionalMap("context"));
  }

  @Override
  public Map<String, Object> toPayload() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put(SESSION_ID, sessionId);
    map.put("reason", reason);
    map.put("details", details);
    map.put("priority", priority.name());
    map.put("context", context);
    return map;
  }
}
