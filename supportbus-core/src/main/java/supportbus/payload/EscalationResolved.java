package supportbus.payload;

import supportbus.Event;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@code ESCALATION_RESOLVED}: the operator closed an escalation.
 */
public record EscalationResolved(String sessionId, String operatorId, String resolutionNotes)
    implements WorkflowPayload {

  public EscalationResolved {
    Objects.requireNonNull(sessionId, "sessionId");
    Objects.requireNonNull(operatorId, "operatorId");
    resolutionNotes = resolutionNotes == null ? "" : resolutionNotes;
  }

  public static EscalationResolved from(Event event) {
    PayloadReader reader = PayloadReader.of(event);
    return new EscalationResolved(
        reader.requireString(SESSION_ID),
        reader.requireString("operator_id"),
        reader.optionalString("resolution_notes"));
  }

  @Override
  public Map<String, Object> toPayload() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put(SESSION_ID, sessionId);
    map.put("operator_id", operatorId);
    map.put("resolution_notes", resolutionNotes);
    return map;
  }
}
