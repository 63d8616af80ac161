package supportbus.payload;

import supportbus.Event;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@code AGENT_ERROR}: a processing unit failed on a session.
 *
 * @param task the event type the agent was handling, may be {@code null}
 */
public record AgentError(String sessionId, String agentName, String error, String task)
    implements WorkflowPayload {

  public AgentError {
    Objects.requireNonNull(sessionId, "sessionId");
    Objects.requireNonNull(agentName, "agentName");
    error = error == null ? "" : error;
  }

  public static AgentError from(Event event) {
    PayloadReader reader = PayloadReader.of(event);
    return new AgentError(
        reader.requireString(SESSION_ID),
        reader.requireString("agent_name"),
        reader.optionalString("error"),
        reader.optionalString("task"));
  }

  @Override
  public Map<String, Object> toPayload() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put(SESSION_ID, sessionId);
    map.put("agent_name", agentName);
    map.put("error", error);
    if (task != null) {
      map.put("task", task);
    }
    return map;
  }
}
