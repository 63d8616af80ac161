package supportbus.payload;

import supportbus.Event;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@code RESULT_SEND_RESPONSE_TO_USER}: a business handler answered the customer.
 *
 * @param finalResponse {@code true} when the answer closes the conversation
 */
public record AgentResponse(String sessionId, String text, String agent, boolean finalResponse)
    implements WorkflowPayload {

  public AgentResponse {
    Objects.requireNonNull(sessionId, "sessionId");
    Objects.requireNonNull(text, "text");
    agent = agent == null ? "unknown" : agent;
  }

  public static AgentResponse from(Event event) {
    PayloadReader reader = PayloadReader.of(event);
    return new AgentResponse(
        reader.requireString(SESSION_ID),
        reader.requireString("text"),
        reader.optionalString("agent"),
        reader.optionalBoolean("final"));
  }

  @Override
  public Map<String, Object> toPayload() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put(SESSION_ID, sessionId);
    map.put("text", text);
    map.put("agent", agent);
    map.put("final", finalResponse);
    return map;
  }
}
