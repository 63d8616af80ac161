package supportbus.payload;

import supportbus.Event;
import supportbus.util.ImmutableValues;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@code RESULT_INTENT_RECOGNIZED}: output of the intent classifier.
 *
 * @param entities extracted entities, may be {@code null}
 */
public record IntentResult(String sessionId, String intent, double confidence,
    Map<String, Object> entities) implements WorkflowPayload {

  public IntentResult {
    Objects.requireNonNull(sessionId, "sessionId");
    Objects.requireNonNull(intent, "intent");
    entities = ImmutableValues.copyOf(entities);
  }

  public static IntentResult from(Event event) {
    PayloadReader reader = PayloadReader.of(event);
    return new IntentResult(
        reader.requireString(SESSION_ID),
        reader.requireString("intent"),
        reader.requireNumber("confidence"),
        reader.optionalMap("entities"));
  }

  @Override
  public Map<String, Object> toPayload() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put(SESSION_ID, sessionId);
    map.put("intent", intent);
    map.put("confidence", confidence);
    map.put("entities", entities == null ? Map.of() : entities);
    return map;
  }
}
