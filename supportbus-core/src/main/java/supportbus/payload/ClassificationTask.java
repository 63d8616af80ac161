package supportbus.payload;

import supportbus.Event;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@code TASK_RECOGNIZE_SENTIMENT} and {@code TASK_RECOGNIZE_INTENT}: text to classify.
 *
 * @param history all user texts of the session in order; {@code null} for sentiment tasks
 */
public record ClassificationTask(String sessionId, String text, List<String> history)
    implements WorkflowPayload {

  public ClassificationTask {
    Objects.requireNonNull(sessionId, "sessionId");
    Objects.requireNonNull(text, "text");
    history = history == null ? null : List.copyOf(history);
  }

  public static ClassificationTask sentiment(String sessionId, String text) {
    return new ClassificationTask(sessionId, text, null);
  }

  public static ClassificationTask from(Event event) {
    PayloadReader reader = PayloadReader.of(event);
    return new ClassificationTask(
        reader.requireString(SESSION_ID),
        reader.requireString("text"),
        reader.optionalStringList("history"));
  }

  @Override
  public Map<String, Object> toPayload() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put(SESSION_ID, sessionId);
    map.put("text", text);
    if (history != null) {
      map.put("history", List.copyOf(history));
    }
    return map;
  }
}
