package supportbus.payload;

import supportbus.Event;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@code RESULT_SENTIMENT_RECOGNIZED}: output of the sentiment classifier.
 *
 * @param confidence may be {@code null}
 */
public record SentimentResult(String sessionId, String sentiment, Double confidence)
    implements WorkflowPayload {

  public SentimentResult {
    Objects.requireNonNull(sessionId, "sessionId");
    Objects.requireNonNull(sentiment, "sentiment");
  }

  public static SentimentResult from(Event event) {
    PayloadReader reader = PayloadReader.of(event);
    return new SentimentResult(
        reader.requireString(SESSION_ID),
        reader.requireString("sentiment"),
        reader.optionalNumber("confidence"));
  }

  @Override
  public Map<String, Object> toPayload() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put(SESSION_ID, sessionId);
    map.put("sentiment", sentiment);
    map.put("confidence", confidence);
    return map;
  }
}
