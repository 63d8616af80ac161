package supportbus.session;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One message of a conversation. Immutable; labels discovered after the message was
 * recorded are attached by replacing the message with a labelled copy, see
 * {@link ConversationContext}.
 *
 * @param sender         who wrote the message
 * @param text           message text
 * @param timestamp      when the message was recorded
 * @param intentLabel    intent attached after classification, may be {@code null}
 * @param sentimentLabel sentiment attached after classification, may be {@code null}
 * @param entities       entities attached after classification, may be {@code null}
 * @param agentAction    what the answering agent did, may be {@code null}
 */
public record Message(
    Sender sender,
    String text,
    Instant timestamp,
    String intentLabel,
    String sentimentLabel,
    Map<String, Object> entities,
    Map<String, Object> agentAction) {

  public static final String INTENT_LABEL = "intent_label";
  public static final String SENTIMENT_LABEL = "sentiment_label";
  public static final String ENTITIES = "entities";
  public static final String AGENT_ACTION = "agent_action";

  public Message {
    Objects.requireNonNull(sender, "sender");
    Objects.requireNonNull(text, "text");
    Objects.requireNonNull(timestamp, "timestamp");
    entities = copyOrNull(entities);
    agentAction = copyOrNull(agentAction);
  }

  public Message withSentimentLabel(String label) {
    return new Message(sender, text, timestamp, intentLabel, label, entities, agentAction);
  }

  /**
   * Returns a copy labelled with {@code label}, with {@code newEntities} merged over the
   * entities already attached.
   */
  public Message withIntent(String label, Map<String, Object> newEntities) {
    Map<String, Object> merged = entities;
    if (newEntities != null) {
      merged = entities == null ? new LinkedHashMap<>() : new LinkedHashMap<>(entities);
      merged.putAll(newEntities);
    }
    return new Message(sender, text, timestamp, label, sentimentLabel, merged, agentAction);
  }

  /**
   * Returns the payload form: {@code sender, text, timestamp} plus the optional fields
   * that are present.
   *
   * @return a fresh map
   */
  public Map<String, Object> toPayload() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("sender", sender.name());
    map.put("text", text);
    map.put("timestamp", timestamp.toString());
    if (intentLabel != null) {
      map.put(INTENT_LABEL, intentLabel);
    }
    if (sentimentLabel != null) {
      map.put(SENTIMENT_LABEL, sentimentLabel);
    }
    if (entities != null) {
      map.put(ENTITIES, new LinkedHashMap<>(entities));
    }
    if (agentAction != null) {
      map.put(AGENT_ACTION, new LinkedHashMap<>(agentAction));
    }
    return map;
  }

  private static Map<String, Object> copyOrNull(Map<String, Object> source) {
    return source == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(source));
  }
}
