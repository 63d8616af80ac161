package supportbus.classify;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Output of a {@link Classifier}.
 *
 * @param label      predicted label, e.g. {@code NEUTRAL} or {@code process_return}
 * @param confidence score in {@code [0, 1]}
 * @param entities   extracted entities, never {@code null}
 */
public record Classification(String label, double confidence, Map<String, Object> entities) {

  public Classification {
    Objects.requireNonNull(label, "label");
    entities = entities == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(entities));
  }

  public static Classification of(String label, double confidence) {
    return new Classification(label, confidence, Map.of());
  }
}
