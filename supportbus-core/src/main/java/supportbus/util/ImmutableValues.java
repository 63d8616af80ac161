package supportbus.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only deep copies of payload values.
 *
 * <p>Maps, lists and sets are copied recursively into unmodifiable structures that keep
 * iteration order and allow {@code null} values. Other values are returned as they are;
 * payloads are expected to carry only strings, numbers, booleans and other immutable
 * leaves besides their containers.
 */
public final class ImmutableValues {
  private ImmutableValues() {
  }

  /**
   * Copies a map and everything nested in it.
   *
   * @param source the map to copy, may be {@code null}
   * @return an unmodifiable copy, or {@code null} for {@code null} input
   */
  public static Map<String, Object> copyOf(Map<String, ?> source) {
    if (source == null) {
      return null;
    }
    Map<String, Object> copy = new LinkedHashMap<>();
    for (Map.Entry<String, ?> entry : source.entrySet()) {
      copy.put(entry.getKey(), deepCopy(entry.getValue()));
    }
    return Collections.unmodifiableMap(copy);
  }

  /**
   * Copies a value if it is a container, recursively.
   *
   * @param value any payload value
   * @return an unmodifiable copy for maps, lists and sets, else {@code value} itself
   */
  public static Object deepCopy(Object value) {
    if (value instanceof Map<?, ?> map) {
      Map<Object, Object> copy = new LinkedHashMap<>();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        copy.put(entry.getKey(), deepCopy(entry.getValue()));
      }
      return Collections.unmodifiableMap(copy);
    }
    if (value instanceof Set<?> set) {
      Set<Object> copy = new LinkedHashSet<>();
      for (Object item : set) {
        copy.add(deepCopy(item));
      }
      return Collections.unmodifiableSet(copy);
    }
    if (value instanceof Collection<?> items) {
      List<Object> copy = new ArrayList<>(items.size());
      for (Object item : items) {
        copy.add(deepCopy(item));
      }
      return Collections.unmodifiableList(copy);
    }
    return value;
  }
}
