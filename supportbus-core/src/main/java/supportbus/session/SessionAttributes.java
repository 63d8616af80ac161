package supportbus.session;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Customer attributes captured when a session is created.
 *
 * @param customerEmail customer email, may be {@code null}
 * @param customerId    customer id, may be {@code null}
 * @param metadata      free-form metadata, copied
 */
public record SessionAttributes(String customerEmail, String customerId, Map<String, Object> metadata) {

  private static final SessionAttributes EMPTY = new SessionAttributes(null, null, Map.of());

  public SessionAttributes {
    metadata = metadata == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
  }

  public static SessionAttributes empty() {
    return EMPTY;
  }

  public static SessionAttributes of(String customerEmail, String customerId) {
    return new SessionAttributes(customerEmail, customerId, Map.of());
  }
}
