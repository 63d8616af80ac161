package supportbus.payload;

import supportbus.Event;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@code NEW_USER_MESSAGE}: a message typed by the customer.
 */
public record NewMessage(String sessionId, String text, String customerEmail, String customerId)
    implements WorkflowPayload {

  public NewMessage {
    Objects.requireNonNull(sessionId, "sessionId");
    Objects.requireNonNull(text, "text");
  }

  public static NewMessage from(Event event) {
    PayloadReader reader = PayloadReader.of(event);
    return new NewMessage(
        reader.requireString(SESSION_ID),
        reader.requireString("text"),
        reader.optionalString("customer_email"),
        reader.optionalString("customer_id"));
  }

  @Override
  public Map<String, Object> toPayload() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put(SESSION_ID, sessionId);
    map.put("text", text);
    if (customerEmail != null) {
      map.put("customer_email", customerEmail);
    }
    if (customerId != null) {
      map.put("customer_id", customerId);
    }
    return map;
  }
}
