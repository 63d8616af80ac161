package supportbus.payload;

import supportbus.Event;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@code OPERATOR_AVAILABLE}: a human operator can take the next escalation.
 */
public record OperatorAvailable(String operatorId, String operatorName) implements WorkflowPayload {

  public OperatorAvailable {
    Objects.requireNonNull(operatorId, "operatorId");
    operatorName = operatorName == null ? "Unknown" : operatorName;
  }

  public static OperatorAvailable from(Event event) {
    PayloadReader reader = PayloadReader.of(event);
    return new OperatorAvailable(
        reader.requireString("operator_id"),
        reader.optionalString("operator_name"));
  }

  @Override
  public Map<String, Object> toPayload() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("operator_id", operatorId);
    map.put("operator_name", operatorName);
    return map;
  }
}
