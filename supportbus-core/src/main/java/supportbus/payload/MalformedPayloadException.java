package supportbus.payload;

/**
 * Thrown when an event payload lacks a required field or carries a value of the wrong
 * type. Raised at the handler boundary by the {@code from(Event)} factories.
 */
public final class MalformedPayloadException extends IllegalArgumentException {

  private final String eventType;
  private final String field;

  public MalformedPayloadException(String eventType, String field, String problem) {
    super("Malformed " + eventType + " payload: field '" + field + "' " + problem);
    this.eventType = eventType;
    this.field = field;
  }

  public String eventType() {
    return eventType;
  }

  public String field() {
    return field;
  }
}
