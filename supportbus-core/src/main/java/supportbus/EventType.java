package supportbus;

/**
 * Represents an event type identifier.
 *
 * <p>Implementations can be enums for compile-time safety:
 * <pre>{@code
 * public enum BillingEvents implements EventType {
 *   TASK_HANDLE_REFUND,
 *   TASK_HANDLE_INVOICE
 * }
 * }</pre>
 *
 * <p>Or use {@link StringEventType} for routes configured at runtime:
 * <pre>{@code
 * EventType type = StringEventType.of("TASK_HANDLE_RETURNS");
 * }</pre>
 *
 * @see WorkflowEvent
 */
public interface EventType {

    /**
     * Returns the string representation of this event type.
     * This value is the broker's subscription key.
     *
     * @return the event type name, never null
     */
    String name();
}
