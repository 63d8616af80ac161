package supportbus;

/**
 * Event types exchanged between the support workflow components.
 *
 * <p>Routing tasks published by the coordinator after gate 2 are not listed here;
 * their names come from {@link supportbus.coordinator.CoordinatorConfig#getRoutes()}.
 */
public enum WorkflowEvent implements EventType {
  /** A user message arrived from the gateway. */
  NEW_USER_MESSAGE,
  TASK_RECOGNIZE_SENTIMENT,
  RESULT_SENTIMENT_RECOGNIZED,
  TASK_RECOGNIZE_INTENT,
  RESULT_INTENT_RECOGNIZED,
  /** Any component asking for a human hand-off. */
  REQUEST_ESCALATION,
  AGENT_ERROR,
  /** Canonical escalation emitted by the coordinator; the escalation manager's only entry point. */
  TASK_ESCALATE,
  RESULT_ESCALATION_COMPLETE,
  NOTIFICATION_OPERATOR,
  OPERATOR_AVAILABLE,
  RESULT_OPERATOR_ASSIGNED,
  ESCALATION_RESOLVED,
  RESULT_ESCALATION_RESOLVED,
  /** A business handler answered the user directly. */
  RESULT_SEND_RESPONSE_TO_USER,
  /** Published by an external watchdog when a session went quiet. */
  CONVERSATION_TIMEOUT,
  CONVERSATION_END,
  TRANSCRIPT_SAVED
}
