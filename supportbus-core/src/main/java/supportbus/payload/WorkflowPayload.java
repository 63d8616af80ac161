package supportbus.payload;

import java.util.Map;

/**
 * Typed view of a workflow event payload. Each variant validates a raw payload in its
 * {@code from(Event)} factory and renders itself back with {@link #toPayload()}.
 */
public sealed interface WorkflowPayload
    permits NewMessage, SentimentResult, IntentResult, EscalationRequest, AgentError,
    OperatorAvailable, EscalationResolved, ConversationTimeout, AgentResponse,
    ConversationEnd, ClassificationTask, EscalationTask {

  String SESSION_ID = "session_id";

  /**
   * Renders the payload map to publish.
   *
   * @return a fresh map
   */
  Map<String, Object> toPayload();
}
