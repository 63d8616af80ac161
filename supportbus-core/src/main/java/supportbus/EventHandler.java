package supportbus;

/**
 * Handler that reacts to events delivered by the {@link supportbus.broker.EventBroker}.
 *
 * <h2>Execution Model</h2>
 * <p>Handlers are executed <b>synchronously</b> on the publisher's thread, inside the
 * {@code publish} call. A handler may itself publish; the nested delivery completes
 * before the outer one resumes.
 *
 * <h2>Error Handling</h2>
 * <p>If a handler throws, the broker logs the failure, counts it as a delivery error,
 * and continues with the remaining subscribers. Nothing is retried.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * broker.subscribe(WorkflowEvent.TASK_RECOGNIZE_SENTIMENT, event -> {
 *   ClassificationTask task = ClassificationTask.from(event);
 *   broker.publish(WorkflowEvent.RESULT_SENTIMENT_RECOGNIZED, Map.of(
 *       "session_id", task.sessionId(), "sentiment", "NEUTRAL", "confidence", 0.9));
 * });
 * }</pre>
 *
 * @see supportbus.broker.EventBroker
 */
@FunctionalInterface
public interface EventHandler {

  /**
   * Processes an event.
   *
   * @param event the immutable event
   * @throws Exception if processing fails; isolated and counted by the broker
   */
  void onEvent(Event event) throws Exception;
}
