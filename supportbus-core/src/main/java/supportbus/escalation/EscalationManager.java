package supportbus.escalation;

import supportbus.Event;
import supportbus.EventHandler;
import supportbus.WorkflowEvent;
import supportbus.broker.EventBroker;
import supportbus.payload.AgentError;
import supportbus.payload.EscalationResolved;
import supportbus.payload.EscalationTask;
import supportbus.payload.MalformedPayloadException;
import supportbus.payload.OperatorAvailable;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Connects the {@link EscalationQueue} to the broker.
 *
 * <ul>
 *   <li>{@code TASK_ESCALATE} enqueues the session and publishes
 *       {@code RESULT_ESCALATION_COMPLETE} and {@code NOTIFICATION_OPERATOR}</li>
 *   <li>{@code OPERATOR_AVAILABLE} assigns the next session and publishes
 *       {@code RESULT_OPERATOR_ASSIGNED}</li>
 *   <li>{@code ESCALATION_RESOLVED} closes the escalation and publishes
 *       {@code RESULT_ESCALATION_RESOLVED}</li>
 * </ul>
 *
 * <p>Malformed payloads are reported as {@code AGENT_ERROR} when the session is known.
 */
public final class EscalationManager implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(EscalationManager.class.getName());

  public static final String AGENT_NAME = "escalation_manager";

  private final EventBroker broker;
  private final EscalationQueue queue;
  private final EventHandler onEscalate = this::onEscalate;
  private final EventHandler onOperatorAvailable = this::onOperatorAvailable;
  private final EventHandler onResolved = this::onResolved;

  private EscalationManager(EventBroker broker, EscalationQueue queue) {
    this.broker = Objects.requireNonNull(broker, "broker");
    this.queue = Objects.requireNonNull(queue, "queue");
  }

  /**
   * Creates a manager and subscribes it to the broker.
   *
   * @param broker the broker
   * @param queue the queue to drive
   * @return the subscribed manager; {@link #close()} unsubscribes it
   */
  public static EscalationManager attach(EventBroker broker, EscalationQueue queue) {
    EscalationManager manager = new EscalationManager(broker, queue);
    broker.subscribe(WorkflowEvent.TASK_ESCALATE, manager.onEscalate);
    broker.subscribe(WorkflowEvent.OPERATOR_AVAILABLE, manager.onOperatorAvailable);
    broker.subscribe(WorkflowEvent.ESCALATION_RESOLVED, manager.onResolved);
    return manager;
  }

  public EscalationQueue queue() {
    return queue;
  }

  private void onEscalate(Event event) {
    EscalationTask task;
    try {
      task = EscalationTask.from(event);
    } catch (MalformedPayloadException e) {
      reportMalformed(event, e);
      return;
    }
    int position = queue.enqueue(task.sessionId(), task.reason(), task.details(),
        task.priority(), task.context());
    EscalationStatus status = queue.get(task.sessionId())
        .map(EscalationRecord::status)
        .orElse(EscalationStatus.QUEUED);

    Map<String, Object> complete = new LinkedHashMap<>();
    complete.put(Event.SESSION_ID, task.sessionId());
    complete.put("status", status.name());
    complete.put("queue_position", position);
    complete.put("estimated_wait_time", queue.estimatedWaitSeconds(position));
    broker.publish(WorkflowEvent.RESULT_ESCALATION_COMPLETE, complete);

    Map<String, Object> notification = new LinkedHashMap<>();
    notification.put("type", "NEW_ESCALATION");
    notification.put(Event.SESSION_ID, task.sessionId());
    notification.put("reason", task.reason());
    notification.put("priority", task.priority().name());
    notification.put("queue_size", queue.size());
    broker.publish(WorkflowEvent.NOTIFICATION_OPERATOR, notification);
  }

  private void onOperatorAvailable(Event event) {
    OperatorAvailable operator;
    try {
      operator = OperatorAvailable.from(event);
    } catch (MalformedPayloadException e) {
      reportMalformed(event, e);
      return;
    }
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("operator_id", operator.operatorId());
    Assignment assignment = queue.assignNext(operator.operatorId());
    if (assignment instanceof Assignment.Assigned assigned) {
      EscalationRecord record = assigned.record();
      payload.put("operator_name", operator.operatorName());
      payload.put("assigned", true);
      payload.put(Event.SESSION_ID, record.sessionId());
      payload.put("reason", record.reason());
      payload.put("context", record.context());
      payload.put("escalated_at", record.enqueuedAt().toString());
      payload.put("wait_time_seconds",
          record.waitTime().map(EscalationRecord::seconds).orElse(0.0));
    } else {
      payload.put("assigned", false);
      payload.put("reason", "QUEUE_EMPTY");
    }
    broker.publish(WorkflowEvent.RESULT_OPERATOR_ASSIGNED, payload);
  }

  private void onResolved(Event event) {
    EscalationResolved resolution;
    try {
      resolution = EscalationResolved.from(event);
    } catch (MalformedPayloadException e) {
      reportMalformed(event, e);
      return;
    }
    Optional<EscalationRecord> resolved = queue.resolve(resolution.sessionId(),
        resolution.operatorId(), resolution.resolutionNotes());
    if (resolved.isEmpty()) {
      return;
    }
    EscalationRecord record = resolved.get();
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put(Event.SESSION_ID, record.sessionId());
    payload.put("operator_id", record.operatorId());
    payload.put("total_time_seconds", record.totalTime().map(EscalationRecord::seconds).orElse(0.0));
    payload.put("handling_time_seconds",
        record.handlingTime().map(EscalationRecord::seconds).orElse(null));
    payload.put("resolution_notes", record.resolutionNotes());
    broker.publish(WorkflowEvent.RESULT_ESCALATION_RESOLVED, payload);
  }

  private void reportMalformed(Event event, MalformedPayloadException e) {
    String sessionId = event.sessionIdOrNull();
    if (sessionId == null) {
      logger.warning("Dropping " + event.eventType() + " without session: " + e.getMessage());
      return;
    }
    logger.warning(e.getMessage());
    broker.publish(WorkflowEvent.AGENT_ERROR,
        new AgentError(sessionId, AGENT_NAME, e.getMessage(), event.eventType()).toPayload());
  }

  /**
   * Unsubscribes the manager. Queued escalations stay in the queue.
   */
  @Override
  public void close() {
    broker.unsubscribe(WorkflowEvent.TASK_ESCALATE, onEscalate);
    broker.unsubscribe(WorkflowEvent.OPERATOR_AVAILABLE, onOperatorAvailable);
    broker.unsubscribe(WorkflowEvent.ESCALATION_RESOLVED, onResolved);
  }
}
