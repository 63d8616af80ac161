package supportbus.classify;

import supportbus.Event;
import supportbus.EventHandler;
import supportbus.WorkflowEvent;
import supportbus.broker.EventBroker;
import supportbus.payload.AgentError;
import supportbus.payload.ClassificationTask;
import supportbus.payload.MalformedPayloadException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bridges a classification task event to a {@link Classifier} and publishes the result.
 *
 * <pre>{@code
 * ClassifierAgent.sentiment(broker, (text, history) -> Classification.of("NEUTRAL", 0.9));
 * ClassifierAgent.intent(broker, myIntentModel::classify);
 * }</pre>
 *
 * <p>A classifier failure, a {@code null} result or a malformed task is published as
 * {@code AGENT_ERROR}.
 */
public final class ClassifierAgent implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ClassifierAgent.class.getName());

  private final EventBroker broker;
  private final Classifier classifier;
  private final String agentName;
  private final WorkflowEvent taskType;
  private final WorkflowEvent resultType;
  private final String labelField;
  private final boolean withEntities;
  private final EventHandler handler = this::onTask;

  private ClassifierAgent(EventBroker broker, Classifier classifier, String agentName,
      WorkflowEvent taskType, WorkflowEvent resultType, String labelField, boolean withEntities) {
    this.broker = Objects.requireNonNull(broker, "broker");
    this.classifier = Objects.requireNonNull(classifier, "classifier");
    this.agentName = agentName;
    this.taskType = taskType;
    this.resultType = resultType;
    this.labelField = labelField;
    this.withEntities = withEntities;
  }

  /**
   * Subscribes a sentiment classifier to {@code TASK_RECOGNIZE_SENTIMENT}.
   */
  public static ClassifierAgent sentiment(EventBroker broker, Classifier classifier) {
    return start(new ClassifierAgent(broker, classifier, "sentiment_agent",
        WorkflowEvent.TASK_RECOGNIZE_SENTIMENT, WorkflowEvent.RESULT_SENTIMENT_RECOGNIZED,
        "sentiment", false));
  }

  /**
   * Subscribes an intent classifier to {@code TASK_RECOGNIZE_INTENT}.
   */
  public static ClassifierAgent intent(EventBroker broker, Classifier classifier) {
    return start(new ClassifierAgent(broker, classifier, "intent_agent",
        WorkflowEvent.TASK_RECOGNIZE_INTENT, WorkflowEvent.RESULT_INTENT_RECOGNIZED,
        "intent", true));
  }

  private static ClassifierAgent start(ClassifierAgent agent) {
    agent.broker.subscribe(agent.taskType, agent.handler);
    return agent;
  }

  public String agentName() {
    return agentName;
  }

  private void onTask(Event event) {
    ClassificationTask task;
    try {
      task = ClassificationTask.from(event);
    } catch (MalformedPayloadException e) {
      reportFailure(event, e);
      return;
    }
    Map<String, Object> payload;
    try {
      List<String> history = task.history() == null ? List.of() : task.history();
      payload = resultPayload(task.sessionId(), classifier.classify(task.text(), history));
    } catch (Exception e) {
      reportFailure(event, e);
      return;
    }
    broker.publish(resultType, payload);
  }

  private Map<String, Object> resultPayload(String sessionId, Classification result) {
    if (result == null) {
      throw new IllegalStateException("classifier returned no result");
    }
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put(Event.SESSION_ID, sessionId);
    payload.put(labelField, result.label());
    payload.put("confidence", result.confidence());
    if (withEntities) {
      payload.put("entities", result.entities());
    }
    return payload;
  }

  private void reportFailure(Event event, Exception failure) {
    String sessionId = event.sessionIdOrNull();
    if (sessionId == null) {
      logger.log(Level.WARNING, agentName + " dropped " + event.eventType() + " without session", failure);
      return;
    }
    logger.log(Level.WARNING, agentName + " failed on session " + sessionId, failure);
    broker.publish(WorkflowEvent.AGENT_ERROR,
        new AgentError(sessionId, agentName, String.valueOf(failure.getMessage()),
            event.eventType()).toPayload());
  }

  @Override
  public void close() {
    broker.unsubscribe(taskType, handler);
  }
}
