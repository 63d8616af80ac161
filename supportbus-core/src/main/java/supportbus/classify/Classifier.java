package supportbus.classify;

import java.util.List;

/**
 * Black-box text classifier plugged into a {@link ClassifierAgent}.
 */
@FunctionalInterface
public interface Classifier {

  /**
   * Classifies a user message.
   *
   * @param text    the message to classify
   * @param history earlier user messages of the session in order, empty if none were sent
   * @return the classification
   * @throws Exception if classification failed; reported as {@code AGENT_ERROR}
   */
  Classification classify(String text, List<String> history) throws Exception;
}
