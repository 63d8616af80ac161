package supportbus.broker;

/**
 * Thrown by {@link EventBroker#publish} when handlers publishing from inside handlers
 * nest deeper than the configured maximum on one thread.
 *
 * <p>When raised inside a handler the enclosing publish treats it like any other
 * handler failure.
 */
public final class PublishDepthExceededException extends IllegalStateException {

  private final int maxDepth;

  public PublishDepthExceededException(String eventType, int maxDepth) {
    super("Publish of '" + eventType + "' exceeds max nested publish depth " + maxDepth);
    this.maxDepth = maxDepth;
  }

  public int maxDepth() {
    return maxDepth;
  }
}
