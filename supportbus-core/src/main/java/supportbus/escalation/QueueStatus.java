package supportbus.escalation;

import java.util.List;

/**
 * Point-in-time view of the {@link EscalationQueue}.
 *
 * @param queueSize         escalations waiting for an operator
 * @param activeEscalations outstanding escalations, waiting or assigned
 * @param entries           waiting escalations in service order
 */
public record QueueStatus(int queueSize, int activeEscalations, List<Entry> entries) {

  public QueueStatus {
    entries = List.copyOf(entries);
  }

  /**
   * One waiting escalation.
   *
   * @param position       1-based position in service order
   * @param waitingSeconds time since enqueue
   */
  public record Entry(int position, String sessionId, String reason, EscalationPriority priority,
      double waitingSeconds) {
  }
}
