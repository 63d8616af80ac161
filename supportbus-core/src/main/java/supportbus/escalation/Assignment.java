package supportbus.escalation;

/**
 * Outcome of {@link EscalationQueue#assignNext(String)}.
 */
public sealed interface Assignment permits Assignment.Assigned, Assignment.QueueEmpty {

  /**
   * The operator took the escalation at the front of the queue.
   *
   * @param record the record, now {@link EscalationStatus#ASSIGNED}
   */
  record Assigned(EscalationRecord record) implements Assignment {
  }

  /**
   * Nothing was waiting.
   */
  record QueueEmpty() implements Assignment {
  }
}
