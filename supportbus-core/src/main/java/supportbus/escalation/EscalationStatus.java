package supportbus.escalation;

/**
 * Lifecycle of an {@link EscalationRecord}.
 *
 * <pre>
 *   QUEUED ──→ ASSIGNED ──→ RESOLVED
 *     └─────────────────────↗
 * </pre>
 */
public enum EscalationStatus {
  QUEUED,
  ASSIGNED,
  RESOLVED
}
