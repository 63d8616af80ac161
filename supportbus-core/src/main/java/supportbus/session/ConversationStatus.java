package supportbus.session;

/**
 * Lifecycle status of a conversation held by the {@link SessionRegistry}.
 *
 * <pre>
 *   ACTIVE ──→ ESCALATED ──→ (removed)
 *     │
 *     ├──→ RESOLVED ──→ (removed)
 *     └──→ ABANDONED ──→ (removed)
 * </pre>
 */
public enum ConversationStatus {
  ACTIVE,
  ESCALATED,
  RESOLVED,
  ABANDONED
}
