package supportbus.transcript;

import java.util.Locale;

/**
 * How a conversation ended, as stored with its transcript.
 */
public enum FinalStatus {
  RESOLVED_BY_AGENT,
  ESCALATED_TO_HUMAN,
  ABANDONED;

  /**
   * Maps a {@code CONVERSATION_END} reason: anything mentioning escalation is
   * {@link #ESCALATED_TO_HUMAN}, {@code TIMEOUT} and {@code ABANDONED} are
   * {@link #ABANDONED}, everything else, including no reason, is {@link #RESOLVED_BY_AGENT}.
   */
  public static FinalStatus fromEndReason(String reason) {
    if (reason == null) {
      return RESOLVED_BY_AGENT;
    }
    String normalized = reason.toUpperCase(Locale.ROOT);
    if (normalized.contains("ESCALAT")) {
      return ESCALATED_TO_HUMAN;
    }
    if (normalized.equals("TIMEOUT") || normalized.equals("ABANDONED")) {
      return ABANDONED;
    }
    return RESOLVED_BY_AGENT;
  }
}
