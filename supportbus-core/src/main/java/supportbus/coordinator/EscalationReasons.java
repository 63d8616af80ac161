package supportbus.coordinator;

import java.util.Locale;

/**
 * Reason codes the {@link Coordinator} attaches to escalations.
 */
public final class EscalationReasons {
  public static final String NEGATIVE_SENTIMENT_PREFIX = "NEGATIVE_SENTIMENT_";
  public static final String LOW_INTENT_CONFIDENCE = "LOW_INTENT_CONFIDENCE";
  public static final String UNKNOWN_INTENT = "UNKNOWN_INTENT";
  public static final String AGENT_ERROR_PREFIX = "AGENT_ERROR_";
  public static final String SYSTEM_ERROR = "SYSTEM_ERROR";
  public static final String OTHER = "OTHER";

  private EscalationReasons() {
  }

  public static String negativeSentiment(String label) {
    return NEGATIVE_SENTIMENT_PREFIX + label.toUpperCase(Locale.ROOT);
  }

  public static String agentError(String agentName) {
    return AGENT_ERROR_PREFIX + agentName;
  }

  /**
   * Maps a reason to one of a fixed set of categories: {@code NEGATIVE_SENTIMENT},
   * {@code AGENT_ERROR}, {@link #LOW_INTENT_CONFIDENCE}, {@link #UNKNOWN_INTENT},
   * {@link #SYSTEM_ERROR}, or {@link #OTHER} for free-form reasons.
   *
   * @param reason an escalation reason, may be {@code null}
   * @return the category, never {@code null}
   */
  public static String category(String reason) {
    if (reason == null) {
      return OTHER;
    }
    if (reason.startsWith(NEGATIVE_SENTIMENT_PREFIX)) {
      return "NEGATIVE_SENTIMENT";
    }
    if (reason.startsWith(AGENT_ERROR_PREFIX)) {
      return "AGENT_ERROR";
    }
    switch (reason) {
      case LOW_INTENT_CONFIDENCE:
      case UNKNOWN_INTENT:
      case SYSTEM_ERROR:
        return reason;
      default:
        return OTHER;
    }
  }
}
