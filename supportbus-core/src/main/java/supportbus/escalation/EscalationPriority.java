package supportbus.escalation;

import java.util.Locale;

/**
 * Two-level priority of an escalation. {@link #HIGH} entries are served before every
 * other entry; {@link #LOW} is queued exactly like {@link #NORMAL}.
 */
public enum EscalationPriority {
  HIGH,
  NORMAL,
  LOW;

  /**
   * Parses a priority name case-insensitively.
   *
   * @param value the name, or {@code null}
   * @return the priority, {@link #NORMAL} for {@code null} or blank input
   * @throws IllegalArgumentException if the name is not a priority
   */
  public static EscalationPriority parse(String value) {
    if (value == null || value.isBlank()) {
      return NORMAL;
    }
    return valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
