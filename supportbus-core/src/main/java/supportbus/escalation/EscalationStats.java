package supportbus.escalation;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Counters of an {@link EscalationQueue}.
 *
 * @param totalEscalations escalations accepted since start, duplicates excluded
 * @param queued           escalations currently waiting
 * @param assigned         escalations currently with an operator
 * @param resolved         escalations resolved since start
 * @param byReason         accepted escalations per reason, in first-seen order
 */
public record EscalationStats(long totalEscalations, int queued, int assigned, long resolved,
    Map<String, Long> byReason) {

  public EscalationStats {
    byReason = Collections.unmodifiableMap(new LinkedHashMap<>(byReason));
  }

  /** Outstanding escalations, waiting or assigned. */
  public int activeEscalations() {
    return queued + assigned;
  }
}
