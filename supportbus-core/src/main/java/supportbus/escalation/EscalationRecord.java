package supportbus.escalation;

import supportbus.util.ImmutableValues;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable state of one escalation. The {@link EscalationQueue} replaces the record on
 * every transition.
 *
 * @param context session snapshot taken when the escalation was raised, may be {@code null}
 */
public record EscalationRecord(
    String sessionId,
    String reason,
    Map<String, Object> details,
    EscalationPriority priority,
    EscalationStatus status,
    Instant enqueuedAt,
    Instant assignedAt,
    String operatorId,
    Instant resolvedAt,
    String resolutionNotes,
    Map<String, Object> context) {

  public EscalationRecord {
    Objects.requireNonNull(sessionId, "sessionId");
    Objects.requireNonNull(reason, "reason");
    Objects.requireNonNull(priority, "priority");
    Objects.requireNonNull(status, "status");
    Objects.requireNonNull(enqueuedAt, "enqueuedAt");
    details = details == null ? Map.of() : ImmutableValues.copyOf(details);
    context = ImmutableValues.copyOf(context);
  }

  static EscalationRecord queued(String sessionId, String reason, Map<String, Object> details,
      EscalationPriority priority, Map<String, Object> context, Instant now) {
    return new EscalationRecord(sessionId, reason, details, priority, EscalationStatus.QUEUED,
        now, null, null, null, null, context);
  }

  EscalationRecord assign(String operatorId, Instant now) {
    return new EscalationRecord(sessionId, reason, details, priority, EscalationStatus.ASSIGNED,
        enqueuedAt, now, operatorId, null, null, context);
  }

  EscalationRecord resolve(String resolvingOperatorId, String notes, Instant now) {
    String operator = operatorId != null ? operatorId : resolvingOperatorId;
    return new EscalationRecord(sessionId, reason, details, priority, EscalationStatus.RESOLVED,
        enqueuedAt, assignedAt, operator, now, notes, context);
  }

  public boolean outstanding() {
    return status != EscalationStatus.RESOLVED;
  }

  /** Time between enqueue and assignment. */
  public Optional<Duration> waitTime() {
    return assignedAt == null ? Optional.empty() : Optional.of(Duration.between(enqueuedAt, assignedAt));
  }

  /** Time between assignment and resolution. Empty if resolved without assignment. */
  public Optional<Duration> handlingTime() {
    if (assignedAt == null || resolvedAt == null) {
      return Optional.empty();
    }
    return Optional.of(Duration.between(assignedAt, resolvedAt));
  }

  /** Time between enqueue and resolution. */
  public Optional<Duration> totalTime() {
    return resolvedAt == null ? Optional.empty() : Optional.of(Duration.between(enqueuedAt, resolvedAt));
  }

  static double seconds(Duration duration) {
    return duration.toMillis() / 1000.0;
  }
}
