package supportbus.escalation;

import supportbus.spi.MetricsExporter;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Logger;

/**
 * Sessions waiting for a human operator, served with two-level priority.
 *
 * <p>{@link EscalationPriority#HIGH} entries are served before all others; within one
 * priority class entries are served strictly in arrival order, and {@code LOW} is queued
 * like {@code NORMAL}. At most one outstanding (queued or assigned) escalation exists per
 * session: a duplicate enqueue is ignored and reports the existing position.
 *
 * <p>Every operation runs under one lock. Wait and handling times are derived from the
 * record timestamps, taken from the injected {@link Clock}.
 */
public final class EscalationQueue {
  private static final Logger logger = Logger.getLogger(EscalationQueue.class.getName());

  public static final long DEFAULT_AVG_HANDLING_SECONDS = 300;

  private final ReentrantLock lock = new ReentrantLock();
  private final Deque<String> highLane = new ArrayDeque<>();
  private final Deque<String> normalLane = new ArrayDeque<>();
  private final Map<String, EscalationRecord> active = new HashMap<>();
  private final Map<String, Long> byReason = new LinkedHashMap<>();
  private long totalEscalations;
  private long resolvedCount;
  private final Clock clock;
  private final MetricsExporter metrics;
  private final long avgHandlingSeconds;

  public EscalationQueue() {
    this(Clock.systemUTC(), MetricsExporter.NOOP, DEFAULT_AVG_HANDLING_SECONDS);
  }

  public EscalationQueue(Clock clock, MetricsExporter metrics, long avgHandlingSeconds) {
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
    if (avgHandlingSeconds < 0) {
      throw new IllegalArgumentException("avgHandlingSeconds must be >= 0");
    }
    this.avgHandlingSeconds = avgHandlingSeconds;
  }

  /**
   * Queues a session for a human operator.
   *
   * @return the 1-based position in service order; for a session that already has an
   *     outstanding escalation, its current position, or {@code 0} if already assigned
   */
  public int enqueue(String sessionId, String reason, Map<String, Object> details,
      EscalationPriority priority) {
    return enqueue(sessionId, reason, details, priority, null);
  }

  /**
   * Queues a session together with the session snapshot handed to the operator.
   *
   * @param context session snapshot, may be {@code null}
   * @return see {@link #enqueue(String, String, Map, EscalationPriority)}
   */
  public int enqueue(String sessionId, String reason, Map<String, Object> details,
      EscalationPriority priority, Map<String, Object> context) {
    Objects.requireNonNull(sessionId, "sessionId");
    Objects.requireNonNull(reason, "reason");
    EscalationPriority effective = priority == null ? EscalationPriority.NORMAL : priority;
    int position;
    int depth;
    lock.lock();
    try {
      EscalationRecord existing = active.get(sessionId);
      if (existing != null) {
        int current = positionOfLocked(sessionId);
        logger.warning("Session " + sessionId + " already has an outstanding escalation ("
            + existing.status() + "); ignoring new reason " + reason);
        return current;
      }
      active.put(sessionId, EscalationRecord.queued(sessionId, reason, details, effective,
          context, clock.instant()));
      totalEscalations++;
      byReason.merge(reason, 1L, Long::sum);
      if (effective == EscalationPriority.HIGH) {
        highLane.addLast(sessionId);
        position = highLane.size();
      } else {
        normalLane.addLast(sessionId);
        position = highLane.size() + normalLane.size();
      }
      depth = highLane.size() + normalLane.size();
    } finally {
      lock.unlock();
    }
    metrics.recordEscalationQueueDepth(depth);
    logger.info("Escalation queued: session=" + sessionId + " reason=" + reason
        + " priority=" + effective + " position=" + position);
    return position;
  }

  /**
   * Hands the escalation at the front of the queue to an operator.
   *
   * @param operatorId the operator taking it
   * @return {@link Assignment.Assigned} with the updated record, or
   *     {@link Assignment.QueueEmpty} when nothing is waiting
   */
  public Assignment assignNext(String operatorId) {
    Objects.requireNonNull(operatorId, "operatorId");
    EscalationRecord assigned;
    int depth;
    lock.lock();
    try {
      String sessionId = highLane.pollFirst();
      if (sessionId == null) {
        sessionId = normalLane.pollFirst();
      }
      if (sessionId == null) {
        logger.fine(() -> "No escalation waiting for operator " + operatorId);
        return new Assignment.QueueEmpty();
      }
      assigned = active.get(sessionId).assign(operatorId, clock.instant());
      active.put(sessionId, assigned);
      depth = highLane.size() + normalLane.size();
    } finally {
      lock.unlock();
    }
    metrics.recordEscalationQueueDepth(depth);
    logger.info("Operator " + operatorId + " assigned to session " + assigned.sessionId());
    return new Assignment.Assigned(assigned);
  }

  /**
   * Closes an outstanding escalation. A record still waiting is taken off the queue.
   * Resolving an unknown or already resolved session is a logged no-op, since duplicate
   * resolution notifications are expected.
   *
   * @param notes resolution notes, may be {@code null}
   * @return the resolved record, or empty if nothing was outstanding
   */
  public Optional<EscalationRecord> resolve(String sessionId, String operatorId, String notes) {
    EscalationRecord resolved;
    int depth;
    lock.lock();
    try {
      EscalationRecord existing = active.remove(sessionId);
      if (existing == null) {
        logger.warning("resolve: no outstanding escalation for session " + sessionId);
        return Optional.empty();
      }
      if (existing.status() == EscalationStatus.QUEUED) {
        highLane.remove(sessionId);
        normalLane.remove(sessionId);
      }
      resolved = existing.resolve(operatorId, notes == null ? "" : notes, clock.instant());
      resolvedCount++;
      depth = highLane.size() + normalLane.size();
    } finally {
      lock.unlock();
    }
    metrics.recordEscalationQueueDepth(depth);
    logger.info("Escalation resolved: session=" + sessionId + " operator=" + resolved.operatorId());
    return Optional.of(resolved);
  }

  public Optional<EscalationRecord> get(String sessionId) {
    lock.lock();
    try {
      return Optional.ofNullable(active.get(sessionId));
    } finally {
      lock.unlock();
    }
  }

  /**
   * Returns the 1-based position of a waiting session, or {@code 0} if it is not waiting.
   */
  public int positionOf(String sessionId) {
    lock.lock();
    try {
      return positionOfLocked(sessionId);
    } finally {
      lock.unlock();
    }
  }

  /** Escalations waiting for an operator. */
  public int size() {
    lock.lock();
    try {
      return highLane.size() + normalLane.size();
    } finally {
      lock.unlock();
    }
  }

  /**
   * Estimated seconds until an operator reaches the given position.
   */
  public long estimatedWaitSeconds(int position) {
    return Math.max(0, position) * avgHandlingSeconds;
  }

  public QueueStatus status() {
    lock.lock();
    try {
      Instant now = clock.instant();
      List<QueueStatus.Entry> entries = new ArrayList<>();
      int position = 0;
      for (Deque<String> lane : List.of(highLane, normalLane)) {
        for (String sessionId : lane) {
          EscalationRecord record = active.get(sessionId);
          entries.add(new QueueStatus.Entry(++position, sessionId, record.reason(),
              record.priority(), EscalationRecord.seconds(Duration.between(record.enqueuedAt(), now))));
        }
      }
      return new QueueStatus(entries.size(), active.size(), entries);
    } finally {
      lock.unlock();
    }
  }

  public EscalationStats stats() {
    lock.lock();
    try {
      int waiting = highLane.size() + normalLane.size();
      return new EscalationStats(totalEscalations, waiting, active.size() - waiting,
          resolvedCount, byReason);
    } finally {
      lock.unlock();
    }
  }

  private int positionOfLocked(String sessionId) {
    int position = 1;
    for (String queued : highLane) {
      if (queued.equals(sessionId)) {
        return position;
      }
      position++;
    }
    for (String queued : normalLane) {
      if (queued.equals(sessionId)) {
        return position;
      }
      position++;
    }
    return 0;
  }
}
