package supportbus.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import supportbus.coordinator.EscalationReasons;
import supportbus.spi.MetricsExporter;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code supportbus.events.published}: events accepted by the broker</li>
 *   <li>{@code supportbus.events.delivered}: successful handler invocations</li>
 *   <li>{@code supportbus.events.errors}: handler invocations that threw</li>
 *   <li>{@code supportbus.events.undelivered}: events published with no subscriber</li>
 *   <li>{@code supportbus.routed}, tagged {@code task}: conversations routed to a handler</li>
 *   <li>{@code supportbus.escalated}, tagged {@code reason}: conversations escalated. The tag
 *       is the reason category from {@link EscalationReasons#category(String)}, so free-form
 *       reasons share the {@code OTHER} counter</li>
 * </ul>
 *
 * <h3>Gauges and timers</h3>
 * <ul>
 *   <li>{@code supportbus.sessions.active}: sessions currently in the registry</li>
 *   <li>{@code supportbus.escalation.queue.depth}: escalations waiting for an operator</li>
 *   <li>{@code supportbus.handler.duration}: time spent in a single handler</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final String namePrefix;
  private final Counter published;
  private final Counter delivered;
  private final Counter handlerErrors;
  private final Counter undelivered;
  private final Timer handlerDuration;
  private final Gauge activeSessionsGauge;
  private final Gauge queueDepthGauge;
  private final Map<String, Counter> routedByTask = new ConcurrentHashMap<>();
  private final Map<String, Counter> escalatedByCategory = new ConcurrentHashMap<>();

  private final AtomicInteger activeSessions = new AtomicInteger();
  private final AtomicInteger queueDepth = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "supportbus"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "supportbus");
  }

  /**
   * Creates an exporter with a custom metric name prefix for multi-instance use.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "eu.supportbus"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.namePrefix = namePrefix;
    this.published = Counter.builder(namePrefix + ".events.published")
        .description("Events accepted by the broker")
        .register(registry);
    this.delivered = Counter.builder(namePrefix + ".events.delivered")
        .description("Successful handler invocations")
        .register(registry);
    this.handlerErrors = Counter.builder(namePrefix + ".events.errors")
        .description("Handler invocations that threw")
        .register(registry);
    this.undelivered = Counter.builder(namePrefix + ".events.undelivered")
        .description("Events published with no subscriber")
        .register(registry);
    this.handlerDuration = Timer.builder(namePrefix + ".handler.duration")
        .description("Time spent in a single event handler")
        .register(registry);

    this.activeSessionsGauge = Gauge.builder(namePrefix + ".sessions.active",
            activeSessions, AtomicInteger::get)
        .register(registry);
    this.queueDepthGauge = Gauge.builder(namePrefix + ".escalation.queue.depth",
            queueDepth, AtomicInteger::get)
        .register(registry);
  }

  @Override
  public void incrementPublished() {
    if (closed) return;
    published.increment();
  }

  @Override
  public void incrementDelivered() {
    if (closed) return;
    delivered.increment();
  }

  @Override
  public void incrementHandlerErrors() {
    if (closed) return;
    handlerErrors.increment();
  }

  @Override
  public void incrementUndelivered() {
    if (closed) return;
    undelivered.increment();
  }

  @Override
  public void incrementRouted(String taskName) {
    if (closed) return;
    routedByTask.computeIfAbsent(taskName, task -> Counter.builder(namePrefix + ".routed")
            .description("Conversations routed to a task handler")
            .tag("task", task)
            .register(registry))
        .increment();
  }

  @Override
  public void incrementEscalated(String reason) {
    if (closed) return;
    escalatedByCategory.computeIfAbsent(EscalationReasons.category(reason),
            category -> Counter.builder(namePrefix + ".escalated")
                .description("Conversations escalated to a human operator")
                .tag("reason", category)
                .register(registry))
        .increment();
  }

  @Override
  public void recordHandlerDurationMs(long durationMs) {
    if (closed) return;
    handlerDuration.record(Duration.ofMillis(durationMs).toNanos(), TimeUnit.NANOSECONDS);
  }

  @Override
  public void recordActiveSessions(int activeSessions) {
    if (closed) return;
    this.activeSessions.set(activeSessions);
  }

  @Override
  public void recordEscalationQueueDepth(int depth) {
    if (closed) return;
    this.queueDepth.set(depth);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   *
   * <p>The owner of the exporter calls this once the bus using it is closed; the Spring
   * Boot starter leaves it to the container.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>(List.of(published, delivered, handlerErrors,
        undelivered, handlerDuration, activeSessionsGauge, queueDepthGauge));
    meters.addAll(routedByTask.values());
    meters.addAll(escalatedByCategory.values());
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
