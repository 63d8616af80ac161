package supportbus;

import supportbus.broker.EventBroker;
import supportbus.broker.EventInterceptor;
import supportbus.coordinator.Coordinator;
import supportbus.coordinator.CoordinatorConfig;
import supportbus.escalation.EscalationManager;
import supportbus.escalation.EscalationQueue;
import supportbus.session.SessionRegistry;
import supportbus.spi.ConversationWriter;
import supportbus.spi.MetricsExporter;
import supportbus.transcript.TranscriptRecorder;
import supportbus.util.JsonCodec;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * Composite entry point that wires an {@link EventBroker}, {@link SessionRegistry},
 * {@link Coordinator}, {@link EscalationManager} and {@link TranscriptRecorder} into a
 * single {@link AutoCloseable} unit.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (SupportBus bus = SupportBus.builder()
 *     .conversationWriter(jdbcWriter)
 *     .build()) {
 *   ClassifierAgent.sentiment(bus.broker(), sentimentModel);
 *   ClassifierAgent.intent(bus.broker(), intentModel);
 *   bus.broker().publish(WorkflowEvent.NEW_USER_MESSAGE,
 *       Map.of("session_id", "s1", "text", "Where is my order?"));
 * }
 * }</pre>
 */
public final class SupportBus implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(SupportBus.class.getName());

  private final EventBroker broker;
  private final SessionRegistry registry;
  private final Coordinator coordinator;
  private final EscalationQueue escalationQueue;
  private final EscalationManager escalationManager;
  private final TranscriptRecorder transcriptRecorder;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  private SupportBus(Builder builder) {
    MetricsExporter metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    Clock clock = builder.clock != null ? builder.clock : Clock.systemUTC();
    this.broker = EventBroker.builder()
        .metrics(metrics)
        .interceptors(builder.interceptors)
        .maxPublishDepth(builder.maxPublishDepth)
        .jsonCodec(builder.jsonCodec)
        .build();
    this.registry = new SessionRegistry(clock, metrics);
    this.coordinator = Coordinator.builder()
        .broker(broker)
        .registry(registry)
        .config(builder.coordinatorConfig)
        .metrics(metrics)
        .build();
    this.escalationQueue = new EscalationQueue(clock, metrics, builder.avgHandlingSeconds);
    this.escalationManager = EscalationManager.attach(broker, escalationQueue);
    this.transcriptRecorder = TranscriptRecorder.attach(broker, registry,
        builder.conversationWriter, clock);
    logger.info("SupportBus started");
  }

  public static Builder builder() {
    return new Builder();
  }

  public EventBroker broker() {
    return broker;
  }

  public SessionRegistry registry() {
    return registry;
  }

  public Coordinator coordinator() {
    return coordinator;
  }

  public EscalationQueue escalationQueue() {
    return escalationQueue;
  }

  public TranscriptRecorder transcriptRecorder() {
    return transcriptRecorder;
  }

  /**
   * Unsubscribes components in reverse start order. Calling close twice is a no-op.
   *
   * <p>The metrics exporter and conversation writer are supplied by the caller and stay
   * open; their owner closes them.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    RuntimeException first = null;
    for (AutoCloseable component : List.<AutoCloseable>of(
        transcriptRecorder, escalationManager, coordinator)) {
      try {
        component.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    logger.info("SupportBus closed");
    if (first != null) {
      throw first;
    }
  }

  /** Builder for {@link SupportBus}. */
  public static final class Builder {
    private MetricsExporter metrics;
    private CoordinatorConfig coordinatorConfig;
    private ConversationWriter conversationWriter;
    private JsonCodec jsonCodec;
    private Clock clock;
    private long avgHandlingSeconds = EscalationQueue.DEFAULT_AVG_HANDLING_SECONDS;
    private int maxPublishDepth = 32;
    private final List<EventInterceptor> interceptors = new ArrayList<>();
    private final AtomicBoolean built = new AtomicBoolean(false);

    private Builder() {}

    /**
     * Optional. Defaults to {@link MetricsExporter#NOOP}.
     */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Optional. Defaults to {@code new CoordinatorConfig()}.
     */
    public Builder coordinatorConfig(CoordinatorConfig coordinatorConfig) {
      this.coordinatorConfig = coordinatorConfig;
      return this;
    }

    /**
     * Sets where finished conversations are written.
     *
     * <p>Optional. Defaults to {@link ConversationWriter#NOOP}, which only logs.
     */
    public Builder conversationWriter(ConversationWriter conversationWriter) {
      this.conversationWriter = conversationWriter;
      return this;
    }

    /**
     * Optional. Defaults to {@link JsonCodec#getDefault()}.
     */
    public Builder jsonCodec(JsonCodec jsonCodec) {
      this.jsonCodec = jsonCodec;
      return this;
    }

    /**
     * Sets the clock for session, escalation and transcript timestamps.
     *
     * <p>Optional. Defaults to {@link Clock#systemUTC()}.
     */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Sets the per-position wait estimate reported for queued escalations.
     *
     * <p>Optional. Defaults to {@code 300} seconds.
     */
    public Builder avgHandlingSeconds(long avgHandlingSeconds) {
      this.avgHandlingSeconds = avgHandlingSeconds;
      return this;
    }

    /**
     * Optional. Defaults to {@code 32}.
     */
    public Builder maxPublishDepth(int maxPublishDepth) {
      this.maxPublishDepth = maxPublishDepth;
      return this;
    }

    public Builder interceptor(EventInterceptor interceptor) {
      this.interceptors.add(Objects.requireNonNull(interceptor, "interceptor"));
      return this;
    }

    /**
     * Builds and starts the bus.
     *
     * @throws IllegalStateException if build() was already called
     */
    public SupportBus build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      return new SupportBus(this);
    }
  }
}
