package supportbus.spi;

/**
 * Observability hook for exporting broker, registry, coordinator and escalation
 * counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of events published to the broker.
     */
    void incrementPublished();

    /**
     * Increments the count of successful handler invocations.
     */
    void incrementDelivered();

    /**
     * Increments the count of handler invocations that threw.
     */
    void incrementHandlerErrors();

    /**
     * Increments the count of events published with no subscriber.
     */
    void incrementUndelivered();

    /**
     * Increments the count of conversations routed to a downstream task.
     *
     * @param taskName the routing task the coordinator published
     */
    default void incrementRouted(String taskName) {
    }

    /**
     * Increments the count of escalations raised by the coordinator.
     *
     * @param reason the escalation reason, e.g. {@code LOW_INTENT_CONFIDENCE}
     */
    default void incrementEscalated(String reason) {
    }

    /**
     * Records the time spent executing one handler.
     *
     * @param durationMs handler execution time in milliseconds (always non-negative)
     */
    default void recordHandlerDurationMs(long durationMs) {
    }

    /**
     * Records the number of sessions currently held by the registry.
     *
     * @param activeSessions current session count
     */
    void recordActiveSessions(int activeSessions);

    /**
     * Records the number of escalations waiting for an operator.
     *
     * @param depth current queue depth
     */
    void recordEscalationQueueDepth(int depth);

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementPublished() {
        }

        @Override
        public void incrementDelivered() {
        }

        @Override
        public void incrementHandlerErrors() {
        }

        @Override
        public void incrementUndelivered() {
        }

        @Override
        public void recordActiveSessions(int activeSessions) {
        }

        @Override
        public void recordEscalationQueueDepth(int depth) {
        }
    }
}
