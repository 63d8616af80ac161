/**
 * Root API for supportbus: an in-process, event-driven workflow for customer-support
 * conversations.
 *
 * <h2>Core Design</h2>
 * <p>Components never call each other. They exchange {@link supportbus.Event}s through an
 * {@linkplain supportbus.broker.EventBroker broker} that delivers synchronously on the
 * publisher's thread. Conversation state lives in a
 * {@linkplain supportbus.session.SessionRegistry session registry}. The
 * {@linkplain supportbus.coordinator.Coordinator coordinator} moves each conversation
 * through a sentiment gate and an intent gate, then routes it to a downstream handler or
 * escalates it to the {@linkplain supportbus.escalation.EscalationQueue escalation queue}.
 * A {@linkplain supportbus.transcript.TranscriptRecorder transcript recorder} archives
 * conversations when they end.
 *
 * <p>Delivery is best-effort and volatile: nothing survives a restart, and a handler
 * failure is contained and counted rather than retried.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>supportbus-core</b>: broker, registry, coordinator, escalation, SPI</li>
 *   <li><b>supportbus-jdbc</b>: {@linkplain supportbus.jdbc JDBC conversation writer}</li>
 *   <li><b>supportbus-micrometer</b>: Micrometer metrics exporter</li>
 *   <li><b>supportbus-spring-boot-starter</b>: auto-configuration</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (SupportBus bus = SupportBus.builder().build()) {
 *   EventBroker broker = bus.broker();
 *   ClassifierAgent.sentiment(broker, (text, history) -> Classification.of("NEUTRAL", 0.9));
 *   ClassifierAgent.intent(broker, (text, history) -> Classification.of("track_order", 0.92));
 *   broker.subscribe("TASK_HANDLE_ORDER_TRACKING", event ->
 *       System.out.println("Route: " + event.payload().get("session_id")));
 *
 *   broker.publish(WorkflowEvent.NEW_USER_MESSAGE,
 *       Map.of("session_id", "s1", "text", "Where is my parcel?"));
 * }
 * }</pre>
 *
 * @see supportbus.SupportBus
 * @see supportbus.Event
 * @see supportbus.WorkflowEvent
 */
package supportbus;
