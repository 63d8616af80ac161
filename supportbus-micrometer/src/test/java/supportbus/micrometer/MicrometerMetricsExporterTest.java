package supportbus.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import supportbus.SupportBus;
import supportbus.WorkflowEvent;
import supportbus.classify.Classification;
import supportbus.classify.ClassifierAgent;

import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MicrometerMetricsExporterTest {

  private SimpleMeterRegistry registry;
  private MicrometerMetricsExporter exporter;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    exporter = new MicrometerMetricsExporter(registry);
  }

  @Test
  void brokerCounters() {
    exporter.incrementPublished();
    exporter.incrementPublished();
    exporter.incrementDelivered();
    exporter.incrementHandlerErrors();
    exporter.incrementUndelivered();

    assertEquals(2.0, counter("supportbus.events.published").count());
    assertEquals(1.0, counter("supportbus.events.delivered").count());
    assertEquals(1.0, counter("supportbus.events.errors").count());
    assertEquals(1.0, counter("supportbus.events.undelivered").count());
  }

  @Test
  void routedAndEscalatedAreTagged() {
    exporter.incrementRouted("TASK_HANDLE_RETURNS");
    exporter.incrementRouted("TASK_HANDLE_RETURNS");
    exporter.incrementRouted("TASK_HANDLE_ACCOUNT");
    exporter.incrementEscalated("UNKNOWN_INTENT");

    assertEquals(2.0, registry.find("supportbus.routed").tag("task", "TASK_HANDLE_RETURNS")
        .counter().count());
    assertEquals(1.0, registry.find("supportbus.routed").tag("task", "TASK_HANDLE_ACCOUNT")
        .counter().count());
    assertEquals(1.0, registry.find("supportbus.escalated").tag("reason", "UNKNOWN_INTENT")
        .counter().count());
  }

  @Test
  void escalationReasonsAreGroupedIntoFixedTags() {
    exporter.incrementEscalated("NEGATIVE_SENTIMENT_ANGRY");
    exporter.incrementEscalated("NEGATIVE_SENTIMENT_NEGATIVE");
    exporter.incrementEscalated("AGENT_ERROR_intent_agent");
    exporter.incrementEscalated("customer asked for a manager");
    exporter.incrementEscalated("order #4411 lost twice");

    assertEquals(2.0, registry.find("supportbus.escalated").tag("reason", "NEGATIVE_SENTIMENT")
        .counter().count());
    assertEquals(1.0, registry.find("supportbus.escalated").tag("reason", "AGENT_ERROR")
        .counter().count());
    assertEquals(2.0, registry.find("supportbus.escalated").tag("reason", "OTHER")
        .counter().count());
    assertEquals(3, registry.find("supportbus.escalated").counters().size());
  }

  @Test
  void gaugesFollowLatestValue() {
    exporter.recordActiveSessions(12);
    exporter.recordEscalationQueueDepth(3);
    assertEquals(12.0, gauge("supportbus.sessions.active").value());
    assertEquals(3.0, gauge("supportbus.escalation.queue.depth").value());

    exporter.recordActiveSessions(0);
    assertEquals(0.0, gauge("supportbus.sessions.active").value());
  }

  @Test
  void handlerDurationIsTimed() {
    exporter.recordHandlerDurationMs(40);
    exporter.recordHandlerDurationMs(60);

    Timer timer = registry.find("supportbus.handler.duration").timer();
    assertNotNull(timer);
    assertEquals(2, timer.count());
    assertEquals(100.0, timer.totalTime(TimeUnit.MILLISECONDS), 0.001);
  }

  @Test
  void customNamePrefix() {
    MicrometerMetricsExporter custom = new MicrometerMetricsExporter(registry, "eu.supportbus");
    custom.incrementPublished();
    custom.recordEscalationQueueDepth(5);

    assertEquals(1.0, counter("eu.supportbus.events.published").count());
    assertEquals(5.0, gauge("eu.supportbus.escalation.queue.depth").value());
  }

  @Test
  void invalidPrefixThrows() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(registry, null));
    assertThrows(IllegalArgumentException.class, () -> new MicrometerMetricsExporter(registry, ""));
    assertThrows(IllegalArgumentException.class,
        () -> new MicrometerMetricsExporter(registry, "supportbus."));
  }

  @Test
  void nullRegistryThrows() {
    assertThrows(NullPointerException.class, () -> new MicrometerMetricsExporter(null));
  }

  @Test
  void closeRemovesMetersAndIgnoresLaterUpdates() {
    exporter.incrementRouted("TASK_HANDLE_RETURNS");
    exporter.close();

    assertNull(registry.find("supportbus.events.published").counter());
    assertNull(registry.find("supportbus.routed").counter());
    assertNull(registry.find("supportbus.sessions.active").gauge());

    exporter.incrementPublished();
    assertNull(registry.find("supportbus.events.published").counter());
  }

  @Test
  void supportBusReportsThroughExporter() {
    try (SupportBus bus = SupportBus.builder().metrics(exporter).build()) {
      ClassifierAgent.sentiment(bus.broker(), (text, history) -> Classification.of("NEUTRAL", 0.9));
      ClassifierAgent.intent(bus.broker(), (text, history) -> Classification.of("track_order", 0.9));

      bus.broker().publish(WorkflowEvent.NEW_USER_MESSAGE,
          Map.of("session_id", "m1", "text", "Where is my parcel?"));

      assertEquals(1.0, registry.find("supportbus.routed")
          .tag("task", "TASK_HANDLE_ORDER_TRACKING").counter().count());
      assertEquals(1.0, gauge("supportbus.sessions.active").value());
      assertTrue(counter("supportbus.events.published").count() >= 5);
      assertEquals(1.0, counter("supportbus.events.undelivered").count());
    }
    assertNotNull(registry.find("supportbus.events.published").counter());
    exporter.close();
    assertNull(registry.find("supportbus.events.published").counter());
  }

  private Counter counter(String name) {
    Counter c = registry.find(name).counter();
    assertNotNull(c, "Counter not found: " + name);
    return c;
  }

  private Gauge gauge(String name) {
    Gauge g = registry.find(name).gauge();
    assertNotNull(g, "Gauge not found: " + name);
    return g;
  }
}
