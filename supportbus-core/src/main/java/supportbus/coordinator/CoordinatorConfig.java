package supportbus.coordinator;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

public final class CoordinatorConfig {
  private Set<String> sentimentEscalationLabels = normalize(Set.of("NEGATIVE", "ANGRY"));
  private double intentConfidenceThreshold = 0.7;
  private Map<String, String> routes = defaultRoutes();

  public static Map<String, String> defaultRoutes() {
    Map<String, String> routes = new LinkedHashMap<>();
    routes.put("track_order", "TASK_HANDLE_ORDER_TRACKING");
    routes.put("process_return", "TASK_HANDLE_RETURNS");
    routes.put("general_inquiry", "TASK_HANDLE_GENERAL_INQUIRY");
    routes.put("update_account", "TASK_HANDLE_ACCOUNT");
    return Collections.unmodifiableMap(routes);
  }

  public Set<String> getSentimentEscalationLabels() {
    return sentimentEscalationLabels;
  }

  /**
   * Sentiment labels that escalate at gate 1. Compared case-insensitively.
   */
  public CoordinatorConfig setSentimentEscalationLabels(Set<String> sentimentEscalationLabels) {
    this.sentimentEscalationLabels = normalize(sentimentEscalationLabels);
    return this;
  }

  public double getIntentConfidenceThreshold() {
    return intentConfidenceThreshold;
  }

  /**
   * Minimum intent confidence that routes at gate 2; a confidence equal to the
   * threshold routes.
   */
  public CoordinatorConfig setIntentConfidenceThreshold(double intentConfidenceThreshold) {
    if (intentConfidenceThreshold < 0.0 || intentConfidenceThreshold > 1.0) {
      throw new IllegalArgumentException("intentConfidenceThreshold must be within [0, 1]");
    }
    this.intentConfidenceThreshold = intentConfidenceThreshold;
    return this;
  }

  public Map<String, String> getRoutes() {
    return routes;
  }

  /**
   * Intent to downstream task event type.
   */
  public CoordinatorConfig setRoutes(Map<String, String> routes) {
    Objects.requireNonNull(routes, "routes");
    this.routes = Collections.unmodifiableMap(new LinkedHashMap<>(routes));
    return this;
  }

  public CoordinatorConfig addRoute(String intent, String taskName) {
    Map<String, String> copy = new LinkedHashMap<>(routes);
    copy.put(Objects.requireNonNull(intent, "intent"), Objects.requireNonNull(taskName, "taskName"));
    this.routes = Collections.unmodifiableMap(copy);
    return this;
  }

  boolean escalatesOn(String sentiment) {
    return sentiment != null && sentimentEscalationLabels.contains(sentiment.toUpperCase(Locale.ROOT));
  }

  String routeFor(String intent) {
    return routes.get(intent);
  }

  private static Set<String> normalize(Set<String> labels) {
    Objects.requireNonNull(labels, "sentimentEscalationLabels");
    Set<String> normalized = new LinkedHashSet<>();
    for (String label : labels) {
      normalized.add(label.toUpperCase(Locale.ROOT));
    }
    return Collections.unmodifiableSet(normalized);
  }
}
