package supportbus.spring.boot;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Configuration properties for the support bus.
 *
 * <pre>
 * supportbus:
 *   max-publish-depth: 32
 *   coordinator:
 *     intent-confidence-threshold: 0.7
 *     sentiment-escalation-labels: [NEGATIVE, ANGRY]
 *     routes:
 *       track_order: TASK_HANDLE_ORDER_TRACKING
 *   escalation:
 *     avg-handling-seconds: 300
 *   jdbc:
 *     conversations-table: completed_conversations
 * </pre>
 *
 * @see SupportBusAutoConfiguration
 */
@ConfigurationProperties(prefix = "supportbus")
public class SupportBusProperties {

    /**
     * Maximum nesting of publish calls made from inside handlers.
     */
    private int maxPublishDepth = 32;

    private final Coordinator coordinator = new Coordinator();
    private final Escalation escalation = new Escalation();
    private final Jdbc jdbc = new Jdbc();
    private final Metrics metrics = new Metrics();

    public int getMaxPublishDepth() {
        return maxPublishDepth;
    }

    public void setMaxPublishDepth(int maxPublishDepth) {
        this.maxPublishDepth = maxPublishDepth;
    }

    public Coordinator getCoordinator() {
        return coordinator;
    }

    public Escalation getEscalation() {
        return escalation;
    }

    public Jdbc getJdbc() {
        return jdbc;
    }

    public Metrics getMetrics() {
        return metrics;
    }

    public static class Coordinator {
        /**
         * Intent results below this confidence are escalated.
         */
        private double intentConfidenceThreshold = 0.7;

        /**
         * Sentiment labels that escalate immediately.
         */
        private Set<String> sentimentEscalationLabels = new LinkedHashSet<>(List.of("NEGATIVE", "ANGRY"));

        /**
         * Intent to task event routes. Empty means the built-in routes.
         */
        private Map<String, String> routes = new LinkedHashMap<>();

        public double getIntentConfidenceThreshold() {
            return intentConfidenceThreshold;
        }

        public void setIntentConfidenceThreshold(double intentConfidenceThreshold) {
            this.intentConfidenceThreshold = intentConfidenceThreshold;
        }

        public Set<String> getSentimentEscalationLabels() {
            return sentimentEscalationLabels;
        }

        public void setSentimentEscalationLabels(Set<String> sentimentEscalationLabels) {
            this.sentimentEscalationLabels = sentimentEscalationLabels;
        }

        public Map<String, String> getRoutes() {
            return routes;
        }

        public void setRoutes(Map<String, String> routes) {
            this.routes = routes;
        }
    }

    public static class Escalation {
        /**
         * Seconds of wait reported per queue position.
         */
        private long avgHandlingSeconds = 300;

        public long getAvgHandlingSeconds() {
            return avgHandlingSeconds;
        }

        public void setAvgHandlingSeconds(long avgHandlingSeconds) {
            this.avgHandlingSeconds = avgHandlingSeconds;
        }
    }

    public static class Jdbc {
        /**
         * Whether to persist transcripts when a DataSource is present.
         */
        private boolean enabled = true;
        private String conversationsTable = "completed_conversations";
        private String messagesTable = "completed_messages";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getConversationsTable() {
            return conversationsTable;
        }

        public void setConversationsTable(String conversationsTable) {
            this.conversationsTable = conversationsTable;
        }

        public String getMessagesTable() {
            return messagesTable;
        }

        public void setMessagesTable(String messagesTable) {
            this.messagesTable = messagesTable;
        }
    }

    public static class Metrics {
        private boolean enabled = true;
        private String namePrefix = "supportbus";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getNamePrefix() {
            return namePrefix;
        }

        public void setNamePrefix(String namePrefix) {
            this.namePrefix = namePrefix;
        }
    }
}
