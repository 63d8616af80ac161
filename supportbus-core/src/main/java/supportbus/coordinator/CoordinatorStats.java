package supportbus.coordinator;

/**
 * Point-in-time copy of the coordinator counters.
 *
 * @param messagesProcessed user messages accepted at gate 0
 * @param escalations       {@code TASK_ESCALATE} events published
 * @param routes            routing tasks published at gate 2
 * @param errors            agent errors received plus failures inside the gates
 * @param activeSessions    sessions currently held by the registry
 */
public record CoordinatorStats(long messagesProcessed, long escalations, long routes, long errors,
    int activeSessions) {
}
