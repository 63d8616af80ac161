package supportbus.broker;

/**
 * Point-in-time copy of the broker counters.
 *
 * @param published   events published
 * @param delivered   handler invocations that completed normally
 * @param errors      handler invocations that threw
 * @param undelivered events published while nobody was subscribed
 */
public record BrokerStats(long published, long delivered, long errors, long undelivered) {
}
