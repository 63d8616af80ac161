package supportbus.session;

/**
 * Point-in-time copy of the registry counters.
 *
 * @param created       sessions created since startup
 * @param active        sessions currently held
 * @param ended         sessions removed via {@link SessionRegistry#delete}
 * @param totalMessages messages appended since startup
 */
public record RegistryStats(long created, int active, long ended, long totalMessages) {
}
