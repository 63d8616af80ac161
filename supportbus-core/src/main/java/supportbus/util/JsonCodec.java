package supportbus.util;

/**
 * Encodes payload values as JSON text.
 *
 * <p>Used wherever a payload fragment leaves the process as text: the JDBC writer stores
 * message entities and agent actions as JSON columns, and the broker renders payloads
 * in FINE-level log lines. The default implementation ({@link DefaultJsonCodec}) has no
 * external dependencies and handles the value shapes payloads are made of: maps with
 * string keys, lists, strings, numbers, booleans and {@code null}. Applications with
 * Jackson or Gson on the classpath can implement this interface to delegate to them.
 *
 * @see #getDefault()
 * @see DefaultJsonCodec
 */
public interface JsonCodec {

    /**
     * Returns the default singleton implementation.
     *
     * @return the default {@link JsonCodec}
     */
    static JsonCodec getDefault() {
        return DefaultJsonCodec.INSTANCE;
    }

    /**
     * Encodes a payload value as JSON. Values of other types are written as their
     * {@code toString()} in a JSON string.
     *
     * @param value a map, list, string, number, boolean or {@code null}
     * @return JSON text, {@code "null"} for a {@code null} value
     * @throws IllegalArgumentException if a map contains a {@code null} key
     */
    String toJson(Object value);
}
