package supportbus.jdbc;

/**
 * Unchecked exception wrapping JDBC errors raised while persisting a conversation.
 */
public final class ConversationStoreException extends RuntimeException {
  public ConversationStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
