package supportbus.session;

/**
 * Thrown by {@link SessionRegistry#createSession} when the session id is already registered.
 * Indicates a logic error in the caller; use {@link SessionRegistry#getOrCreate} when the
 * session may already exist.
 */
public final class SessionAlreadyExistsException extends IllegalStateException {

  private final String sessionId;

  public SessionAlreadyExistsException(String sessionId) {
    super("Session already exists: " + sessionId);
    this.sessionId = sessionId;
  }

  public String sessionId() {
    return sessionId;
  }
}
