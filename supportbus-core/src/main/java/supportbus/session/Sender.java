package supportbus.session;

/**
 * Author of a {@link Message}.
 */
public enum Sender {
  USER,
  AGENT
}
