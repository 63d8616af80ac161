/**
 * Per-conversation state: {@link supportbus.session.SessionRegistry} owns one
 * {@link supportbus.session.ConversationContext} per session id together with its
 * ordered {@link supportbus.session.Message}s.
 */
package supportbus.session;
