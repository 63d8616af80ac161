/**
 * JDBC storage for finished conversations.
 *
 * <p>{@link supportbus.jdbc.JdbcConversationWriter} plugs into the transcript recorder as a
 * {@link supportbus.spi.ConversationWriter}. The expected schema ships as the classpath
 * resource {@code supportbus/jdbc/schema.sql}.
 *
 * @see supportbus.jdbc.JdbcConversationWriter
 * @see supportbus.jdbc.DataSourceConnectionProvider
 */
package supportbus.jdbc;
