/**
 * Archiving of finished conversations through {@link supportbus.spi.ConversationWriter}.
 */
package supportbus.transcript;
