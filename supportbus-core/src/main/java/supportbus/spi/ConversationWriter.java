package supportbus.spi;

import supportbus.transcript.CompletedConversation;

import java.util.logging.Logger;

/**
 * Persists a finished conversation. Invoked by the
 * {@link supportbus.transcript.TranscriptRecorder} once per conversation, right before
 * the session is removed from the registry.
 *
 * <p>Implementations run on the publisher's thread. Failures should be thrown; the
 * recorder logs them and still cleans up the session.
 *
 * @see supportbus.transcript.TranscriptRecorder
 */
public interface ConversationWriter {

    /**
     * Writer that only logs what it would have persisted.
     */
    ConversationWriter NOOP = new LoggingOnly();

    /**
     * Writes the conversation header and its messages.
     *
     * @param conversation the completed conversation
     * @throws Exception if the conversation could not be persisted
     */
    void writeConversation(CompletedConversation conversation) throws Exception;

    /**
     * Default writer used when no storage is configured.
     */
    final class LoggingOnly implements ConversationWriter {
        private static final Logger logger = Logger.getLogger(LoggingOnly.class.getName());

        @Override
        public void writeConversation(CompletedConversation conversation) {
            logger.info("No conversation store configured; dropping transcript for session "
                + conversation.sessionId() + " (" + conversation.messages().size() + " messages)");
        }
    }
}
