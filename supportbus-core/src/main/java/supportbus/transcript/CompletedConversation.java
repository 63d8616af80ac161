package supportbus.transcript;

import supportbus.session.ConversationContext;
import supportbus.session.Message;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A finished conversation handed to a {@link supportbus.spi.ConversationWriter}.
 *
 * @param customerId       may be {@code null}
 * @param customerEmail    may be {@code null}
 * @param operatorId       may be {@code null}
 * @param escalationReason may be {@code null}
 */
public record CompletedConversation(
    String sessionId,
    Instant startTime,
    Instant endTime,
    FinalStatus finalStatus,
    String customerId,
    String customerEmail,
    String operatorId,
    String escalationReason,
    List<Message> messages) {

  public CompletedConversation {
    Objects.requireNonNull(sessionId, "sessionId");
    Objects.requireNonNull(startTime, "startTime");
    Objects.requireNonNull(endTime, "endTime");
    Objects.requireNonNull(finalStatus, "finalStatus");
    messages = List.copyOf(messages);
  }

  public static CompletedConversation of(ConversationContext context, FinalStatus finalStatus,
      Instant endTime) {
    return new CompletedConversation(context.sessionId(), context.startTime(), endTime,
        finalStatus, context.customerId(), context.customerEmail(), context.operatorId(),
        context.escalationReason(), context.messages());
  }
}
