/**
 * Hand-off of conversations to human operators.
 *
 * <p>{@link supportbus.escalation.EscalationQueue} holds waiting and assigned escalations;
 * {@link supportbus.escalation.EscalationManager} drives it from broker events.
 */
package supportbus.escalation;
