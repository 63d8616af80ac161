/**
 * Synchronous in-process event broker.
 *
 * <p>{@link supportbus.broker.EventBroker} delivers events on the publisher's thread to a
 * snapshot of subscribers held by {@link supportbus.broker.DefaultSubscriberRegistry}.
 * {@link supportbus.broker.EventInterceptor}s wrap each handler invocation.
 */
package supportbus.broker;
