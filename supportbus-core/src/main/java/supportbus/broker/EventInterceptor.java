package supportbus.broker;

import supportbus.Event;

/**
 * Cross-cutting hook around every handler invocation made by the {@link EventBroker}.
 *
 * <p>For each subscriber of a published event:
 * <ol>
 *   <li>{@link #beforeDispatch} in registration order</li>
 *   <li>Handler execution</li>
 *   <li>{@link #afterDispatch} in reverse registration order</li>
 * </ol>
 *
 * <p>If {@code beforeDispatch} throws, the handler is skipped and the delivery is
 * counted as an error. {@code afterDispatch} exceptions are logged but swallowed.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * EventBroker.builder()
 *     .interceptor(EventInterceptor.before(event ->
 *         audit.log(event.eventType(), event.eventId())))
 *     .interceptor(EventInterceptor.after((event, error) -> {
 *         if (error != null) alerts.handlerFailed(event, error);
 *     }))
 *     .build();
 * }</pre>
 */
public interface EventInterceptor {

    /**
     * Called before a handler is invoked.
     *
     * @param event the event about to be delivered
     * @throws Exception to skip the handler; counted as a delivery error
     */
    default void beforeDispatch(Event event) throws Exception {
    }

    /**
     * Called after handler invocation (or after beforeDispatch failure).
     *
     * @param event the event that was delivered
     * @param error null on success, the exception on failure
     */
    default void afterDispatch(Event event, Exception error) {
    }

    /**
     * Creates an interceptor with only a beforeDispatch hook.
     */
    static EventInterceptor before(BeforeHook hook) {
        return new EventInterceptor() {
            @Override
            public void beforeDispatch(Event event) throws Exception {
                hook.accept(event);
            }
        };
    }

    /**
     * Creates an interceptor with only an afterDispatch hook.
     */
    static EventInterceptor after(AfterHook hook) {
        return new EventInterceptor() {
            @Override
            public void afterDispatch(Event event, Exception error) {
                hook.accept(event, error);
            }
        };
    }

    @FunctionalInterface
    interface BeforeHook {
        void accept(Event event) throws Exception;
    }

    @FunctionalInterface
    interface AfterHook {
        void accept(Event event, Exception error);
    }
}
