package supportbus.spring.boot;

import supportbus.WorkflowEvent;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a Spring bean as a support bus event handler.
 *
 * <p>The annotated bean must implement {@link supportbus.EventHandler}. It is subscribed
 * to every listed event type once the context has started.
 *
 * <pre>{@code
 * @Component
 * @SupportBusHandler(events = WorkflowEvent.TASK_ESCALATE)
 * public class PagerHandler implements EventHandler { ... }
 *
 * @Component
 * @SupportBusHandler(eventTypes = "TASK_HANDLE_RETURNS")
 * public class ReturnsAgent implements EventHandler { ... }
 * }</pre>
 *
 * <p>At least one of {@code events} or {@code eventTypes} must be given. Use
 * {@code eventTypes = "*"} to receive every event.
 *
 * @see SupportBusHandlerRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface SupportBusHandler {

    /**
     * Built-in workflow events to subscribe to.
     */
    WorkflowEvent[] events() default {};

    /**
     * Event type names, for routed task events and custom events.
     */
    String[] eventTypes() default {};
}
