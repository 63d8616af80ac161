package supportbus.spring.boot;

import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.core.annotation.AnnotationUtils;
import supportbus.EventHandler;
import supportbus.WorkflowEvent;
import supportbus.broker.DefaultSubscriberRegistry;
import supportbus.broker.EventBroker;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Scans for beans annotated with {@link SupportBusHandler} and subscribes them on the
 * {@link EventBroker}.
 *
 * <p>Runs after all singleton beans are initialized via {@link SmartInitializingSingleton}.
 *
 * @see SupportBusHandler
 */
public class SupportBusHandlerRegistrar implements SmartInitializingSingleton {
    private static final Logger logger = Logger.getLogger(SupportBusHandlerRegistrar.class.getName());

    private final ListableBeanFactory beanFactory;
    private final EventBroker broker;

    public SupportBusHandlerRegistrar(ListableBeanFactory beanFactory, EventBroker broker) {
        this.beanFactory = beanFactory;
        this.broker = broker;
    }

    @Override
    public void afterSingletonsInstantiated() {
        Map<String, Object> beans = beanFactory.getBeansWithAnnotation(SupportBusHandler.class);
        for (Map.Entry<String, Object> entry : beans.entrySet()) {
            String beanName = entry.getKey();
            Object bean = entry.getValue();

            if (!(bean instanceof EventHandler handler)) {
                throw new BeanCreationException(beanName,
                        "Bean annotated with @SupportBusHandler must implement EventHandler, " +
                                "but " + bean.getClass().getName() + " does not");
            }

            // Proxies may hide the annotation on the target class
            SupportBusHandler annotation = AnnotationUtils.findAnnotation(
                    bean.getClass(), SupportBusHandler.class);
            if (annotation == null) {
                throw new BeanCreationException(beanName,
                        "Could not find @SupportBusHandler annotation on " + bean.getClass().getName());
            }

            Set<String> eventTypes = resolveEventTypes(beanName, annotation);
            for (String eventType : eventTypes) {
                if (DefaultSubscriberRegistry.ALL_EVENTS.equals(eventType)) {
                    broker.subscribeAll(handler);
                } else {
                    broker.subscribe(eventType, handler);
                }
            }
            logger.info("Subscribed handler bean '" + beanName + "' to " + eventTypes);
        }
    }

    private Set<String> resolveEventTypes(String beanName, SupportBusHandler annotation) {
        Set<String> eventTypes = new LinkedHashSet<>();
        for (WorkflowEvent event : annotation.events()) {
            eventTypes.add(event.name());
        }
        for (String eventType : annotation.eventTypes()) {
            if (eventType.isBlank()) {
                throw new BeanCreationException(beanName,
                        "@SupportBusHandler eventTypes must not contain blank names");
            }
            eventTypes.add(eventType);
        }
        if (eventTypes.isEmpty()) {
            throw new BeanCreationException(beanName,
                    "@SupportBusHandler must specify events or eventTypes");
        }
        return eventTypes;
    }
}
