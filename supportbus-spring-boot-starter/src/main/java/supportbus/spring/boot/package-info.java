/**
 * Spring Boot auto-configuration for the support bus.
 *
 * <p>{@link supportbus.spring.boot.SupportBusAutoConfiguration} builds the bus from
 * {@code supportbus.*} properties. {@link supportbus.spring.boot.SupportBusHandler} beans
 * are subscribed on its broker.
 */
package supportbus.spring.boot;
