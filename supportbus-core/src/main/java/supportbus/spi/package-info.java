/**
 * Service provider interfaces for plugging metrics backends and conversation storage
 * into the workflow core.
 */
package supportbus.spi;
