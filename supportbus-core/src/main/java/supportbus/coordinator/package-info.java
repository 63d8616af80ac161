/**
 * The gate state machine: {@link supportbus.coordinator.Coordinator} turns classification
 * results into routing or escalation decisions.
 */
package supportbus.coordinator;
