/**
 * Typed payload variants, one per workflow event type, validated at the handler boundary.
 */
package supportbus.payload;
