/**
 * Adapters plugging external sentiment and intent classifiers into the workflow.
 */
package supportbus.classify;
