/**
 * Micrometer bridge for {@link supportbus.spi.MetricsExporter}.
 *
 * @see supportbus.micrometer.MicrometerMetricsExporter
 */
package supportbus.micrometer;
