/**
 * Micrometer bridge for exporting retry metrics to Prometheus, Grafana, and other backends.
 *
 * @see retrydrain.micrometer.MicrometerDrainMetrics
 */
package retrydrain.micrometer;
