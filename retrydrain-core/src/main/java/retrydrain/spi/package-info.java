/**
 * Service provider interfaces for plugging observability into retrying drains.
 *
 * @see retrydrain.spi.DrainMetrics
 */
package retrydrain.spi;
