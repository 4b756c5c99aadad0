/**
 * Service provider interfaces for plugging the coordinator into a realtime backend
 * and a metrics system.
 *
 * <ul>
 *   <li>{@link io.livefeed.spi.ChannelProvider} - opens and closes live channels</li>
 *   <li>{@link io.livefeed.spi.ChannelListener} - per-channel status and change callbacks</li>
 *   <li>{@link io.livefeed.spi.MetricsExporter} - counters and gauges (see {@code livefeed-micrometer})</li>
 * </ul>
 */
package io.livefeed.spi;
