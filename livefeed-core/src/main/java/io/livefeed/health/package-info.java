/**
 * Periodic health checks for live channels.
 *
 * @see io.livefeed.health.StaleChannelMonitor
 */
package io.livefeed.health;
