/**
 * Root API for livefeed - a coordinator that shares one realtime backend connection
 * among many independent features, each wanting a "notify me when X changes" feed.
 *
 * <h2>Core Design</h2>
 * <p>Callers ask the {@linkplain io.livefeed.coordinator.SubscriptionCoordinator coordinator}
 * for a feed on a {@code (scope, topic)} pair and get back an id. Identical intents share
 * one channel. Channels are opened one at a time by a single drain thread so a burst of
 * screens never turns into a burst of connections. Transient failures are retried with
 * exponential backoff; a request that keeps failing is eventually dropped.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>livefeed-core</b> - coordinator, SPIs, stale-channel monitor (zero external deps)</li>
 *   <li><b>livefeed-micrometer</b> - optional Micrometer metrics bridge</li>
 *   <li><b>livefeed-spring-boot-starter</b> - Spring Boot auto-configuration with
 *       {@code @LiveFeedSubscription}</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (SubscriptionCoordinator coordinator = SubscriptionCoordinator.builder()
 *     .channelProvider(realtimeClient)
 *     .build()) {
 *
 *   String id = coordinator.request("sessions", () -> sessions.reload(), 1, "dashboard");
 *   // ...
 *   coordinator.cancel(id);
 * }
 * }</pre>
 *
 * @see io.livefeed.ChangeCallback
 * @see io.livefeed.SubscriptionKey
 * @see io.livefeed.spi.ChannelProvider
 */
package io.livefeed;
