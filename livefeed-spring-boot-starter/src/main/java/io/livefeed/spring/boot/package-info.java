/**
 * Spring Boot auto-configuration for the live-feed subscription coordinator.
 *
 * <p>Provide a {@link io.livefeed.spi.ChannelProvider} bean and a
 * {@link io.livefeed.coordinator.SubscriptionCoordinator} is created from
 * {@code livefeed.*} properties. Annotate {@link io.livefeed.ChangeCallback} beans with
 * {@link io.livefeed.spring.boot.LiveFeedSubscription} to subscribe them at startup.
 */
package io.livefeed.spring.boot;
