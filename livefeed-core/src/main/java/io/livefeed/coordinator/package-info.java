/**
 * Serialized admission of live-update subscriptions.
 *
 * <p>{@link io.livefeed.coordinator.SubscriptionCoordinator} keeps a priority-ordered
 * {@link io.livefeed.coordinator.PendingQueue} and an
 * {@link io.livefeed.coordinator.ActiveRegistry}, admits one request at a time,
 * deduplicates by {@link io.livefeed.SubscriptionKey}, and retries failed admissions
 * with exponential backoff.
 *
 * @see io.livefeed.coordinator.SubscriptionCoordinator
 * @see io.livefeed.coordinator.RetryPolicy
 * @see io.livefeed.coordinator.SubscriptionRequest
 */
package io.livefeed.coordinator;
