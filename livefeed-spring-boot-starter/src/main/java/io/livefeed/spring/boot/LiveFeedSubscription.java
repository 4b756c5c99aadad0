package io.livefeed.spring.boot;

import io.livefeed.SubscriptionKey;
import io.livefeed.coordinator.SubscriptionCoordinator;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Subscribes a Spring bean to live changes on a topic.
 *
 * <p>The annotated bean must implement {@link io.livefeed.ChangeCallback}. Once all
 * singletons are initialized, {@link LiveFeedSubscriptionRegistrar} requests a
 * subscription for it from the {@link SubscriptionCoordinator}.
 *
 * <pre>{@code
 * @Component
 * @LiveFeedSubscription(topic = "orders", scope = "dashboard", priority = 5)
 * public class OrdersRefresher implements ChangeCallback {
 *   public void onChange() { ... }
 * }
 * }</pre>
 *
 * <p>Two beans with the same scope and topic share one channel; only the first one
 * registered receives notifications.
 *
 * @see LiveFeedSubscriptionRegistrar
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface LiveFeedSubscription {

    /**
     * Topic to watch. Required.
     */
    String topic();

    /**
     * Caller namespace. Defaults to {@value SubscriptionKey#DEFAULT_SCOPE}.
     */
    String scope() default SubscriptionKey.DEFAULT_SCOPE;

    /**
     * Admission priority; higher values are admitted first.
     */
    int priority() default SubscriptionCoordinator.DEFAULT_PRIORITY;
}
