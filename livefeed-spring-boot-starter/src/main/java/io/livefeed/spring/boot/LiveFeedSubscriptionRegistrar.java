package io.livefeed.spring.boot;

import io.livefeed.ChangeCallback;
import io.livefeed.coordinator.SubscriptionCoordinator;

import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.core.annotation.AnnotationUtils;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Scans for beans annotated with {@link LiveFeedSubscription} and requests a
 * subscription for each of them.
 *
 * <p>Runs after all singleton beans are initialized via {@link SmartInitializingSingleton}.
 *
 * @see LiveFeedSubscription
 */
public class LiveFeedSubscriptionRegistrar implements SmartInitializingSingleton {

    private final ListableBeanFactory beanFactory;
    private final SubscriptionCoordinator coordinator;
    private final Map<String, String> subscriptionIds = new LinkedHashMap<>();

    public LiveFeedSubscriptionRegistrar(ListableBeanFactory beanFactory,
            SubscriptionCoordinator coordinator) {
        this.beanFactory = beanFactory;
        this.coordinator = coordinator;
    }

    @Override
    public void afterSingletonsInstantiated() {
        Map<String, Object> beans = beanFactory.getBeansWithAnnotation(LiveFeedSubscription.class);
        for (Map.Entry<String, Object> entry : beans.entrySet()) {
            String beanName = entry.getKey();
            Object bean = entry.getValue();

            if (!(bean instanceof ChangeCallback callback)) {
                throw new BeanCreationException(beanName,
                        "Bean annotated with @LiveFeedSubscription must implement ChangeCallback, " +
                                "but " + bean.getClass().getName() + " does not");
            }

            LiveFeedSubscription annotation = bean.getClass().getAnnotation(LiveFeedSubscription.class);
            if (annotation == null) {
                // Proxy may hide annotation; try the target class
                annotation = AnnotationUtils.findAnnotation(bean.getClass(), LiveFeedSubscription.class);
            }
            if (annotation == null) {
                throw new BeanCreationException(beanName,
                        "Could not find @LiveFeedSubscription annotation on " + bean.getClass().getName());
            }
            if (annotation.topic().isEmpty()) {
                throw new BeanCreationException(beanName, "@LiveFeedSubscription topic must not be empty");
            }
            if (annotation.scope().isEmpty()) {
                throw new BeanCreationException(beanName, "@LiveFeedSubscription scope must not be empty");
            }

            String id = coordinator.request(annotation.topic(), callback,
                    annotation.priority(), annotation.scope());
            subscriptionIds.put(beanName, id);
        }
    }

    /**
     * Returns the subscription id requested for each annotated bean, by bean name.
     *
     * @return an immutable copy
     */
    public Map<String, String> subscriptionIds() {
        return Map.copyOf(subscriptionIds);
    }
}
