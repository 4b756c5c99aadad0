package io.livefeed.coordinator;

import io.livefeed.SubscriptionKey;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Live subscriptions indexed by id and by {@link SubscriptionKey}, in activation order.
 * Holds at most one entry per key.
 *
 * <p>Not thread-safe; guarded by the owning coordinator's lock.
 */
public final class ActiveRegistry {
  private final Map<String, ActiveSubscription> byId = new LinkedHashMap<>();
  private final Map<SubscriptionKey, String> idByKey = new HashMap<>();

  /**
   * Registers a subscription.
   *
   * @param subscription the newly active subscription
   * @return {@code false} if its key (or id) is already registered
   */
  public boolean register(ActiveSubscription subscription) {
    if (idByKey.containsKey(subscription.key()) || byId.containsKey(subscription.id())) {
      return false;
    }
    byId.put(subscription.id(), subscription);
    idByKey.put(subscription.key(), subscription.id());
    return true;
  }

  public Optional<ActiveSubscription> get(String id) {
    return Optional.ofNullable(byId.get(id));
  }

  public Optional<ActiveSubscription> find(SubscriptionKey key) {
    String id = idByKey.get(key);
    return id == null ? Optional.empty() : Optional.ofNullable(byId.get(id));
  }

  public boolean contains(SubscriptionKey key) {
    return idByKey.containsKey(key);
  }

  /**
   * Returns whether any scope holds a live channel for {@code topic}.
   */
  public boolean hasTopic(String topic) {
    for (SubscriptionKey key : idByKey.keySet()) {
      if (key.topic().equals(topic)) {
        return true;
      }
    }
    return false;
  }

  /**
   * Removes the subscription with the given id.
   *
   * @param id subscription id
   * @return the removed subscription, if any
   */
  public Optional<ActiveSubscription> remove(String id) {
    ActiveSubscription removed = byId.remove(id);
    if (removed == null) {
      return Optional.empty();
    }
    idByKey.remove(removed.key());
    return Optional.of(removed);
  }

  /**
   * Removes {@code subscription} only if it is still the registered entry for its id.
   *
   * @return {@code true} if removed
   */
  public boolean removeExact(ActiveSubscription subscription) {
    if (byId.get(subscription.id()) != subscription) {
      return false;
    }
    remove(subscription.id());
    return true;
  }

  /**
   * Removes every entry.
   *
   * @return the removed subscriptions in activation order
   */
  public List<ActiveSubscription> drain() {
    List<ActiveSubscription> all = new ArrayList<>(byId.values());
    byId.clear();
    idByKey.clear();
    return all;
  }

  public List<String> ids() {
    return List.copyOf(byId.keySet());
  }

  public List<ActiveSubscription> snapshot() {
    return List.copyOf(byId.values());
  }

  public int size() {
    return byId.size();
  }
}
