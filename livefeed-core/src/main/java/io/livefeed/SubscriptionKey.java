package io.livefeed;

import java.util.Objects;

/**
 * Identity of a subscription intent: the caller's namespace plus the watched topic.
 *
 * <p>Two requests with equal keys are duplicates. Distinct scopes let independent
 * features watch the same topic without colliding.
 *
 * @param scope caller-supplied namespace, never empty
 * @param topic backend resource being watched, never empty
 */
public record SubscriptionKey(String scope, String topic) {

  /** Scope used when the caller does not name one. */
  public static final String DEFAULT_SCOPE = "default";

  public SubscriptionKey {
    Objects.requireNonNull(scope, "scope");
    Objects.requireNonNull(topic, "topic");
    if (scope.isEmpty()) {
      throw new IllegalArgumentException("scope must not be empty");
    }
    if (topic.isEmpty()) {
      throw new IllegalArgumentException("topic must not be empty");
    }
  }

  @Override
  public String toString() {
    return scope + ":" + topic;
  }
}
