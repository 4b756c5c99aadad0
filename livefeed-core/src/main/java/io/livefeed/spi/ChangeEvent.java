package io.livefeed.spi;

import java.time.Instant;
import java.util.Objects;

/**
 * A single change notification delivered on a live channel.
 *
 * <p>The payload is opaque to the coordinator; it is only used to wake the
 * subscriber's {@link io.livefeed.ChangeCallback}.
 *
 * @param topic      the watched topic
 * @param type       the kind of change
 * @param payload    backend-specific payload, may be {@code null}
 * @param receivedAt when the provider received the change
 */
public record ChangeEvent(String topic, Type type, String payload, Instant receivedAt) {

  public ChangeEvent {
    Objects.requireNonNull(topic, "topic");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(receivedAt, "receivedAt");
  }

  /**
   * Creates an event stamped with the current time.
   *
   * @param topic   the watched topic
   * @param type    the kind of change
   * @param payload backend-specific payload, may be {@code null}
   * @return a new event
   */
  public static ChangeEvent of(String topic, Type type, String payload) {
    return new ChangeEvent(topic, type, payload, Instant.now());
  }

  /** Row-level change kinds. */
  public enum Type {
    INSERT,
    UPDATE,
    DELETE
  }
}
