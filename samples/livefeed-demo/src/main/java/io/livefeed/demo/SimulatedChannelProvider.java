package io.livefeed.demo;

import io.livefeed.spi.ChangeEvent;
import io.livefeed.spi.ChannelHandle;
import io.livefeed.spi.ChannelListener;
import io.livefeed.spi.ChannelProvider;
import io.livefeed.spi.ChannelStatus;
import io.livefeed.util.DaemonThreadFactory;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process stand-in for a pub/sub backend.
 *
 * <p>Channels connect after a short delay and then emit an {@code UPDATE} every
 * {@code changeIntervalMs}. Topics listed in {@code flakyTopics} fail their first
 * connection attempt with {@code ERROR}.
 */
final class SimulatedChannelProvider implements ChannelProvider, AutoCloseable {

  private final ScheduledExecutorService scheduler =
      Executors.newScheduledThreadPool(2, new DaemonThreadFactory("simulated-backend-"));
  private final Set<String> flakyTopics;
  private final long changeIntervalMs;
  private final Map<String, AtomicInteger> attempts = new ConcurrentHashMap<>();
  private final AtomicInteger openChannels = new AtomicInteger();

  SimulatedChannelProvider(Set<String> flakyTopics, long changeIntervalMs) {
    this.flakyTopics = Set.copyOf(flakyTopics);
    this.changeIntervalMs = changeIntervalMs;
  }

  @Override
  public ChannelHandle open(String topic, ChannelListener listener) {
    int attempt = attempts.computeIfAbsent(topic, t -> new AtomicInteger()).incrementAndGet();
    SimulatedChannel channel = new SimulatedChannel(topic);
    openChannels.incrementAndGet();
    System.out.println("[Backend] open " + topic + " (attempt " + attempt + ")");

    listener.onStatus(ChannelStatus.CONNECTING, null);
    scheduler.schedule(() -> {
      if (flakyTopics.contains(topic) && attempt == 1) {
        listener.onStatus(ChannelStatus.ERROR, new IllegalStateException("simulated connect failure"));
        return;
      }
      listener.onStatus(ChannelStatus.ACTIVE, null);
      channel.changes = scheduler.scheduleAtFixedRate(
          () -> listener.onChange(ChangeEvent.of(topic, ChangeEvent.Type.UPDATE, "{\"topic\":\"" + topic + "\"}")),
          changeIntervalMs, changeIntervalMs, TimeUnit.MILLISECONDS);
    }, 50, TimeUnit.MILLISECONDS);
    return channel;
  }

  @Override
  public void close(ChannelHandle handle) {
    SimulatedChannel channel = (SimulatedChannel) handle;
    ScheduledFuture<?> changes = channel.changes;
    if (changes != null) {
      changes.cancel(false);
    }
    openChannels.decrementAndGet();
    System.out.println("[Backend] close " + channel.topic());
  }

  int openChannels() {
    return openChannels.get();
  }

  @Override
  public void close() {
    scheduler.shutdownNow();
  }

  private static final class SimulatedChannel implements ChannelHandle {
    private final String topic;
    private volatile ScheduledFuture<?> changes;

    SimulatedChannel(String topic) {
      this.topic = topic;
    }

    @Override
    public String topic() {
      return topic;
    }
  }
}
