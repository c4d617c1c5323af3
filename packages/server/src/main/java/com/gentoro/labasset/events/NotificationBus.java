package com.gentoro.labasset.events;

import com.gentoro.labasset.logging.LoggingService;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;
import org.slf4j.Logger;

/**
 * Best-effort fan-out of job and configuration events.
 *
 * <p>Publishing is serialized so that every subscriber observes events with the same key in
 * publish order. Delivery never blocks: when a subscriber's queue is full the event is dropped for
 * that subscriber only and counted in {@link Subscription#missed()}.
 */
public class NotificationBus {
  private static final Logger log = LoggingService.getLogger(NotificationBus.class);

  public static final int DEFAULT_CAPACITY = 256;

  private final List<Subscription> subscribers = new CopyOnWriteArrayList<>();
  private final Object publishLock = new Object();
  private final int defaultCapacity;

  public NotificationBus() {
    this(DEFAULT_CAPACITY);
  }

  public NotificationBus(int defaultCapacity) {
    if (defaultCapacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    this.defaultCapacity = defaultCapacity;
  }

  public void publish(BusEvent event) {
    if (event == null) return;
    synchronized (publishLock) {
      for (Subscription s : subscribers) {
        long before = s.missed();
        s.deliver(event);
        if (s.missed() != before) {
          log.debug(
              "Subscriber queue full, dropped {} for key {}",
              event.getClass().getSimpleName(),
              event.key());
        }
      }
    }
  }

  public Subscription subscribe() {
    return subscribe(defaultCapacity, e -> true);
  }

  public Subscription subscribe(Class<? extends BusEvent> type) {
    return subscribe(defaultCapacity, type::isInstance);
  }

  public Subscription subscribe(int capacity, Predicate<BusEvent> filter) {
    Subscription s = new Subscription(capacity, filter, subscribers::remove);
    subscribers.add(s);
    return s;
  }

  public int subscriberCount() {
    return subscribers.size();
  }
}
