package com.gentoro.labasset.events;

import java.time.Instant;

/** Event carried by the {@link NotificationBus}. */
public interface BusEvent {
  /** Ordering key. Events sharing a key are delivered in publish order. */
  String key();

  Instant timestamp();
}
