package com.gentoro.labasset.events;

import java.time.Instant;
import java.util.List;

/** Published after a configuration mutation has been persisted. */
public record ConfigChanged(long version, List<String> paths, Instant timestamp)
    implements BusEvent {

  public ConfigChanged {
    paths = List.copyOf(paths);
  }

  @Override
  public String key() {
    return "config";
  }
}
