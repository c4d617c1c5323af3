package com.gentoro.labasset.retry;

/** Delay source for retries; swapped in tests to avoid real sleeping. */
@FunctionalInterface
public interface Sleeper {
  Sleeper SYSTEM = Thread::sleep;

  void sleep(long millis) throws InterruptedException;
}
