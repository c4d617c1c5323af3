package com.gentoro.labasset.events;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Predicate;

/** Bounded mailbox of a single bus subscriber. */
public final class Subscription implements AutoCloseable {
  private final BlockingQueue<Envelope> queue;
  private final Predicate<BusEvent> filter;
  private final Consumer<Subscription> onClose;
  private final AtomicLong sequence = new AtomicLong();
  private final AtomicLong missed = new AtomicLong();
  private volatile boolean closed;

  Subscription(int capacity, Predicate<BusEvent> filter, Consumer<Subscription> onClose) {
    this.queue = new ArrayBlockingQueue<>(capacity);
    this.filter = filter;
    this.onClose = onClose;
  }

  /** Called by the bus while holding its publish lock. Never blocks. */
  void deliver(BusEvent event) {
    if (closed || !filter.test(event)) {
      return;
    }
    long seq = sequence.incrementAndGet();
    if (!queue.offer(new Envelope(seq, event))) {
      missed.incrementAndGet();
    }
  }

  /** Next envelope, waiting up to {@code timeout}; {@code null} if none arrived. */
  public Envelope poll(Duration timeout) throws InterruptedException {
    return queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  /** Remove and return everything currently queued. */
  public List<Envelope> drain() {
    List<Envelope> out = new ArrayList<>();
    queue.drainTo(out);
    return out;
  }

  /** Number of events dropped for this subscriber. */
  public long missed() {
    return missed.get();
  }

  public boolean isClosed() {
    return closed;
  }

  @Override
  public void close() {
    if (!closed) {
      closed = true;
      queue.clear();
      onClose.accept(this);
    }
  }
}
