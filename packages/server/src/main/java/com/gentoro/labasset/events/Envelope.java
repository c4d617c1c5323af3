package com.gentoro.labasset.events;

/**
 * An event as seen by one subscriber. Sequence numbers are contiguous per subscription; a jump
 * means events were dropped because the subscriber's queue was full.
 */
public record Envelope(long sequence, BusEvent event) {}
