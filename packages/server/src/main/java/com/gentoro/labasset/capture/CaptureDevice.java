package com.gentoro.labasset.capture;

import java.io.IOException;

/**
 * A camera or equivalent image source. Implementations need not be thread safe; {@link
 * CaptureService} never calls {@link #grab} concurrently for the same device.
 */
public interface CaptureDevice {
  String id();

  boolean isPresent();

  /**
   * Block until one frame is available. Implementations must react to thread interruption, which
   * is how the caller abandons a grab that exceeded its deadline.
   */
  CapturedFrame grab(Resolution requested) throws IOException, InterruptedException;
}
