package com.gentoro.labasset.capture;

import com.gentoro.labasset.config.ConfigSnapshot;
import java.nio.file.Path;

/** Resolves the device configured under {@code capture.*}. */
@FunctionalInterface
public interface CaptureDeviceFactory {
  CaptureDevice create(String deviceId, ConfigSnapshot config);

  static CaptureDeviceFactory directory() {
    return (deviceId, config) ->
        new DirectoryCaptureDevice(
            deviceId, Path.of(config.getString("capture.inboxDir", "capture-inbox")));
  }
}
