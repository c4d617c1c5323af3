package com.gentoro.labasset.exception;

/** Configuration could not be loaded, parsed or persisted. */
public class ConfigException extends LabAssetException {
  public ConfigException(String message) {
    super(ErrorKind.CONFIG_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(ErrorKind.CONFIG_ERROR, message, cause);
  }
}
