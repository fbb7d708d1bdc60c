package com.gentoro.duosmium.exception;

/** Invalid or missing configuration. */
public class ConfigException extends DuosmiumException {
  public ConfigException(String message) {
    super(DuosmiumErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(DuosmiumErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
