package com.gentoro.projectkit.exception;

import java.util.Map;

/** Configuration or environment related problem detected at startup or runtime. */
public class ConfigException extends ProjectKitException {
  public ConfigException(String message) {
    super(ProjectKitErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(ProjectKitErrorCode.CONFIGURATION_ERROR, message, cause);
  }

  public ConfigException(ProjectKitErrorCode code, String message, Throwable cause) {
    super(code, message, cause);
  }

  public ConfigException(
      ProjectKitErrorCode code, String message, Map<String, ?> context, Throwable cause) {
    super(code, message, context, cause);
  }
}
