package com.gentoro.projectkit.exception;

import java.util.Map;

/** JSON/YAML serialization or deserialization error. */
public class SerializationException extends ProjectKitException {
  public SerializationException(String message) {
    super(ProjectKitErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(ProjectKitErrorCode.SERIALIZATION_ERROR, message, cause);
  }

  public SerializationException(String message, Map<String, ?> context, Throwable cause) {
    super(ProjectKitErrorCode.SERIALIZATION_ERROR, message, context, cause);
  }
}
