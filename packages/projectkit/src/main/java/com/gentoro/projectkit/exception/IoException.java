package com.gentoro.projectkit.exception;

import java.util.Map;

/**
 * I/O operation failed on a filesystem backend. The original {@link java.io.IOException} is kept
 * as cause.
 */
public class IoException extends ProjectKitException {
  public IoException(String message) {
    super(ProjectKitErrorCode.IO_ERROR, message);
  }

  public IoException(String message, Throwable cause) {
    super(ProjectKitErrorCode.IO_ERROR, message, cause);
  }

  public IoException(String message, Map<String, ?> context, Throwable cause) {
    super(ProjectKitErrorCode.IO_ERROR, message, context, cause);
  }
}
