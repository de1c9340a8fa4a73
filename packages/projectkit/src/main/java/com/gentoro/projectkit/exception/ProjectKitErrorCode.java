package com.gentoro.projectkit.exception;

/**
 * Canonical error codes for ProjectKit. Codes are stable and meant to be matched by callers through
 * {@link ExceptionUtil#hasCode(Throwable, ProjectKitErrorCode)} instead of comparing messages.
 */
public enum ProjectKitErrorCode {
  // Generic
  UNKNOWN,
  INVALID_ARGUMENT,
  PERMISSION_DENIED,
  RESOURCE_NOT_FOUND,

  // I/O and configuration
  IO_ERROR,
  SERIALIZATION_ERROR,
  CONFIGURATION_ERROR,
  CONFIG_NOT_FOUND,
  CONFIG_LOAD_FAILED,
  CONFIG_VALIDATION_FAILED,

  // Source resolution
  URI_SCHEME_NOT_FOUND,
  SCHEME_DRIVER_NOT_REGISTERED,
  SCHEME_DRIVER_ALREADY_REGISTERED,
  UNSUPPORTED_SCHEME,
  SOURCE_PATH_EMPTY,
  SOURCE_PATH_NOT_FOUND,
  SOURCE_PATH_CHECK_FAILED,

  // Resource loading
  READ_FAILED,
  PARSE_FAILED,
  VALIDATION_FAILED,
  NO_INSTRUCTIONS_FOUND,
  NO_SKILLS_FOUND,
  NO_MCP_SERVERS_FOUND,
  NO_WORKFLOWS_FOUND,
  NO_STANDARDS_FOUND,
  RULEBOOK_METADATA_MISSING,

  // Repositories
  SKILL_ALREADY_EXISTS,
  SKILL_NOT_FOUND,
  WORKFLOW_ALREADY_EXISTS,
  WORKFLOW_NOT_FOUND,
  EXECUTION_ALREADY_EXISTS,
  EXECUTION_NOT_FOUND,
}
