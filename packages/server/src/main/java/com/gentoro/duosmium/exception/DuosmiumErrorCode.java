package com.gentoro.duosmium.exception;

/**
 * Canonical error codes. Codes are stable and suitable for logs and protocol responses; prefer the
 * most specific code that reflects where the failure originated.
 */
public enum DuosmiumErrorCode {
  // Generic
  UNKNOWN,
  INVALID_ARGUMENT,
  FAILED_PRECONDITION,
  NOT_FOUND,

  // I/O and configuration
  CONFIGURATION_ERROR,
  IO_ERROR,
  SERIALIZATION_ERROR,
  FETCH_ERROR,
  NETWORK_ERROR,

  // Results records
  PARSE_ERROR,
  CONSISTENCY_ERROR,
}
