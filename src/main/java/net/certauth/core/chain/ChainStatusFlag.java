package net.certauth.core.chain;

/** Reasons a certificate chain can fail validation. */
public enum ChainStatusFlag {
  NOT_TIME_VALID,
  REVOKED,
  NOT_SIGNATURE_VALID,
  NOT_VALID_FOR_USAGE,
  UNTRUSTED_ROOT,
  REVOCATION_STATUS_UNKNOWN,
  PARTIAL_CHAIN,
  INVALID_BASIC_CONSTRAINTS,
  INVALID_NAME_CONSTRAINTS,
  INVALID_POLICY_CONSTRAINTS,
  HAS_NOT_SUPPORTED_CRITICAL_EXTENSION,
  INVALID_EXTENSION,
  VALIDATION_TIMED_OUT
}
