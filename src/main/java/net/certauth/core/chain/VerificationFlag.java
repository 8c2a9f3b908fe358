package net.certauth.core.chain;

/** Relaxations of the chain verification rules. */
public enum VerificationFlag {
  /** A path may end at a self-signed certificate that is not a configured trust anchor. */
  ALLOW_UNKNOWN_CERTIFICATE_AUTHORITY,

  /** An undetermined revocation status of the end certificate is not a failure. */
  IGNORE_END_REVOCATION_UNKNOWN,

  /** Certificates outside their validity window are not a failure. */
  IGNORE_NOT_TIME_VALID
}
