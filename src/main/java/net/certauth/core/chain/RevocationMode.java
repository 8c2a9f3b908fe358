package net.certauth.core.chain;

/** How strictly revocation status is established. */
public enum RevocationMode {
  /** No revocation check is made. */
  NO_CHECK,

  /**
   * Revocation status is fetched online. A certificate is rejected only if it is known to be
   * revoked; an undetermined status is tolerated.
   */
  ONLINE_BEST_EFFORT,

  /** Revocation status is fetched online and must be determined. */
  ONLINE_REQUIRED,

  /** Revocation status is established from locally configured CRLs only. */
  OFFLINE
}
