package net.certauth.core.chain;

/** Which certificates of a trust path are checked for revocation. */
public enum RevocationFlag {
  /** Only the end certificate is checked. */
  END_CERTIFICATE_ONLY,

  /** Every certificate of the path is checked. */
  ENTIRE_CHAIN,

  /** Every certificate except the root is checked. */
  EXCLUDE_ROOT
}
