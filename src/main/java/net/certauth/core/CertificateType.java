package net.certauth.core;

/** Categories of client certificates an authenticator can be configured to accept. */
public enum CertificateType {
  /** Issuer equals subject and the certificate verifies with its own public key. */
  SELF_SIGNED,
  /** Issued by another certificate authority. */
  CHAINED
}
