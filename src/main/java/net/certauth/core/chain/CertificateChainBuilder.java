package net.certauth.core.chain;

import java.security.GeneralSecurityException;
import java.security.cert.X509Certificate;

/**
 * The path building and revocation checking primitive. Implementations build a trust path for the
 * end certificate under the given policy and report every problem they find.
 *
 * <p>Implementations may block on network I/O and must respond to thread interruption.
 */
public interface CertificateChainBuilder {

  /**
   * @param certificate the end certificate
   * @param policy the policy for this build
   * @return valid, or invalid with the statuses in the order they were found
   * @throws GeneralSecurityException if the primitive itself fails, as opposed to the chain being
   *     invalid
   */
  ChainValidationResult build(X509Certificate certificate, ChainPolicy policy)
      throws GeneralSecurityException;
}
