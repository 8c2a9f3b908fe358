package net.certauth.core;

import java.security.cert.X509Certificate;
import net.certauth.log.AuthLogger;
import net.certauth.log.AuthLoggerFactory;

/**
 * Decides whether a certificate is self-signed: its issuer must equal its subject and its
 * signature must verify with its own public key. A certificate with matching names whose
 * signature does not verify is treated as chained.
 */
public class SelfSignedCertificateClassifier {
  private static final AuthLogger logger =
      AuthLoggerFactory.getLogger(SelfSignedCertificateClassifier.class);

  public boolean isSelfSigned(X509Certificate certificate) {
    if (!certificate.getSubjectX500Principal().equals(certificate.getIssuerX500Principal())) {
      return false;
    }
    try {
      certificate.verify(certificate.getPublicKey());
      return true;
    } catch (Exception e) {
      logger.debug(
          "Certificate {} names itself as issuer but its signature does not verify with its own"
              + " key: {}",
          certificate.getSubjectX500Principal(),
          e.getMessage());
      return false;
    }
  }

  public CertificateType classify(X509Certificate certificate) {
    return isSelfSigned(certificate) ? CertificateType.SELF_SIGNED : CertificateType.CHAINED;
  }
}
