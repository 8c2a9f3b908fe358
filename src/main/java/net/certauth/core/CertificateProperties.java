package net.certauth.core;

import java.security.cert.CertificateEncodingException;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.util.Collections;
import java.util.Map;
import net.certauth.util.CertificateUtil;

/** Keys and helpers for the property map of a successful authentication. */
public final class CertificateProperties {
  /** Upper-case hex of the authenticated certificate's DER bytes. */
  public static final String CERTIFICATE_PROPERTY = "x509certificate";

  private CertificateProperties() {}

  static Map<String, String> forCertificate(X509Certificate certificate)
      throws CertificateAuthenticationException {
    try {
      return Collections.singletonMap(
          CERTIFICATE_PROPERTY, CertificateUtil.rawDataString(certificate));
    } catch (CertificateEncodingException e) {
      throw new CertificateAuthenticationException(
          e, ErrorCode.MALFORMED_CERTIFICATE, e.getMessage());
    }
  }

  /**
   * Decodes the certificate stored in the properties of a successful result.
   *
   * @param properties result properties
   * @return the certificate, or null if the properties carry none
   * @throws CertificateAuthenticationException if the stored value is not a certificate
   */
  public static X509Certificate recoverCertificate(Map<String, String> properties)
      throws CertificateAuthenticationException {
    String raw = properties == null ? null : properties.get(CERTIFICATE_PROPERTY);
    if (raw == null) {
      return null;
    }
    try {
      return CertificateUtil.decodeCertificate(CertificateUtil.rawDataBytes(raw));
    } catch (CertificateException e) {
      throw new CertificateAuthenticationException(
          e, ErrorCode.MALFORMED_CERTIFICATE, e.getMessage());
    }
  }
}
