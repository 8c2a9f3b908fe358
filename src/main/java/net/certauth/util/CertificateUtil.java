package net.certauth.util;

import java.io.ByteArrayInputStream;
import java.security.cert.CertificateEncodingException;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Hex;
import org.apache.commons.codec.digest.DigestUtils;

/** Encoding and fingerprint helpers for X.509 certificates. */
public class CertificateUtil {
  private static final String X509 = "X.509";

  private CertificateUtil() {}

  /**
   * Decodes a single DER (or PEM) encoded certificate.
   *
   * @param encoded the encoded certificate
   * @return the decoded certificate
   * @throws CertificateException if the bytes are not a valid X.509 certificate
   */
  public static X509Certificate decodeCertificate(byte[] encoded) throws CertificateException {
    if (encoded == null || encoded.length == 0) {
      throw new CertificateException("Certificate bytes are empty");
    }
    CertificateFactory cf = CertificateFactory.getInstance(X509);
    return (X509Certificate) cf.generateCertificate(new ByteArrayInputStream(encoded));
  }

  /**
   * SHA-1 thumbprint as upper-case hex, the form used for the thumbprint claim.
   *
   * @param cert certificate
   * @return thumbprint
   * @throws CertificateEncodingException if the certificate cannot be encoded
   */
  public static String sha1Thumbprint(X509Certificate cert) throws CertificateEncodingException {
    return Hex.encodeHexString(DigestUtils.sha1(cert.getEncoded()), false);
  }

  /**
   * SHA-256 thumbprint as upper-case hex, used to correlate log lines for one certificate.
   *
   * @param cert certificate
   * @return thumbprint, or "unknown" if the certificate cannot be encoded
   */
  public static String sha256Thumbprint(X509Certificate cert) {
    try {
      return Hex.encodeHexString(DigestUtils.sha256(cert.getEncoded()), false);
    } catch (CertificateEncodingException e) {
      return "unknown";
    }
  }

  /**
   * Encodes the raw certificate data as an upper-case hex string.
   *
   * @param cert certificate
   * @return hex encoded DER bytes
   * @throws CertificateEncodingException if the certificate cannot be encoded
   */
  public static String rawDataString(X509Certificate cert) throws CertificateEncodingException {
    return Hex.encodeHexString(cert.getEncoded(), false);
  }

  /**
   * Inverse of {@link #rawDataString(X509Certificate)}.
   *
   * @param rawDataString hex encoded DER bytes
   * @return DER bytes
   * @throws CertificateException if the string is not valid hex
   */
  public static byte[] rawDataBytes(String rawDataString) throws CertificateException {
    try {
      return Hex.decodeHex(rawDataString);
    } catch (DecoderException e) {
      throw new CertificateException("Raw certificate data is not a hex string", e);
    }
  }

  /**
   * Upper-case hex of the serial number's two's-complement bytes.
   *
   * @param cert certificate
   * @return serial number
   */
  public static String serialNumberHex(X509Certificate cert) {
    return Hex.encodeHexString(cert.getSerialNumber().toByteArray(), false);
  }
}
