package net.certauth.util;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.security.MessageDigest;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import net.certauth.category.TestTags;
import net.certauth.core.CertificateGeneratorUtil;
import org.apache.commons.codec.binary.Hex;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag(TestTags.CORE)
public class CertificateUtilTest {
  private static X509Certificate certificate;

  @BeforeAll
  public static void setUp() throws Exception {
    certificate = new CertificateGeneratorUtil().createClientCertificate("CN=client");
  }

  @Test
  public void testRawDataRoundTrip() throws Exception {
    String raw = CertificateUtil.rawDataString(certificate);

    assertTrue(raw.matches("[0-9A-F]+"));
    X509Certificate decoded = CertificateUtil.decodeCertificate(CertificateUtil.rawDataBytes(raw));
    assertArrayEquals(certificate.getEncoded(), decoded.getEncoded());
  }

  @Test
  public void testEmptyBytesRejected() {
    assertThrows(CertificateException.class, () -> CertificateUtil.decodeCertificate(new byte[0]));
    assertThrows(CertificateException.class, () -> CertificateUtil.decodeCertificate(null));
  }

  @Test
  public void testInvalidHexRejected() {
    assertThrows(CertificateException.class, () -> CertificateUtil.rawDataBytes("XYZ"));
  }

  @Test
  public void testThumbprints() throws Exception {
    byte[] sha1 = MessageDigest.getInstance("SHA-1").digest(certificate.getEncoded());
    byte[] sha256 = MessageDigest.getInstance("SHA-256").digest(certificate.getEncoded());

    assertEquals(Hex.encodeHexString(sha1, false), CertificateUtil.sha1Thumbprint(certificate));
    assertEquals(
        Hex.encodeHexString(sha256, false), CertificateUtil.sha256Thumbprint(certificate));
  }

  @Test
  public void testSerialNumberHex() {
    assertEquals(
        Hex.encodeHexString(certificate.getSerialNumber().toByteArray(), false),
        CertificateUtil.serialNumberHex(certificate));
  }
}
