package net.certauth.core;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.security.cert.X509Certificate;
import java.util.Collections;
import java.util.Map;
import net.certauth.category.TestTags;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag(TestTags.CORE)
class CertificatePropertiesTest {

  @Test
  void shouldRecoverStoredCertificate() throws Exception {
    X509Certificate certificate =
        new CertificateGeneratorUtil().createClientCertificate("CN=client");

    Map<String, String> properties = CertificateProperties.forCertificate(certificate);
    X509Certificate recovered = CertificateProperties.recoverCertificate(properties);

    assertArrayEquals(certificate.getEncoded(), recovered.getEncoded());
  }

  @Test
  void shouldReturnNullWithoutCertificate() throws Exception {
    assertNull(CertificateProperties.recoverCertificate(null));
    assertNull(CertificateProperties.recoverCertificate(Collections.emptyMap()));
  }

  @Test
  void shouldRejectGarbage() {
    CertificateAuthenticationException e =
        assertThrows(
            CertificateAuthenticationException.class,
            () ->
                CertificateProperties.recoverCertificate(
                    Collections.singletonMap(CertificateProperties.CERTIFICATE_PROPERTY, "0102")));

    assertEquals(ErrorCode.MALFORMED_CERTIFICATE, e.getErrorCode());
  }
}
