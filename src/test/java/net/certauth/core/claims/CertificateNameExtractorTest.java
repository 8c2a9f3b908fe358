package net.certauth.core.claims;

import static net.certauth.core.CertificateGeneratorUtil.dnsName;
import static net.certauth.core.CertificateGeneratorUtil.emailName;
import static net.certauth.core.CertificateGeneratorUtil.upnName;
import static net.certauth.core.CertificateGeneratorUtil.uriName;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.security.cert.X509Certificate;
import net.certauth.category.TestTags;
import net.certauth.core.CertificateGeneratorUtil;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag(TestTags.CLAIMS)
class CertificateNameExtractorTest {
  private static CertificateGeneratorUtil certGen;

  private final CertificateNameExtractor extractor = new CertificateNameExtractor();

  @BeforeAll
  static void setUpAll() {
    certGen = new CertificateGeneratorUtil();
  }

  @Nested
  class DnsName {
    @Test
    void shouldPreferSubjectAlternativeName() throws Exception {
      X509Certificate cert =
          certGen.createClientCertificateWithSan(
              "CN=common.example.com", dnsName("san.example.com"), dnsName("other.example.com"));

      assertEquals("san.example.com", extractor.getDnsName(cert));
    }

    @Test
    void shouldFallBackToCommonName() throws Exception {
      X509Certificate cert = certGen.createClientCertificate("CN=common.example.com, O=Acme");

      assertEquals("common.example.com", extractor.getDnsName(cert));
    }

    @Test
    void shouldSkipBlankSubjectAlternativeName() throws Exception {
      X509Certificate cert =
          certGen.createClientCertificateWithSan("CN=common.example.com", dnsName("   "));

      assertEquals("common.example.com", extractor.getDnsName(cert));
    }

    @Test
    void shouldReadCommonNameFromMultiValuedRdn() throws Exception {
      X509Certificate cert = certGen.createClientCertificate("CN=client.example.com+OU=x");

      assertEquals("client.example.com", extractor.getDnsName(cert));
    }
  }

  @Nested
  class SimpleName {
    @Test
    void shouldUseCommonName() throws Exception {
      X509Certificate cert = certGen.createClientCertificate("CN=Alice, OU=Engineering, O=Acme");

      assertEquals("Alice", extractor.getSimpleName(cert));
    }

    @Test
    void shouldPickRequestedAttributeOfMultiValuedRdn() throws Exception {
      X509Certificate cert = certGen.createClientCertificate("CN=client.example.com+OU=x, O=Acme");

      assertEquals("client.example.com", extractor.getSimpleName(cert));
    }

    @Test
    void shouldFallBackToOrganizationalUnit() throws Exception {
      X509Certificate cert = certGen.createClientCertificate("OU=Engineering, O=Acme");

      assertEquals("Engineering", extractor.getSimpleName(cert));
    }

    @Test
    void shouldFallBackToOrganization() throws Exception {
      X509Certificate cert = certGen.createClientCertificate("O=Acme, C=US");

      assertEquals("Acme", extractor.getSimpleName(cert));
    }

    @Test
    void shouldFallBackToEmailAttribute() throws Exception {
      X509Certificate cert = certGen.createClientCertificate("E=alice@example.com, C=US");

      assertEquals("alice@example.com", extractor.getSimpleName(cert));
    }

    @Test
    void shouldFallBackToSubjectAlternativeNames() throws Exception {
      X509Certificate cert =
          certGen.createClientCertificateWithSan(
              "C=US", uriName("https://alice.example.com"), emailName("alice@example.com"));

      assertEquals("alice@example.com", extractor.getSimpleName(cert));
    }
  }

  @Nested
  class EmailName {
    @Test
    void shouldPreferSubjectAlternativeName() throws Exception {
      X509Certificate cert =
          certGen.createClientCertificateWithSan(
              "CN=Alice, E=subject@example.com", emailName("san@example.com"));

      assertEquals("san@example.com", extractor.getEmailName(cert));
    }

    @Test
    void shouldFallBackToEmailAttribute() throws Exception {
      X509Certificate cert = certGen.createClientCertificate("CN=Alice, E=subject@example.com");

      assertEquals("subject@example.com", extractor.getEmailName(cert));
    }

    @Test
    void shouldSkipBlankSubjectAlternativeName() throws Exception {
      X509Certificate cert =
          certGen.createClientCertificateWithSan(
              "CN=Alice, E=subject@example.com", emailName(" "));

      assertEquals("subject@example.com", extractor.getEmailName(cert));
    }

    @Test
    void shouldReturnNullWithoutEmail() throws Exception {
      X509Certificate cert = certGen.createClientCertificate("CN=Alice");

      assertNull(extractor.getEmailName(cert));
    }
  }

  @Test
  void shouldReadUserPrincipalName() throws Exception {
    X509Certificate cert =
        certGen.createClientCertificateWithSan(
            "CN=Alice", dnsName("alice.example.com"), upnName("alice@corp.example.com"));

    assertEquals("alice@corp.example.com", extractor.getUpnName(cert));
  }

  @Test
  void shouldReadUri() throws Exception {
    X509Certificate cert =
        certGen.createClientCertificateWithSan(
            "CN=Alice", uriName("spiffe://example.com/workload/alice"));

    assertEquals("spiffe://example.com/workload/alice", extractor.getUriName(cert));
  }

  @Test
  void shouldReturnNullForMissingNames() throws Exception {
    X509Certificate cert = certGen.createClientCertificate("CN=Alice");

    assertNull(extractor.getUpnName(cert));
    assertNull(extractor.getUriName(cert));
  }
}
