package net.certauth.core.claims;

import static net.certauth.core.CertificateGeneratorUtil.dnsName;
import static net.certauth.core.CertificateGeneratorUtil.emailName;
import static net.certauth.core.CertificateGeneratorUtil.upnName;
import static net.certauth.core.CertificateGeneratorUtil.uriName;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.security.cert.X509Certificate;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import javax.security.auth.x500.X500Principal;
import net.certauth.category.TestTags;
import net.certauth.core.CertificateGeneratorUtil;
import org.apache.commons.codec.binary.Hex;
import org.apache.commons.codec.digest.DigestUtils;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag(TestTags.CLAIMS)
class CertificateClaimsMapperTest {
  private static final String ISSUER = "LOCAL AUTHORITY";

  private static CertificateGeneratorUtil certGen;

  private final CertificateClaimsMapper mapper = new CertificateClaimsMapper();

  @BeforeAll
  static void setUpAll() {
    certGen = new CertificateGeneratorUtil();
  }

  @Test
  void shouldMapEveryNameInFixedOrder() throws Exception {
    X509Certificate cert =
        certGen.createClientCertificateWithSan(
            "CN=Alice, O=Acme",
            dnsName("alice.example.com"),
            emailName("alice@example.com"),
            upnName("alice@corp.example.com"),
            uriName("https://alice.example.com"));

    List<Claim> claims = mapper.mapClaims(cert, ISSUER);

    assertEquals(
        Arrays.asList(
            ClaimTypes.ISSUER,
            ClaimTypes.THUMBPRINT,
            ClaimTypes.X500_DISTINGUISHED_NAME,
            ClaimTypes.SERIAL_NUMBER,
            ClaimTypes.DNS,
            ClaimTypes.NAME,
            ClaimTypes.EMAIL,
            ClaimTypes.UPN,
            ClaimTypes.URI),
        claims.stream().map(Claim::getType).collect(Collectors.toList()));

    assertEquals(
        cert.getIssuerX500Principal().getName(X500Principal.RFC2253), claims.get(0).getValue());
    assertEquals(
        Hex.encodeHexString(DigestUtils.sha1(cert.getEncoded()), false), claims.get(1).getValue());
    assertEquals(ClaimValueTypes.BASE64_BINARY, claims.get(1).getValueType());
    assertEquals(
        cert.getSubjectX500Principal().getName(X500Principal.RFC2253), claims.get(2).getValue());
    assertEquals(
        Hex.encodeHexString(cert.getSerialNumber().toByteArray(), false), claims.get(3).getValue());
    assertEquals("alice.example.com", claims.get(4).getValue());
    assertEquals("Alice", claims.get(5).getValue());
    assertEquals("alice@example.com", claims.get(6).getValue());
    assertEquals("alice@corp.example.com", claims.get(7).getValue());
    assertEquals("https://alice.example.com", claims.get(8).getValue());
  }

  @Test
  void shouldStampConfiguredIssuerOnEveryClaim() throws Exception {
    X509Certificate cert = certGen.createClientCertificate("CN=Alice");

    for (Claim claim : mapper.mapClaims(cert, "my-issuer")) {
      assertEquals("my-issuer", claim.getIssuer());
      assertEquals("my-issuer", claim.getOriginalIssuer());
    }
  }

  @Test
  void shouldOmitMissingNames() throws Exception {
    X509Certificate cert = certGen.createClientCertificate("CN=Alice");

    List<String> types =
        mapper.mapClaims(cert, ISSUER).stream().map(Claim::getType).collect(Collectors.toList());

    assertEquals(
        Arrays.asList(
            ClaimTypes.ISSUER,
            ClaimTypes.THUMBPRINT,
            ClaimTypes.X500_DISTINGUISHED_NAME,
            ClaimTypes.SERIAL_NUMBER,
            ClaimTypes.DNS,
            ClaimTypes.NAME),
        types);
    assertFalse(types.contains(ClaimTypes.EMAIL));
    assertFalse(types.contains(ClaimTypes.UPN));
    assertFalse(types.contains(ClaimTypes.URI));
  }

  @Test
  void shouldOmitWhitespaceOnlyNames() throws Exception {
    X509Certificate cert =
        certGen.createClientCertificateWithSan("C=US", dnsName("   "), emailName(" "));

    List<String> types =
        mapper.mapClaims(cert, ISSUER).stream().map(Claim::getType).collect(Collectors.toList());

    assertEquals(
        Arrays.asList(
            ClaimTypes.ISSUER,
            ClaimTypes.THUMBPRINT,
            ClaimTypes.X500_DISTINGUISHED_NAME,
            ClaimTypes.SERIAL_NUMBER),
        types);
  }

  @Test
  void shouldCreateCertificatePrincipal() throws Exception {
    X509Certificate cert = certGen.createClientCertificate("CN=Alice");

    ClaimsPrincipal principal = mapper.createPrincipal(cert, ISSUER);

    assertEquals(
        CertificateClaimsMapper.AUTHENTICATION_TYPE,
        principal.getIdentity().getAuthenticationType());
    assertTrue(principal.getIdentity().isAuthenticated());
    assertEquals("Alice", principal.getIdentity().getName());
    assertEquals(mapper.mapClaims(cert, ISSUER), principal.getClaims());
  }
}
