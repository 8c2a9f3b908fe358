package net.certauth.core.claims;

import java.security.cert.CertificateEncodingException;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.List;
import javax.security.auth.x500.X500Principal;
import net.certauth.core.CertificateAuthenticationException;
import net.certauth.core.ErrorCode;
import net.certauth.util.CertificateUtil;
import net.certauth.util.SystemUtil;

/** Converts a validated certificate into the claims of a certificate identity. */
public class CertificateClaimsMapper {
  public static final String AUTHENTICATION_TYPE = "Certificate";

  private final CertificateNameExtractor nameExtractor;

  public CertificateClaimsMapper() {
    this(new CertificateNameExtractor());
  }

  public CertificateClaimsMapper(CertificateNameExtractor nameExtractor) {
    this.nameExtractor = nameExtractor;
  }

  /**
   * Maps a certificate to claims in a fixed order: issuer, thumbprint, distinguished name, serial
   * number, DNS name, simple name, e-mail, UPN and URI. Blank optional values are left out.
   *
   * @param cert certificate
   * @param claimsIssuer issuer label of every claim
   * @return ordered claims
   * @throws CertificateAuthenticationException if the certificate cannot be encoded
   */
  public List<Claim> mapClaims(X509Certificate cert, String claimsIssuer)
      throws CertificateAuthenticationException {
    List<Claim> claims = new ArrayList<>();

    claims.add(
        new Claim(
            ClaimTypes.ISSUER,
            cert.getIssuerX500Principal().getName(X500Principal.RFC2253),
            ClaimValueTypes.STRING,
            claimsIssuer));

    String thumbprint;
    try {
      thumbprint = CertificateUtil.sha1Thumbprint(cert);
    } catch (CertificateEncodingException e) {
      throw new CertificateAuthenticationException(
          e, ErrorCode.MALFORMED_CERTIFICATE, e.getMessage());
    }
    claims.add(
        new Claim(ClaimTypes.THUMBPRINT, thumbprint, ClaimValueTypes.BASE64_BINARY, claimsIssuer));

    addIfPresent(
        claims,
        ClaimTypes.X500_DISTINGUISHED_NAME,
        cert.getSubjectX500Principal().getName(X500Principal.RFC2253),
        claimsIssuer);
    addIfPresent(
        claims, ClaimTypes.SERIAL_NUMBER, CertificateUtil.serialNumberHex(cert), claimsIssuer);
    addIfPresent(claims, ClaimTypes.DNS, nameExtractor.getDnsName(cert), claimsIssuer);
    addIfPresent(claims, ClaimTypes.NAME, nameExtractor.getSimpleName(cert), claimsIssuer);
    addIfPresent(claims, ClaimTypes.EMAIL, nameExtractor.getEmailName(cert), claimsIssuer);
    addIfPresent(claims, ClaimTypes.UPN, nameExtractor.getUpnName(cert), claimsIssuer);
    addIfPresent(claims, ClaimTypes.URI, nameExtractor.getUriName(cert), claimsIssuer);

    return claims;
  }

  public ClaimsPrincipal createPrincipal(X509Certificate cert, String claimsIssuer)
      throws CertificateAuthenticationException {
    return new ClaimsPrincipal(
        new ClaimsIdentity(mapClaims(cert, claimsIssuer), AUTHENTICATION_TYPE));
  }

  private static void addIfPresent(
      List<Claim> claims, String type, String value, String claimsIssuer) {
    if (!SystemUtil.isNullOrBlank(value)) {
      claims.add(new Claim(type, value, ClaimValueTypes.STRING, claimsIssuer));
    }
  }
}
