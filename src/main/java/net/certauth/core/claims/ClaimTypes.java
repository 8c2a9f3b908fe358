package net.certauth.core.claims;

/** Claim type identifiers produced for certificate identities. */
public final class ClaimTypes {
  public static final String ISSUER = "issuer";
  public static final String THUMBPRINT =
      "http://schemas.microsoft.com/ws/2008/06/identity/claims/thumbprint";
  public static final String X500_DISTINGUISHED_NAME =
      "http://schemas.xmlsoap.org/ws/2005/05/identity/claims/x500distinguishedname";
  public static final String SERIAL_NUMBER =
      "http://schemas.microsoft.com/ws/2008/06/identity/claims/serialnumber";
  public static final String DNS = "http://schemas.xmlsoap.org/ws/2005/05/identity/claims/dns";
  public static final String NAME = "http://schemas.xmlsoap.org/ws/2005/05/identity/claims/name";
  public static final String EMAIL =
      "http://schemas.xmlsoap.org/ws/2005/05/identity/claims/emailaddress";
  public static final String UPN = "http://schemas.xmlsoap.org/ws/2005/05/identity/claims/upn";
  public static final String URI = "http://schemas.xmlsoap.org/ws/2005/05/identity/claims/uri";

  private ClaimTypes() {}
}
