package net.certauth.core.claims;

public final class ClaimValueTypes {
  public static final String STRING = "http://www.w3.org/2001/XMLSchema#string";
  public static final String BASE64_BINARY = "http://www.w3.org/2001/XMLSchema#base64Binary";

  private ClaimValueTypes() {}
}
