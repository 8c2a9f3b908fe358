package net.certauth.core.claims;

import java.util.Objects;

/** A single statement about an authenticated subject. */
public final class Claim {
  private final String type;
  private final String value;
  private final String valueType;
  private final String issuer;
  private final String originalIssuer;

  public Claim(String type, String value, String valueType, String issuer) {
    this(type, value, valueType, issuer, issuer);
  }

  public Claim(String type, String value, String valueType, String issuer, String originalIssuer) {
    if (type == null) {
      throw new IllegalArgumentException("Claim type cannot be null");
    }
    if (value == null) {
      throw new IllegalArgumentException("Claim value cannot be null");
    }
    this.type = type;
    this.value = value;
    this.valueType = valueType == null ? ClaimValueTypes.STRING : valueType;
    this.issuer = issuer;
    this.originalIssuer = originalIssuer;
  }

  public String getType() {
    return type;
  }

  public String getValue() {
    return value;
  }

  public String getValueType() {
    return valueType;
  }

  public String getIssuer() {
    return issuer;
  }

  public String getOriginalIssuer() {
    return originalIssuer;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    Claim claim = (Claim) o;
    return type.equals(claim.type)
        && value.equals(claim.value)
        && valueType.equals(claim.valueType)
        && Objects.equals(issuer, claim.issuer)
        && Objects.equals(originalIssuer, claim.originalIssuer);
  }

  @Override
  public int hashCode() {
    return Objects.hash(type, value, valueType, issuer, originalIssuer);
  }

  @Override
  public String toString() {
    return type + ": " + value;
  }
}
