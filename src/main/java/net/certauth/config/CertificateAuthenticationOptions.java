package net.certauth.config;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import net.certauth.core.CertificateAuthenticationException;
import net.certauth.core.CertificateType;
import net.certauth.core.ErrorCode;
import net.certauth.core.chain.RevocationFlag;
import net.certauth.core.chain.RevocationMode;

/**
 * Immutable options of a {@link net.certauth.core.CertificateAuthenticator}. One instance is read
 * per authentication attempt, so a new snapshot published through {@link
 * ReloadableOptionsProvider} takes effect on the next request.
 */
public final class CertificateAuthenticationOptions {
  public static final String DEFAULT_CLAIMS_ISSUER = "LOCAL AUTHORITY";
  public static final Duration DEFAULT_CHAIN_VALIDATION_TIMEOUT = Duration.ofSeconds(30);

  private final Set<CertificateType> allowedCertificateTypes;
  private final RevocationFlag revocationFlag;
  private final RevocationMode revocationMode;
  private final boolean validateCertificateUse;
  private final boolean validateValidityPeriod;
  private final String claimsIssuer;
  private final Duration chainValidationTimeout;

  private CertificateAuthenticationOptions(Builder builder) {
    this.allowedCertificateTypes =
        Collections.unmodifiableSet(EnumSet.copyOf(builder.allowedCertificateTypes));
    this.revocationFlag = builder.revocationFlag;
    this.revocationMode = builder.revocationMode;
    this.validateCertificateUse = builder.validateCertificateUse;
    this.validateValidityPeriod = builder.validateValidityPeriod;
    this.claimsIssuer = builder.claimsIssuer;
    this.chainValidationTimeout = builder.chainValidationTimeout;
  }

  /** Options with every default applied. */
  public static CertificateAuthenticationOptions defaults() {
    return new Builder().buildUnchecked();
  }

  public Set<CertificateType> getAllowedCertificateTypes() {
    return allowedCertificateTypes;
  }

  public boolean isAllowed(CertificateType type) {
    return allowedCertificateTypes.contains(type);
  }

  public RevocationFlag getRevocationFlag() {
    return revocationFlag;
  }

  public RevocationMode getRevocationMode() {
    return revocationMode;
  }

  /** Whether the end certificate must carry the client authentication extended key usage. */
  public boolean isValidateCertificateUse() {
    return validateCertificateUse;
  }

  public boolean isValidateValidityPeriod() {
    return validateValidityPeriod;
  }

  /** Issuer label stamped on every claim created from a certificate. */
  public String getClaimsIssuer() {
    return claimsIssuer;
  }

  public Duration getChainValidationTimeout() {
    return chainValidationTimeout;
  }

  public Builder toBuilder() {
    return new Builder()
        .allowedCertificateTypes(allowedCertificateTypes)
        .revocationFlag(revocationFlag)
        .revocationMode(revocationMode)
        .validateCertificateUse(validateCertificateUse)
        .validateValidityPeriod(validateValidityPeriod)
        .claimsIssuer(claimsIssuer)
        .chainValidationTimeout(chainValidationTimeout);
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public String toString() {
    return "CertificateAuthenticationOptions{"
        + "allowedCertificateTypes="
        + allowedCertificateTypes
        + ", revocationFlag="
        + revocationFlag
        + ", revocationMode="
        + revocationMode
        + ", validateCertificateUse="
        + validateCertificateUse
        + ", validateValidityPeriod="
        + validateValidityPeriod
        + ", claimsIssuer='"
        + claimsIssuer
        + '\''
        + ", chainValidationTimeout="
        + chainValidationTimeout
        + '}';
  }

  public static class Builder {
    private Set<CertificateType> allowedCertificateTypes = EnumSet.of(CertificateType.CHAINED);
    private RevocationFlag revocationFlag = RevocationFlag.ENTIRE_CHAIN;
    private RevocationMode revocationMode = RevocationMode.ONLINE_REQUIRED;
    private boolean validateCertificateUse = true;
    private boolean validateValidityPeriod = true;
    private String claimsIssuer = DEFAULT_CLAIMS_ISSUER;
    private Duration chainValidationTimeout = DEFAULT_CHAIN_VALIDATION_TIMEOUT;

    public Builder allowedCertificateTypes(Set<CertificateType> types) {
      this.allowedCertificateTypes =
          types == null || types.isEmpty()
              ? EnumSet.noneOf(CertificateType.class)
              : EnumSet.copyOf(types);
      return this;
    }

    public Builder allowedCertificateTypes(CertificateType first, CertificateType... rest) {
      this.allowedCertificateTypes = EnumSet.of(first, rest);
      return this;
    }

    public Builder revocationFlag(RevocationFlag revocationFlag) {
      this.revocationFlag = revocationFlag;
      return this;
    }

    public Builder revocationMode(RevocationMode revocationMode) {
      this.revocationMode = revocationMode;
      return this;
    }

    public Builder validateCertificateUse(boolean validateCertificateUse) {
      this.validateCertificateUse = validateCertificateUse;
      return this;
    }

    public Builder validateValidityPeriod(boolean validateValidityPeriod) {
      this.validateValidityPeriod = validateValidityPeriod;
      return this;
    }

    public Builder claimsIssuer(String claimsIssuer) {
      this.claimsIssuer = claimsIssuer;
      return this;
    }

    public Builder chainValidationTimeout(Duration chainValidationTimeout) {
      this.chainValidationTimeout = chainValidationTimeout;
      return this;
    }

    /**
     * @return the options
     * @throws CertificateAuthenticationException ({@link ErrorCode#INVALID_CONFIGURATION}) if a
     *     value is missing or out of range
     */
    public CertificateAuthenticationOptions build() throws CertificateAuthenticationException {
      if (revocationFlag == null) {
        throw new CertificateAuthenticationException(
            ErrorCode.INVALID_CONFIGURATION, "revocation flag is required");
      }
      if (revocationMode == null) {
        throw new CertificateAuthenticationException(
            ErrorCode.INVALID_CONFIGURATION, "revocation mode is required");
      }
      if (claimsIssuer == null) {
        throw new CertificateAuthenticationException(
            ErrorCode.INVALID_CONFIGURATION, "claims issuer is required");
      }
      if (chainValidationTimeout == null
          || chainValidationTimeout.isNegative()
          || chainValidationTimeout.isZero()) {
        throw new CertificateAuthenticationException(
            ErrorCode.INVALID_CONFIGURATION,
            "chain validation timeout must be positive, was " + chainValidationTimeout);
      }
      return buildUnchecked();
    }

    private CertificateAuthenticationOptions buildUnchecked() {
      return new CertificateAuthenticationOptions(this);
    }
  }
}
