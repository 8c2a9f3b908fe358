package net.certauth.config;

import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/** POJO for the certificate authentication config file. */
public class CertificateAuthenticationConfig {
  @JsonProperty("common")
  private CommonProps commonProps;

  @JsonProperty("authentication")
  private AuthenticationProps authenticationProps;

  @JsonProperty("trust")
  private TrustProps trustProps;

  @JsonAnySetter private Map<String, Object> unknownKeys = new LinkedHashMap<>();

  @JsonIgnore private String configFilePath;

  public CertificateAuthenticationConfig() {}

  public CommonProps getCommonProps() {
    return commonProps;
  }

  public void setCommonProps(CommonProps commonProps) {
    this.commonProps = commonProps;
  }

  public AuthenticationProps getAuthenticationProps() {
    return authenticationProps;
  }

  public void setAuthenticationProps(AuthenticationProps authenticationProps) {
    this.authenticationProps = authenticationProps;
  }

  public TrustProps getTrustProps() {
    return trustProps;
  }

  public void setTrustProps(TrustProps trustProps) {
    this.trustProps = trustProps;
  }

  public String getConfigFilePath() {
    return configFilePath;
  }

  public void setConfigFilePath(String configFilePath) {
    this.configFilePath = configFilePath;
  }

  /** Keys of every section that did not map to a known field, prefixed with the section name. */
  @JsonIgnore
  public Set<String> getUnknownParamKeys() {
    Set<String> keys = new LinkedHashSet<>(unknownKeys.keySet());
    if (commonProps != null) {
      for (String key : commonProps.unknownKeys.keySet()) {
        keys.add("common." + key);
      }
    }
    if (authenticationProps != null) {
      for (String key : authenticationProps.unknownKeys.keySet()) {
        keys.add("authentication." + key);
      }
    }
    if (trustProps != null) {
      for (String key : trustProps.unknownKeys.keySet()) {
        keys.add("trust." + key);
      }
    }
    return keys;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    CertificateAuthenticationConfig that = (CertificateAuthenticationConfig) o;
    return Objects.equals(commonProps, that.commonProps)
        && Objects.equals(authenticationProps, that.authenticationProps)
        && Objects.equals(trustProps, that.trustProps);
  }

  @Override
  public int hashCode() {
    return Objects.hash(commonProps, authenticationProps, trustProps);
  }

  public static class CommonProps {
    @JsonProperty("log_level")
    private String logLevel;

    @JsonProperty("log_path")
    private String logPath;

    @JsonAnySetter private Map<String, Object> unknownKeys = new LinkedHashMap<>();

    public CommonProps() {}

    public String getLogLevel() {
      return logLevel;
    }

    public void setLogLevel(String logLevel) {
      this.logLevel = logLevel;
    }

    public String getLogPath() {
      return logPath;
    }

    public void setLogPath(String logPath) {
      this.logPath = logPath;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (o == null || getClass() != o.getClass()) {
        return false;
      }
      CommonProps that = (CommonProps) o;
      return Objects.equals(logLevel, that.logLevel) && Objects.equals(logPath, that.logPath);
    }

    @Override
    public int hashCode() {
      return Objects.hash(logLevel, logPath);
    }
  }

  /** Values are kept as strings and converted by {@link CertificateAuthenticationConfigParser}. */
  public static class AuthenticationProps {
    @JsonProperty("allowed_certificate_types")
    private List<String> allowedCertificateTypes;

    @JsonProperty("revocation_flag")
    private String revocationFlag;

    @JsonProperty("revocation_mode")
    private String revocationMode;

    @JsonProperty("validate_certificate_use")
    private Boolean validateCertificateUse;

    @JsonProperty("validate_validity_period")
    private Boolean validateValidityPeriod;

    @JsonProperty("claims_issuer")
    private String claimsIssuer;

    @JsonProperty("chain_validation_timeout_ms")
    private Long chainValidationTimeoutMs;

    @JsonAnySetter private Map<String, Object> unknownKeys = new LinkedHashMap<>();

    public AuthenticationProps() {}

    public List<String> getAllowedCertificateTypes() {
      return allowedCertificateTypes;
    }

    public void setAllowedCertificateTypes(List<String> allowedCertificateTypes) {
      this.allowedCertificateTypes = allowedCertificateTypes;
    }

    public String getRevocationFlag() {
      return revocationFlag;
    }

    public void setRevocationFlag(String revocationFlag) {
      this.revocationFlag = revocationFlag;
    }

    public String getRevocationMode() {
      return revocationMode;
    }

    public void setRevocationMode(String revocationMode) {
      this.revocationMode = revocationMode;
    }

    public Boolean getValidateCertificateUse() {
      return validateCertificateUse;
    }

    public void setValidateCertificateUse(Boolean validateCertificateUse) {
      this.validateCertificateUse = validateCertificateUse;
    }

    public Boolean getValidateValidityPeriod() {
      return validateValidityPeriod;
    }

    public void setValidateValidityPeriod(Boolean validateValidityPeriod) {
      this.validateValidityPeriod = validateValidityPeriod;
    }

    public String getClaimsIssuer() {
      return claimsIssuer;
    }

    public void setClaimsIssuer(String claimsIssuer) {
      this.claimsIssuer = claimsIssuer;
    }

    public Long getChainValidationTimeoutMs() {
      return chainValidationTimeoutMs;
    }

    public void setChainValidationTimeoutMs(Long chainValidationTimeoutMs) {
      this.chainValidationTimeoutMs = chainValidationTimeoutMs;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (o == null || getClass() != o.getClass()) {
        return false;
      }
      AuthenticationProps that = (AuthenticationProps) o;
      return Objects.equals(allowedCertificateTypes, that.allowedCertificateTypes)
          && Objects.equals(revocationFlag, that.revocationFlag)
          && Objects.equals(revocationMode, that.revocationMode)
          && Objects.equals(validateCertificateUse, that.validateCertificateUse)
          && Objects.equals(validateValidityPeriod, that.validateValidityPeriod)
          && Objects.equals(claimsIssuer, that.claimsIssuer)
          && Objects.equals(chainValidationTimeoutMs, that.chainValidationTimeoutMs);
    }

    @Override
    public int hashCode() {
      return Objects.hash(
          allowedCertificateTypes,
          revocationFlag,
          revocationMode,
          validateCertificateUse,
          validateValidityPeriod,
          claimsIssuer,
          chainValidationTimeoutMs);
    }
  }

  public static class TrustProps {
    @JsonProperty("trust_store_path")
    private String trustStorePath;

    @JsonProperty("trust_store_type")
    private String trustStoreType;

    @JsonProperty("trust_store_password")
    private String trustStorePassword;

    @JsonProperty("intermediate_certificates_path")
    private String intermediateCertificatesPath;

    @JsonProperty("crl_path")
    private String crlPath;

    @JsonAnySetter private Map<String, Object> unknownKeys = new LinkedHashMap<>();

    public TrustProps() {}

    public String getTrustStorePath() {
      return trustStorePath;
    }

    public void setTrustStorePath(String trustStorePath) {
      this.trustStorePath = trustStorePath;
    }

    public String getTrustStoreType() {
      return trustStoreType;
    }

    public void setTrustStoreType(String trustStoreType) {
      this.trustStoreType = trustStoreType;
    }

    public String getTrustStorePassword() {
      return trustStorePassword;
    }

    public void setTrustStorePassword(String trustStorePassword) {
      this.trustStorePassword = trustStorePassword;
    }

    public String getIntermediateCertificatesPath() {
      return intermediateCertificatesPath;
    }

    public void setIntermediateCertificatesPath(String intermediateCertificatesPath) {
      this.intermediateCertificatesPath = intermediateCertificatesPath;
    }

    public String getCrlPath() {
      return crlPath;
    }

    public void setCrlPath(String crlPath) {
      this.crlPath = crlPath;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (o == null || getClass() != o.getClass()) {
        return false;
      }
      TrustProps that = (TrustProps) o;
      return Objects.equals(trustStorePath, that.trustStorePath)
          && Objects.equals(trustStoreType, that.trustStoreType)
          && Objects.equals(trustStorePassword, that.trustStorePassword)
          && Objects.equals(intermediateCertificatesPath, that.intermediateCertificatesPath)
          && Objects.equals(crlPath, that.crlPath);
    }

    @Override
    public int hashCode() {
      return Objects.hash(
          trustStorePath,
          trustStoreType,
          trustStorePassword,
          intermediateCertificatesPath,
          crlPath);
    }
  }
}
