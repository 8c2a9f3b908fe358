package net.certauth.core.chain;

import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Parameters of one chain build. Instances are created per authentication attempt by {@link
 * ChainPolicyBuilder} and never shared.
 */
public final class ChainPolicy {
  private final RevocationFlag revocationFlag;
  private final RevocationMode revocationMode;
  private final Set<VerificationFlag> verificationFlags;
  private final List<String> applicationPolicies;
  private final List<X509Certificate> extraStore;

  private ChainPolicy(Builder builder) {
    this.revocationFlag = builder.revocationFlag;
    this.revocationMode = builder.revocationMode;
    this.verificationFlags = Collections.unmodifiableSet(EnumSet.copyOf(builder.verificationFlags));
    this.applicationPolicies =
        Collections.unmodifiableList(new ArrayList<>(builder.applicationPolicies));
    this.extraStore = Collections.unmodifiableList(new ArrayList<>(builder.extraStore));
  }

  public RevocationFlag getRevocationFlag() {
    return revocationFlag;
  }

  public RevocationMode getRevocationMode() {
    return revocationMode;
  }

  public Set<VerificationFlag> getVerificationFlags() {
    return verificationFlags;
  }

  public boolean hasVerificationFlag(VerificationFlag flag) {
    return verificationFlags.contains(flag);
  }

  /** @return application policy (extended key usage) OIDs the trust path must carry */
  public List<String> getApplicationPolicies() {
    return applicationPolicies;
  }

  /** @return certificates available to this validation only */
  public List<X509Certificate> getExtraStore() {
    return extraStore;
  }

  public static Builder builder() {
    return new Builder();
  }

  @Override
  public String toString() {
    return "ChainPolicy{"
        + "revocationFlag="
        + revocationFlag
        + ", revocationMode="
        + revocationMode
        + ", verificationFlags="
        + verificationFlags
        + ", applicationPolicies="
        + applicationPolicies
        + ", extraStore="
        + extraStore.size()
        + '}';
  }

  public static class Builder {
    private RevocationFlag revocationFlag = RevocationFlag.ENTIRE_CHAIN;
    private RevocationMode revocationMode = RevocationMode.ONLINE_REQUIRED;
    private final Set<VerificationFlag> verificationFlags = EnumSet.noneOf(VerificationFlag.class);
    private final List<String> applicationPolicies = new ArrayList<>();
    private final List<X509Certificate> extraStore = new ArrayList<>();

    public Builder revocationFlag(RevocationFlag flag) {
      this.revocationFlag = flag;
      return this;
    }

    public Builder revocationMode(RevocationMode mode) {
      this.revocationMode = mode;
      return this;
    }

    public Builder addVerificationFlag(VerificationFlag flag) {
      this.verificationFlags.add(flag);
      return this;
    }

    public Builder addApplicationPolicy(String oid) {
      this.applicationPolicies.add(oid);
      return this;
    }

    public Builder addToExtraStore(X509Certificate certificate) {
      this.extraStore.add(certificate);
      return this;
    }

    public ChainPolicy build() {
      return new ChainPolicy(this);
    }
  }
}
