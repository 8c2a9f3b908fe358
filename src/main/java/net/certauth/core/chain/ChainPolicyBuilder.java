package net.certauth.core.chain;

import java.security.cert.X509Certificate;
import net.certauth.config.CertificateAuthenticationOptions;

/** Derives the {@link ChainPolicy} for one attempt from the options and the certificate type. */
public class ChainPolicyBuilder {
  /** id-kp-clientAuth */
  public static final String CLIENT_AUTHENTICATION_OID = "1.3.6.1.5.5.7.3.2";

  /**
   * @param certificate end certificate
   * @param options options snapshot of the attempt
   * @param selfSigned whether the certificate was classified self-signed
   * @return chain policy
   */
  public ChainPolicy build(
      X509Certificate certificate, CertificateAuthenticationOptions options, boolean selfSigned) {
    ChainPolicy.Builder builder =
        ChainPolicy.builder()
            .revocationFlag(options.getRevocationFlag())
            .revocationMode(options.getRevocationMode());

    if (selfSigned) {
      // nobody publishes revocation data for a self-signed certificate
      builder
          .revocationMode(RevocationMode.NO_CHECK)
          .revocationFlag(RevocationFlag.ENTIRE_CHAIN)
          .addVerificationFlag(VerificationFlag.ALLOW_UNKNOWN_CERTIFICATE_AUTHORITY)
          .addVerificationFlag(VerificationFlag.IGNORE_END_REVOCATION_UNKNOWN)
          .addToExtraStore(certificate);
    }

    if (options.isValidateCertificateUse()) {
      builder.addApplicationPolicy(CLIENT_AUTHENTICATION_OID);
    }

    if (!options.isValidateValidityPeriod()) {
      builder.addVerificationFlag(VerificationFlag.IGNORE_NOT_TIME_VALID);
    }

    return builder.build();
  }
}
