package net.certauth.core.chain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.security.cert.X509Certificate;
import java.util.Collections;
import java.util.EnumSet;
import net.certauth.category.TestTags;
import net.certauth.config.CertificateAuthenticationOptions;
import net.certauth.core.CertificateGeneratorUtil;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

@Tag(TestTags.CHAIN)
class ChainPolicyBuilderTest {
  private static X509Certificate certificate;

  private final ChainPolicyBuilder policyBuilder = new ChainPolicyBuilder();

  @BeforeAll
  static void setUpAll() throws Exception {
    certificate =
        new CertificateGeneratorUtil().createSelfSignedCertificate("CN=policy.example.com");
  }

  @Test
  void shouldCopyRevocationSettingsForChainedCertificate() throws Exception {
    CertificateAuthenticationOptions options =
        CertificateAuthenticationOptions.builder()
            .revocationFlag(RevocationFlag.END_CERTIFICATE_ONLY)
            .revocationMode(RevocationMode.OFFLINE)
            .build();

    ChainPolicy policy = policyBuilder.build(certificate, options, false);

    assertEquals(RevocationFlag.END_CERTIFICATE_ONLY, policy.getRevocationFlag());
    assertEquals(RevocationMode.OFFLINE, policy.getRevocationMode());
    assertTrue(policy.getVerificationFlags().isEmpty());
    assertTrue(policy.getExtraStore().isEmpty());
    assertEquals(
        Collections.singletonList(ChainPolicyBuilder.CLIENT_AUTHENTICATION_OID),
        policy.getApplicationPolicies());
  }

  @ParameterizedTest
  @EnumSource(RevocationMode.class)
  void shouldRelaxPolicyForSelfSignedCertificate(RevocationMode configuredMode) throws Exception {
    CertificateAuthenticationOptions options =
        CertificateAuthenticationOptions.builder()
            .revocationFlag(RevocationFlag.EXCLUDE_ROOT)
            .revocationMode(configuredMode)
            .build();

    ChainPolicy policy = policyBuilder.build(certificate, options, true);

    assertEquals(RevocationMode.NO_CHECK, policy.getRevocationMode());
    assertEquals(RevocationFlag.ENTIRE_CHAIN, policy.getRevocationFlag());
    assertEquals(
        EnumSet.of(
            VerificationFlag.ALLOW_UNKNOWN_CERTIFICATE_AUTHORITY,
            VerificationFlag.IGNORE_END_REVOCATION_UNKNOWN),
        policy.getVerificationFlags());
    assertEquals(Collections.singletonList(certificate), policy.getExtraStore());
  }

  @Test
  void shouldSkipApplicationPolicyWhenCertificateUseIsNotValidated() throws Exception {
    CertificateAuthenticationOptions options =
        CertificateAuthenticationOptions.builder().validateCertificateUse(false).build();

    ChainPolicy policy = policyBuilder.build(certificate, options, false);

    assertTrue(policy.getApplicationPolicies().isEmpty());
  }

  @Test
  void shouldIgnoreTimeValidityWhenValidityPeriodIsNotValidated() throws Exception {
    CertificateAuthenticationOptions options =
        CertificateAuthenticationOptions.builder().validateValidityPeriod(false).build();

    ChainPolicy policy = policyBuilder.build(certificate, options, false);

    assertTrue(policy.hasVerificationFlag(VerificationFlag.IGNORE_NOT_TIME_VALID));
    assertFalse(policy.hasVerificationFlag(VerificationFlag.ALLOW_UNKNOWN_CERTIFICATE_AUTHORITY));
  }
}
