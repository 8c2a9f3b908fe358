package net.certauth.core.chain;

import java.security.GeneralSecurityException;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import java.security.NoSuchProviderException;
import java.security.SignatureException;
import java.security.cert.CertPath;
import java.security.cert.CertPathValidator;
import java.security.cert.CertPathValidatorException;
import java.security.cert.CertStore;
import java.security.cert.CertificateException;
import java.security.cert.CertificateExpiredException;
import java.security.cert.CertificateFactory;
import java.security.cert.CertificateNotYetValidException;
import java.security.cert.CertificateParsingException;
import java.security.cert.CollectionCertStoreParameters;
import java.security.cert.PKIXParameters;
import java.security.cert.PKIXReason;
import java.security.cert.PKIXRevocationChecker;
import java.security.cert.TrustAnchor;
import java.security.cert.X509Certificate;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Date;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import net.certauth.log.AuthLogger;
import net.certauth.log.AuthLoggerFactory;

/**
 * Default {@link CertificateChainBuilder} on top of the JDK PKIX provider.
 *
 * <p>A path is assembled from the end certificate through the policy's extra store and the
 * configured intermediates up to a trust anchor. Validity periods and application policies are
 * checked for every certificate of the path so that each problem is reported, then the path is
 * handed to the PKIX {@link CertPathValidator} for signature, constraint and revocation checks.
 */
public class PkixCertificateChainBuilder implements CertificateChainBuilder {
  private static final AuthLogger logger =
      AuthLoggerFactory.getLogger(PkixCertificateChainBuilder.class);

  static final String ANY_EXTENDED_KEY_USAGE = "2.5.29.37.0";

  private static final int MAX_PATH_LENGTH = 10;
  private static final String PKIX = "PKIX";

  private final TrustMaterial trustMaterial;
  private final Clock clock;

  public PkixCertificateChainBuilder(TrustMaterial trustMaterial) {
    this(trustMaterial, Clock.systemUTC());
  }

  public PkixCertificateChainBuilder(TrustMaterial trustMaterial, Clock clock) {
    if (trustMaterial == null) {
      throw new IllegalArgumentException("Trust material cannot be null");
    }
    this.trustMaterial = trustMaterial;
    this.clock = clock;
  }

  @Override
  public ChainValidationResult build(X509Certificate certificate, ChainPolicy policy)
      throws GeneralSecurityException {
    logger.debug(
        "Building chain for {} with {}", certificate.getSubjectX500Principal(), policy);

    List<ChainStatus> statuses = new ArrayList<>();
    AssembledPath assembled = assemblePath(certificate, policy, statuses);

    Date now = Date.from(clock.instant());
    boolean ignoreTime = policy.hasVerificationFlag(VerificationFlag.IGNORE_NOT_TIME_VALID);
    boolean timeErrors = checkValidityPeriods(assembled, now, ignoreTime, statuses);

    checkApplicationPolicies(assembled, policy.getApplicationPolicies(), statuses);

    if (assembled.anchor != null) {
      Date validationDate =
          ignoreTime || timeErrors ? dateInsideValidityWindows(assembled, now) : now;
      validatePath(assembled, policy, validationDate, statuses);
    }

    if (statuses.isEmpty()) {
      logger.debug("Chain for {} is valid", certificate.getSubjectX500Principal());
      return ChainValidationResult.valid();
    }
    return ChainValidationResult.invalid(statuses);
  }

  /** Walks issuer links from the end certificate up to a trust anchor. */
  private AssembledPath assemblePath(
      X509Certificate certificate, ChainPolicy policy, List<ChainStatus> statuses) {
    List<X509Certificate> candidates = new ArrayList<>(policy.getExtraStore());
    candidates.addAll(trustMaterial.getIntermediateCertificates());

    List<X509Certificate> path = new ArrayList<>();
    path.add(certificate);
    X509Certificate current = certificate;

    for (int depth = 0; depth < MAX_PATH_LENGTH; depth++) {
      boolean trusted = trustMaterial.getTrustedCertificates().contains(current);
      if (trusted && depth > 0) {
        path.remove(path.size() - 1);
        return new AssembledPath(path, current);
      }

      if (isSelfIssuedAndSigned(current)) {
        if (!trusted
            && !policy.hasVerificationFlag(VerificationFlag.ALLOW_UNKNOWN_CERTIFICATE_AUTHORITY)) {
          statuses.add(
              new ChainStatus(
                  ChainStatusFlag.UNTRUSTED_ROOT,
                  "Root certificate "
                      + current.getSubjectX500Principal()
                      + " is not a trusted certificate authority"));
        }
        if (depth > 0) {
          path.remove(path.size() - 1);
        }
        return new AssembledPath(path, current);
      }

      X509Certificate anchorIssuer = findIssuer(current, trustMaterial.getTrustedCertificates());
      if (anchorIssuer != null) {
        return new AssembledPath(path, anchorIssuer);
      }

      X509Certificate issuer = findIssuer(current, candidates);
      if (issuer == null || path.contains(issuer)) {
        statuses.add(
            new ChainStatus(
                ChainStatusFlag.PARTIAL_CHAIN,
                "No issuer certificate found for "
                    + current.getSubjectX500Principal()
                    + ", issuer was "
                    + current.getIssuerX500Principal()));
        return new AssembledPath(path, null);
      }
      path.add(issuer);
      current = issuer;
    }

    statuses.add(
        new ChainStatus(
            ChainStatusFlag.PARTIAL_CHAIN,
            "Certificate path exceeds " + MAX_PATH_LENGTH + " certificates"));
    return new AssembledPath(path, null);
  }

  private static X509Certificate findIssuer(
      X509Certificate certificate, List<X509Certificate> candidates) {
    for (X509Certificate candidate : candidates) {
      if (candidate.getSubjectX500Principal().equals(certificate.getIssuerX500Principal())
          && verifies(certificate, candidate)) {
        return candidate;
      }
    }
    return null;
  }

  private static boolean isSelfIssuedAndSigned(X509Certificate certificate) {
    return certificate.getSubjectX500Principal().equals(certificate.getIssuerX500Principal())
        && verifies(certificate, certificate);
  }

  private static boolean verifies(X509Certificate certificate, X509Certificate issuer) {
    try {
      certificate.verify(issuer.getPublicKey());
      return true;
    } catch (CertificateException
        | NoSuchAlgorithmException
        | InvalidKeyException
        | NoSuchProviderException
        | SignatureException e) {
      logger.trace(
          "Signature of {} does not verify with key of {}: {}",
          certificate.getSubjectX500Principal(),
          issuer.getSubjectX500Principal(),
          e.getMessage());
      return false;
    }
  }

  /** @return true if any certificate of the path is outside its validity window */
  private boolean checkValidityPeriods(
      AssembledPath assembled, Date now, boolean ignoreTime, List<ChainStatus> statuses) {
    boolean timeErrors = false;
    for (X509Certificate cert : assembled.allCertificates()) {
      String detail = null;
      try {
        cert.checkValidity(now);
      } catch (CertificateExpiredException e) {
        detail =
            "Certificate " + cert.getSubjectX500Principal() + " expired on " + cert.getNotAfter();
      } catch (CertificateNotYetValidException e) {
        detail =
            "Certificate "
                + cert.getSubjectX500Principal()
                + " is not valid before "
                + cert.getNotBefore();
      }
      if (detail != null) {
        timeErrors = true;
        if (ignoreTime) {
          logger.debug("Ignoring time validity: {}", detail);
        } else {
          statuses.add(new ChainStatus(ChainStatusFlag.NOT_TIME_VALID, detail));
        }
      }
    }
    return timeErrors;
  }

  /**
   * The end certificate must list every required usage. CA certificates restrict usages only when
   * they carry an extended key usage extension.
   */
  private void checkApplicationPolicies(
      AssembledPath assembled, List<String> requiredPolicies, List<ChainStatus> statuses) {
    if (requiredPolicies.isEmpty()) {
      return;
    }
    List<X509Certificate> certificates = assembled.allCertificates();
    for (int i = 0; i < certificates.size(); i++) {
      X509Certificate cert = certificates.get(i);
      boolean endCertificate = i == 0;
      List<String> usages;
      try {
        usages = cert.getExtendedKeyUsage();
      } catch (CertificateParsingException e) {
        statuses.add(
            new ChainStatus(
                ChainStatusFlag.INVALID_EXTENSION,
                "Extended key usage of "
                    + cert.getSubjectX500Principal()
                    + " cannot be parsed: "
                    + e.getMessage()));
        continue;
      }
      for (String oid : requiredPolicies) {
        boolean allowed;
        if (endCertificate) {
          allowed = usages != null && usages.contains(oid);
        } else {
          allowed =
              usages == null || usages.contains(oid) || usages.contains(ANY_EXTENDED_KEY_USAGE);
        }
        if (!allowed) {
          statuses.add(
              new ChainStatus(
                  ChainStatusFlag.NOT_VALID_FOR_USAGE,
                  "Certificate "
                      + cert.getSubjectX500Principal()
                      + " is not valid for application policy "
                      + oid));
        }
      }
    }
  }

  private void validatePath(
      AssembledPath assembled, ChainPolicy policy, Date validationDate, List<ChainStatus> statuses)
      throws GeneralSecurityException {
    CertPath certPath = CertificateFactory.getInstance("X.509").generateCertPath(assembled.path);
    TrustAnchor trustAnchor = new TrustAnchor(assembled.anchor, null);

    PKIXParameters params = new PKIXParameters(Collections.singleton(trustAnchor));
    params.setDate(validationDate);

    List<Object> storeContent = new ArrayList<>(trustMaterial.getIntermediateCertificates());
    storeContent.addAll(policy.getExtraStore());
    storeContent.addAll(trustMaterial.getCrls());
    if (!storeContent.isEmpty()) {
      params.addCertStore(
          CertStore.getInstance("Collection", new CollectionCertStoreParameters(storeContent)));
    }

    CertPathValidator validator = CertPathValidator.getInstance(PKIX);
    configureRevocation(validator, params, policy);

    try {
      validator.validate(certPath, params);
    } catch (CertPathValidatorException e) {
      ChainStatus status = toChainStatus(e, assembled.path);
      if (!statuses.contains(status)) {
        statuses.add(status);
      }
    }
  }

  private static void configureRevocation(
      CertPathValidator validator, PKIXParameters params, ChainPolicy policy) {
    RevocationMode mode = policy.getRevocationMode();
    if (mode == RevocationMode.NO_CHECK) {
      params.setRevocationEnabled(false);
      return;
    }

    PKIXRevocationChecker checker = (PKIXRevocationChecker) validator.getRevocationChecker();
    Set<PKIXRevocationChecker.Option> options =
        EnumSet.noneOf(PKIXRevocationChecker.Option.class);

    // the PKIX validator never checks the trust anchor, so EXCLUDE_ROOT and ENTIRE_CHAIN agree
    if (policy.getRevocationFlag() == RevocationFlag.END_CERTIFICATE_ONLY) {
      options.add(PKIXRevocationChecker.Option.ONLY_END_ENTITY);
    }
    switch (mode) {
      case ONLINE_BEST_EFFORT:
        options.add(PKIXRevocationChecker.Option.SOFT_FAIL);
        break;
      case OFFLINE:
        options.add(PKIXRevocationChecker.Option.PREFER_CRLS);
        options.add(PKIXRevocationChecker.Option.NO_FALLBACK);
        break;
      case ONLINE_REQUIRED:
      default:
        break;
    }
    if (policy.hasVerificationFlag(VerificationFlag.IGNORE_END_REVOCATION_UNKNOWN)) {
      options.add(PKIXRevocationChecker.Option.SOFT_FAIL);
    }
    checker.setOptions(options);

    params.setRevocationEnabled(true);
    params.addCertPathChecker(checker);
  }

  static ChainStatus toChainStatus(CertPathValidatorException e, List<X509Certificate> path) {
    String detail = e.getMessage();
    int index = e.getIndex();
    if (index >= 0 && index < path.size()) {
      detail = detail + " (certificate " + path.get(index).getSubjectX500Principal() + ")";
    }
    return new ChainStatus(toChainStatusFlag(e.getReason()), detail);
  }

  static ChainStatusFlag toChainStatusFlag(CertPathValidatorException.Reason reason) {
    if (reason instanceof CertPathValidatorException.BasicReason) {
      switch ((CertPathValidatorException.BasicReason) reason) {
        case EXPIRED:
        case NOT_YET_VALID:
          return ChainStatusFlag.NOT_TIME_VALID;
        case REVOKED:
          return ChainStatusFlag.REVOKED;
        case UNDETERMINED_REVOCATION_STATUS:
          return ChainStatusFlag.REVOCATION_STATUS_UNKNOWN;
        case INVALID_SIGNATURE:
        case ALGORITHM_CONSTRAINED:
          return ChainStatusFlag.NOT_SIGNATURE_VALID;
        case UNSPECIFIED:
        default:
          return ChainStatusFlag.INVALID_EXTENSION;
      }
    }
    if (reason instanceof PKIXReason) {
      switch ((PKIXReason) reason) {
        case NAME_CHAINING:
          return ChainStatusFlag.PARTIAL_CHAIN;
        case INVALID_KEY_USAGE:
          return ChainStatusFlag.NOT_VALID_FOR_USAGE;
        case INVALID_POLICY:
          return ChainStatusFlag.INVALID_POLICY_CONSTRAINTS;
        case NO_TRUST_ANCHOR:
          return ChainStatusFlag.UNTRUSTED_ROOT;
        case UNRECOGNIZED_CRIT_EXT:
          return ChainStatusFlag.HAS_NOT_SUPPORTED_CRITICAL_EXTENSION;
        case NOT_CA_CERT:
        case PATH_TOO_LONG:
          return ChainStatusFlag.INVALID_BASIC_CONSTRAINTS;
        case INVALID_NAME:
          return ChainStatusFlag.INVALID_NAME_CONSTRAINTS;
        default:
          return ChainStatusFlag.INVALID_EXTENSION;
      }
    }
    return ChainStatusFlag.INVALID_EXTENSION;
  }

  /**
   * An instant inside every validity window of the path, as close to now as possible. Falls back
   * to now when the windows do not overlap.
   */
  private static Date dateInsideValidityWindows(AssembledPath assembled, Date now) {
    Date latestNotBefore = null;
    Date earliestNotAfter = null;
    for (X509Certificate cert : assembled.allCertificates()) {
      if (latestNotBefore == null || cert.getNotBefore().after(latestNotBefore)) {
        latestNotBefore = cert.getNotBefore();
      }
      if (earliestNotAfter == null || cert.getNotAfter().before(earliestNotAfter)) {
        earliestNotAfter = cert.getNotAfter();
      }
    }
    if (latestNotBefore == null || latestNotBefore.after(earliestNotAfter)) {
      return now;
    }
    if (now.before(latestNotBefore)) {
      return latestNotBefore;
    }
    if (now.after(earliestNotAfter)) {
      return earliestNotAfter;
    }
    return now;
  }

  /** A path without its anchor, and the anchor certificate (null if none was reached). */
  private static final class AssembledPath {
    private final List<X509Certificate> path;
    private final X509Certificate anchor;

    private AssembledPath(List<X509Certificate> path, X509Certificate anchor) {
      this.path = path;
      this.anchor = anchor;
    }

    /** The path followed by the anchor, without repeating a self-signed end certificate. */
    private List<X509Certificate> allCertificates() {
      List<X509Certificate> all = new ArrayList<>(path);
      if (anchor != null && !all.contains(anchor)) {
        all.add(anchor);
      }
      return all;
    }
  }
}
