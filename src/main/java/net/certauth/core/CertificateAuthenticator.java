package net.certauth.core;

import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import net.certauth.config.CertificateAuthenticationOptions;
import net.certauth.core.chain.CertificateChainBuilder;
import net.certauth.core.chain.ChainPolicy;
import net.certauth.core.chain.ChainPolicyBuilder;
import net.certauth.core.chain.ChainValidationResult;
import net.certauth.core.chain.ChainValidator;
import net.certauth.core.chain.PkixCertificateChainBuilder;
import net.certauth.core.chain.TrustMaterial;
import net.certauth.core.claims.CertificateClaimsMapper;
import net.certauth.core.claims.ClaimsPrincipal;
import net.certauth.log.AuthLogger;
import net.certauth.log.AuthLoggerFactory;
import net.certauth.util.CertificateUtil;

/**
 * Decides whether the client certificate of a request authenticates the caller.
 *
 * <p>Each call to {@link #authenticate(AuthenticationRequest)} reads one options snapshot and
 * walks these steps: channel and certificate presence, decoding, classification as self-signed or
 * chained, the allowed type gate, chain validation, the {@link CertificateValidationHook} and,
 * when the hook defers, the claims mapping. Unexpected failures are offered to the {@link
 * AuthenticationFailureHook} before they are thrown.
 *
 * <p>The authenticator holds no per-request state and may be shared between threads.
 */
public class CertificateAuthenticator {
  private static final AuthLogger logger =
      AuthLoggerFactory.getLogger(CertificateAuthenticator.class);

  static final String SELF_SIGNED_NOT_PERMITTED = "self-signed not permitted";
  static final String CHAINED_NOT_PERMITTED = "chained not permitted";
  static final String CHAIN_VALIDATION_FAILED = "Client certificate failed validation.";

  private static final int HTTP_FORBIDDEN = 403;

  private final Supplier<CertificateAuthenticationOptions> optionsSupplier;
  private final SelfSignedCertificateClassifier classifier;
  private final ChainPolicyBuilder policyBuilder;
  private final ChainValidator chainValidator;
  private final CertificateClaimsMapper claimsMapper;
  private final CertificateValidationHook validationHook;
  private final AuthenticationFailureHook failureHook;

  private CertificateAuthenticator(Builder builder, ChainValidator chainValidator) {
    this.optionsSupplier = builder.optionsSupplier;
    this.classifier = builder.classifier;
    this.policyBuilder = builder.policyBuilder;
    this.chainValidator = chainValidator;
    this.claimsMapper = builder.claimsMapper;
    this.validationHook = builder.validationHook;
    this.failureHook = builder.failureHook;
  }

  /**
   * Authenticates one request.
   *
   * @param request the request
   * @return exactly one outcome
   * @throws CertificateAuthenticationException on an unexpected failure the failure hook did not
   *     recover from
   */
  public AuthenticationResult authenticate(AuthenticationRequest request)
      throws CertificateAuthenticationException {
    CertificateAuthenticationOptions options = optionsSupplier.get();
    try {
      return authenticate(request, options);
    } catch (CertificateAuthenticationException e) {
      return recover(e, request, options);
    } catch (RuntimeException e) {
      logger.error("Unexpected error during certificate authentication", e);
      return recover(
          new CertificateAuthenticationException(e, ErrorCode.INTERNAL_ERROR, e.getMessage()),
          request,
          options);
    }
  }

  private AuthenticationResult authenticate(
      AuthenticationRequest request, CertificateAuthenticationOptions options)
      throws CertificateAuthenticationException {
    long deadlineNanos = System.nanoTime() + options.getChainValidationTimeout().toNanos();

    if (!request.isChannelSecured()) {
      logger.info("Not https, skipping certificate authentication");
      return AuthenticationResult.noResult();
    }
    if (!request.hasCertificate()) {
      logger.debug("No client certificate found");
      return AuthenticationResult.noResult();
    }

    X509Certificate certificate;
    try {
      certificate = CertificateUtil.decodeCertificate(request.getRawCertificate());
    } catch (CertificateException e) {
      throw new CertificateAuthenticationException(
          e, ErrorCode.MALFORMED_CERTIFICATE, e.getMessage());
    }

    boolean selfSigned = classifier.isSelfSigned(certificate);
    if (selfSigned && !options.isAllowed(CertificateType.SELF_SIGNED)) {
      logger.warn(
          "Self signed certificate rejected, subject was {}",
          certificate.getSubjectX500Principal());
      return AuthenticationResult.rejected(SELF_SIGNED_NOT_PERMITTED);
    }
    if (!selfSigned && !options.isAllowed(CertificateType.CHAINED)) {
      logger.warn(
          "Chained certificate rejected, subject was {}", certificate.getSubjectX500Principal());
      return AuthenticationResult.rejected(CHAINED_NOT_PERMITTED);
    }

    ChainPolicy policy = policyBuilder.build(certificate, options, selfSigned);
    ChainValidationResult chainResult =
        chainValidator.validate(certificate, policy, remaining(deadlineNanos));
    if (!chainResult.isValid()) {
      return AuthenticationResult.chainInvalid(CHAIN_VALIDATION_FAILED, chainResult.getStatuses());
    }

    ValidateCertificateContext context =
        new ValidateCertificateContext(certificate, request, options, remaining(deadlineNanos));
    ValidationDecision decision = awaitValidationHook(context, deadlineNanos);

    switch (decision.getKind()) {
      case ACCEPT:
        logger.debug(
            "Validation hook accepted certificate {}",
            CertificateUtil.sha256Thumbprint(certificate));
        return success(decision.getPrincipal(), certificate);
      case REJECT:
        logger.warn(
            "Validation hook rejected certificate {}: {}",
            certificate.getSubjectX500Principal(),
            decision.getReason());
        return AuthenticationResult.rejected(decision.getReason());
      case DEFER:
      default:
        ClaimsPrincipal principal =
            claimsMapper.createPrincipal(certificate, options.getClaimsIssuer());
        return success(principal, certificate);
    }
  }

  private static AuthenticationResult success(ClaimsPrincipal principal, X509Certificate cert)
      throws CertificateAuthenticationException {
    Map<String, String> properties = CertificateProperties.forCertificate(cert);
    logger.debug(
        "Certificate {} authenticated {}", CertificateUtil.sha256Thumbprint(cert), principal);
    return AuthenticationResult.valid(principal, properties);
  }

  private ValidationDecision awaitValidationHook(
      ValidateCertificateContext context, long deadlineNanos)
      throws CertificateAuthenticationException {
    CompletionStage<ValidationDecision> stage = validationHook.tryValidate(context);
    if (stage == null) {
      throw new CertificateAuthenticationException(
          ErrorCode.HOOK_FAILURE, "validation hook returned no result");
    }
    CompletableFuture<ValidationDecision> future = stage.toCompletableFuture();
    long timeoutMs = remaining(deadlineNanos).toMillis();
    try {
      ValidationDecision decision = future.get(timeoutMs, TimeUnit.MILLISECONDS);
      if (decision == null) {
        throw new CertificateAuthenticationException(
            ErrorCode.HOOK_FAILURE, "validation hook returned no decision");
      }
      return decision;
    } catch (TimeoutException e) {
      future.cancel(true);
      throw new CertificateAuthenticationException(
          e,
          ErrorCode.HOOK_FAILURE,
          "validation hook did not complete within " + timeoutMs + " ms");
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new CertificateAuthenticationException(e, ErrorCode.INTERRUPTED);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      throw new CertificateAuthenticationException(
          cause, ErrorCode.HOOK_FAILURE, cause.getMessage());
    }
  }

  /**
   * Offers {@code failure} to the failure hook. The hook gets a full chain validation timeout of
   * its own, since the failure may itself have been a timeout.
   */
  private AuthenticationResult recover(
      CertificateAuthenticationException failure,
      AuthenticationRequest request,
      CertificateAuthenticationOptions options)
      throws CertificateAuthenticationException {
    logger.debug("Certificate authentication failed: {}", failure.getMessage());

    CompletableFuture<Optional<AuthenticationResult>> future;
    try {
      CompletionStage<Optional<AuthenticationResult>> stage =
          failureHook.tryRecover(new AuthenticationFailedContext(failure, request, options));
      if (stage == null) {
        throw failure;
      }
      future = stage.toCompletableFuture();
    } catch (RuntimeException e) {
      throw hookFailure(e, failure);
    }

    long timeoutMs = options.getChainValidationTimeout().toMillis();
    Optional<AuthenticationResult> recovered;
    try {
      recovered = future.get(timeoutMs, TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      logger.warn("Failure hook did not complete within {} ms", timeoutMs);
      failure.addSuppressed(e);
      throw failure;
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      CertificateAuthenticationException interrupted =
          new CertificateAuthenticationException(e, ErrorCode.INTERRUPTED);
      interrupted.addSuppressed(failure);
      throw interrupted;
    } catch (ExecutionException e) {
      throw hookFailure(e.getCause() != null ? e.getCause() : e, failure);
    }

    if (recovered != null && recovered.isPresent()) {
      logger.debug(
          "Failure hook replaced error {} with {}", failure.getErrorCode(), recovered.get());
      return recovered.get();
    }
    throw failure;
  }

  private static CertificateAuthenticationException hookFailure(
      Throwable cause, CertificateAuthenticationException original) {
    CertificateAuthenticationException e =
        new CertificateAuthenticationException(cause, ErrorCode.HOOK_FAILURE, cause.getMessage());
    e.addSuppressed(original);
    return e;
  }

  private static Duration remaining(long deadlineNanos) {
    long left = deadlineNanos - System.nanoTime();
    return left > 0 ? Duration.ofNanos(left) : Duration.ZERO;
  }

  /**
   * Status the transport answers a challenge with. A TLS client certificate cannot be requested
   * again on an established connection, so a challenge is answered like a forbid.
   */
  public int challengeStatusCode() {
    return HTTP_FORBIDDEN;
  }

  public int forbiddenStatusCode() {
    return HTTP_FORBIDDEN;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static class Builder {
    private Supplier<CertificateAuthenticationOptions> optionsSupplier =
        CertificateAuthenticationOptions::defaults;
    private SelfSignedCertificateClassifier classifier = new SelfSignedCertificateClassifier();
    private ChainPolicyBuilder policyBuilder = new ChainPolicyBuilder();
    private ChainValidator chainValidator;
    private CertificateChainBuilder chainBuilder;
    private CertificateClaimsMapper claimsMapper = new CertificateClaimsMapper();
    private CertificateValidationHook validationHook = CertificateValidationHook.NO_OP;
    private AuthenticationFailureHook failureHook = AuthenticationFailureHook.NO_OP;

    public Builder options(CertificateAuthenticationOptions options) {
      this.optionsSupplier = () -> options;
      return this;
    }

    /**
     * Options read once per attempt, e.g. a {@link net.certauth.config.ReloadableOptionsProvider}.
     */
    public Builder options(Supplier<CertificateAuthenticationOptions> optionsSupplier) {
      this.optionsSupplier = optionsSupplier;
      return this;
    }

    public Builder classifier(SelfSignedCertificateClassifier classifier) {
      this.classifier = classifier;
      return this;
    }

    public Builder policyBuilder(ChainPolicyBuilder policyBuilder) {
      this.policyBuilder = policyBuilder;
      return this;
    }

    public Builder chainValidator(ChainValidator chainValidator) {
      this.chainValidator = chainValidator;
      return this;
    }

    /** Chain building primitive, run by a {@link ChainValidator} on the shared executor. */
    public Builder chainBuilder(CertificateChainBuilder chainBuilder) {
      this.chainBuilder = chainBuilder;
      return this;
    }

    public Builder claimsMapper(CertificateClaimsMapper claimsMapper) {
      this.claimsMapper = claimsMapper;
      return this;
    }

    public Builder validationHook(CertificateValidationHook validationHook) {
      this.validationHook =
          validationHook == null ? CertificateValidationHook.NO_OP : validationHook;
      return this;
    }

    public Builder failureHook(AuthenticationFailureHook failureHook) {
      this.failureHook = failureHook == null ? AuthenticationFailureHook.NO_OP : failureHook;
      return this;
    }

    /**
     * @return the authenticator
     * @throws CertificateAuthenticationException if neither a chain validator nor a chain builder
     *     was set and the JVM default trust anchors cannot be loaded
     */
    public CertificateAuthenticator build() throws CertificateAuthenticationException {
      if (optionsSupplier == null) {
        throw new IllegalArgumentException("Options cannot be null");
      }
      ChainValidator validator = chainValidator;
      if (validator == null) {
        CertificateChainBuilder primitive =
            chainBuilder != null
                ? chainBuilder
                : new PkixCertificateChainBuilder(TrustMaterial.systemDefault());
        validator = new ChainValidator(primitive);
      }
      return new CertificateAuthenticator(this, validator);
    }
  }
}
