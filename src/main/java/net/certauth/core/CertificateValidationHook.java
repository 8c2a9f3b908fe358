package net.certauth.core;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Called after the chain of a client certificate validated. The hook may accept the certificate
 * with its own principal, reject it, or defer to the default claims mapping.
 *
 * <p>The returned stage is awaited within the remaining time budget of the attempt and cancelled
 * if the attempt is interrupted or runs out of time. A stage completing exceptionally fails the
 * attempt with {@link ErrorCode#HOOK_FAILURE}.
 */
@FunctionalInterface
public interface CertificateValidationHook {
  CertificateValidationHook NO_OP =
      context -> CompletableFuture.completedFuture(ValidationDecision.defer());

  CompletionStage<ValidationDecision> tryValidate(ValidateCertificateContext context);
}
