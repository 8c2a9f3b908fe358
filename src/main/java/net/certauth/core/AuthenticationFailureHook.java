package net.certauth.core;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Called when an attempt fails unexpectedly. A non-empty result replaces the failure; an empty one
 * lets the original {@link CertificateAuthenticationException} propagate.
 */
@FunctionalInterface
public interface AuthenticationFailureHook {
  AuthenticationFailureHook NO_OP = context -> CompletableFuture.completedFuture(Optional.empty());

  CompletionStage<Optional<AuthenticationResult>> tryRecover(AuthenticationFailedContext context);
}
