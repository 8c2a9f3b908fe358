package net.certauth.core;

import net.certauth.core.claims.ClaimsPrincipal;

/** Answer of a {@link CertificateValidationHook}. */
public final class ValidationDecision {
  public enum Kind {
    ACCEPT,
    REJECT,
    DEFER
  }

  private static final ValidationDecision DEFER_INSTANCE =
      new ValidationDecision(Kind.DEFER, null, null);

  private final Kind kind;
  private final ClaimsPrincipal principal;
  private final String reason;

  private ValidationDecision(Kind kind, ClaimsPrincipal principal, String reason) {
    this.kind = kind;
    this.principal = principal;
    this.reason = reason;
  }

  /** Authenticate as {@code principal} instead of the claims derived from the certificate. */
  public static ValidationDecision accept(ClaimsPrincipal principal) {
    if (principal == null) {
      throw new IllegalArgumentException("Principal cannot be null");
    }
    return new ValidationDecision(Kind.ACCEPT, principal, null);
  }

  public static ValidationDecision reject(String reason) {
    if (reason == null) {
      throw new IllegalArgumentException("Reason cannot be null");
    }
    return new ValidationDecision(Kind.REJECT, null, reason);
  }

  /** Fall through to the claims derived from the certificate. */
  public static ValidationDecision defer() {
    return DEFER_INSTANCE;
  }

  public Kind getKind() {
    return kind;
  }

  public ClaimsPrincipal getPrincipal() {
    return principal;
  }

  public String getReason() {
    return reason;
  }
}
