package net.certauth.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.certauth.core.chain.ChainStatus;
import net.certauth.core.claims.ClaimsPrincipal;

/** Outcome of one authentication attempt. */
public final class AuthenticationResult {
  public enum Outcome {
    /** Nothing to authenticate; other schemes may still run. */
    NO_RESULT,
    REJECTED,
    VALID
  }

  private static final AuthenticationResult NO_RESULT_INSTANCE =
      new AuthenticationResult(
          Outcome.NO_RESULT, null, null, Collections.emptyList(), Collections.emptyMap());

  private final Outcome outcome;
  private final String failureMessage;
  private final ClaimsPrincipal principal;
  private final List<ChainStatus> chainStatuses;
  private final Map<String, String> properties;

  private AuthenticationResult(
      Outcome outcome,
      String failureMessage,
      ClaimsPrincipal principal,
      List<ChainStatus> chainStatuses,
      Map<String, String> properties) {
    this.outcome = outcome;
    this.failureMessage = failureMessage;
    this.principal = principal;
    this.chainStatuses = chainStatuses;
    this.properties = properties;
  }

  public static AuthenticationResult noResult() {
    return NO_RESULT_INSTANCE;
  }

  public static AuthenticationResult rejected(String failureMessage) {
    return new AuthenticationResult(
        Outcome.REJECTED,
        failureMessage,
        null,
        Collections.emptyList(),
        Collections.emptyMap());
  }

  /** A rejection caused by chain validation; {@code chainStatuses} must not be empty. */
  public static AuthenticationResult chainInvalid(
      String failureMessage, List<ChainStatus> chainStatuses) {
    if (chainStatuses == null || chainStatuses.isEmpty()) {
      throw new IllegalArgumentException("A chain validation failure needs at least one status");
    }
    return new AuthenticationResult(
        Outcome.REJECTED,
        failureMessage,
        null,
        Collections.unmodifiableList(new ArrayList<>(chainStatuses)),
        Collections.emptyMap());
  }

  public static AuthenticationResult valid(
      ClaimsPrincipal principal, Map<String, String> properties) {
    if (principal == null) {
      throw new IllegalArgumentException("A valid result needs a principal");
    }
    return new AuthenticationResult(
        Outcome.VALID,
        null,
        principal,
        Collections.emptyList(),
        properties == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new HashMap<>(properties)));
  }

  public Outcome getOutcome() {
    return outcome;
  }

  public boolean isValid() {
    return outcome == Outcome.VALID;
  }

  public boolean isRejected() {
    return outcome == Outcome.REJECTED;
  }

  public boolean isNoResult() {
    return outcome == Outcome.NO_RESULT;
  }

  /** @return the rejection message, null unless rejected */
  public String getFailureMessage() {
    return failureMessage;
  }

  /** @return the principal, null unless valid */
  public ClaimsPrincipal getPrincipal() {
    return principal;
  }

  /** Chain status entries of a chain validation failure; empty for every other outcome. */
  public List<ChainStatus> getChainStatuses() {
    return chainStatuses;
  }

  public Map<String, String> getProperties() {
    return properties;
  }

  @Override
  public String toString() {
    switch (outcome) {
      case REJECTED:
        return "AuthenticationResult{REJECTED, " + failureMessage + ", " + chainStatuses + "}";
      case VALID:
        return "AuthenticationResult{VALID, " + principal + "}";
      default:
        return "AuthenticationResult{NO_RESULT}";
    }
  }
}
