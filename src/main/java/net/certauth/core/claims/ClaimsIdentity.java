package net.certauth.core.claims;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * An identity made of an ordered list of claims. Claims are kept in insertion order and can only
 * be appended.
 */
public class ClaimsIdentity {
  private final String authenticationType;
  private final List<Claim> claims;

  public ClaimsIdentity(List<Claim> claims, String authenticationType) {
    this.claims = claims == null ? new ArrayList<>() : new ArrayList<>(claims);
    this.authenticationType = authenticationType;
  }

  public String getAuthenticationType() {
    return authenticationType;
  }

  public boolean isAuthenticated() {
    return authenticationType != null && !authenticationType.isEmpty();
  }

  public List<Claim> getClaims() {
    return Collections.unmodifiableList(claims);
  }

  public void addClaim(Claim claim) {
    if (claim == null) {
      throw new IllegalArgumentException("Claim cannot be null");
    }
    claims.add(claim);
  }

  /** @return the first claim of the given type */
  public Optional<Claim> findFirst(String type) {
    for (Claim claim : claims) {
      if (claim.getType().equals(type)) {
        return Optional.of(claim);
      }
    }
    return Optional.empty();
  }

  /** Value of the first {@link ClaimTypes#NAME} claim, or null. */
  public String getName() {
    return findFirst(ClaimTypes.NAME).map(Claim::getValue).orElse(null);
  }
}
