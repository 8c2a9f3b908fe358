package net.certauth.core.claims;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/** The authenticated caller: one or more identities. */
public class ClaimsPrincipal {
  private final List<ClaimsIdentity> identities;

  public ClaimsPrincipal(ClaimsIdentity identity) {
    this(Collections.singletonList(identity));
  }

  public ClaimsPrincipal(List<ClaimsIdentity> identities) {
    if (identities == null || identities.isEmpty()) {
      throw new IllegalArgumentException("A principal needs at least one identity");
    }
    this.identities = Collections.unmodifiableList(new ArrayList<>(identities));
  }

  public List<ClaimsIdentity> getIdentities() {
    return identities;
  }

  /** The primary identity. */
  public ClaimsIdentity getIdentity() {
    return identities.get(0);
  }

  /** Claims of all identities, in identity order. */
  public List<Claim> getClaims() {
    List<Claim> all = new ArrayList<>();
    for (ClaimsIdentity identity : identities) {
      all.addAll(identity.getClaims());
    }
    return all;
  }

  public Optional<Claim> findFirst(String type) {
    for (ClaimsIdentity identity : identities) {
      Optional<Claim> claim = identity.findFirst(type);
      if (claim.isPresent()) {
        return claim;
      }
    }
    return Optional.empty();
  }

  @Override
  public String toString() {
    return "ClaimsPrincipal{" + getIdentity().getName() + "}";
  }
}
