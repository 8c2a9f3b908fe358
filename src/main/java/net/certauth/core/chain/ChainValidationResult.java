package net.certauth.core.chain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Outcome of one chain build: valid, or invalid with every reported status in order. */
public final class ChainValidationResult {
  private static final ChainValidationResult VALID =
      new ChainValidationResult(Collections.emptyList());

  private final List<ChainStatus> statuses;

  private ChainValidationResult(List<ChainStatus> statuses) {
    this.statuses = statuses;
  }

  public static ChainValidationResult valid() {
    return VALID;
  }

  /**
   * @param statuses statuses reported by the chain builder, must not be empty
   * @return an invalid result
   */
  public static ChainValidationResult invalid(List<ChainStatus> statuses) {
    if (statuses == null || statuses.isEmpty()) {
      throw new IllegalArgumentException("An invalid chain must report at least one status");
    }
    return new ChainValidationResult(Collections.unmodifiableList(new ArrayList<>(statuses)));
  }

  public static ChainValidationResult invalid(ChainStatusFlag status, String detail) {
    return invalid(Collections.singletonList(new ChainStatus(status, detail)));
  }

  public boolean isValid() {
    return statuses.isEmpty();
  }

  public List<ChainStatus> getStatuses() {
    return statuses;
  }

  public boolean hasStatus(ChainStatusFlag flag) {
    for (ChainStatus status : statuses) {
      if (status.getStatus() == flag) {
        return true;
      }
    }
    return false;
  }

  @Override
  public String toString() {
    return isValid() ? "ChainValidationResult{valid}" : "ChainValidationResult" + statuses;
  }
}
