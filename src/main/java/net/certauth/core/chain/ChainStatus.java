package net.certauth.core.chain;

import java.util.Objects;

/** One status entry reported while validating a chain, with its diagnostic detail. */
public final class ChainStatus {
  private final ChainStatusFlag status;
  private final String detail;

  public ChainStatus(ChainStatusFlag status, String detail) {
    this.status = Objects.requireNonNull(status, "status");
    this.detail = detail == null ? "" : detail;
  }

  public ChainStatusFlag getStatus() {
    return status;
  }

  public String getDetail() {
    return detail;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    ChainStatus that = (ChainStatus) o;
    return status == that.status && detail.equals(that.detail);
  }

  @Override
  public int hashCode() {
    return Objects.hash(status, detail);
  }

  @Override
  public String toString() {
    return status + " " + detail;
  }
}
