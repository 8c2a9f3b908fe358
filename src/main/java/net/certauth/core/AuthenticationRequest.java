package net.certauth.core;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * What the transport knows about an inbound request: whether it arrived over a secured channel,
 * the DER encoded client certificate (if the client presented one) and free-form attributes that
 * are passed through to the hooks.
 */
public final class AuthenticationRequest {
  private final boolean channelSecured;
  private final byte[] rawCertificate;
  private final Map<String, Object> attributes;

  private AuthenticationRequest(Builder builder) {
    this.channelSecured = builder.channelSecured;
    this.rawCertificate = builder.rawCertificate == null ? null : builder.rawCertificate.clone();
    this.attributes = Collections.unmodifiableMap(new HashMap<>(builder.attributes));
  }

  public boolean isChannelSecured() {
    return channelSecured;
  }

  /** @return a copy of the DER bytes, or null if no certificate was presented */
  public byte[] getRawCertificate() {
    return rawCertificate == null ? null : rawCertificate.clone();
  }

  public boolean hasCertificate() {
    return rawCertificate != null && rawCertificate.length > 0;
  }

  public Map<String, Object> getAttributes() {
    return attributes;
  }

  public static Builder builder() {
    return new Builder();
  }

  public static class Builder {
    private boolean channelSecured;
    private byte[] rawCertificate;
    private final Map<String, Object> attributes = new HashMap<>();

    public Builder channelSecured(boolean channelSecured) {
      this.channelSecured = channelSecured;
      return this;
    }

    public Builder rawCertificate(byte[] rawCertificate) {
      this.rawCertificate = rawCertificate;
      return this;
    }

    public Builder attribute(String name, Object value) {
      attributes.put(name, value);
      return this;
    }

    public AuthenticationRequest build() {
      return new AuthenticationRequest(this);
    }
  }
}
