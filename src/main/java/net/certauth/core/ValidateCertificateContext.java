package net.certauth.core;

import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.Map;
import net.certauth.config.CertificateAuthenticationOptions;

public final class ValidateCertificateContext {
  private final X509Certificate certificate;
  private final AuthenticationRequest request;
  private final CertificateAuthenticationOptions options;
  private final Duration remainingTime;

  ValidateCertificateContext(
      X509Certificate certificate,
      AuthenticationRequest request,
      CertificateAuthenticationOptions options,
      Duration remainingTime) {
    this.certificate = certificate;
    this.request = request;
    this.options = options;
    this.remainingTime = remainingTime;
  }

  /** The client certificate, already chain validated. */
  public X509Certificate getCertificate() {
    return certificate;
  }

  public AuthenticationRequest getRequest() {
    return request;
  }

  public Map<String, Object> getAttributes() {
    return request.getAttributes();
  }

  public CertificateAuthenticationOptions getOptions() {
    return options;
  }

  /** Time left before the engine stops waiting for the hook. */
  public Duration getRemainingTime() {
    return remainingTime;
  }
}
