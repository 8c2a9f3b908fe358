package net.certauth.core;

import net.certauth.config.CertificateAuthenticationOptions;

public final class AuthenticationFailedContext {
  private final CertificateAuthenticationException failure;
  private final AuthenticationRequest request;
  private final CertificateAuthenticationOptions options;

  AuthenticationFailedContext(
      CertificateAuthenticationException failure,
      AuthenticationRequest request,
      CertificateAuthenticationOptions options) {
    this.failure = failure;
    this.request = request;
    this.options = options;
  }

  public CertificateAuthenticationException getFailure() {
    return failure;
  }

  public AuthenticationRequest getRequest() {
    return request;
  }

  public CertificateAuthenticationOptions getOptions() {
    return options;
  }
}
