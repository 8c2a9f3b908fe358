package net.certauth.core;

import java.text.MessageFormat;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

/**
 * An unexpected failure during certificate authentication: a malformed certificate, an error
 * inside the chain building primitive, a failing hook or an interrupted attempt.
 *
 * <p>Instances are offered to the {@link AuthenticationFailureHook}; if the hook does not supply a
 * result, the same instance is thrown from {@link CertificateAuthenticator#authenticate}.
 */
public class CertificateAuthenticationException extends Exception {
  private static final long serialVersionUID = 1L;

  private final ErrorCode errorCode;
  private final transient Object[] params;

  /**
   * @param errorCode error code
   * @param params parameters substituted into the localized message
   */
  public CertificateAuthenticationException(ErrorCode errorCode, Object... params) {
    this(null, errorCode, params);
  }

  /**
   * @param cause throwable
   * @param errorCode error code
   * @param params parameters substituted into the localized message
   */
  public CertificateAuthenticationException(
      Throwable cause, ErrorCode errorCode, Object... params) {
    super(localizedMessage(errorCode, params), cause);
    this.errorCode = errorCode;
    this.params = params;
  }

  /**
   * Get the error code
   *
   * @return error code
   */
  public ErrorCode getErrorCode() {
    return errorCode;
  }

  /**
   * Get the vendor code
   *
   * @return numeric message code
   */
  public int getVendorCode() {
    return errorCode.getMessageCode();
  }

  /**
   * Get additional parameters
   *
   * @return parameter array
   */
  public Object[] getParams() {
    return params;
  }

  private static String localizedMessage(ErrorCode errorCode, Object... params) {
    String key = String.valueOf(errorCode.getMessageCode());
    try {
      String pattern = ResourceBundle.getBundle(ErrorCode.errorMessageResource).getString(key);
      return MessageFormat.format(pattern, params);
    } catch (MissingResourceException e) {
      return "!!" + key + "!!";
    }
  }

  @Override
  public String toString() {
    return super.toString() + ", errorCode = " + errorCode;
  }
}
