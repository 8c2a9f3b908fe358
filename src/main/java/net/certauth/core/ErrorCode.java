package net.certauth.core;

import java.util.HashMap;
import java.util.Map;

/**
 * Error codes for unexpected authentication failures.
 *
 * <p>Policy rejections and chain validation failures are not errors; they are reported as {@link
 * AuthenticationResult#rejected(String)} outcomes and never carry an error code.
 */
public enum ErrorCode {
  INTERNAL_ERROR(300001),
  MALFORMED_CERTIFICATE(300002),
  CHAIN_BUILD_ERROR(300003),
  HOOK_FAILURE(300004),
  INTERRUPTED(300005),
  INVALID_CONFIGURATION(300006),
  TRUST_STORE_ERROR(300007);

  public static final String errorMessageResource = "net.certauth.core.error_messages";

  private static final Map<Integer, ErrorCode> errorCodeMap = new HashMap<>();

  static {
    for (ErrorCode errorCode : ErrorCode.values()) {
      errorCodeMap.put(errorCode.getMessageCode(), errorCode);
    }
  }

  private final int messageCode;

  ErrorCode(int messageCode) {
    this.messageCode = messageCode;
  }

  public int getMessageCode() {
    return messageCode;
  }

  public static ErrorCode getByMessageCode(int messageCode) {
    return errorCodeMap.get(messageCode);
  }

  @Override
  public String toString() {
    return "ErrorCode{" + "name=" + name() + ", messageCode=" + messageCode + '}';
  }
}
