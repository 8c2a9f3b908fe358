package net.certauth.core;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import net.certauth.category.TestTags;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag(TestTags.CORE)
class CertificateAuthenticationExceptionTest {

  @Test
  void shouldFormatMessageFromBundle() {
    CertificateAuthenticationException e =
        new CertificateAuthenticationException(ErrorCode.CHAIN_BUILD_ERROR, "no provider");

    assertEquals("Certificate chain could not be built: no provider", e.getMessage());
    assertEquals(300003, e.getVendorCode());
    assertEquals(ErrorCode.CHAIN_BUILD_ERROR, e.getErrorCode());
  }

  @Test
  void shouldKeepCause() {
    IOException cause = new IOException("disk");

    CertificateAuthenticationException e =
        new CertificateAuthenticationException(cause, ErrorCode.TRUST_STORE_ERROR, "disk");

    assertSame(cause, e.getCause());
    assertTrue(e.toString().contains("TRUST_STORE_ERROR"));
  }

  @Test
  void shouldFormatMessageWithoutParameters() {
    CertificateAuthenticationException e =
        new CertificateAuthenticationException(ErrorCode.INTERRUPTED);

    assertEquals("Certificate authentication was interrupted.", e.getMessage());
  }

  @Test
  void shouldLookUpErrorCodeByMessageCode() {
    for (ErrorCode code : ErrorCode.values()) {
      assertSame(code, ErrorCode.getByMessageCode(code.getMessageCode()));
    }
  }
}
