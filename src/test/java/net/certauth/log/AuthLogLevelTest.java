package net.certauth.log;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.logging.Level;
import net.certauth.category.TestTags;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag(TestTags.LOGGING)
public class AuthLogLevelTest {

  @Test
  public void testGetLogLevelIgnoresCase() {
    assertEquals(AuthLogLevel.DEBUG, AuthLogLevel.getLogLevel("debug"));
    assertEquals(AuthLogLevel.WARN, AuthLogLevel.getLogLevel("Warn"));
    assertEquals(AuthLogLevel.TRACE, AuthLogLevel.getLogLevel("TRACE"));
  }

  @Test
  public void testUnknownLevelIsOff() {
    assertEquals(AuthLogLevel.OFF, AuthLogLevel.getLogLevel("verbose"));
    assertEquals(AuthLogLevel.OFF, AuthLogLevel.getLogLevel(null));
  }

  @Test
  public void testJavaUtilLoggingMapping() {
    assertEquals(Level.SEVERE, AuthLogLevel.ERROR.toJavaUtilLoggingLevel());
    assertEquals(Level.FINE, AuthLogLevel.DEBUG.toJavaUtilLoggingLevel());
    assertEquals(Level.FINEST, AuthLogLevel.TRACE.toJavaUtilLoggingLevel());
  }
}
