package net.certauth.log;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.logging.Level;
import java.util.logging.LogRecord;
import net.certauth.category.TestTags;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag(TestTags.LOGGING)
public class AuthLogFormatterTest {
  private final AuthLogFormatter formatter = new AuthLogFormatter();

  @Test
  public void testShortensLibraryClassNames() {
    LogRecord record = new LogRecord(Level.WARNING, "Certificate rejected");
    record.setSourceClassName("net.certauth.core.CertificateAuthenticator");
    record.setSourceMethodName("authenticate");
    record.setMillis(0L);

    String line = formatter.format(record);

    assertEquals(
        "1970-01-01 00:00:00.000 n.c.core.CertificateAuthenticator WARNING authenticate"
            + " - Certificate rejected\n",
        line);
  }

  @Test
  public void testKeepsForeignClassNamesAndAppendsThrowable() {
    LogRecord record = new LogRecord(Level.SEVERE, "failure");
    record.setSourceClassName("org.example.Host");
    record.setSourceMethodName("handle");
    record.setThrown(new IllegalStateException("boom"));

    String line = formatter.format(record);

    assertTrue(line.contains(" org.example.Host SEVERE handle - failure\n"));
    assertTrue(line.endsWith("java.lang.IllegalStateException: boom\n"));
  }

  @Test
  public void testFallsBackToLoggerName() {
    LogRecord record = new LogRecord(Level.INFO, "message");
    record.setLoggerName("net.certauth.config");

    assertTrue(formatter.format(record).contains(" net.certauth.config INFO "));
  }
}
