package net.certauth.log;

import static org.junit.jupiter.api.Assertions.assertInstanceOf;

import net.certauth.category.TestTags;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag(TestTags.LOGGING)
public class AuthLoggerFactoryTest {

  @AfterEach
  public void tearDown() {
    System.clearProperty(AuthLoggerFactory.LOGGER_IMPL_PROPERTY);
    AuthLoggerFactory.reset();
  }

  @Test
  public void testDefaultsToJdk14Logger() {
    System.clearProperty(AuthLoggerFactory.LOGGER_IMPL_PROPERTY);
    AuthLoggerFactory.reset();

    assertInstanceOf(JDK14Logger.class, AuthLoggerFactory.getLogger(AuthLoggerFactoryTest.class));
  }

  @Test
  public void testSlf4jLoggerSelectedByProperty() {
    System.setProperty(
        AuthLoggerFactory.LOGGER_IMPL_PROPERTY,
        AuthLoggerFactory.LoggerImpl.SLF4JLOGGER.getLoggerImplClassName());
    AuthLoggerFactory.reset();

    assertInstanceOf(SLF4JLogger.class, AuthLoggerFactory.getLogger(AuthLoggerFactoryTest.class));
  }

  @Test
  public void testUnknownImplementationFallsBackToJdk14Logger() {
    System.setProperty(AuthLoggerFactory.LOGGER_IMPL_PROPERTY, "org.example.NoSuchLogger");
    AuthLoggerFactory.reset();

    assertInstanceOf(JDK14Logger.class, AuthLoggerFactory.getLogger("custom"));
  }
}
