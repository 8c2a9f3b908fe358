package net.certauth.log;

import static net.certauth.util.SystemUtil.systemGetProperty;

/** Used to create AuthLogger instance */
public class AuthLoggerFactory {
  public static final String LOGGER_IMPL_PROPERTY = "net.certauth.loggerImpl";

  private static volatile LoggerImpl loggerImplementation;

  enum LoggerImpl {
    SLF4JLOGGER("net.certauth.log.SLF4JLogger"),
    JDK14LOGGER("net.certauth.log.JDK14Logger");

    private final String loggerImplClassName;

    LoggerImpl(String loggerClass) {
      this.loggerImplClassName = loggerClass;
    }

    public String getLoggerImplClassName() {
      return this.loggerImplClassName;
    }

    public static LoggerImpl fromString(String loggerImplClassName) {
      if (loggerImplClassName != null) {
        for (LoggerImpl imp : LoggerImpl.values()) {
          if (loggerImplClassName.equalsIgnoreCase(imp.getLoggerImplClassName())) {
            return imp;
          }
        }
      }
      return null;
    }
  }

  /**
   * @param clazz Class type that the logger is instantiated
   * @return An AuthLogger instance given the name of the class
   */
  public static AuthLogger getLogger(Class<?> clazz) {
    return getLogger(clazz.getName());
  }

  /**
   * @param name name to indicate the class (might be different with the class name) that the logger
   *     is instantiated
   * @return An AuthLogger instance given the name
   */
  public static AuthLogger getLogger(String name) {
    if (loggerImplementation == null) {
      LoggerImpl configured = LoggerImpl.fromString(systemGetProperty(LOGGER_IMPL_PROPERTY));

      // default to use java util logging
      loggerImplementation = configured != null ? configured : LoggerImpl.JDK14LOGGER;
    }

    switch (loggerImplementation) {
      case SLF4JLOGGER:
        return new SLF4JLogger(name);
      case JDK14LOGGER:
      default:
        return new JDK14Logger(name);
    }
  }

  static void reset() {
    loggerImplementation = null;
  }
}
