package net.certauth.log;

import java.util.logging.Level;

/** Log levels accepted by the log_level entry of the configuration file. */
public enum AuthLogLevel {
  // OFF is highest level, no logs will be shown at this level.
  OFF(50, "OFF", Level.OFF),
  ERROR(40, "ERROR", Level.SEVERE),
  WARN(30, "WARN", Level.WARNING),
  INFO(20, "INFO", Level.INFO),
  DEBUG(10, "DEBUG", Level.FINE),
  TRACE(0, "TRACE", Level.FINEST);

  private final int levelInt;
  private final String levelStr;
  private final Level javaUtilLoggingLevel;

  AuthLogLevel(int levelInt, String levelStr, Level javaUtilLoggingLevel) {
    this.levelInt = levelInt;
    this.levelStr = levelStr;
    this.javaUtilLoggingLevel = javaUtilLoggingLevel;
  }

  public int getLevelInt() {
    return levelInt;
  }

  public Level toJavaUtilLoggingLevel() {
    return javaUtilLoggingLevel;
  }

  /**
   * Method to parse the input loglevel string and returns corresponding loglevel. This method uses
   * case in-sensitive matching.
   *
   * @param levelStr log level string
   * @return AuthLogLevel, OFF if the string is not a known level
   */
  public static AuthLogLevel getLogLevel(String levelStr) {
    for (AuthLogLevel level : AuthLogLevel.values()) {
      if (level.levelStr.equalsIgnoreCase(levelStr)) {
        return level;
      }
    }

    // Default is off.
    return AuthLogLevel.OFF;
  }
}
