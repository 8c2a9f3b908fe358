package net.certauth.log;

import static net.certauth.util.SystemUtil.systemGetProperty;

import java.io.IOException;
import java.text.MessageFormat;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Use java.util.logging to implements AuthLogger.
 *
 * <p>Log Level mapping from AuthLogger to java.util.logging: ERROR -- SEVERE WARN -- WARNING INFO
 * -- INFO DEBUG -- FINE TRACE -- FINEST
 */
public class JDK14Logger implements AuthLogger {
  public static final String STDOUT = "STDOUT";

  private static final String LOG_SIZE_PROPERTY = "net.certauth.log.size";
  private static final String LOG_COUNT_PROPERTY = "net.certauth.log.count";

  private static boolean isLoggerInit = false;

  private final Logger jdkLogger;

  private final Set<String> logMethods =
      new HashSet<>(Arrays.asList("debug", "error", "info", "trace", "warn"));

  public JDK14Logger(String name) {
    this.jdkLogger = Logger.getLogger(name);
  }

  public boolean isDebugEnabled() {
    return this.jdkLogger.isLoggable(Level.FINE);
  }

  public boolean isErrorEnabled() {
    return this.jdkLogger.isLoggable(Level.SEVERE);
  }

  public boolean isInfoEnabled() {
    return this.jdkLogger.isLoggable(Level.INFO);
  }

  public boolean isWarnEnabled() {
    return this.jdkLogger.isLoggable(Level.WARNING);
  }

  public void debug(String msg, Object... arguments) {
    logInternal(Level.FINE, msg, arguments);
  }

  public void error(String msg, Object... arguments) {
    logInternal(Level.SEVERE, msg, arguments);
  }

  public void error(String msg, Throwable t) {
    logInternal(Level.SEVERE, msg, t);
  }

  public void info(String msg, Object... arguments) {
    logInternal(Level.INFO, msg, arguments);
  }

  public void trace(String msg, Object... arguments) {
    logInternal(Level.FINEST, msg, arguments);
  }

  public void warn(String msg, Object... arguments) {
    logInternal(Level.WARNING, msg, arguments);
  }

  private void logInternal(Level level, String msg, Object... arguments) {
    if (jdkLogger.isLoggable(level)) {
      String[] source = findSourceInStack();
      String message;
      try {
        message = MessageFormat.format(refactorString(msg), evaluateLambdaArgs(arguments));
      } catch (IllegalArgumentException e) {
        message = "Unable to format msg: " + msg;
      }
      jdkLogger.logp(level, source[0], source[1], message);
    }
  }

  private void logInternal(Level level, String msg, Throwable t) {
    if (jdkLogger.isLoggable(level)) {
      String[] source = findSourceInStack();
      jdkLogger.logp(level, source[0], source[1], msg, t);
    }
  }

  public static void addHandler(Handler handler) {
    Logger.getLogger(AuthLogFormatter.CLASS_NAME_PREFIX).addHandler(handler);
  }

  public static void removeHandler(Handler handler) {
    Logger.getLogger(AuthLogFormatter.CLASS_NAME_PREFIX).removeHandler(handler);
  }

  public static void setUseParentHandlers(boolean value) {
    Logger.getLogger(AuthLogFormatter.CLASS_NAME_PREFIX).setUseParentHandlers(value);
  }

  public static void setLevel(Level level) {
    Logger.getLogger(AuthLogFormatter.CLASS_NAME_PREFIX).setLevel(level);
  }

  public static Level getLevel() {
    return Logger.getLogger(AuthLogFormatter.CLASS_NAME_PREFIX).getLevel();
  }

  /**
   * Enables logging for the library through the log_level and log_path entries of the
   * configuration file.
   *
   * @param level log level
   * @param logPath log path, or {@link #STDOUT} to log to the console
   * @throws IOException if there is an error writing to the log
   */
  public static synchronized void instantiateLogger(Level level, String logPath)
      throws IOException {
    if (!isLoggerInit) {
      loggerInit(level, logPath);
      isLoggerInit = true;
    }
  }

  /**
   * Since we use SLF4J ways of formatting string we need to refactor message string if we have
   * arguments. For example, in slf4j, this string can be formatted with 2 arguments
   *
   * <p>ex.1: Certificate {} failed with {}
   *
   * <p>However, in java.util.logging, to achieve formatted message, the same string should be
   * converted to
   *
   * <p>ex.2: Certificate {0} failed with {1}
   *
   * <p>This method will convert string in ex.1 to ex.2
   *
   * @param original original string
   * @return refactored string
   */
  private String refactorString(String original) {
    StringBuilder sb = new StringBuilder();
    int argCount = 0;
    for (int i = 0; i < original.length(); i++) {
      if (original.charAt(i) == '{' && i < original.length() - 1 && original.charAt(i + 1) == '}') {
        sb.append(String.format("{%d}", argCount));
        argCount++;
        i++;
      } else if (original.charAt(i) == '\'') {
        // MessageFormat treats single quotes as escape characters
        sb.append("''");
      } else {
        sb.append(original.charAt(i));
      }
    }
    return sb.toString();
  }

  /**
   * Used to find the index of the source class/method in current stack This method will locate the
   * source as the first method after logMethods
   *
   * @return an array of size two, first element is className and second is methodName
   */
  private String[] findSourceInStack() {
    StackTraceElement[] stackTraces = Thread.currentThread().getStackTrace();
    String[] results = new String[2];
    for (int i = 0; i < stackTraces.length; i++) {
      if (logMethods.contains(stackTraces[i].getMethodName())) {
        for (int j = i; j < stackTraces.length; j++) {
          if (!logMethods.contains(stackTraces[j].getMethodName())) {
            results[0] = stackTraces[j].getClassName();
            results[1] = stackTraces[j].getMethodName();
            return results;
          }
        }
      }
    }
    return results;
  }

  private static void loggerInit(Level level, String outputPath) throws IOException {
    JDK14Logger.setLevel(level);

    if (STDOUT.equalsIgnoreCase(outputPath)) {
      ConsoleHandler consoleHandler = new ConsoleHandler();
      consoleHandler.setLevel(level);
      consoleHandler.setFormatter(new AuthLogFormatter());
      JDK14Logger.addHandler(consoleHandler);
    } else {
      // default log size to 100 MB, rotated over 2 files
      int logSize = parseIntOrDefault(systemGetProperty(LOG_SIZE_PROPERTY), 100000000);
      int logCount = parseIntOrDefault(systemGetProperty(LOG_COUNT_PROPERTY), 2);

      FileHandler fileHandler = new FileHandler(outputPath, logSize, logCount, true);
      fileHandler.setFormatter(new AuthLogFormatter());
      fileHandler.setLevel(level);
      JDK14Logger.addHandler(fileHandler);
    }
  }

  private static int parseIntOrDefault(String value, int defaultValue) {
    if (value == null) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException ex) {
      return defaultValue;
    }
  }

  private static Object[] evaluateLambdaArgs(Object... args) {
    final Object[] result = new Object[args.length];

    for (int i = 0; i < args.length; i++) {
      result[i] = args[i] instanceof ArgSupplier ? ((ArgSupplier) args[i]).get() : args[i];
    }

    return result;
  }
}
