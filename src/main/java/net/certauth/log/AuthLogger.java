package net.certauth.log;

/**
 * Logger used by every class of the library. Messages use {@code {}} placeholders; an argument
 * that is expensive to compute can be passed as an {@link ArgSupplier}, which is only evaluated
 * when the level is enabled.
 */
public interface AuthLogger {
  boolean isDebugEnabled();

  boolean isErrorEnabled();

  boolean isInfoEnabled();

  boolean isWarnEnabled();

  void debug(String msg, Object... arguments);

  void error(String msg, Object... arguments);

  /** Logs at ERROR level with the stack trace of {@code t}. */
  void error(String msg, Throwable t);

  void info(String msg, Object... arguments);

  void trace(String msg, Object... arguments);

  void warn(String msg, Object... arguments);
}
