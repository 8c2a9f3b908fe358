package net.certauth.log;

import java.text.DateFormat;
import java.text.SimpleDateFormat;
import java.util.Date;
import java.util.TimeZone;
import java.util.logging.Formatter;
import java.util.logging.LogRecord;

/** Single-line formatter for records produced by {@link JDK14Logger}. */
public class AuthLogFormatter extends Formatter {
  public static final String CLASS_NAME_PREFIX = "net.certauth";

  private static final String SHORT_CLASS_NAME_PREFIX = "n.c";

  @Override
  public String format(LogRecord record) {
    String className = record.getSourceClassName();
    final String methodName = record.getSourceMethodName();
    if (className == null) {
      className = record.getLoggerName();
    } else if (className.startsWith(CLASS_NAME_PREFIX)) {
      className = SHORT_CLASS_NAME_PREFIX + className.substring(CLASS_NAME_PREFIX.length());
    }

    // SimpleDateFormat is not thread safe
    DateFormat df = new SimpleDateFormat("yyyy-MM-dd HH:mm:ss.SSS");
    df.setTimeZone(TimeZone.getTimeZone("UTC"));

    StringBuilder builder = new StringBuilder(256);
    builder.append(df.format(new Date(record.getMillis()))).append(" ");
    builder.append(className).append(" ");
    builder.append(record.getLevel()).append(" ");
    builder.append(methodName).append(" - ");
    builder.append(formatMessage(record));
    builder.append("\n");
    if (record.getThrown() != null) {
      builder.append(record.getThrown()).append("\n");
    }
    return builder.toString();
  }
}
