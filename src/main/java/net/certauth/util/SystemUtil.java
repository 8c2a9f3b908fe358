package net.certauth.util;

import net.certauth.log.AuthLogger;
import net.certauth.log.AuthLoggerFactory;

public class SystemUtil {
  private SystemUtil() {}

  /**
   * System.getProperty wrapper. If System.getProperty raises an SecurityException, it is ignored
   * and returns null.
   *
   * @param property name of the system property
   * @return the value of the system property
   */
  public static String systemGetProperty(String property) {
    try {
      return System.getProperty(property);
    } catch (SecurityException ex) {
      // logger is not used here, the logger factory itself reads system properties
      return null;
    }
  }

  /**
   * System.getenv wrapper. If System.getenv raises an SecurityException, it is ignored and returns
   * null.
   *
   * @param env name of the environment variable
   * @return the value of the environment variable
   */
  public static String systemGetEnv(String env) {
    try {
      return System.getenv(env);
    } catch (SecurityException ex) {
      AuthLogger logger = AuthLoggerFactory.getLogger(SystemUtil.class);
      logger.debug(
          "Failed to get environment variable {}. Security exception raised: {}",
          env,
          ex.getMessage());
    }
    return null;
  }

  public static boolean isNullOrEmpty(String str) {
    return str == null || str.isEmpty();
  }

  public static boolean isNullOrBlank(String str) {
    return str == null || str.trim().isEmpty();
  }
}
