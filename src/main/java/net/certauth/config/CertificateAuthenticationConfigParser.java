package net.certauth.config;

import static net.certauth.util.SystemUtil.systemGetEnv;
import static net.certauth.util.SystemUtil.systemGetProperty;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.File;
import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.nio.file.attribute.PosixFilePermission;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import net.certauth.config.CertificateAuthenticationConfig.AuthenticationProps;
import net.certauth.config.CertificateAuthenticationConfig.CommonProps;
import net.certauth.core.CertificateAuthenticationException;
import net.certauth.core.CertificateAuthenticator;
import net.certauth.core.CertificateType;
import net.certauth.core.ErrorCode;
import net.certauth.core.chain.PkixCertificateChainBuilder;
import net.certauth.core.chain.RevocationFlag;
import net.certauth.core.chain.RevocationMode;
import net.certauth.log.AuthLogLevel;
import net.certauth.log.AuthLogger;
import net.certauth.log.AuthLoggerFactory;
import net.certauth.log.JDK14Logger;
import net.certauth.util.SystemUtil;

public class CertificateAuthenticationConfigParser {
  private static final AuthLogger logger =
      AuthLoggerFactory.getLogger(CertificateAuthenticationConfigParser.class);
  public static final String CONFIG_FILE_NAME = "certauth_config.json";
  public static final String CONFIG_FILE_ENV_NAME = "CERTAUTH_CONFIG_FILE";

  private CertificateAuthenticationConfigParser() {}

  /**
   * Reads the config file. The file is searched in the following order: 1. configFilePath param.
   * 2. Environment variable CERTAUTH_CONFIG_FILE containing the full path to the file. 3. The
   * default file name (certauth_config.json) under the user home directory.
   *
   * @param configFilePath explicit path, may be null
   * @return the config, or null if no file was found
   * @throws IOException if the file cannot be read or is not valid JSON
   */
  public static CertificateAuthenticationConfig loadConfig(String configFilePath)
      throws IOException {
    String derivedConfigFilePath = null;
    if (!SystemUtil.isNullOrEmpty(configFilePath)) {
      logger.info("Using config file specified by the caller: {}", configFilePath);
      derivedConfigFilePath = configFilePath;
    } else if (!SystemUtil.isNullOrEmpty(systemGetEnv(CONFIG_FILE_ENV_NAME))) {
      String filePath = systemGetEnv(CONFIG_FILE_ENV_NAME);
      logger.info("Using config file specified from environment variable: {}", filePath);
      derivedConfigFilePath = filePath;
    } else {
      String homeDirectory = systemGetProperty("user.home");
      if (homeDirectory != null) {
        String userHomeFilePath = Paths.get(homeDirectory, CONFIG_FILE_NAME).toString();
        if (Files.exists(Paths.get(userHomeFilePath))) {
          logger.info("Using config file specified from home directory: {}", userHomeFilePath);
          derivedConfigFilePath = userHomeFilePath;
        }
      }
    }
    if (derivedConfigFilePath == null) {
      return null;
    }

    try {
      checkConfigFilePermissions(derivedConfigFilePath);

      ObjectMapper objectMapper = new ObjectMapper();
      CertificateAuthenticationConfig config =
          objectMapper.readValue(
              new File(derivedConfigFilePath), CertificateAuthenticationConfig.class);

      for (String unknownParam : config.getUnknownParamKeys()) {
        logger.warn("Unknown field from config: {}", unknownParam);
      }
      config.setConfigFilePath(derivedConfigFilePath);
      return config;
    } catch (IOException e) {
      throw new IOException(
          "Error while reading config file at location: " + derivedConfigFilePath, e);
    }
  }

  /**
   * Loads the options from the config file, falling back to the defaults when no file exists.
   *
   * @param configFilePath explicit path, may be null
   * @return options
   * @throws CertificateAuthenticationException if the file cannot be read or holds invalid values
   */
  public static CertificateAuthenticationOptions loadOptions(String configFilePath)
      throws CertificateAuthenticationException {
    CertificateAuthenticationConfig config = readConfig(configFilePath);
    if (config == null) {
      logger.debug("No certificate authentication config file found, using defaults");
      return CertificateAuthenticationOptions.defaults();
    }
    configureLogging(config.getCommonProps());
    return toOptions(config);
  }

  /**
   * Creates an authenticator builder with the options and trust material of the config file. When
   * no file exists the builder keeps its defaults.
   *
   * @param configFilePath explicit path, may be null
   * @return builder, hooks still to be set by the caller
   * @throws CertificateAuthenticationException if the file or the trust material cannot be loaded
   */
  public static CertificateAuthenticator.Builder newAuthenticatorBuilder(String configFilePath)
      throws CertificateAuthenticationException {
    CertificateAuthenticator.Builder builder = CertificateAuthenticator.builder();
    CertificateAuthenticationConfig config = readConfig(configFilePath);
    if (config == null) {
      logger.debug("No certificate authentication config file found, using defaults");
      return builder;
    }
    configureLogging(config.getCommonProps());
    return builder
        .options(toOptions(config))
        .chainBuilder(
            new PkixCertificateChainBuilder(TrustMaterialLoader.load(config.getTrustProps())));
  }

  private static CertificateAuthenticationConfig readConfig(String configFilePath)
      throws CertificateAuthenticationException {
    try {
      return loadConfig(configFilePath);
    } catch (IOException e) {
      throw new CertificateAuthenticationException(
          e, ErrorCode.INVALID_CONFIGURATION, e.getMessage());
    }
  }

  /**
   * Converts the authentication section into options. Absent values keep their defaults.
   *
   * @param config parsed config
   * @return options
   * @throws CertificateAuthenticationException if an enum name or a number is invalid
   */
  public static CertificateAuthenticationOptions toOptions(CertificateAuthenticationConfig config)
      throws CertificateAuthenticationException {
    CertificateAuthenticationOptions.Builder builder = CertificateAuthenticationOptions.builder();
    AuthenticationProps props = config == null ? null : config.getAuthenticationProps();
    if (props == null) {
      return builder.build();
    }

    if (props.getAllowedCertificateTypes() != null) {
      Set<CertificateType> types = EnumSet.noneOf(CertificateType.class);
      for (String type : props.getAllowedCertificateTypes()) {
        types.add(parseEnum(CertificateType.class, type, "allowed_certificate_types"));
      }
      builder.allowedCertificateTypes(types);
    }
    if (props.getRevocationFlag() != null) {
      builder.revocationFlag(
          parseEnum(RevocationFlag.class, props.getRevocationFlag(), "revocation_flag"));
    }
    if (props.getRevocationMode() != null) {
      builder.revocationMode(
          parseEnum(RevocationMode.class, props.getRevocationMode(), "revocation_mode"));
    }
    if (props.getValidateCertificateUse() != null) {
      builder.validateCertificateUse(props.getValidateCertificateUse());
    }
    if (props.getValidateValidityPeriod() != null) {
      builder.validateValidityPeriod(props.getValidateValidityPeriod());
    }
    if (props.getClaimsIssuer() != null) {
      builder.claimsIssuer(props.getClaimsIssuer());
    }
    if (props.getChainValidationTimeoutMs() != null) {
      builder.chainValidationTimeout(Duration.ofMillis(props.getChainValidationTimeoutMs()));
    }
    return builder.build();
  }

  /**
   * Turns on java.util.logging output for the library when the config has a log_level. A missing
   * log_path logs to the console.
   */
  static void configureLogging(CommonProps commonProps) throws CertificateAuthenticationException {
    if (commonProps == null || commonProps.getLogLevel() == null) {
      return;
    }
    AuthLogLevel level = AuthLogLevel.getLogLevel(commonProps.getLogLevel());
    String logPath =
        SystemUtil.isNullOrEmpty(commonProps.getLogPath())
            ? JDK14Logger.STDOUT
            : commonProps.getLogPath();
    logger.debug(
        "Reading values logLevel {} and logPath {} from client configuration", level, logPath);
    try {
      JDK14Logger.instantiateLogger(level.toJavaUtilLoggingLevel(), logPath);
    } catch (IOException e) {
      throw new CertificateAuthenticationException(
          e, ErrorCode.INVALID_CONFIGURATION, "log_path " + logPath + " is not writable");
    }
  }

  static <E extends Enum<E>> E parseEnum(Class<E> enumClass, String value, String key)
      throws CertificateAuthenticationException {
    String normalized = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
    try {
      return Enum.valueOf(enumClass, normalized);
    } catch (IllegalArgumentException e) {
      throw new CertificateAuthenticationException(
          e, ErrorCode.INVALID_CONFIGURATION, "unknown value " + value + " for " + key);
    }
  }

  private static void checkConfigFilePermissions(String derivedConfigFilePath) throws IOException {
    if (!FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
      return;
    }
    if (checkGroupOthersWritePermissions(derivedConfigFilePath)) {
      logger.warn(
          "Error due to other users having permission to modify the config file: {}",
          derivedConfigFilePath);
    }
  }

  static boolean checkGroupOthersWritePermissions(String configFilePath) throws IOException {
    Set<PosixFilePermission> permissions =
        Files.getPosixFilePermissions(Paths.get(configFilePath));
    return permissions.contains(PosixFilePermission.GROUP_WRITE)
        || permissions.contains(PosixFilePermission.OTHERS_WRITE);
  }
}
