package net.certauth.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.cert.CRL;
import java.security.cert.Certificate;
import java.security.cert.CertificateFactory;
import java.security.cert.X509CRL;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.List;
import net.certauth.config.CertificateAuthenticationConfig.TrustProps;
import net.certauth.core.CertificateAuthenticationException;
import net.certauth.core.ErrorCode;
import net.certauth.core.chain.TrustMaterial;
import net.certauth.log.AuthLogger;
import net.certauth.log.AuthLoggerFactory;
import net.certauth.util.SystemUtil;

/** Loads the trust section of the config file into {@link TrustMaterial}. */
public class TrustMaterialLoader {
  private static final AuthLogger logger = AuthLoggerFactory.getLogger(TrustMaterialLoader.class);

  private static final String X509 = "X.509";

  private TrustMaterialLoader() {}

  /**
   * @param trustProps trust section, may be null
   * @return trust anchors of the configured key store (or the JVM defaults when no key store is
   *     configured) plus the configured intermediate certificates and CRLs
   * @throws CertificateAuthenticationException ({@link ErrorCode#TRUST_STORE_ERROR}) if a file
   *     cannot be read or parsed
   */
  public static TrustMaterial load(TrustProps trustProps)
      throws CertificateAuthenticationException {
    if (trustProps == null) {
      return TrustMaterial.systemDefault();
    }

    TrustMaterial anchors =
        SystemUtil.isNullOrEmpty(trustProps.getTrustStorePath())
            ? TrustMaterial.systemDefault()
            : TrustMaterial.fromKeyStore(
                loadKeyStore(
                    trustProps.getTrustStorePath(),
                    trustProps.getTrustStoreType(),
                    trustProps.getTrustStorePassword()));

    TrustMaterial.Builder builder =
        TrustMaterial.builder().addTrustedCertificates(anchors.getTrustedCertificates());
    if (!SystemUtil.isNullOrEmpty(trustProps.getIntermediateCertificatesPath())) {
      builder.addIntermediateCertificates(
          loadCertificates(trustProps.getIntermediateCertificatesPath()));
    }
    if (!SystemUtil.isNullOrEmpty(trustProps.getCrlPath())) {
      builder.addCrls(loadCrls(trustProps.getCrlPath()));
    }
    TrustMaterial material = builder.build();
    logger.debug(
        "Loaded {} trust anchors, {} intermediate certificates and {} CRLs",
        material.getTrustedCertificates().size(),
        material.getIntermediateCertificates().size(),
        material.getCrls().size());
    return material;
  }

  static KeyStore loadKeyStore(String path, String type, String password)
      throws CertificateAuthenticationException {
    String storeType = SystemUtil.isNullOrEmpty(type) ? KeyStore.getDefaultType() : type;
    try (InputStream in = Files.newInputStream(Paths.get(path))) {
      KeyStore keyStore = KeyStore.getInstance(storeType);
      keyStore.load(in, password == null ? null : password.toCharArray());
      logger.debug("Loaded {} trust store from {}", storeType, path);
      return keyStore;
    } catch (IOException | GeneralSecurityException e) {
      throw new CertificateAuthenticationException(
          e, ErrorCode.TRUST_STORE_ERROR, "trust store " + path + ": " + e.getMessage());
    }
  }

  /** Reads every PEM or DER certificate in the file. */
  static List<X509Certificate> loadCertificates(String path)
      throws CertificateAuthenticationException {
    try (InputStream in = Files.newInputStream(Paths.get(path))) {
      List<X509Certificate> certificates = new ArrayList<>();
      CertificateFactory factory = CertificateFactory.getInstance(X509);
      for (Certificate certificate : factory.generateCertificates(in)) {
        certificates.add((X509Certificate) certificate);
      }
      return certificates;
    } catch (IOException | GeneralSecurityException e) {
      throw new CertificateAuthenticationException(
          e, ErrorCode.TRUST_STORE_ERROR, "certificates " + path + ": " + e.getMessage());
    }
  }

  static List<X509CRL> loadCrls(String path) throws CertificateAuthenticationException {
    try (InputStream in = Files.newInputStream(Paths.get(path))) {
      List<X509CRL> crls = new ArrayList<>();
      for (CRL crl : CertificateFactory.getInstance(X509).generateCRLs(in)) {
        crls.add((X509CRL) crl);
      }
      return crls;
    } catch (IOException | GeneralSecurityException e) {
      throw new CertificateAuthenticationException(
          e, ErrorCode.TRUST_STORE_ERROR, "CRLs " + path + ": " + e.getMessage());
    }
  }
}
