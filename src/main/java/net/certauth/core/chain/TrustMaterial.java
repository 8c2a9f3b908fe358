package net.certauth.core.chain;

import java.security.KeyStore;
import java.security.KeyStoreException;
import java.security.NoSuchAlgorithmException;
import java.security.cert.Certificate;
import java.security.cert.X509CRL;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Enumeration;
import java.util.List;
import javax.net.ssl.TrustManager;
import javax.net.ssl.TrustManagerFactory;
import javax.net.ssl.X509TrustManager;
import net.certauth.core.CertificateAuthenticationException;
import net.certauth.core.ErrorCode;
import net.certauth.log.AuthLogger;
import net.certauth.log.AuthLoggerFactory;

/**
 * Trusted roots, intermediate certificates and local CRLs used by {@link
 * PkixCertificateChainBuilder}.
 */
public final class TrustMaterial {
  private static final AuthLogger logger = AuthLoggerFactory.getLogger(TrustMaterial.class);

  private final List<X509Certificate> trustedCertificates;
  private final List<X509Certificate> intermediateCertificates;
  private final List<X509CRL> crls;

  private TrustMaterial(Builder builder) {
    this.trustedCertificates =
        Collections.unmodifiableList(new ArrayList<>(builder.trustedCertificates));
    this.intermediateCertificates =
        Collections.unmodifiableList(new ArrayList<>(builder.intermediateCertificates));
    this.crls = Collections.unmodifiableList(new ArrayList<>(builder.crls));
  }

  public List<X509Certificate> getTrustedCertificates() {
    return trustedCertificates;
  }

  public List<X509Certificate> getIntermediateCertificates() {
    return intermediateCertificates;
  }

  public List<X509CRL> getCrls() {
    return crls;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Trust anchors of the JVM default trust manager.
   *
   * @return trust material with the accepted issuers of the default trust manager
   * @throws CertificateAuthenticationException if the default trust manager cannot be initialized
   */
  public static TrustMaterial systemDefault() throws CertificateAuthenticationException {
    try {
      TrustManagerFactory factory =
          TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
      factory.init((KeyStore) null);

      for (TrustManager tm : factory.getTrustManagers()) {
        if (tm instanceof X509TrustManager) {
          X509Certificate[] accepted = ((X509TrustManager) tm).getAcceptedIssuers();
          logger.debug("Loaded {} trust anchors from the default trust manager", accepted.length);
          return builder().addTrustedCertificates(Arrays.asList(accepted)).build();
        }
      }
      throw new CertificateAuthenticationException(
          ErrorCode.TRUST_STORE_ERROR, "No X509TrustManager found in default trust managers");
    } catch (NoSuchAlgorithmException | KeyStoreException ex) {
      throw new CertificateAuthenticationException(
          ex, ErrorCode.TRUST_STORE_ERROR, "Failed to initialize default trust manager");
    }
  }

  /**
   * Trust anchors from every certificate entry of a key store.
   *
   * @param keyStore loaded key store
   * @return trust material
   * @throws CertificateAuthenticationException if the key store cannot be read
   */
  public static TrustMaterial fromKeyStore(KeyStore keyStore)
      throws CertificateAuthenticationException {
    Builder builder = builder();
    try {
      Enumeration<String> aliases = keyStore.aliases();
      while (aliases.hasMoreElements()) {
        String alias = aliases.nextElement();
        Certificate certificate = keyStore.getCertificate(alias);
        if (certificate instanceof X509Certificate) {
          builder.addTrustedCertificate((X509Certificate) certificate);
        } else {
          logger.debug("Skipping key store entry {} without an X.509 certificate", alias);
        }
      }
    } catch (KeyStoreException ex) {
      throw new CertificateAuthenticationException(
          ex, ErrorCode.TRUST_STORE_ERROR, ex.getMessage());
    }
    return builder.build();
  }

  public static class Builder {
    private final List<X509Certificate> trustedCertificates = new ArrayList<>();
    private final List<X509Certificate> intermediateCertificates = new ArrayList<>();
    private final List<X509CRL> crls = new ArrayList<>();

    public Builder addTrustedCertificate(X509Certificate certificate) {
      this.trustedCertificates.add(certificate);
      return this;
    }

    public Builder addTrustedCertificates(Collection<X509Certificate> certificates) {
      this.trustedCertificates.addAll(certificates);
      return this;
    }

    public Builder addIntermediateCertificate(X509Certificate certificate) {
      this.intermediateCertificates.add(certificate);
      return this;
    }

    public Builder addIntermediateCertificates(Collection<X509Certificate> certificates) {
      this.intermediateCertificates.addAll(certificates);
      return this;
    }

    public Builder addCrl(X509CRL crl) {
      this.crls.add(crl);
      return this;
    }

    public Builder addCrls(Collection<X509CRL> crls) {
      this.crls.addAll(crls);
      return this;
    }

    public TrustMaterial build() {
      return new TrustMaterial(this);
    }
  }
}
