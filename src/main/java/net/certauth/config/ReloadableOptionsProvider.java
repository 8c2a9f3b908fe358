package net.certauth.config;

import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import net.certauth.log.AuthLogger;
import net.certauth.log.AuthLoggerFactory;

/**
 * Holds the current options snapshot. Readers get whichever snapshot was published last; an
 * attempt already in progress keeps the snapshot it started with.
 */
public class ReloadableOptionsProvider implements Supplier<CertificateAuthenticationOptions> {
  private static final AuthLogger logger =
      AuthLoggerFactory.getLogger(ReloadableOptionsProvider.class);

  private final AtomicReference<CertificateAuthenticationOptions> current;

  public ReloadableOptionsProvider(CertificateAuthenticationOptions initial) {
    if (initial == null) {
      throw new IllegalArgumentException("Initial options cannot be null");
    }
    this.current = new AtomicReference<>(initial);
  }

  @Override
  public CertificateAuthenticationOptions get() {
    return current.get();
  }

  /**
   * Publishes a new snapshot.
   *
   * @param options new options
   * @return the snapshot that was replaced
   */
  public CertificateAuthenticationOptions update(CertificateAuthenticationOptions options) {
    if (options == null) {
      throw new IllegalArgumentException("Options cannot be null");
    }
    CertificateAuthenticationOptions previous = current.getAndSet(options);
    logger.info("Certificate authentication options reloaded: {}", options);
    return previous;
  }
}
