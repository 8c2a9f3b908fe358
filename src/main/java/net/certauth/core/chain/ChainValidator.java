package net.certauth.core.chain;

import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import net.certauth.core.CertificateAuthenticationException;
import net.certauth.core.ErrorCode;
import net.certauth.log.AuthLogger;
import net.certauth.log.AuthLoggerFactory;
import net.certauth.util.CertificateUtil;

/**
 * Runs one build attempt of a {@link CertificateChainBuilder} under a time limit and reports its
 * chain status entries.
 */
public class ChainValidator {
  private static final AuthLogger logger = AuthLoggerFactory.getLogger(ChainValidator.class);

  private final CertificateChainBuilder chainBuilder;
  private final ExecutorService executor;

  public ChainValidator(CertificateChainBuilder chainBuilder) {
    this(chainBuilder, DefaultExecutorHolder.EXECUTOR);
  }

  public ChainValidator(CertificateChainBuilder chainBuilder, ExecutorService executor) {
    if (chainBuilder == null) {
      throw new IllegalArgumentException("Chain builder cannot be null");
    }
    if (executor == null) {
      throw new IllegalArgumentException("Executor cannot be null");
    }
    this.chainBuilder = chainBuilder;
    this.executor = executor;
  }

  /**
   * Builds and validates the chain of {@code certificate}.
   *
   * @param certificate end certificate
   * @param policy chain policy for this attempt
   * @param timeout upper bound for the build
   * @return the validation result; {@link ChainStatusFlag#VALIDATION_TIMED_OUT} if the build did
   *     not finish in time
   * @throws CertificateAuthenticationException if the builder fails or the calling thread is
   *     interrupted
   */
  public ChainValidationResult validate(
      X509Certificate certificate, ChainPolicy policy, Duration timeout)
      throws CertificateAuthenticationException {
    String thumbprint = CertificateUtil.sha256Thumbprint(certificate);
    Future<ChainValidationResult> future =
        executor.submit(() -> chainBuilder.build(certificate, policy));

    ChainValidationResult result;
    try {
      result = future.get(Math.max(0L, timeout.toMillis()), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      logger.warn(
          "Chain validation of certificate {} ({}) timed out after {} ms",
          certificate.getSubjectX500Principal(),
          thumbprint,
          timeout.toMillis());
      return ChainValidationResult.invalid(
          ChainStatusFlag.VALIDATION_TIMED_OUT,
          "Chain validation did not complete within " + timeout.toMillis() + " ms");
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new CertificateAuthenticationException(e, ErrorCode.INTERRUPTED);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      logger.debug("Chain builder failed for {}: {}", thumbprint, cause.getMessage());
      throw new CertificateAuthenticationException(
          cause, ErrorCode.CHAIN_BUILD_ERROR, cause.getMessage());
    }

    if (result == null) {
      throw new CertificateAuthenticationException(
          ErrorCode.CHAIN_BUILD_ERROR, "chain builder returned no result");
    }
    if (!result.isValid()) {
      logger.warn(
          "Certificate validation failed, subject was {}. Thumbprint {}",
          certificate.getSubjectX500Principal(),
          thumbprint);
      for (ChainStatus status : result.getStatuses()) {
        logger.warn(
            "Certificate {} failed validation: {} {}",
            thumbprint,
            status.getStatus(),
            status.getDetail());
      }
    }
    return result;
  }

  /** Starts every build on its own thread. Idle threads are released after 30 seconds. */
  private static class DefaultExecutorHolder {
    private static final ExecutorService EXECUTOR = createExecutor();

    private static ExecutorService createExecutor() {
      ThreadFactory daemonThreadFactory =
          r -> {
            Thread thread = Executors.defaultThreadFactory().newThread(r);
            thread.setName("certauth-chain-builder-" + thread.getId());
            thread.setDaemon(true);
            return thread;
          };
      return new ThreadPoolExecutor(
          0, // core size
          Integer.MAX_VALUE, // max size
          30L, // keep alive time
          TimeUnit.SECONDS,
          new SynchronousQueue<>(), // hand-off, no waiting queue
          daemonThreadFactory);
    }
  }
}
