package net.certauth.core.chain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.security.cert.CertPathValidatorException;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import net.certauth.category.TestTags;
import net.certauth.core.CertificateAuthenticationException;
import net.certauth.core.CertificateGeneratorUtil;
import net.certauth.core.ErrorCode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag(TestTags.CHAIN)
class ChainValidatorTest {
  private static X509Certificate certificate;

  private CertificateChainBuilder chainBuilder;
  private ExecutorService executor;
  private ChainValidator validator;
  private final ChainPolicy policy = ChainPolicy.builder().build();

  @BeforeAll
  static void setUpAll() throws Exception {
    certificate = new CertificateGeneratorUtil().createClientCertificate("CN=chain.example.com");
  }

  @BeforeEach
  void setUp() {
    chainBuilder = mock(CertificateChainBuilder.class);
    executor = Executors.newCachedThreadPool();
    validator = new ChainValidator(chainBuilder, executor);
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  @Test
  void shouldReturnValidResult() throws Exception {
    when(chainBuilder.build(certificate, policy)).thenReturn(ChainValidationResult.valid());

    ChainValidationResult result = validator.validate(certificate, policy, Duration.ofSeconds(5));

    assertTrue(result.isValid());
  }

  @Test
  void shouldKeepEveryStatusInOrder() throws Exception {
    List<ChainStatus> statuses =
        Arrays.asList(
            new ChainStatus(ChainStatusFlag.NOT_TIME_VALID, "expired"),
            new ChainStatus(ChainStatusFlag.UNTRUSTED_ROOT, "unknown root"));
    when(chainBuilder.build(certificate, policy))
        .thenReturn(ChainValidationResult.invalid(statuses));

    ChainValidationResult result = validator.validate(certificate, policy, Duration.ofSeconds(5));

    assertEquals(statuses, result.getStatuses());
  }

  @Test
  void shouldReportTimeoutAndCancelBuild() throws Exception {
    CountDownLatch interrupted = new CountDownLatch(1);
    when(chainBuilder.build(any(), any()))
        .thenAnswer(
            invocation -> {
              try {
                Thread.sleep(60_000);
              } catch (InterruptedException e) {
                interrupted.countDown();
              }
              return ChainValidationResult.valid();
            });

    ChainValidationResult result =
        validator.validate(certificate, policy, Duration.ofMillis(100));

    assertTrue(result.hasStatus(ChainStatusFlag.VALIDATION_TIMED_OUT));
    assertEquals(1, result.getStatuses().size());
    assertTrue(interrupted.await(10, TimeUnit.SECONDS), "Build should have been cancelled");
  }

  @Test
  void shouldWrapBuilderFailure() throws Exception {
    CertPathValidatorException failure = new CertPathValidatorException("no provider");
    when(chainBuilder.build(certificate, policy)).thenThrow(failure);

    CertificateAuthenticationException e =
        assertThrows(
            CertificateAuthenticationException.class,
            () -> validator.validate(certificate, policy, Duration.ofSeconds(5)));

    assertEquals(ErrorCode.CHAIN_BUILD_ERROR, e.getErrorCode());
    assertSame(failure, e.getCause());
  }

  @Test
  void shouldFailWhenCallerIsInterrupted() throws Exception {
    when(chainBuilder.build(any(), any()))
        .thenAnswer(
            invocation -> {
              Thread.sleep(60_000);
              return ChainValidationResult.valid();
            });

    Thread.currentThread().interrupt();
    try {
      CertificateAuthenticationException e =
          assertThrows(
              CertificateAuthenticationException.class,
              () -> validator.validate(certificate, policy, Duration.ofSeconds(30)));
      assertEquals(ErrorCode.INTERRUPTED, e.getErrorCode());
      assertTrue(Thread.currentThread().isInterrupted(), "Interrupt flag should be restored");
    } finally {
      Thread.interrupted();
    }
  }

  @Test
  void shouldNotQueueConcurrentBuildsBehindEachOther() throws Exception {
    when(chainBuilder.build(any(), any()))
        .thenAnswer(
            invocation -> {
              Thread.sleep(400);
              return ChainValidationResult.valid();
            });
    ChainValidator sharedValidator = new ChainValidator(chainBuilder);
    int callers = 12;
    ExecutorService requests = Executors.newFixedThreadPool(callers);
    try {
      List<Future<ChainValidationResult>> results = new ArrayList<>();
      for (int i = 0; i < callers; i++) {
        results.add(
            requests.submit(
                () -> sharedValidator.validate(certificate, policy, Duration.ofMillis(2000))));
      }

      for (Future<ChainValidationResult> result : results) {
        assertTrue(result.get(10, TimeUnit.SECONDS).isValid());
      }
    } finally {
      requests.shutdownNow();
    }
  }
}
