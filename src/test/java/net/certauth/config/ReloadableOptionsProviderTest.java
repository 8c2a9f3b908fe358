package net.certauth.config;

import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import net.certauth.category.TestTags;
import net.certauth.core.chain.RevocationMode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag(TestTags.CONFIG)
class ReloadableOptionsProviderTest {

  @Test
  void shouldPublishNewSnapshot() throws Exception {
    CertificateAuthenticationOptions initial = CertificateAuthenticationOptions.defaults();
    CertificateAuthenticationOptions reloaded =
        initial.toBuilder().revocationMode(RevocationMode.NO_CHECK).build();
    ReloadableOptionsProvider provider = new ReloadableOptionsProvider(initial);

    assertSame(initial, provider.get());
    assertSame(initial, provider.update(reloaded));
    assertSame(reloaded, provider.get());
  }

  @Test
  void shouldRejectNullOptions() {
    assertThrows(IllegalArgumentException.class, () -> new ReloadableOptionsProvider(null));
    ReloadableOptionsProvider provider =
        new ReloadableOptionsProvider(CertificateAuthenticationOptions.defaults());
    assertThrows(IllegalArgumentException.class, () -> provider.update(null));
  }
}
