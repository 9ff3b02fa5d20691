package com.example.alarm.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import java.util.Base64;
import nl.martijndwars.webpush.PushService;
import org.junit.jupiter.api.Test;

class VapidKeysTest {

  @Test
  void generatesRawP256KeysInBase64Url() {
    final VapidKeys.Pair pair = VapidKeys.generate();

    final byte[] publicKey = Base64.getUrlDecoder().decode(pair.publicKey());
    assertThat(publicKey).hasSize(65);
    assertThat(publicKey[0]).isEqualTo((byte) 0x04);
    assertThat(Base64.getUrlDecoder().decode(pair.privateKey())).hasSize(32);
    assertThat(pair.publicKey()).doesNotContain("=", "+", "/");
  }

  @Test
  void generatedPairIsAcceptedAsSigningIdentity() {
    final VapidKeys.Pair pair = VapidKeys.generate();

    assertThatCode(() -> new PushService(pair.publicKey(), pair.privateKey(), "mailto:admin@example.com"))
        .doesNotThrowAnyException();
  }

  @Test
  void everyCallGivesANewPair() {
    assertThat(VapidKeys.generate()).isNotEqualTo(VapidKeys.generate());
  }
}
