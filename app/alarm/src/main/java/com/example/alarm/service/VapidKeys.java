/*
 * Where: Alarm service layer
 * What: Generates and encodes P-256 VAPID key pairs in the form alarm.push.* expects
 * Why: Operators need a key pair before the Web Push transport can sign anything
 */
package com.example.alarm.service;

import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.Security;
import java.security.interfaces.ECPrivateKey;
import java.security.interfaces.ECPublicKey;
import java.security.spec.ECGenParameterSpec;
import java.security.spec.ECPoint;
import java.util.Base64;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.util.BigIntegers;

/**
 * VAPID key helper.
 *
 * <p>Run {@link #main(String[])} to print a fresh pair as {@code VAPID_PUBLIC_KEY} and
 * {@code VAPID_PRIVATE_KEY} lines, e.g. from the packaged jar:
 *
 * <pre>
 * java -cp alarm.jar -Dloader.main=com.example.alarm.service.VapidKeys \
 *     org.springframework.boot.loader.launch.PropertiesLauncher
 * </pre>
 *
 * <p>The public key is the uncompressed curve point and the private key the raw scalar, both
 * base64url without padding.
 */
public final class VapidKeys {

  private static final String CURVE = "secp256r1";
  private static final int COORDINATE_LENGTH = 32;
  private static final byte UNCOMPRESSED_POINT = 0x04;

  public record Pair(String publicKey, String privateKey) {}

  private VapidKeys() {}

  public static Pair generate() {
    final KeyPair keyPair = generateKeyPair();
    return new Pair(
        encodePublicKey((ECPublicKey) keyPair.getPublic()),
        encodePrivateKey((ECPrivateKey) keyPair.getPrivate()));
  }

  public static KeyPair generateKeyPair() {
    ensureProvider();
    try {
      final KeyPairGenerator generator =
          KeyPairGenerator.getInstance("EC", BouncyCastleProvider.PROVIDER_NAME);
      generator.initialize(new ECGenParameterSpec(CURVE));
      return generator.generateKeyPair();
    } catch (GeneralSecurityException ex) {
      throw new IllegalStateException("P-256 key generation is unavailable", ex);
    }
  }

  public static String encodePublicKey(ECPublicKey publicKey) {
    final ECPoint point = publicKey.getW();
    final byte[] encoded = new byte[1 + 2 * COORDINATE_LENGTH];
    encoded[0] = UNCOMPRESSED_POINT;
    System.arraycopy(
        BigIntegers.asUnsignedByteArray(COORDINATE_LENGTH, point.getAffineX()), 0, encoded, 1, COORDINATE_LENGTH);
    System.arraycopy(
        BigIntegers.asUnsignedByteArray(COORDINATE_LENGTH, point.getAffineY()),
        0,
        encoded,
        1 + COORDINATE_LENGTH,
        COORDINATE_LENGTH);
    return base64Url(encoded);
  }

  public static String encodePrivateKey(ECPrivateKey privateKey) {
    return base64Url(BigIntegers.asUnsignedByteArray(COORDINATE_LENGTH, privateKey.getS()));
  }

  /** Key decoding and payload encryption in the web-push library look the provider up by name. */
  static void ensureProvider() {
    if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
      Security.addProvider(new BouncyCastleProvider());
    }
  }

  private static String base64Url(byte[] bytes) {
    return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
  }

  public static void main(String[] args) {
    final Pair pair = generate();
    System.out.println("VAPID_PUBLIC_KEY=" + pair.publicKey());
    System.out.println("VAPID_PRIVATE_KEY=" + pair.privateKey());
  }
}
