package io.wzbankapi.sdk;

import org.bouncycastle.asn1.gm.GMNamedCurves;
import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.math.ec.FixedPointCombMultiplier;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;

import java.math.BigInteger;
import java.util.Locale;

public final class Sm2Keys {
  private Sm2Keys() {}

  private static final X9ECParameters SM2_PARAMS = GMNamedCurves.getByName("sm2p256v1");

  public static final ECDomainParameters SM2P256V1 = new ECDomainParameters(
      SM2_PARAMS.getCurve(),
      SM2_PARAMS.getG(),
      SM2_PARAMS.getN(),
      SM2_PARAMS.getH()
  );

  public static BigInteger parsePrivateKey(String hex) {
    return parsePrivateKey(hex, SM2P256V1);
  }

  public static BigInteger parsePrivateKey(String hex, ECDomainParameters domain) {
    if (isBlank(hex)) {
      throw new ConfigException("SM2 private key is required");
    }
    BigInteger d;
    try {
      d = new BigInteger(1, Hex.decodeStrict(hex.trim()));
    } catch (DecoderException e) {
      throw new ConfigException("SM2 private key is not valid hex", e);
    }
    // d + 1 must be invertible mod n, so n - 1 is excluded as well
    if (d.signum() <= 0 || d.compareTo(domain.getN().subtract(BigInteger.ONE)) >= 0) {
      throw new ConfigException("SM2 private key is out of range");
    }
    return d;
  }

  public static ECPoint derivePublicKey(BigInteger privateKey) {
    return derivePublicKey(privateKey, SM2P256V1);
  }

  public static ECPoint derivePublicKey(BigInteger privateKey, ECDomainParameters domain) {
    return new FixedPointCombMultiplier().multiply(domain.getG(), privateKey).normalize();
  }

  /** Accepts {@code 04||X||Y}, bare {@code X||Y} or compressed {@code 02/03||X}. */
  public static ECPoint decodePublicKey(String hex) {
    return decodePublicKey(hex, SM2P256V1);
  }

  public static ECPoint decodePublicKey(String hex, ECDomainParameters domain) {
    if (isBlank(hex)) {
      throw new ConfigException("SM2 public key is required");
    }
    try {
      byte[] raw = Hex.decodeStrict(hex.trim());
      int fieldBytes = fieldLength(domain);
      if (raw.length == fieldBytes * 2) {
        byte[] prefixed = new byte[raw.length + 1];
        prefixed[0] = 0x04;
        System.arraycopy(raw, 0, prefixed, 1, raw.length);
        raw = prefixed;
      }
      ECPoint point = domain.getCurve().decodePoint(raw).normalize();
      if (point.isInfinity() || !point.isValid()) {
        throw new ConfigException("SM2 public key is not a point on the curve");
      }
      return point;
    } catch (DecoderException | IllegalArgumentException e) {
      throw new ConfigException("Invalid SM2 public key", e);
    }
  }

  public static String encodePublicKey(ECPoint point) {
    return Hex.toHexString(point.normalize().getEncoded(false)).toUpperCase(Locale.ROOT);
  }

  static int fieldLength(ECDomainParameters domain) {
    return (domain.getCurve().getFieldSize() + 7) / 8;
  }

  private static boolean isBlank(String value) {
    return value == null || value.trim().isEmpty();
  }
}
