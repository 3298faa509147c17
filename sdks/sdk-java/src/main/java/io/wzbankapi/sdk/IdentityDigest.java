package io.wzbankapi.sdk;

import org.bouncycastle.crypto.digests.SM3Digest;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.math.ec.ECPoint;

import java.nio.charset.StandardCharsets;

/**
 * SM2 user-identity pre-hash:
 * {@code Z = SM3(ENTL || ID || a || b || Gx || Gy || Px || Py)}, where ENTL is the bit length of
 * the identity tag as two big-endian bytes. The signed digest is {@code SM3(Z || M)}.
 */
public final class IdentityDigest {
  public static final String DEFAULT_IDENTITY_TAG = "1234567812345678";

  private final ECDomainParameters domain;
  private final byte[] identityTag;

  public IdentityDigest(ECDomainParameters domain, byte[] identityTag) {
    if (domain == null) {
      throw new IllegalArgumentException("curve domain parameters are required");
    }
    if (identityTag == null || identityTag.length * 8 > 0xFFFF) {
      throw new IllegalArgumentException("identity tag must be present and shorter than 8192 bytes");
    }
    this.domain = domain;
    this.identityTag = identityTag.clone();
  }

  public static IdentityDigest sm2Default() {
    return new IdentityDigest(Sm2Keys.SM2P256V1, DEFAULT_IDENTITY_TAG.getBytes(StandardCharsets.US_ASCII));
  }

  public ECDomainParameters domain() {
    return domain;
  }

  public byte[] compute(ECPoint publicKey) {
    ECPoint g = domain.getG().normalize();
    ECPoint p = publicKey.normalize();
    int bits = identityTag.length * 8;

    SM3Digest sm3 = new SM3Digest();
    sm3.update((byte) (bits >>> 8));
    sm3.update((byte) bits);
    update(sm3, identityTag);
    update(sm3, domain.getCurve().getA().getEncoded());
    update(sm3, domain.getCurve().getB().getEncoded());
    update(sm3, g.getAffineXCoord().getEncoded());
    update(sm3, g.getAffineYCoord().getEncoded());
    update(sm3, p.getAffineXCoord().getEncoded());
    update(sm3, p.getAffineYCoord().getEncoded());

    byte[] out = new byte[sm3.getDigestSize()];
    sm3.doFinal(out, 0);
    return out;
  }

  public static byte[] messageDigest(byte[] z, byte[] message) {
    SM3Digest sm3 = new SM3Digest();
    update(sm3, z);
    update(sm3, message);
    byte[] out = new byte[sm3.getDigestSize()];
    sm3.doFinal(out, 0);
    return out;
  }

  private static void update(SM3Digest digest, byte[] bytes) {
    digest.update(bytes, 0, bytes.length);
  }
}
