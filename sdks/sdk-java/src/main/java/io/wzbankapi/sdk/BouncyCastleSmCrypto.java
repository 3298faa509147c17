package io.wzbankapi.sdk;

import org.bouncycastle.asn1.ASN1Encoding;
import org.bouncycastle.asn1.ASN1Integer;
import org.bouncycastle.asn1.ASN1Sequence;
import org.bouncycastle.crypto.BufferedBlockCipher;
import org.bouncycastle.crypto.DataLengthException;
import org.bouncycastle.crypto.InvalidCipherTextException;
import org.bouncycastle.crypto.engines.SM4Engine;
import org.bouncycastle.crypto.modes.CBCBlockCipher;
import org.bouncycastle.crypto.paddings.PKCS7Padding;
import org.bouncycastle.crypto.paddings.PaddedBufferedBlockCipher;
import org.bouncycastle.crypto.params.ECDomainParameters;
import org.bouncycastle.crypto.params.KeyParameter;
import org.bouncycastle.crypto.params.ParametersWithIV;
import org.bouncycastle.crypto.signers.DSAKCalculator;
import org.bouncycastle.crypto.signers.RandomDSAKCalculator;
import org.bouncycastle.crypto.signers.StandardDSAEncoding;
import org.bouncycastle.math.ec.ECAlgorithms;
import org.bouncycastle.math.ec.ECMultiplier;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.math.ec.FixedPointCombMultiplier;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;

import java.io.IOException;
import java.math.BigInteger;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Locale;
import java.util.function.Supplier;

public final class BouncyCastleSmCrypto implements SmCrypto {
  private static final int SM4_BLOCK_BYTES = 16;

  private final IdentityDigest identityDigest;
  private final ECDomainParameters domain;
  private final BigInteger privateKey;
  private final ECPoint publicKey;
  private final byte[] signerZ;
  private final ECPoint bankPublicKey;
  private final byte[] bankZ;
  private final byte[] sm4Key;
  private final byte[] sm4Iv;
  private final Supplier<DSAKCalculator> nonces;
  private final SecureRandom random;

  public BouncyCastleSmCrypto(String privateKeyHex, String bankPublicKeyHex, String sm4KeyHex, String sm4IvHex) {
    this(IdentityDigest.sm2Default(), privateKeyHex, bankPublicKeyHex, sm4KeyHex, sm4IvHex,
        RandomDSAKCalculator::new, new SecureRandom());
  }

  public BouncyCastleSmCrypto(
      IdentityDigest identityDigest,
      String privateKeyHex,
      String bankPublicKeyHex,
      String sm4KeyHex,
      String sm4IvHex,
      Supplier<DSAKCalculator> nonces,
      SecureRandom random
  ) {
    this.identityDigest = identityDigest;
    this.domain = identityDigest.domain();
    this.nonces = nonces;
    this.random = random;

    if (privateKeyHex != null) {
      this.privateKey = Sm2Keys.parsePrivateKey(privateKeyHex, domain);
      this.publicKey = Sm2Keys.derivePublicKey(privateKey, domain);
      this.signerZ = identityDigest.compute(publicKey);
    } else {
      this.privateKey = null;
      this.publicKey = null;
      this.signerZ = null;
    }

    if (bankPublicKeyHex != null) {
      this.bankPublicKey = Sm2Keys.decodePublicKey(bankPublicKeyHex, domain);
      this.bankZ = identityDigest.compute(bankPublicKey);
    } else {
      this.bankPublicKey = null;
      this.bankZ = null;
    }

    this.sm4Key = sm4KeyHex == null ? null : blockSized(sm4KeyHex, "SM4 key");
    this.sm4Iv = sm4IvHex == null ? null : blockSized(sm4IvHex, "SM4 IV");
  }

  public ECPoint publicKey() {
    return publicKey;
  }

  @Override
  public String sign(byte[] data) {
    if (privateKey == null) {
      throw new ConfigException("SM2 private key is not configured");
    }
    try {
      byte[] e = IdentityDigest.messageDigest(signerZ, data);
      BigInteger[] rs = signDigest(e);
      byte[] der = StandardDSAEncoding.INSTANCE.encode(domain.getN(), rs[0], rs[1]);
      return Hex.toHexString(der).toUpperCase(Locale.ROOT);
    } catch (Exception ex) {
      throw new SignatureException(Phase.SIGN, "Failed to sign payload", ex);
    }
  }

  @Override
  public boolean verify(byte[] data, String signatureHex) {
    if (bankPublicKey == null) {
      throw new ConfigException("Bank SM2 public key is not configured");
    }
    return verify(data, signatureHex, bankPublicKey, bankZ);
  }

  public boolean verify(byte[] data, String signatureHex, ECPoint signerKey) {
    return verify(data, signatureHex, signerKey, identityDigest.compute(signerKey));
  }

  private boolean verify(byte[] data, String signatureHex, ECPoint signerKey, byte[] z) {
    BigInteger[] rs = decodeSignature(signatureHex);
    BigInteger n = domain.getN();
    BigInteger r = rs[0];
    BigInteger s = rs[1];
    if (r.signum() <= 0 || r.compareTo(n) >= 0 || s.signum() <= 0 || s.compareTo(n) >= 0) {
      return false;
    }
    BigInteger t = r.add(s).mod(n);
    if (t.signum() == 0) {
      return false;
    }
    ECPoint point = ECAlgorithms.sumOfTwoMultiplies(domain.getG(), s, signerKey, t).normalize();
    if (point.isInfinity()) {
      return false;
    }
    BigInteger e = new BigInteger(1, IdentityDigest.messageDigest(z, data));
    return e.add(point.getAffineXCoord().toBigInteger()).mod(n).equals(r);
  }

  @Override
  public String encrypt(byte[] plaintext) {
    requireSm4();
    try {
      byte[] cipher = sm4(true, plaintext);
      return Hex.toHexString(cipher).toUpperCase(Locale.ROOT);
    } catch (InvalidCipherTextException | DataLengthException | IllegalStateException e) {
      throw new EncryptException("SM4 encryption failed", e);
    }
  }

  @Override
  public byte[] decrypt(String cipherHex) {
    requireSm4();
    if (cipherHex == null || cipherHex.isEmpty()) {
      throw new DecryptException("bizContent is empty");
    }
    byte[] cipher;
    try {
      cipher = Hex.decodeStrict(cipherHex);
    } catch (DecoderException e) {
      throw new DecryptException("bizContent is not valid hex", e);
    }
    if (cipher.length == 0 || cipher.length % SM4_BLOCK_BYTES != 0) {
      throw new DecryptException("bizContent length is not a multiple of the SM4 block size");
    }
    try {
      return sm4(false, cipher);
    } catch (InvalidCipherTextException | DataLengthException | IllegalStateException e) {
      throw new DecryptException("SM4 decryption failed", e);
    }
  }

  private BigInteger[] signDigest(byte[] digest) {
    BigInteger n = domain.getN();
    BigInteger e = new BigInteger(1, digest);
    ECMultiplier multiplier = new FixedPointCombMultiplier();

    DSAKCalculator calculator = nonces.get();
    if (calculator.isDeterministic()) {
      calculator.init(n, privateKey, digest);
    } else {
      calculator.init(n, random);
    }

    BigInteger r;
    BigInteger s;
    do {
      BigInteger k;
      do {
        k = calculator.nextK();
        ECPoint p = multiplier.multiply(domain.getG(), k).normalize();
        r = e.add(p.getAffineXCoord().toBigInteger()).mod(n);
      } while (r.signum() == 0 || r.add(k).equals(n));

      BigInteger inverse = privateKey.add(BigInteger.ONE).modInverse(n);
      s = inverse.multiply(k.subtract(r.multiply(privateKey))).mod(n);
    } while (s.signum() == 0);

    return new BigInteger[] {r, s};
  }

  private BigInteger[] decodeSignature(String signatureHex) {
    if (signatureHex == null || signatureHex.trim().isEmpty()) {
      throw new SignatureException(Phase.VERIFY, "Signature is empty");
    }
    BigInteger[] rs;
    try {
      byte[] der = Hex.decodeStrict(signatureHex.trim());
      // range against n is checked by the caller, an out-of-range value is a mismatch
      ASN1Sequence seq = ASN1Sequence.getInstance(der);
      if (seq.size() != 2) {
        throw new SignatureException(Phase.VERIFY, "Signature must hold exactly r and s");
      }
      rs = new BigInteger[] {
          ASN1Integer.getInstance(seq.getObjectAt(0)).getValue(),
          ASN1Integer.getInstance(seq.getObjectAt(1)).getValue()
      };
      if (!Arrays.equals(der, seq.getEncoded(ASN1Encoding.DER))) {
        throw new SignatureException(Phase.VERIFY, "Signature is not DER encoded");
      }
    } catch (IOException | IllegalArgumentException | IllegalStateException e) {
      throw new SignatureException(Phase.VERIFY, "Malformed signature encoding", e);
    }
    return rs;
  }

  private byte[] sm4(boolean encrypt, byte[] input) throws InvalidCipherTextException {
    BufferedBlockCipher cipher = new PaddedBufferedBlockCipher(
        CBCBlockCipher.newInstance(new SM4Engine()), new PKCS7Padding());
    cipher.init(encrypt, new ParametersWithIV(new KeyParameter(sm4Key), sm4Iv));
    byte[] out = new byte[cipher.getOutputSize(input.length)];
    int length = cipher.processBytes(input, 0, input.length, out, 0);
    length += cipher.doFinal(out, length);
    return Arrays.copyOf(out, length);
  }

  private void requireSm4() {
    if (sm4Key == null || sm4Iv == null) {
      throw new ConfigException("SM4 key and IV are not configured");
    }
  }

  private static byte[] blockSized(String hex, String label) {
    byte[] bytes;
    try {
      bytes = Hex.decodeStrict(hex.trim());
    } catch (DecoderException e) {
      throw new ConfigException(label + " is not valid hex", e);
    }
    if (bytes.length != SM4_BLOCK_BYTES) {
      throw new ConfigException(label + " must be " + SM4_BLOCK_BYTES + " bytes, got " + bytes.length);
    }
    return bytes;
  }
}
