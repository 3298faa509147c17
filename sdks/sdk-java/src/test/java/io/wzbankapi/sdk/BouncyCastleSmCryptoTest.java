package io.wzbankapi.sdk;

import org.bouncycastle.asn1.ASN1EncodableVector;
import org.bouncycastle.asn1.ASN1Integer;
import org.bouncycastle.asn1.DERSequence;
import org.bouncycastle.crypto.digests.SM3Digest;
import org.bouncycastle.crypto.params.ECPrivateKeyParameters;
import org.bouncycastle.crypto.params.ECPublicKeyParameters;
import org.bouncycastle.crypto.params.ParametersWithRandom;
import org.bouncycastle.crypto.signers.HMacDSAKCalculator;
import org.bouncycastle.crypto.signers.SM2Signer;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.util.encoders.Hex;
import org.junit.jupiter.api.Test;

import javax.crypto.Cipher;
import javax.crypto.spec.IvParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class BouncyCastleSmCryptoTest {
  private static final byte[] PAYLOAD =
      TestVectors.signature("canonical").getBytes(StandardCharsets.UTF_8);

  @Test
  void sm4MatchesStandardVector() {
    String key = "0123456789ABCDEFFEDCBA9876543210";
    BouncyCastleSmCrypto crypto = new BouncyCastleSmCrypto(null, null, key, "00000000000000000000000000000000");

    String cipher = crypto.encrypt(Hex.decode(key));
    // one data block plus one full padding block
    assertEquals(64, cipher.length());
    assertTrue(cipher.startsWith("681EDF34D206965E86B3E94F536E4246"), cipher);
    assertArrayEquals(Hex.decode(key), crypto.decrypt(cipher));
  }

  @Test
  void sm4MatchesJceCbcPkcs5() throws Exception {
    byte[] key = Hex.decode(TestVectors.key("sm4Key"));
    byte[] iv = Hex.decode(TestVectors.key("sm4Iv"));
    byte[] plaintext = "{\"payAcctName\":\"瓯江实验室\",\"transAmt\":\"0.01\"}".getBytes(StandardCharsets.UTF_8);

    Cipher jce = Cipher.getInstance("SM4/CBC/PKCS5Padding", new BouncyCastleProvider());
    jce.init(Cipher.ENCRYPT_MODE, new SecretKeySpec(key, "SM4"), new IvParameterSpec(iv));

    assertEquals(Hex.toHexString(jce.doFinal(plaintext)).toUpperCase(), TestVectors.crypto().encrypt(plaintext));
  }

  @Test
  void fixedNonceReproducesPinnedSignature() {
    BouncyCastleSmCrypto crypto = TestVectors.fixedNonceCrypto(TestVectors.signature("nonce"));

    assertEquals(TestVectors.signature("value"), crypto.sign(PAYLOAD));
    assertTrue(crypto.verify(PAYLOAD, TestVectors.signature("value")));
  }

  @Test
  void freshNonceEverySignature() {
    BouncyCastleSmCrypto crypto = TestVectors.crypto();

    String first = crypto.sign(PAYLOAD);
    String second = crypto.sign(PAYLOAD);

    assertNotEquals(first, second);
    assertTrue(crypto.verify(PAYLOAD, first));
    assertTrue(crypto.verify(PAYLOAD, second));
    assertEquals(first.toUpperCase(), first);
  }

  @Test
  void deterministicCalculatorIsSupported() {
    BouncyCastleSmCrypto crypto = new BouncyCastleSmCrypto(IdentityDigest.sm2Default(),
        TestVectors.key("privateKey"), TestVectors.key("publicKey"), null, null,
        () -> new HMacDSAKCalculator(new SM3Digest()), new SecureRandom());

    String first = crypto.sign(PAYLOAD);
    assertEquals(first, crypto.sign(PAYLOAD));
    assertTrue(crypto.verify(PAYLOAD, first));
  }

  @Test
  void concurrentSignaturesNeverShareNonces() throws Exception {
    BouncyCastleSmCrypto crypto = TestVectors.crypto();
    ExecutorService pool = Executors.newFixedThreadPool(8);
    try {
      List<Future<String>> futures = new ArrayList<>();
      for (int i = 0; i < 200; i++) {
        futures.add(pool.submit(() -> crypto.sign(PAYLOAD)));
      }
      Set<String> signatures = new HashSet<>();
      for (Future<String> future : futures) {
        signatures.add(future.get());
      }
      assertEquals(200, signatures.size());
    } finally {
      pool.shutdownNow();
    }
  }

  @Test
  void interoperatesWithBouncyCastleSm2Signer() throws Exception {
    BouncyCastleSmCrypto crypto = TestVectors.crypto();
    BigInteger d = Sm2Keys.parsePrivateKey(TestVectors.key("privateKey"));

    SM2Signer verifier = new SM2Signer();
    verifier.init(false, new ECPublicKeyParameters(crypto.publicKey(), Sm2Keys.SM2P256V1));
    byte[] ours = Hex.decode(crypto.sign(PAYLOAD));
    verifier.update(PAYLOAD, 0, PAYLOAD.length);
    assertTrue(verifier.verifySignature(ours));

    SM2Signer signer = new SM2Signer();
    signer.init(true, new ParametersWithRandom(new ECPrivateKeyParameters(d, Sm2Keys.SM2P256V1), new SecureRandom()));
    signer.update(PAYLOAD, 0, PAYLOAD.length);
    String theirs = Hex.toHexString(signer.generateSignature());
    assertTrue(crypto.verify(PAYLOAD, theirs));
  }

  @Test
  void tamperedPayloadFailsVerification() {
    BouncyCastleSmCrypto crypto = TestVectors.crypto();
    String signature = crypto.sign(PAYLOAD);

    for (int i = 0; i < PAYLOAD.length; i += 17) {
      byte[] tampered = PAYLOAD.clone();
      tampered[i] ^= 0x01;
      assertFalse(crypto.verify(tampered, signature), "byte " + i);
    }
  }

  @Test
  void malformedSignatureEncodingThrows() {
    BouncyCastleSmCrypto crypto = TestVectors.crypto();

    SignatureException notHex = assertThrows(SignatureException.class, () -> crypto.verify(PAYLOAD, "XYZ"));
    assertEquals(Phase.VERIFY, notHex.phase());
    assertThrows(SignatureException.class, () -> crypto.verify(PAYLOAD, "3044"));
    assertThrows(SignatureException.class, () -> crypto.verify(PAYLOAD, ""));
    // well-formed DER, zero r and s
    assertFalse(crypto.verify(PAYLOAD, "3006020100020100"));
    // trailing bytes after the sequence
    assertThrows(SignatureException.class, () -> crypto.verify(PAYLOAD, "300602010102010100"));
  }

  @Test
  void outOfRangeComponentsAreAMismatch() throws IOException {
    BouncyCastleSmCrypto crypto = TestVectors.crypto();
    BigInteger n = Sm2Keys.SM2P256V1.getN();

    assertFalse(crypto.verify(PAYLOAD, derSignature(n, BigInteger.ONE)));
    assertFalse(crypto.verify(PAYLOAD, derSignature(BigInteger.ONE, n.add(BigInteger.ONE))));
    assertFalse(crypto.verify(PAYLOAD, derSignature(BigInteger.valueOf(-5), BigInteger.ONE)));
    assertFalse(crypto.verify("{}".getBytes(StandardCharsets.UTF_8),
        "3026022100FFFFFFFEFFFFFFFFFFFFFFFFFFFFFFFF7203DF6B21C6052B53BBF40939D54123020101"));
  }

  private static String derSignature(BigInteger r, BigInteger s) throws IOException {
    ASN1EncodableVector v = new ASN1EncodableVector();
    v.add(new ASN1Integer(r));
    v.add(new ASN1Integer(s));
    return Hex.toHexString(new DERSequence(v).getEncoded());
  }

  @Test
  void missingKeyMaterialIsAConfigError() {
    BouncyCastleSmCrypto empty = new BouncyCastleSmCrypto(null, null, null, null);

    assertEquals(Phase.CONFIG, assertThrows(ConfigException.class, () -> empty.sign(PAYLOAD)).phase());
    assertThrows(ConfigException.class, () -> empty.verify(PAYLOAD, TestVectors.signature("value")));
    assertThrows(ConfigException.class, () -> empty.encrypt(PAYLOAD));
    assertThrows(ConfigException.class, () -> empty.decrypt("00"));
    assertThrows(ConfigException.class,
        () -> new BouncyCastleSmCrypto(null, null, "0011", TestVectors.key("sm4Iv")));
  }
}
