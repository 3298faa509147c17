package io.wzbankapi.sdk;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SymmetricCodecTest {
  private final SymmetricCodec codec = new SymmetricCodec(TestVectors.crypto());

  @Test
  void encryptsToPinnedCiphertexts() {
    for (int i = 0; i < TestVectors.bodies().size(); i++) {
      assertEquals(TestVectors.bizContent(i), codec.encryptBody(TestVectors.body(i)),
          (String) TestVectors.bodies().get(i).get("name"));
    }
  }

  @Test
  void decryptsPinnedCiphertextsInOrder() {
    for (int i = 0; i < TestVectors.bodies().size(); i++) {
      Map<String, Object> decrypted = codec.decryptBody(TestVectors.bizContent(i));
      Map<String, Object> expected = TestVectors.body(i);

      assertEquals(expected, decrypted);
      assertEquals(new ArrayList<>(expected.keySet()), new ArrayList<>(decrypted.keySet()));
    }
  }

  @Test
  void decryptAcceptsLowercaseHex() {
    assertEquals(TestVectors.body(0), codec.decryptBody(TestVectors.bizContent(0).toLowerCase()));
  }

  @Test
  void roundTripsStructuredBodies() {
    Map<String, Object> detail = new LinkedHashMap<>();
    detail.put("rcvAcctNo", "6231120100000000024");
    detail.put("rcvAcctName", "夏沽");
    detail.put("transAmt", "0.01");
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("payAcctNo", "733000120190056868");
    body.put("totalNum", 1);
    body.put("details", List.of(detail));
    body.put("remark", null);

    assertEquals(body, codec.decryptBody(codec.encryptBody(body)));
  }

  @Test
  void wrongKeyIsADecryptError() {
    SymmetricCodec other = new SymmetricCodec(new BouncyCastleSmCrypto(null, null,
        "00112233445566778899AABBCCDDEEFF", TestVectors.key("sm4Iv")));

    DecryptException e = assertThrows(DecryptException.class, () -> other.decryptBody(TestVectors.bizContent(1)));
    assertEquals(Phase.DECRYPT, e.phase());
  }

  @Test
  void malformedHexIsADecryptError() {
    assertThrows(DecryptException.class, () -> codec.decryptBody("ZZ"));
    assertThrows(DecryptException.class, () -> codec.decryptBody("ABC"));
    assertThrows(DecryptException.class, () -> codec.decryptBody("ABCD"));
    assertThrows(DecryptException.class, () -> codec.decryptBody(""));
  }

  @Test
  void nonJsonPlaintextIsADecryptError() {
    String cipher = TestVectors.crypto().encrypt("not json".getBytes(StandardCharsets.UTF_8));
    String array = TestVectors.crypto().encrypt("[\"a\"]".getBytes(StandardCharsets.UTF_8));

    DecryptException e = assertThrows(DecryptException.class, () -> codec.decryptBody(cipher));
    assertEquals(Phase.DECRYPT, e.phase());
    assertThrows(DecryptException.class, () -> codec.decryptBody(array));
  }
}
