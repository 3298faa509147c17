package io.wzbankapi.sdk;

import java.util.Map;

public final class SymmetricCodec {
  private final SmCrypto crypto;

  public SymmetricCodec(SmCrypto crypto) {
    this.crypto = crypto;
  }

  public String encryptBody(Map<String, ?> body) {
    byte[] plaintext = CanonicalJson.encode(body);
    return crypto.encrypt(plaintext);
  }

  public Map<String, Object> decryptBody(String cipherHex) {
    byte[] plaintext = crypto.decrypt(cipherHex);
    try {
      return CanonicalJson.decode(plaintext, Phase.DECRYPT);
    } catch (EncodeException e) {
      throw new DecryptException("Decrypted bizContent is not a JSON object: " + e.getMessage(), e);
    }
  }
}
