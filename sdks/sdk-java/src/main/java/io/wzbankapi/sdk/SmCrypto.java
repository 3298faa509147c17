package io.wzbankapi.sdk;

public interface SmCrypto {

  String sign(byte[] data);

  /**
   * Checks the gateway's signature over {@code data}. Returns false for a well-formed signature
   * that does not match; throws {@link SignatureException} when the encoding itself is malformed.
   */
  boolean verify(byte[] data, String signatureHex);

  String encrypt(byte[] plaintext);

  byte[] decrypt(String cipherHex);
}
