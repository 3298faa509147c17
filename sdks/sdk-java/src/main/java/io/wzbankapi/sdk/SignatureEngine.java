package io.wzbankapi.sdk;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class SignatureEngine {
  private final SmCrypto crypto;
  private final List<String> signedHeaders;

  public SignatureEngine(SmCrypto crypto) {
    this(crypto, WzBank.SIGNED_HEADERS);
  }

  public SignatureEngine(SmCrypto crypto, List<String> signedHeaders) {
    this.crypto = crypto;
    this.signedHeaders = List.copyOf(signedHeaders);
  }

  public Map<String, String> buildSignMap(Map<String, String> headers, String bizContent) {
    Map<String, String> signMap = new LinkedHashMap<>();
    if (headers != null) {
      for (String name : signedHeaders) {
        String value = headers.get(name);
        if (value != null && !value.isEmpty()) {
          signMap.put(name, value);
        }
      }
    }
    if (bizContent != null && !bizContent.isEmpty()) {
      signMap.put(WzBank.BIZ_CONTENT, bizContent);
    }
    return signMap;
  }

  public String sign(Map<String, String> signMap) {
    return crypto.sign(CanonicalJson.encode(signMap));
  }

  public boolean verify(Map<String, String> signMap, String signatureHex) {
    return crypto.verify(CanonicalJson.encode(signMap), signatureHex);
  }
}
