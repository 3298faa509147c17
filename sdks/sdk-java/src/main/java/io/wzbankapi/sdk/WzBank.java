package io.wzbankapi.sdk;

import java.net.http.HttpClient;
import java.util.List;
import java.util.Map;

public final class WzBank {
  private WzBank() {}

  public static final String DEFAULT_API_BASE_URL = "https://openapi.wzbank.cn/prdApiGW/";
  public static final String DEFAULT_BANK_ID = "WZB";
  public static final int DEFAULT_TIMEOUT_SECONDS = 30;

  public static final String HEADER_AUTHORIZATION = "Authorization";
  public static final String HEADER_APP_ID = "x-aob-appID";
  public static final String HEADER_BANK_ID = "x-aob-bankID";
  public static final String HEADER_SIGNATURE = "x-aob-signature";
  public static final String BIZ_CONTENT = "bizContent";

  public static final List<String> SIGNED_HEADERS = List.of(
      HEADER_AUTHORIZATION,
      HEADER_APP_ID,
      HEADER_BANK_ID,
      "x-aob-customer-last-logger-time",
      "x-aob-customer-ip-address",
      "x-aob-interaction-id",
      "x-aob-access-token",
      "x-customer-user-agent",
      "x-idempotency-key"
  );

  public static WzBankClient client(ClientOptions options) {
    return client(options, System.getenv());
  }

  static WzBankClient client(ClientOptions options, Map<String, String> env) {
    String appId = firstNonBlank(options.appId, env.get("WZBANK_APP_ID"), null);
    if (appId == null) {
      throw new ConfigException("appId is required (set it on ClientOptions or WZBANK_APP_ID)");
    }
    String bankId = firstNonBlank(options.bankId, env.get("WZBANK_BANK_ID"), DEFAULT_BANK_ID);
    String baseUrl = firstNonBlank(options.apiBaseUrl, env.get("WZBANK_API_URL"), DEFAULT_API_BASE_URL);

    SmCrypto crypto = options.crypto;
    if (crypto == null) {
      String privateKey = required(options.sm2PrivateKey, env, "WZBANK_SM2_PRIVATE_KEY", "SM2 private key");
      String sm4Key = required(options.sm4Key, env, "WZBANK_SM4_KEY", "SM4 key");
      String sm4Iv = required(options.sm4Iv, env, "WZBANK_SM4_IV", "SM4 IV");
      String bankPublicKey = firstNonBlank(options.bankPublicKey, env.get("WZBANK_SM2_BANK_PUBLIC_KEY"), null);
      crypto = new BouncyCastleSmCrypto(privateKey, bankPublicKey, sm4Key, sm4Iv);
    }

    int timeout = options.timeoutSeconds > 0 ? options.timeoutSeconds : DEFAULT_TIMEOUT_SECONDS;
    Transport transport = options.transport != null
        ? options.transport
        : new HttpClientTransport(options.httpClient, timeout);
    MessageMetadata metadata = options.metadata != null ? options.metadata : MessageMetadata.systemDefault();

    ClientSettings settings = new ClientSettings(
        appId,
        bankId,
        normalizeBaseUrl(baseUrl),
        options.requireResponseSignature,
        options.requireEncryptedResponse
    );
    return new WzBankClient(settings, crypto, transport, metadata);
  }

  public static WzBankApi api(ClientOptions options) {
    return new WzBankApi(client(options));
  }

  static String normalizeBaseUrl(String value) {
    return value.replaceAll("/+$", "") + "/";
  }

  static String resolveUrl(String baseUrl, String path) {
    if (path == null || path.trim().isEmpty()) {
      throw new IllegalArgumentException("request path is required");
    }
    return baseUrl + path.replaceAll("^/+", "");
  }

  private static String required(String explicit, Map<String, String> env, String variable, String label) {
    String value = firstNonBlank(explicit, env.get(variable), null);
    if (value == null) {
      throw new ConfigException(label + " is required (set it on ClientOptions or " + variable + ")");
    }
    return value;
  }

  private static String firstNonBlank(String explicit, String fromEnv, String fallback) {
    if (!isBlank(explicit)) {
      return explicit.trim();
    }
    if (!isBlank(fromEnv)) {
      return fromEnv.trim();
    }
    return fallback;
  }

  static boolean isBlank(String value) {
    return value == null || value.trim().isEmpty();
  }

  public static class ClientOptions {
    public String appId;
    public String bankId;
    public String apiBaseUrl;
    public String sm2PrivateKey;
    public String bankPublicKey;
    public String sm4Key;
    public String sm4Iv;
    public int timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
    /** Reject responses without {@code x-aob-signature} instead of accepting them unverified. */
    public boolean requireResponseSignature;
    /** Reject responses without {@code bizContent} instead of passing the raw JSON through. */
    public boolean requireEncryptedResponse;
    public HttpClient httpClient;
    public Transport transport;
    public SmCrypto crypto;
    public MessageMetadata metadata;
  }

  static final class ClientSettings {
    final String appId;
    final String bankId;
    final String baseUrl;
    final boolean requireResponseSignature;
    final boolean requireEncryptedResponse;

    ClientSettings(
        String appId,
        String bankId,
        String baseUrl,
        boolean requireResponseSignature,
        boolean requireEncryptedResponse
    ) {
      this.appId = appId;
      this.bankId = bankId;
      this.baseUrl = baseUrl;
      this.requireResponseSignature = requireResponseSignature;
      this.requireEncryptedResponse = requireEncryptedResponse;
    }
  }

  public static class WireEnvelope {
    public String url;
    public String method;
    public Map<String, String> headers;
    public byte[] body;
  }

  public static class TransportResponse {
    public int statusCode;
    /** Header names lower-cased. */
    public Map<String, String> headers;
    public String body;

    public TransportResponse() {}

    public TransportResponse(int statusCode, Map<String, String> headers, String body) {
      this.statusCode = statusCode;
      this.headers = headers;
      this.body = body;
    }
  }

  public enum Verification {
    VERIFIED,
    /** The gateway sent no {@code x-aob-signature}; the data was accepted unverified. */
    SKIPPED_UNSIGNED,
    SKIPPED_BY_CALLER
  }

  public static class BankResponse {
    public int statusCode;
    public Map<String, Object> data;
    /** False when the response had no {@code bizContent} and {@link #data} is the raw JSON. */
    public boolean decrypted;
    public Verification verification;
    public Map<String, String> headers;
  }
}
