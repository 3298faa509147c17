package io.wzbankapi.sdk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a business body into a signed, encrypted POST and the gateway's reply back into
 * verified, decrypted data. Holds only immutable settings and key material, so one instance
 * serves concurrent calls.
 *
 * <p>Two relaxations of the gateway contract are visible on {@link WzBank.BankResponse}: an
 * unsigned response is accepted with {@link WzBank.Verification#SKIPPED_UNSIGNED}, and a response
 * without {@code bizContent} is returned raw with {@code decrypted == false}. Both can be made
 * fatal through {@link WzBank.ClientOptions}.
 */
public final class WzBankClient {
  private static final Logger log = LoggerFactory.getLogger(WzBankClient.class);
  static final String MASKED = "***masked***";

  private final WzBank.ClientSettings settings;
  private final SymmetricCodec codec;
  private final SignatureEngine signatures;
  private final Transport transport;
  private final MessageMetadata metadata;

  WzBankClient(WzBank.ClientSettings settings, SmCrypto crypto, Transport transport, MessageMetadata metadata) {
    this.settings = settings;
    this.codec = new SymmetricCodec(crypto);
    this.signatures = new SignatureEngine(crypto);
    this.transport = transport;
    this.metadata = metadata;
  }

  public MessageMetadata metadata() {
    return metadata;
  }

  public WzBank.BankResponse post(String path, Map<String, ?> body) {
    return post(path, body, null, true);
  }

  public WzBank.BankResponse post(String path, Map<String, ?> body, Map<String, String> headers) {
    return post(path, body, headers, true);
  }

  public WzBank.BankResponse post(
      String path,
      Map<String, ?> body,
      Map<String, String> headers,
      boolean verifyResponseSignature
  ) {
    if (body == null) {
      throw new IllegalArgumentException("request body is required");
    }
    String url = WzBank.resolveUrl(settings.baseUrl, path);
    Exchange exchange = new Exchange();
    try {
      return exchange(exchange, url, body, headers, verifyResponseSignature);
    } catch (RuntimeException e) {
      exchange.fail();
      throw e;
    }
  }

  private WzBank.BankResponse exchange(
      Exchange exchange,
      String url,
      Map<String, ?> body,
      Map<String, String> extraHeaders,
      boolean verifyResponseSignature
  ) {
    String bizContent = codec.encryptBody(body);
    exchange.moveTo(CallState.BODY_ENCRYPTED);

    Map<String, String> headers = new LinkedHashMap<>();
    headers.put("Content-Type", "application/json");
    headers.put("Accept", "application/json");
    headers.put(WzBank.HEADER_APP_ID, settings.appId);
    headers.put(WzBank.HEADER_BANK_ID, settings.bankId);
    if (extraHeaders != null) {
      for (Map.Entry<String, String> entry : extraHeaders.entrySet()) {
        headers.put(canonicalName(headers, entry.getKey()), entry.getValue());
      }
    }
    headers.keySet().removeIf(name -> name.equalsIgnoreCase(WzBank.HEADER_SIGNATURE));
    headers.put(WzBank.HEADER_SIGNATURE, signatures.sign(signatures.buildSignMap(headers, bizContent)));
    exchange.moveTo(CallState.SIGNED);

    WzBank.WireEnvelope envelope = new WzBank.WireEnvelope();
    envelope.url = url;
    envelope.method = "POST";
    envelope.headers = Collections.unmodifiableMap(headers);
    envelope.body = CanonicalJson.encode(Collections.singletonMap(WzBank.BIZ_CONTENT, bizContent));
    if (log.isDebugEnabled()) {
      log.debug("POST {} headers={} body={}", url, masked(headers),
          new String(envelope.body, StandardCharsets.UTF_8));
    }

    WzBank.TransportResponse response = transport.send(envelope);
    exchange.moveTo(CallState.SENT);
    if (response.statusCode < 200 || response.statusCode >= 300) {
      throw new HttpStatusException(response.statusCode, response.body);
    }

    String rawBody = response.body == null ? "" : response.body;
    Map<String, Object> json = CanonicalJson.decode(rawBody.getBytes(StandardCharsets.UTF_8), Phase.PARSE);
    exchange.moveTo(CallState.RESPONSE_PARSED);

    Object rawBizContent = json.get(WzBank.BIZ_CONTENT);
    if (rawBizContent != null && !(rawBizContent instanceof String)) {
      throw new DecryptException("bizContent in response is not a string");
    }
    String responseBizContent = (String) rawBizContent;

    WzBank.Verification verification =
        verifyResponse(response, responseBizContent, verifyResponseSignature);
    exchange.moveTo(verification == WzBank.Verification.VERIFIED ? CallState.VERIFIED : CallState.VERIFY_SKIPPED);

    WzBank.BankResponse result = new WzBank.BankResponse();
    result.statusCode = response.statusCode;
    result.headers = response.headers;
    result.verification = verification;

    if (responseBizContent == null) {
      if (settings.requireEncryptedResponse) {
        throw new DecryptException("Response carries no bizContent");
      }
      log.warn("No bizContent in response from {}; returning the JSON body undecrypted", url);
      result.data = json;
      result.decrypted = false;
      exchange.moveTo(CallState.DONE);
      return result;
    }

    result.data = codec.decryptBody(responseBizContent);
    result.decrypted = true;
    exchange.moveTo(CallState.DECRYPTED);
    log.debug("Response from {}: {}", url, result.data);

    exchange.moveTo(CallState.DONE);
    return result;
  }

  private WzBank.Verification verifyResponse(
      WzBank.TransportResponse response,
      String bizContent,
      boolean verifyResponseSignature
  ) {
    if (!verifyResponseSignature) {
      return WzBank.Verification.SKIPPED_BY_CALLER;
    }
    String signature = header(response.headers, WzBank.HEADER_SIGNATURE);
    if (WzBank.isBlank(signature)) {
      if (settings.requireResponseSignature) {
        throw new SignatureException(Phase.VERIFY, "Response carries no " + WzBank.HEADER_SIGNATURE + " header");
      }
      log.warn("Response carries no {} header; accepting it unverified", WzBank.HEADER_SIGNATURE);
      return WzBank.Verification.SKIPPED_UNSIGNED;
    }
    Map<String, String> signMap = signatures.buildSignMap(Collections.emptyMap(), bizContent);
    if (!signatures.verify(signMap, signature)) {
      throw new SignatureException(Phase.VERIFY, "Response signature verification failed");
    }
    return WzBank.Verification.VERIFIED;
  }

  private static String header(Map<String, String> headers, String name) {
    if (headers == null) {
      return null;
    }
    for (Map.Entry<String, String> entry : headers.entrySet()) {
      if (name.equalsIgnoreCase(entry.getKey())) {
        return entry.getValue();
      }
    }
    return null;
  }

  // caller spelling yields to a header already set or to the signed-header name
  private static String canonicalName(Map<String, String> headers, String name) {
    for (String existing : headers.keySet()) {
      if (existing.equalsIgnoreCase(name)) {
        return existing;
      }
    }
    for (String signed : WzBank.SIGNED_HEADERS) {
      if (signed.equalsIgnoreCase(name)) {
        return signed;
      }
    }
    return name;
  }

  private static Map<String, String> masked(Map<String, String> headers) {
    Map<String, String> copy = new LinkedHashMap<>(headers);
    copy.replace(WzBank.HEADER_SIGNATURE, MASKED);
    return copy;
  }

  /** State of a single call. Not shared between threads. */
  static final class Exchange {
    private final List<CallState> history = new ArrayList<>();
    private CallState state = CallState.BUILDING;

    Exchange() {
      history.add(state);
    }

    CallState state() {
      return state;
    }

    List<CallState> history() {
      return Collections.unmodifiableList(history);
    }

    void moveTo(CallState target) {
      if (!state.canMoveTo(target)) {
        throw new IllegalStateException("Illegal call transition " + state + " -> " + target);
      }
      log.trace("{} -> {}", state, target);
      state = target;
      history.add(target);
    }

    void fail() {
      if (state.canMoveTo(CallState.FAILED)) {
        moveTo(CallState.FAILED);
      }
    }
  }
}
