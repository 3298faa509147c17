package io.wzbankapi.sdk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public final class HttpClientTransport implements Transport {
  private static final Logger log = LoggerFactory.getLogger(HttpClientTransport.class);

  private final HttpClient httpClient;
  private final Duration timeout;

  public HttpClientTransport(HttpClient httpClient, int timeoutSeconds) {
    this.timeout = Duration.ofSeconds(timeoutSeconds);
    this.httpClient = httpClient != null
        ? httpClient
        : HttpClient.newBuilder().connectTimeout(timeout).build();
  }

  @Override
  public WzBank.TransportResponse send(WzBank.WireEnvelope envelope) {
    HttpRequest request;
    try {
      HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(envelope.url)).timeout(timeout);
      for (Map.Entry<String, String> entry : envelope.headers.entrySet()) {
        builder.header(entry.getKey(), entry.getValue());
      }
      request = builder.method(envelope.method, HttpRequest.BodyPublishers.ofByteArray(envelope.body)).build();
    } catch (IllegalArgumentException e) {
      throw new TransportException("Cannot build request to " + envelope.url + ": " + e.getMessage(), e);
    }

    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw new TransportException("Request to " + envelope.url + " failed", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new TransportException("Request to " + envelope.url + " was interrupted", e);
    }
    log.debug("{} {} -> {}", envelope.method, envelope.url, response.statusCode());

    Map<String, String> headers = new LinkedHashMap<>();
    for (Map.Entry<String, List<String>> entry : response.headers().map().entrySet()) {
      if (!entry.getValue().isEmpty()) {
        headers.put(entry.getKey().toLowerCase(Locale.ROOT), entry.getValue().get(0));
      }
    }
    return new WzBank.TransportResponse(response.statusCode(), headers, response.body());
  }
}
