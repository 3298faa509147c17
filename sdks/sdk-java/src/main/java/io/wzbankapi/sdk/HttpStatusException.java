package io.wzbankapi.sdk;

public class HttpStatusException extends WzBankException {
  private final int statusCode;
  private final String body;

  public HttpStatusException(int statusCode, String body) {
    super(Phase.TRANSPORT, "HTTP " + statusCode + ": " + body);
    this.statusCode = statusCode;
    this.body = body;
  }

  public int statusCode() {
    return statusCode;
  }

  public String body() {
    return body;
  }
}
