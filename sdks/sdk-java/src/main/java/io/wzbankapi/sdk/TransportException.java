package io.wzbankapi.sdk;

public class TransportException extends WzBankException {
  public TransportException(String message, Throwable cause) {
    super(Phase.TRANSPORT, message, cause);
  }
}
