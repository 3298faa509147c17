package io.wzbankapi.sdk;

public class EncodeException extends WzBankException {
  public EncodeException(String message) {
    super(Phase.ENCODE, message);
  }

  public EncodeException(String message, Throwable cause) {
    super(Phase.ENCODE, message, cause);
  }

  public EncodeException(Phase phase, String message, Throwable cause) {
    super(phase, message, cause);
  }
}
