package io.wzbankapi.sdk;

public class DecryptException extends WzBankException {
  public DecryptException(String message) {
    super(Phase.DECRYPT, message);
  }

  public DecryptException(String message, Throwable cause) {
    super(Phase.DECRYPT, message, cause);
  }
}
