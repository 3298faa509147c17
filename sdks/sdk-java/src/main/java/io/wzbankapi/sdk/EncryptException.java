package io.wzbankapi.sdk;

public class EncryptException extends WzBankException {
  public EncryptException(String message) {
    super(Phase.ENCRYPT, message);
  }

  public EncryptException(String message, Throwable cause) {
    super(Phase.ENCRYPT, message, cause);
  }
}
