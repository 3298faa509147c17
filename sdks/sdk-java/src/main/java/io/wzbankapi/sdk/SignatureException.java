package io.wzbankapi.sdk;

public class SignatureException extends WzBankException {
  public SignatureException(Phase phase, String message) {
    super(phase, message);
  }

  public SignatureException(Phase phase, String message, Throwable cause) {
    super(phase, message, cause);
  }
}
