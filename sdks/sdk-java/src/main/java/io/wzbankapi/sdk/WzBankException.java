package io.wzbankapi.sdk;

public class WzBankException extends RuntimeException {
  private final Phase phase;

  public WzBankException(Phase phase, String message) {
    super(message);
    this.phase = phase;
  }

  public WzBankException(Phase phase, String message, Throwable cause) {
    super(message, cause);
    this.phase = phase;
  }

  public Phase phase() {
    return phase;
  }
}
