package io.wzbankapi.sdk;

public class ConfigException extends WzBankException {
  public ConfigException(String message) {
    super(Phase.CONFIG, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(Phase.CONFIG, message, cause);
  }
}
