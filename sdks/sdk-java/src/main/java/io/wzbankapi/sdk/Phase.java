package io.wzbankapi.sdk;

public enum Phase {
  ENCODE,
  ENCRYPT,
  SIGN,
  TRANSPORT,
  PARSE,
  VERIFY,
  DECRYPT,
  CONFIG
}
