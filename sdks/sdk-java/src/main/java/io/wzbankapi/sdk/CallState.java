package io.wzbankapi.sdk;

import java.util.EnumSet;
import java.util.Set;

public enum CallState {
  BUILDING,
  BODY_ENCRYPTED,
  SIGNED,
  SENT,
  RESPONSE_PARSED,
  VERIFIED,
  VERIFY_SKIPPED,
  DECRYPTED,
  DONE,
  FAILED;

  Set<CallState> next() {
    switch (this) {
      case BUILDING:
        return EnumSet.of(BODY_ENCRYPTED, FAILED);
      case BODY_ENCRYPTED:
        return EnumSet.of(SIGNED, FAILED);
      case SIGNED:
        return EnumSet.of(SENT, FAILED);
      case SENT:
        return EnumSet.of(RESPONSE_PARSED, FAILED);
      case RESPONSE_PARSED:
        return EnumSet.of(VERIFIED, VERIFY_SKIPPED, FAILED);
      case VERIFIED:
      case VERIFY_SKIPPED:
        // DONE directly when the response carried no bizContent
        return EnumSet.of(DECRYPTED, DONE, FAILED);
      case DECRYPTED:
        return EnumSet.of(DONE, FAILED);
      default:
        return EnumSet.noneOf(CallState.class);
    }
  }

  public boolean canMoveTo(CallState target) {
    return next().contains(target);
  }
}
