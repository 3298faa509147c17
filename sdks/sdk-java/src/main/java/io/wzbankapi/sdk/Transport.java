package io.wzbankapi.sdk;

@FunctionalInterface
public interface Transport {
  WzBank.TransportResponse send(WzBank.WireEnvelope envelope);
}
