package io.wzbankapi.sdk;

import java.time.Clock;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.function.Supplier;

public final class MessageMetadata {
  public static final String MESSAGE_ID = "mesgId";
  public static final String MESSAGE_DATE = "mesgDate";
  public static final String MESSAGE_TIME = "mesgTime";

  private static final ZoneId GATEWAY_ZONE = ZoneId.of("Asia/Shanghai");
  private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyyMMdd");
  private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HHmmssSSS");

  private final Clock clock;
  private final Supplier<String> ids;

  public MessageMetadata(Clock clock, Supplier<String> ids) {
    this.clock = clock;
    this.ids = ids;
  }

  public static MessageMetadata systemDefault() {
    return new MessageMetadata(Clock.system(GATEWAY_ZONE),
        () -> UUID.randomUUID().toString().replace("-", ""));
  }

  public Map<String, Object> next() {
    ZonedDateTime now = ZonedDateTime.now(clock);
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put(MESSAGE_ID, ids.get());
    fields.put(MESSAGE_DATE, DATE.format(now));
    fields.put(MESSAGE_TIME, TIME.format(now));
    return fields;
  }
}
