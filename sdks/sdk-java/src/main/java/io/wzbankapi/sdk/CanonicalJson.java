package io.wzbankapi.sdk;

import tools.jackson.core.JacksonException;
import tools.jackson.core.SerializableString;
import tools.jackson.core.io.CharacterEscapes;
import tools.jackson.core.io.SerializedString;
import tools.jackson.core.json.JsonFactory;
import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Order-preserving, whitespace-free UTF-8 JSON. Key order and escaping are part of the wire
 * contract: control characters without a short escape are written as six-character escapes with
 * lower-case hex digits.
 *
 * <p>Decoding normalizes numbers: fractions come back as {@link java.math.BigDecimal} and integers
 * as the narrowest of {@code Integer}, {@code Long}, {@code BigInteger}. A decoded map therefore
 * re-encodes to the same bytes without being {@code equals} to a source map holding
 * {@code Double} or {@code Long} values.
 */
public final class CanonicalJson {
  private CanonicalJson() {}

  private static final ObjectMapper MAPPER = JsonMapper.builder(
          JsonFactory.builder().characterEscapes(new LowerHexEscapes()).build())
      .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS)
      .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
      .build();

  public static byte[] encode(Map<String, ?> fields) {
    if (fields == null) {
      throw new EncodeException("Cannot encode a null field map");
    }
    try {
      return MAPPER.writeValueAsBytes(fields);
    } catch (JacksonException e) {
      throw new EncodeException("Failed to encode canonical JSON", e);
    }
  }

  public static String encodeToString(Map<String, ?> fields) {
    return new String(encode(fields), StandardCharsets.UTF_8);
  }

  public static Map<String, Object> decode(byte[] json) {
    return decode(json, Phase.ENCODE);
  }

  static Map<String, Object> decode(byte[] json, Phase phase) {
    if (json == null || json.length == 0) {
      throw new EncodeException(phase, "Empty JSON document", null);
    }
    Object value;
    try {
      value = MAPPER.readValue(json, Object.class);
    } catch (JacksonException e) {
      throw new EncodeException(phase, "Invalid JSON: " + e.getOriginalMessage(), e);
    }
    if (!(value instanceof Map)) {
      throw new EncodeException(phase, "Expected a JSON object", null);
    }
    @SuppressWarnings("unchecked")
    Map<String, Object> map = (Map<String, Object>) value;
    return map instanceof LinkedHashMap ? map : new LinkedHashMap<>(map);
  }

  private static final class LowerHexEscapes extends CharacterEscapes {
    private final int[] escapes = standardAsciiEscapesForJSON();

    LowerHexEscapes() {
      for (int ch = 0; ch < 0x20; ch++) {
        if (escapes[ch] == ESCAPE_STANDARD) {
          escapes[ch] = ESCAPE_CUSTOM;
        }
      }
    }

    @Override
    public int[] getEscapeCodesForAscii() {
      return escapes;
    }

    @Override
    public SerializableString getEscapeSequence(int ch) {
      if (ch < 0x20 && escapes[ch] == ESCAPE_CUSTOM) {
        return new SerializedString(String.format("\\u%04x", ch));
      }
      return null;
    }
  }
}
