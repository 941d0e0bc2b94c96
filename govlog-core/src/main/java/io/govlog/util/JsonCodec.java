package io.govlog.util;

import java.util.Map;

/**
 * Codec for the flat {@code Map<String, String>} form that event payloads are stored in.
 *
 * <p>The default implementation ({@link DefaultJsonCodec}) is a lightweight,
 * zero-dependency encoder/decoder that only supports flat string-to-string objects.
 * Users who already have Jackson, Gson, or another JSON library on the classpath
 * can implement this interface to delegate to their preferred library.
 *
 * @see #getDefault()
 * @see DefaultJsonCodec
 */
public interface JsonCodec {

  /**
   * Returns the default singleton implementation.
   *
   * @return the default {@link JsonCodec}
   */
  static JsonCodec getDefault() {
    return DefaultJsonCodec.INSTANCE;
  }

  /**
   * Encodes a string map as a JSON object string. Entries with {@code null} values are
   * omitted; a {@code null} or empty map encodes as {@code "{}"}.
   *
   * @param fields the fields to encode
   * @return JSON object string, never {@code null}
   */
  String toJson(Map<String, String> fields);

  /**
   * Parses a JSON object string into a string map. Returns an empty map for {@code null},
   * empty, or {@code "null"} input.
   *
   * @param json the JSON string to parse
   * @return parsed map (never {@code null})
   * @throws IllegalArgumentException if the input is not a flat JSON object of strings
   */
  Map<String, String> parseObject(String json);
}
