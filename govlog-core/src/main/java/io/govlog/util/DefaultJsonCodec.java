package io.govlog.util;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Flat string-map JSON codec used for event payload columns.
 *
 * <p>Keys are written in iteration order, so a {@link java.util.LinkedHashMap} input
 * always yields the same text. Nested objects, arrays and numbers are not accepted.
 */
public final class DefaultJsonCodec implements JsonCodec {
  static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

  DefaultJsonCodec() {
  }

  @Override
  public String toJson(Map<String, String> fields) {
    if (fields == null || fields.isEmpty()) {
      return "{}";
    }
    StringBuilder sb = new StringBuilder(fields.size() * 24);
    sb.append('{');
    boolean first = true;
    for (Map.Entry<String, String> entry : fields.entrySet()) {
      if (entry.getKey() == null) {
        throw new IllegalArgumentException("payload fields cannot have null keys");
      }
      if (entry.getValue() == null) {
        continue;
      }
      if (!first) {
        sb.append(',');
      }
      first = false;
      appendQuoted(sb, entry.getKey());
      sb.append(':');
      appendQuoted(sb, entry.getValue());
    }
    return sb.append('}').toString();
  }

  @Override
  public Map<String, String> parseObject(String json) {
    if (json == null) {
      return Collections.emptyMap();
    }
    String trimmed = json.trim();
    if (trimmed.isEmpty() || "null".equals(trimmed)) {
      return Collections.emptyMap();
    }
    int len = trimmed.length();
    int idx = skipWhitespace(trimmed, 0);
    if (idx >= len || trimmed.charAt(idx) != '{') {
      throw new IllegalArgumentException("Expected JSON object");
    }
    idx++;
    Map<String, String> result = new LinkedHashMap<>();
    while (true) {
      idx = skipWhitespace(trimmed, idx);
      if (idx >= len) {
        throw new IllegalArgumentException("Unexpected end of JSON object");
      }
      char ch = trimmed.charAt(idx);
      if (ch == '}') {
        return result;
      }
      if (ch != '"') {
        throw new IllegalArgumentException("Expected string key");
      }
      ParseResult key = parseString(trimmed, idx + 1);
      idx = skipWhitespace(trimmed, key.nextIndex);
      if (idx >= len || trimmed.charAt(idx) != ':') {
        throw new IllegalArgumentException("Expected ':' after key");
      }
      idx = skipWhitespace(trimmed, idx + 1);
      if (trimmed.startsWith("null", idx)) {
        // absent optional field
        idx += 4;
      } else if (idx >= len || trimmed.charAt(idx) != '"') {
        throw new IllegalArgumentException("Expected string value or null for key '" + key.value + "'");
      } else {
        ParseResult value = parseString(trimmed, idx + 1);
        if (result.put(key.value, value.value) != null) {
          throw new IllegalArgumentException("Duplicate key '" + key.value + "'");
        }
        idx = value.nextIndex;
      }
      idx = skipWhitespace(trimmed, idx);
      if (idx >= len) {
        throw new IllegalArgumentException("Unexpected end of JSON object");
      }
      char next = trimmed.charAt(idx);
      if (next == ',') {
        idx++;
        continue;
      }
      if (next == '}') {
        return result;
      }
      throw new IllegalArgumentException("Expected ',' or '}'");
    }
  }

  private static int skipWhitespace(String input, int index) {
    int i = index;
    while (i < input.length()) {
      char c = input.charAt(i);
      if (c != ' ' && c != '\t' && c != '\n' && c != '\r') {
        break;
      }
      i++;
    }
    return i;
  }

  private static ParseResult parseString(String input, int startIndex) {
    StringBuilder sb = new StringBuilder();
    int i = startIndex;
    while (i < input.length()) {
      char c = input.charAt(i);
      if (c == '"') {
        return new ParseResult(sb.toString(), i + 1);
      }
      if (c != '\\') {
        sb.append(c);
        i++;
        continue;
      }
      if (i + 1 >= input.length()) {
        throw new IllegalArgumentException("Invalid escape sequence");
      }
      char next = input.charAt(i + 1);
      if (next == 'u') {
        sb.append(parseUnicode(input, i));
        i += 6;
        continue;
      }
      sb.append(switch (next) {
        case '"', '\\', '/' -> next;
        case 'b' -> '\b';
        case 'f' -> '\f';
        case 'n' -> '\n';
        case 'r' -> '\r';
        case 't' -> '\t';
        default -> throw new IllegalArgumentException("Unsupported escape sequence: \\" + next);
      });
      i += 2;
    }
    throw new IllegalArgumentException("Unterminated string");
  }

  private static char parseUnicode(String input, int escapeIndex) {
    if (escapeIndex + 5 >= input.length()) {
      throw new IllegalArgumentException("Invalid unicode escape");
    }
    try {
      return (char) Integer.parseInt(input.substring(escapeIndex + 2, escapeIndex + 6), 16);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("Invalid unicode escape", ex);
    }
  }

  private static void appendQuoted(StringBuilder sb, String value) {
    sb.append('"');
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"' -> sb.append("\\\"");
        case '\\' -> sb.append("\\\\");
        case '\b' -> sb.append("\\b");
        case '\f' -> sb.append("\\f");
        case '\n' -> sb.append("\\n");
        case '\r' -> sb.append("\\r");
        case '\t' -> sb.append("\\t");
        default -> {
          if (c < 0x20) {
            sb.append(String.format("\\u%04x", (int) c));
          } else {
            sb.append(c);
          }
        }
      }
    }
    sb.append('"');
  }

  private record ParseResult(String value, int nextIndex) {
  }
}
