package agentdesk.util;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Dependency-free {@link JsonCodec} for flat string objects and string arrays.
 *
 * <p>Accessible via {@link JsonCodec#getDefault()}. This class is stateless and thread-safe.
 */
public final class DefaultJsonCodec implements JsonCodec {
  static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

  DefaultJsonCodec() {
  }

  @Override
  public String toJson(Map<String, String> values) {
    if (values == null || values.isEmpty()) {
      return null;
    }
    StringBuilder sb = new StringBuilder("{");
    for (Map.Entry<String, String> entry : values.entrySet()) {
      if (entry.getKey() == null) {
        throw new IllegalArgumentException("keys cannot be null");
      }
      if (sb.length() > 1) {
        sb.append(',');
      }
      appendString(sb, entry.getKey());
      sb.append(':');
      if (entry.getValue() == null) {
        sb.append("null");
      } else {
        appendString(sb, entry.getValue());
      }
    }
    return sb.append('}').toString();
  }

  @Override
  public String toJsonArray(List<String> values) {
    StringBuilder sb = new StringBuilder("[");
    if (values != null) {
      for (int i = 0; i < values.size(); i++) {
        if (i > 0) {
          sb.append(',');
        }
        String value = values.get(i);
        if (value == null) {
          throw new IllegalArgumentException("array elements cannot be null");
        }
        appendString(sb, value);
      }
    }
    return sb.append(']').toString();
  }

  @Override
  public Map<String, String> parseObject(String json) {
    if (isAbsent(json)) {
      return Collections.emptyMap();
    }
    Cursor cursor = new Cursor(json);
    cursor.expect('{');
    Map<String, String> result = new LinkedHashMap<>();
    if (cursor.consumeIf('}')) {
      cursor.expectEnd();
      return result;
    }
    do {
      String key = cursor.readString();
      cursor.expect(':');
      if (cursor.consumeNull()) {
        continue;
      }
      result.put(key, cursor.readString());
    } while (cursor.consumeIf(','));
    cursor.expect('}');
    cursor.expectEnd();
    return result;
  }

  @Override
  public List<String> parseArray(String json) {
    if (isAbsent(json)) {
      return Collections.emptyList();
    }
    Cursor cursor = new Cursor(json);
    cursor.expect('[');
    List<String> result = new ArrayList<>();
    if (cursor.consumeIf(']')) {
      cursor.expectEnd();
      return result;
    }
    do {
      result.add(cursor.readString());
    } while (cursor.consumeIf(','));
    cursor.expect(']');
    cursor.expectEnd();
    return result;
  }

  private static boolean isAbsent(String json) {
    if (json == null) {
      return true;
    }
    String trimmed = json.trim();
    return trimmed.isEmpty() || "null".equals(trimmed);
  }

  private static void appendString(StringBuilder sb, String value) {
    sb.append('"');
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"':
          sb.append("\\\"");
          break;
        case '\\':
          sb.append("\\\\");
          break;
        case '\n':
          sb.append("\\n");
          break;
        case '\r':
          sb.append("\\r");
          break;
        case '\t':
          sb.append("\\t");
          break;
        default:
          if (c < 0x20) {
            sb.append(String.format("\\u%04x", (int) c));
          } else {
            sb.append(c);
          }
      }
    }
    sb.append('"');
  }

  /** Single-use reader over a JSON text. */
  private static final class Cursor {
    private final String input;
    private int pos;

    private Cursor(String input) {
      this.input = input;
    }

    private void skipWhitespace() {
      while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
        pos++;
      }
    }

    private void expect(char expected) {
      skipWhitespace();
      if (pos >= input.length() || input.charAt(pos) != expected) {
        throw new IllegalArgumentException("Expected '" + expected + "' at position " + pos);
      }
      pos++;
    }

    private boolean consumeIf(char candidate) {
      skipWhitespace();
      if (pos < input.length() && input.charAt(pos) == candidate) {
        pos++;
        return true;
      }
      return false;
    }

    private boolean consumeNull() {
      skipWhitespace();
      if (input.startsWith("null", pos)) {
        pos += 4;
        return true;
      }
      return false;
    }

    private void expectEnd() {
      skipWhitespace();
      if (pos != input.length()) {
        throw new IllegalArgumentException("Unexpected trailing content at position " + pos);
      }
    }

    private String readString() {
      expect('"');
      StringBuilder sb = new StringBuilder();
      while (pos < input.length()) {
        char c = input.charAt(pos++);
        if (c == '"') {
          return sb.toString();
        }
        if (c != '\\') {
          sb.append(c);
          continue;
        }
        if (pos >= input.length()) {
          throw new IllegalArgumentException("Invalid escape sequence");
        }
        char escaped = input.charAt(pos++);
        switch (escaped) {
          case '"':
          case '\\':
          case '/':
            sb.append(escaped);
            break;
          case 'b':
            sb.append('\b');
            break;
          case 'f':
            sb.append('\f');
            break;
          case 'n':
            sb.append('\n');
            break;
          case 'r':
            sb.append('\r');
            break;
          case 't':
            sb.append('\t');
            break;
          case 'u':
            if (pos + 4 > input.length()) {
              throw new IllegalArgumentException("Invalid unicode escape");
            }
            try {
              sb.append((char) Integer.parseInt(input.substring(pos, pos + 4), 16));
            } catch (NumberFormatException ex) {
              throw new IllegalArgumentException("Invalid unicode escape", ex);
            }
            pos += 4;
            break;
          default:
            throw new IllegalArgumentException("Unsupported escape sequence: \\" + escaped);
        }
      }
      throw new IllegalArgumentException("Unterminated string");
    }
  }
}
