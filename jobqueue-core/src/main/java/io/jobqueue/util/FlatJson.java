package io.jobqueue.util;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads and writes single-level JSON objects whose values are strings.
 *
 * <p>Used for serialized job envelopes and for transport headers persisted by
 * database-backed transports. Writing skips {@code null} values. Reading
 * accepts string, number, boolean and {@code null} values; numbers and booleans
 * come back as their literal text and {@code null} members are omitted.
 * Nested objects and arrays are rejected with {@link IllegalArgumentException}.
 */
public final class FlatJson {

  private FlatJson() {
  }

  public static String write(Map<String, String> fields) {
    StringBuilder out = new StringBuilder(64);
    out.append('{');
    boolean first = true;
    for (Map.Entry<String, String> field : fields.entrySet()) {
      if (field.getKey() == null) {
        throw new IllegalArgumentException("field names cannot be null");
      }
      if (field.getValue() == null) {
        continue;
      }
      if (!first) {
        out.append(',');
      }
      first = false;
      quote(out, field.getKey());
      out.append(':');
      quote(out, field.getValue());
    }
    return out.append('}').toString();
  }

  public static Map<String, String> read(String json) {
    if (json == null) {
      throw new IllegalArgumentException("JSON text is null");
    }
    return new Reader(json).object();
  }

  private static void quote(StringBuilder out, String value) {
    out.append('"');
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '"' -> out.append("\\\"");
        case '\\' -> out.append("\\\\");
        case '\n' -> out.append("\\n");
        case '\r' -> out.append("\\r");
        case '\t' -> out.append("\\t");
        case '\b' -> out.append("\\b");
        case '\f' -> out.append("\\f");
        default -> {
          if (c < 0x20) {
            out.append(String.format("\\u%04x", (int) c));
          } else {
            out.append(c);
          }
        }
      }
    }
    out.append('"');
  }

  private static final class Reader {
    private final String text;
    private int pos;

    Reader(String text) {
      this.text = text;
    }

    Map<String, String> object() {
      Map<String, String> fields = new LinkedHashMap<>();
      expect('{');
      if (peek() == '}') {
        pos++;
        return end(fields);
      }
      while (true) {
        String name = string();
        expect(':');
        String value = value();
        if (value != null) {
          fields.put(name, value);
        }
        char next = next();
        if (next == '}') {
          return end(fields);
        }
        if (next != ',') {
          throw error("expected ',' or '}'");
        }
      }
    }

    private Map<String, String> end(Map<String, String> fields) {
      skipWhitespace();
      if (pos != text.length()) {
        throw error("trailing characters");
      }
      return fields;
    }

    private String value() {
      char c = peek();
      if (c == '"') {
        return string();
      }
      if (c == '{' || c == '[') {
        throw error("nested values are not supported");
      }
      int start = pos;
      while (pos < text.length() && ",}".indexOf(text.charAt(pos)) < 0
          && !Character.isWhitespace(text.charAt(pos))) {
        pos++;
      }
      String literal = text.substring(start, pos);
      if (literal.equals("null")) {
        return null;
      }
      if (literal.equals("true") || literal.equals("false") || isNumber(literal)) {
        return literal;
      }
      throw error("unexpected literal '" + literal + "'");
    }

    private String string() {
      expect('"');
      StringBuilder value = new StringBuilder();
      while (true) {
        if (pos >= text.length()) {
          throw error("unterminated string");
        }
        char c = text.charAt(pos++);
        if (c == '"') {
          return value.toString();
        }
        if (c != '\\') {
          value.append(c);
          continue;
        }
        if (pos >= text.length()) {
          throw error("unterminated escape");
        }
        char escaped = text.charAt(pos++);
        switch (escaped) {
          case '"', '\\', '/' -> value.append(escaped);
          case 'n' -> value.append('\n');
          case 'r' -> value.append('\r');
          case 't' -> value.append('\t');
          case 'b' -> value.append('\b');
          case 'f' -> value.append('\f');
          case 'u' -> {
            if (pos + 4 > text.length()) {
              throw error("truncated unicode escape");
            }
            try {
              value.append((char) Integer.parseInt(text.substring(pos, pos + 4), 16));
            } catch (NumberFormatException e) {
              throw error("invalid unicode escape");
            }
            pos += 4;
          }
          default -> throw error("invalid escape '\\" + escaped + "'");
        }
      }
    }

    private static boolean isNumber(String literal) {
      if (literal.isEmpty()) {
        return false;
      }
      try {
        Double.parseDouble(literal);
        return true;
      } catch (NumberFormatException e) {
        return false;
      }
    }

    private void expect(char expected) {
      if (next() != expected) {
        throw error("expected '" + expected + "'");
      }
    }

    private char next() {
      char c = peek();
      pos++;
      return c;
    }

    private char peek() {
      skipWhitespace();
      if (pos >= text.length()) {
        throw error("unexpected end of input");
      }
      return text.charAt(pos);
    }

    private void skipWhitespace() {
      while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
        pos++;
      }
    }

    private IllegalArgumentException error(String message) {
      return new IllegalArgumentException("Malformed JSON at offset " + pos + ": " + message);
    }
  }
}
