package writebuffer.util;

import java.lang.reflect.Array;
import java.util.Map;

/**
 * Lightweight JSON encoder for plain payload structures. Has no external dependencies.
 *
 * <p>Supported: {@code null}, {@link CharSequence}, {@link Number}, {@link Boolean},
 * {@link Character}, {@link Map} (keys rendered with {@code String.valueOf}),
 * {@link Iterable} and arrays. Non-finite doubles encode as {@code null}.
 */
public final class DefaultJsonCodec implements JsonCodec {
  static final DefaultJsonCodec INSTANCE = new DefaultJsonCodec();

  DefaultJsonCodec() {
  }

  @Override
  public String encode(Object value) {
    StringBuilder sb = new StringBuilder();
    write(sb, value);
    return sb.toString();
  }

  private void write(StringBuilder sb, Object value) {
    if (value == null) {
      sb.append("null");
    } else if (value instanceof CharSequence s) {
      writeString(sb, s.toString());
    } else if (value instanceof Character c) {
      writeString(sb, c.toString());
    } else if (value instanceof Boolean b) {
      sb.append(b.booleanValue());
    } else if (value instanceof Double d) {
      sb.append(d.isNaN() || d.isInfinite() ? "null" : d.toString());
    } else if (value instanceof Float f) {
      sb.append(f.isNaN() || f.isInfinite() ? "null" : f.toString());
    } else if (value instanceof Number n) {
      sb.append(n);
    } else if (value instanceof Map<?, ?> map) {
      sb.append('{');
      boolean first = true;
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        if (entry.getKey() == null) {
          throw new IllegalArgumentException("JSON object keys cannot be null");
        }
        if (!first) {
          sb.append(',');
        }
        first = false;
        writeString(sb, String.valueOf(entry.getKey()));
        sb.append(':');
        write(sb, entry.getValue());
      }
      sb.append('}');
    } else if (value instanceof Iterable<?> items) {
      sb.append('[');
      boolean first = true;
      for (Object item : items) {
        if (!first) {
          sb.append(',');
        }
        first = false;
        write(sb, item);
      }
      sb.append(']');
    } else if (value.getClass().isArray()) {
      sb.append('[');
      int len = Array.getLength(value);
      for (int i = 0; i < len; i++) {
        if (i > 0) {
          sb.append(',');
        }
        write(sb, Array.get(value, i));
      }
      sb.append(']');
    } else {
      throw new IllegalArgumentException("Unsupported JSON value type: " + value.getClass().getName());
    }
  }

  private static void writeString(StringBuilder sb, String value) {
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
}
