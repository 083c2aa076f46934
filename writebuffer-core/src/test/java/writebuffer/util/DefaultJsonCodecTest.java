package writebuffer.util;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DefaultJsonCodecTest {

  private final JsonCodec codec = JsonCodec.getDefault();

  @Test
  void encodesNullAsLiteral() {
    assertEquals("null", codec.encode(null));
  }

  @Test
  void encodesNestedStructures() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("id", 7);
    map.put("tags", List.of("a", "b"));
    map.put("paid", true);
    map.put("note", null);

    assertEquals("{\"id\":7,\"tags\":[\"a\",\"b\"],\"paid\":true,\"note\":null}", codec.encode(map));
  }

  @Test
  void encodesArrays() {
    assertEquals("[1,2,3]", codec.encode(new int[]{1, 2, 3}));
    assertEquals("[\"x\",null]", codec.encode(new String[]{"x", null}));
  }

  @Test
  void escapesSpecialCharacters() {
    String json = codec.encode("Hello \"World\"\nNew\\Line\u0001");

    assertEquals("\"Hello \\\"World\\\"\\nNew\\\\Line\\u0001\"", json);
  }

  @Test
  void nonFiniteDoublesEncodeAsNull() {
    assertEquals("[null,null,1.5]",
        codec.encode(Arrays.asList(Double.NaN, Double.POSITIVE_INFINITY, 1.5)));
  }

  @Test
  void rejectsNullKeys() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put(null, 1);

    assertThrows(IllegalArgumentException.class, () -> codec.encode(map));
  }

  @Test
  void rejectsUnsupportedTypes() {
    assertThrows(IllegalArgumentException.class, () -> codec.encode(new Object()));
  }
}
